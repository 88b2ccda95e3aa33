package org.stakenet.network.message;

import com.google.common.primitives.Ints;
import org.stakenet.utils.SerializationException;

import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.util.EnumMap;
import java.util.Map;

/**
 * Packs and parses messages, and reads/writes them as length-prefixed frames.
 * <p>
 * Frame layout:
 * <pre>
 *   int32  length of payload
 *   byte   op value
 *   ...    fields, in the op's declared order
 * </pre>
 */
public class MessageCodec {

	private static final int FRAME_HEADER_LENGTH = Integer.BYTES;

	private MessageCodec() {
	}

	public static Message pack(Op op, Map<Field, ?> values) throws MessageException {
		if (op == null)
			throw new MessageException("Missing op");

		EnumMap<Field, Object> fields = new EnumMap<>(Field.class);
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		bytes.write(op.value);

		try {
			for (Field field : op.getFields()) {
				Object value = values.get(field);
				if (value == null)
					throw new MessageException(String.format("Missing field %s for %s", field.name(), op.name()));

				Object normalized = field.normalize(value);
				field.write(bytes, normalized);
				fields.put(field, normalized);
			}
		} catch (IllegalArgumentException e) {
			throw new MessageException(String.format("Invalid field value for %s: %s", op.name(), e.getMessage()), e);
		} catch (IOException e) {
			throw new AssertionError("IOException shouldn't occur with ByteArrayOutputStream");
		}

		return new Message(op, fields, bytes.toByteArray());
	}

	/**
	 * Parses a message from bytes previously produced by {@link Message#toBytes()}.
	 *
	 * @param maxSize upper bound for variable-length byte fields
	 */
	public static Message parse(byte[] bytes, int maxSize) throws MessageException {
		if (bytes.length == 0)
			throw new MessageException("Empty message");

		ByteBuffer byteBuffer = ByteBuffer.wrap(bytes);

		int opValue = Byte.toUnsignedInt(byteBuffer.get());
		Op op = Op.valueOf(opValue);
		if (op == null)
			throw new MessageException("Unknown op " + opValue);

		EnumMap<Field, Object> fields = new EnumMap<>(Field.class);
		try {
			for (Field field : op.getFields())
				fields.put(field, field.read(byteBuffer, maxSize));
		} catch (SerializationException e) {
			throw new MessageException(String.format("Malformed %s message: %s", op.name(), e.getMessage()), e);
		}

		if (byteBuffer.hasRemaining())
			throw new MessageException(String.format("%d trailing bytes after %s message", byteBuffer.remaining(), op.name()));

		return new Message(op, fields, bytes);
	}

	/** Writes message as one frame. Caller is responsible for flushing. */
	public static void writeFrame(OutputStream out, Message message) throws IOException {
		byte[] bytes = message.rawBytes();
		out.write(Ints.toByteArray(bytes.length));
		out.write(bytes);
	}

	/**
	 * Reads one frame's payload, blocking until it is complete.
	 *
	 * @throws java.io.EOFException if the stream ends, including mid-frame
	 * @throws MessageException if declared length is not within 1..maxMessageSize
	 */
	public static byte[] readFrame(DataInputStream in, int maxMessageSize) throws IOException, MessageException {
		int length = in.readInt();

		if (length <= 0)
			throw new MessageException("Invalid frame length " + length);

		if (length > maxMessageSize)
			throw new MessageException(String.format("Frame length %d exceeds maximum %d", length, maxMessageSize));

		byte[] payload = new byte[length];
		in.readFully(payload);
		return payload;
	}

	/** Bytes occupied on the wire by message, including frame header. */
	public static int frameSize(Message message) {
		return FRAME_HEADER_LENGTH + message.size();
	}

}
