package org.stakenet.test.network.message;

import com.google.common.primitives.Ints;
import org.junit.Test;
import org.stakenet.network.message.Field;
import org.stakenet.network.message.Message;
import org.stakenet.network.message.MessageBuilder;
import org.stakenet.network.message.MessageCodec;
import org.stakenet.network.message.MessageException;
import org.stakenet.network.message.Op;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class MessageCodecTests {

	private static final int MAX_MESSAGE_SIZE = 1024 * 1024;

	private static byte[] id(int n) {
		byte[] id = new byte[Field.ID_LENGTH];
		Arrays.fill(id, (byte) n);
		return id;
	}

	@Test
	public void testPutFields() throws MessageException {
		byte[] container = "container".getBytes();
		Message message = MessageBuilder.put(id(1), 42, id(2), container);

		Message parsed = MessageCodec.parse(message.toBytes(), MAX_MESSAGE_SIZE);

		assertEquals(Op.PUT, parsed.getOp());
		assertArrayEquals(id(1), parsed.getBytes(Field.CHAIN_ID));
		assertEquals(42, parsed.getInt(Field.REQUEST_ID));
		assertArrayEquals(id(2), parsed.getBytes(Field.CONTAINER_ID));
		assertArrayEquals(container, parsed.getBytes(Field.CONTAINER_BYTES));
	}

	@Test
	public void testVersionFields() throws MessageException {
		Message message = MessageBuilder.version(7, 123456789L, "127.0.0.1:9651", "stakenet/1.0.0");

		Message parsed = MessageCodec.parse(message.toBytes(), MAX_MESSAGE_SIZE);

		assertEquals(7, parsed.getInt(Field.NETWORK_ID));
		assertEquals(123456789L, parsed.getLong(Field.MY_TIME));
		assertEquals("127.0.0.1:9651", parsed.getString(Field.IP));
		assertEquals("stakenet/1.0.0", parsed.getString(Field.VERSION_STR));
	}

	@Test
	public void testFieldValuesAreCopies() {
		Message message = MessageBuilder.put(id(1), 1, id(2), new byte[] { 1, 2, 3 });

		byte[] container = message.getBytes(Field.CONTAINER_BYTES);
		container[0] = 99;

		assertEquals(1, message.getBytes(Field.CONTAINER_BYTES)[0]);
	}

	@Test
	public void testFramesPreserveOrder() throws IOException, MessageException {
		List<Message> messages = List.of(MessageBuilder.ping(), MessageBuilder.peerList(List.of("10.0.0.1:9651", "[::1]:9651")),
				MessageBuilder.chits(id(3), 5, List.of(id(4), id(5))), MessageBuilder.pong());

		ByteArrayOutputStream out = new ByteArrayOutputStream();
		for (Message message : messages)
			MessageCodec.writeFrame(out, message);

		DataInputStream in = new DataInputStream(new ByteArrayInputStream(out.toByteArray()));
		for (Message message : messages) {
			Message parsed = MessageCodec.parse(MessageCodec.readFrame(in, MAX_MESSAGE_SIZE), MAX_MESSAGE_SIZE);
			assertEquals(message.getOp(), parsed.getOp());
			assertArrayEquals(message.toBytes(), parsed.toBytes());
		}

		assertEquals(0, in.available());
	}

	@Test
	public void testFrameSize() {
		Message message = MessageBuilder.ping();

		// Length prefix plus op byte
		assertEquals(5, MessageCodec.frameSize(message));
	}

	@Test(expected = MessageException.class)
	public void testOversizedFrameRejected() throws IOException, MessageException {
		DataInputStream in = new DataInputStream(new ByteArrayInputStream(Ints.toByteArray(MAX_MESSAGE_SIZE + 1)));
		MessageCodec.readFrame(in, MAX_MESSAGE_SIZE);
	}

	@Test(expected = MessageException.class)
	public void testEmptyFrameRejected() throws IOException, MessageException {
		DataInputStream in = new DataInputStream(new ByteArrayInputStream(Ints.toByteArray(0)));
		MessageCodec.readFrame(in, MAX_MESSAGE_SIZE);
	}

	@Test(expected = EOFException.class)
	public void testTruncatedFrame() throws IOException, MessageException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		out.write(Ints.toByteArray(10));
		out.write(new byte[] { 1, 2, 3 });

		MessageCodec.readFrame(new DataInputStream(new ByteArrayInputStream(out.toByteArray())), MAX_MESSAGE_SIZE);
	}

	@Test(expected = MessageException.class)
	public void testUnknownOp() throws MessageException {
		MessageCodec.parse(new byte[] { (byte) 200 }, MAX_MESSAGE_SIZE);
	}

	@Test(expected = MessageException.class)
	public void testTrailingBytes() throws MessageException {
		MessageCodec.parse(new byte[] { (byte) Op.PING.value, 0 }, MAX_MESSAGE_SIZE);
	}

	@Test(expected = MessageException.class)
	public void testTruncatedFields() throws MessageException {
		byte[] bytes = MessageBuilder.version(1, 0L, "", "stakenet/1.0.0").toBytes();
		MessageCodec.parse(Arrays.copyOf(bytes, bytes.length - 3), MAX_MESSAGE_SIZE);
	}

	@Test(expected = MessageException.class)
	public void testOversizedContainerRejected() throws MessageException {
		byte[] bytes = MessageBuilder.put(id(1), 1, id(2), new byte[100]).toBytes();
		MessageCodec.parse(bytes, 50);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidIdLength() {
		MessageBuilder.get(new byte[5], 1, 0L, id(1));
	}

	@Test
	public void testNetworkOps() {
		assertTrue(Op.VERSION.isNetworkOp());
		assertTrue(Op.PONG.isNetworkOp());
		assertFalse(Op.GET_ACCEPTED_FRONTIER.isNetworkOp());
		assertFalse(Op.MULTI_PUT.isNetworkOp());
	}

}
