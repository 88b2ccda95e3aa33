package org.stakenet.utils;

import com.google.common.primitives.Ints;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class Serialization {

	private Serialization() {
	}

	/**
	 * Writes UTF-8 bytes of string, prefixed with their length as a 4-byte int.
	 */
	public static void serializeSizedString(ByteArrayOutputStream bytes, String string) throws IOException {
		serializeSizedBytes(bytes, string.getBytes(StandardCharsets.UTF_8));
	}

	public static String deserializeSizedString(ByteBuffer byteBuffer, int maxSize) throws SerializationException {
		return new String(deserializeSizedBytes(byteBuffer, maxSize), StandardCharsets.UTF_8);
	}

	public static void serializeSizedBytes(ByteArrayOutputStream bytes, byte[] data) throws IOException {
		bytes.write(Ints.toByteArray(data.length));
		bytes.write(data);
	}

	public static byte[] deserializeSizedBytes(ByteBuffer byteBuffer, int maxSize) throws SerializationException {
		int size = readInt(byteBuffer);
		if (size < 0)
			throw new SerializationException("Negative size for serialized data");

		if (size > maxSize)
			throw new SerializationException("Serialized data too long");

		if (size > byteBuffer.remaining())
			throw new SerializationException("Byte data too short for serialized data");

		byte[] bytes = new byte[size];
		byteBuffer.get(bytes);
		return bytes;
	}

	public static byte[] deserializeFixedBytes(ByteBuffer byteBuffer, int length) throws SerializationException {
		if (length > byteBuffer.remaining())
			throw new SerializationException("Byte data too short for fixed-length field");

		byte[] bytes = new byte[length];
		byteBuffer.get(bytes);
		return bytes;
	}

	/**
	 * Reads a count prefix and checks it against maxCount before any allocation happens.
	 */
	public static int deserializeCount(ByteBuffer byteBuffer, int maxCount) throws SerializationException {
		int count = readInt(byteBuffer);
		if (count < 0 || count > maxCount)
			throw new SerializationException(String.format("Invalid element count %d (max %d)", count, maxCount));

		return count;
	}

	public static List<byte[]> deserializeSizedBytesList(ByteBuffer byteBuffer, int maxCount, int maxSize) throws SerializationException {
		int count = deserializeCount(byteBuffer, maxCount);

		List<byte[]> list = new ArrayList<>(count);
		for (int i = 0; i < count; ++i)
			list.add(deserializeSizedBytes(byteBuffer, maxSize));

		return list;
	}

	public static int readInt(ByteBuffer byteBuffer) throws SerializationException {
		if (byteBuffer.remaining() < Integer.BYTES)
			throw new SerializationException("Byte data too short for int");

		return byteBuffer.getInt();
	}

	public static long readLong(ByteBuffer byteBuffer) throws SerializationException {
		if (byteBuffer.remaining() < Long.BYTES)
			throw new SerializationException("Byte data too short for long");

		return byteBuffer.getLong();
	}

}
