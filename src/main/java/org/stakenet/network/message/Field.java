package org.stakenet.network.message;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import org.stakenet.utils.Serialization;
import org.stakenet.utils.SerializationException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;

/**
 * Message fields and their wire encodings.
 * <p>
 * Values handed out by {@link Message#get(Field)} are immutable: byte arrays are copied, lists are immutable.
 */
public enum Field {
	NETWORK_ID {
		@Override
		void write(ByteArrayOutputStream bytes, Object value) throws IOException {
			bytes.write(Ints.toByteArray((Integer) value));
		}

		@Override
		Object read(ByteBuffer byteBuffer, int maxSize) throws SerializationException {
			return Serialization.readInt(byteBuffer);
		}

		@Override
		Object normalize(Object value) {
			return requireType(value, Integer.class);
		}
	},
	MY_TIME {
		@Override
		void write(ByteArrayOutputStream bytes, Object value) throws IOException {
			bytes.write(Longs.toByteArray((Long) value));
		}

		@Override
		Object read(ByteBuffer byteBuffer, int maxSize) throws SerializationException {
			return Serialization.readLong(byteBuffer);
		}

		@Override
		Object normalize(Object value) {
			return requireType(value, Long.class);
		}
	},
	IP {
		@Override
		void write(ByteArrayOutputStream bytes, Object value) throws IOException {
			Serialization.serializeSizedString(bytes, (String) value);
		}

		@Override
		Object read(ByteBuffer byteBuffer, int maxSize) throws SerializationException {
			return Serialization.deserializeSizedString(byteBuffer, MAX_STRING_LENGTH);
		}

		@Override
		Object normalize(Object value) {
			return requireType(value, String.class);
		}
	},
	VERSION_STR {
		@Override
		void write(ByteArrayOutputStream bytes, Object value) throws IOException {
			Serialization.serializeSizedString(bytes, (String) value);
		}

		@Override
		Object read(ByteBuffer byteBuffer, int maxSize) throws SerializationException {
			return Serialization.deserializeSizedString(byteBuffer, MAX_STRING_LENGTH);
		}

		@Override
		Object normalize(Object value) {
			return requireType(value, String.class);
		}
	},
	PEERS {
		@Override
		void write(ByteArrayOutputStream bytes, Object value) throws IOException {
			List<?> peers = (List<?>) value;
			bytes.write(Ints.toByteArray(peers.size()));
			for (Object peer : peers)
				Serialization.serializeSizedString(bytes, (String) peer);
		}

		@Override
		Object read(ByteBuffer byteBuffer, int maxSize) throws SerializationException {
			int count = Serialization.deserializeCount(byteBuffer, MAX_PEERS);

			ImmutableList.Builder<String> peers = ImmutableList.builder();
			for (int i = 0; i < count; ++i)
				peers.add(Serialization.deserializeSizedString(byteBuffer, MAX_STRING_LENGTH));

			return peers.build();
		}

		@Override
		Object normalize(Object value) {
			List<?> peers = requireType(value, List.class);
			if (peers.size() > MAX_PEERS)
				throw new IllegalArgumentException("Too many peers: " + peers.size());

			ImmutableList.Builder<String> copy = ImmutableList.builder();
			for (Object peer : peers)
				copy.add(requireType(peer, String.class));

			return copy.build();
		}
	},
	CHAIN_ID {
		@Override
		void write(ByteArrayOutputStream bytes, Object value) throws IOException {
			bytes.write((byte[]) value);
		}

		@Override
		Object read(ByteBuffer byteBuffer, int maxSize) throws SerializationException {
			return Serialization.deserializeFixedBytes(byteBuffer, ID_LENGTH);
		}

		@Override
		Object normalize(Object value) {
			return requireId(value);
		}
	},
	REQUEST_ID {
		@Override
		void write(ByteArrayOutputStream bytes, Object value) throws IOException {
			bytes.write(Ints.toByteArray((Integer) value));
		}

		@Override
		Object read(ByteBuffer byteBuffer, int maxSize) throws SerializationException {
			return Serialization.readInt(byteBuffer);
		}

		@Override
		Object normalize(Object value) {
			return requireType(value, Integer.class);
		}
	},
	DEADLINE {
		@Override
		void write(ByteArrayOutputStream bytes, Object value) throws IOException {
			bytes.write(Longs.toByteArray((Long) value));
		}

		@Override
		Object read(ByteBuffer byteBuffer, int maxSize) throws SerializationException {
			return Serialization.readLong(byteBuffer);
		}

		@Override
		Object normalize(Object value) {
			return requireType(value, Long.class);
		}
	},
	CONTAINER_ID {
		@Override
		void write(ByteArrayOutputStream bytes, Object value) throws IOException {
			bytes.write((byte[]) value);
		}

		@Override
		Object read(ByteBuffer byteBuffer, int maxSize) throws SerializationException {
			return Serialization.deserializeFixedBytes(byteBuffer, ID_LENGTH);
		}

		@Override
		Object normalize(Object value) {
			return requireId(value);
		}
	},
	CONTAINER_BYTES {
		@Override
		void write(ByteArrayOutputStream bytes, Object value) throws IOException {
			Serialization.serializeSizedBytes(bytes, (byte[]) value);
		}

		@Override
		Object read(ByteBuffer byteBuffer, int maxSize) throws SerializationException {
			return Serialization.deserializeSizedBytes(byteBuffer, maxSize);
		}

		@Override
		Object normalize(Object value) {
			return requireType(value, byte[].class).clone();
		}
	},
	CONTAINER_IDS {
		@Override
		void write(ByteArrayOutputStream bytes, Object value) throws IOException {
			List<?> ids = (List<?>) value;
			bytes.write(Ints.toByteArray(ids.size()));
			for (Object id : ids)
				bytes.write((byte[]) id);
		}

		@Override
		Object read(ByteBuffer byteBuffer, int maxSize) throws SerializationException {
			int count = Serialization.deserializeCount(byteBuffer, MAX_CONTAINERS);

			ImmutableList.Builder<byte[]> ids = ImmutableList.builder();
			for (int i = 0; i < count; ++i)
				ids.add(Serialization.deserializeFixedBytes(byteBuffer, ID_LENGTH));

			return ids.build();
		}

		@Override
		Object normalize(Object value) {
			List<?> ids = requireType(value, List.class);
			if (ids.size() > MAX_CONTAINERS)
				throw new IllegalArgumentException("Too many container IDs: " + ids.size());

			ImmutableList.Builder<byte[]> copy = ImmutableList.builder();
			for (Object id : ids)
				copy.add(requireId(id));

			return copy.build();
		}
	},
	MULTI_CONTAINER_BYTES {
		@Override
		void write(ByteArrayOutputStream bytes, Object value) throws IOException {
			List<?> containers = (List<?>) value;
			bytes.write(Ints.toByteArray(containers.size()));
			for (Object container : containers)
				Serialization.serializeSizedBytes(bytes, (byte[]) container);
		}

		@Override
		Object read(ByteBuffer byteBuffer, int maxSize) throws SerializationException {
			return ImmutableList.copyOf(Serialization.deserializeSizedBytesList(byteBuffer, MAX_CONTAINERS, maxSize));
		}

		@Override
		Object normalize(Object value) {
			List<?> containers = requireType(value, List.class);
			if (containers.size() > MAX_CONTAINERS)
				throw new IllegalArgumentException("Too many containers: " + containers.size());

			ImmutableList.Builder<byte[]> copy = ImmutableList.builder();
			for (Object container : containers)
				copy.add(requireType(container, byte[].class).clone());

			return copy.build();
		}
	};

	/** Length of chain and container IDs. */
	public static final int ID_LENGTH = 32;
	public static final int MAX_STRING_LENGTH = 255;
	public static final int MAX_PEERS = 1024;
	public static final int MAX_CONTAINERS = 2048;

	abstract void write(ByteArrayOutputStream bytes, Object value) throws IOException;

	abstract Object read(ByteBuffer byteBuffer, int maxSize) throws SerializationException;

	/** Checks value's type and returns an immutable copy suitable for storing in a Message. */
	abstract Object normalize(Object value);

	private static <T> T requireType(Object value, Class<T> type) {
		if (!type.isInstance(value))
			throw new IllegalArgumentException(String.format("Expected %s but got %s", type.getSimpleName(),
					value == null ? "null" : value.getClass().getSimpleName()));

		return type.cast(value);
	}

	private static byte[] requireId(Object value) {
		byte[] id = requireType(value, byte[].class);
		if (id.length != ID_LENGTH)
			throw new IllegalArgumentException(String.format("ID must be %d bytes, got %d", ID_LENGTH, id.length));

		return id.clone();
	}
}
