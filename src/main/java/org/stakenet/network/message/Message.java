package org.stakenet.network.message;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * An immutable protocol message: operation, field values and serialized form.
 * <p>
 * Safe to share between threads, so the same instance can be queued to many peers.
 * Construct using {@link MessageCodec#pack(Op, Map)}, {@link MessageBuilder} or {@link MessageCodec#parse(byte[], int)}.
 */
public final class Message {

	private final Op op;
	private final Map<Field, Object> fields;
	private final byte[] bytes;

	Message(Op op, EnumMap<Field, Object> fields, byte[] bytes) {
		this.op = op;
		this.fields = Collections.unmodifiableMap(fields);
		this.bytes = bytes;
	}

	public Op getOp() {
		return this.op;
	}

	/**
	 * Returns value of field, or null if this message's operation doesn't carry it.
	 * <p>
	 * Byte arrays are returned as copies. Lists are immutable; their byte array elements must be treated as read-only.
	 */
	public Object get(Field field) {
		Object value = this.fields.get(field);

		if (value instanceof byte[])
			return ((byte[]) value).clone();

		return value;
	}

	public int getInt(Field field) {
		return (Integer) this.fields.get(field);
	}

	public long getLong(Field field) {
		return (Long) this.fields.get(field);
	}

	public String getString(Field field) {
		return (String) this.fields.get(field);
	}

	public byte[] getBytes(Field field) {
		return (byte[]) get(field);
	}

	@SuppressWarnings("unchecked")
	public <T> List<T> getList(Field field) {
		return (List<T>) this.fields.get(field);
	}

	/** Serialized form: op byte followed by fields, without frame length prefix. Returns a copy. */
	public byte[] toBytes() {
		return this.bytes.clone();
	}

	/** Serialized length, excluding frame length prefix. */
	public int size() {
		return this.bytes.length;
	}

	byte[] rawBytes() {
		return this.bytes;
	}

	@Override
	public String toString() {
		return String.format("%s[%d bytes]", this.op.name(), this.bytes.length);
	}

}
