package org.stakenet.network.message;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static java.util.Arrays.stream;
import static java.util.stream.Collectors.toMap;

/**
 * Protocol operations, with their wire value and the ordered fields each carries.
 * <p>
 * Wire values are part of the protocol: never renumber, only append.
 */
public enum Op {
	// Handshake and membership
	GET_VERSION(0),
	VERSION(1, Field.NETWORK_ID, Field.MY_TIME, Field.IP, Field.VERSION_STR),
	GET_PEER_LIST(2),
	PEER_LIST(3, Field.PEERS),

	// Keepalive
	PING(4),
	PONG(5),

	// Bootstrapping
	GET_ACCEPTED_FRONTIER(6, Field.CHAIN_ID, Field.REQUEST_ID, Field.DEADLINE),
	ACCEPTED_FRONTIER(7, Field.CHAIN_ID, Field.REQUEST_ID, Field.CONTAINER_IDS),
	GET_ACCEPTED(8, Field.CHAIN_ID, Field.REQUEST_ID, Field.DEADLINE, Field.CONTAINER_IDS),
	ACCEPTED(9, Field.CHAIN_ID, Field.REQUEST_ID, Field.CONTAINER_IDS),

	// Consensus
	GET(10, Field.CHAIN_ID, Field.REQUEST_ID, Field.DEADLINE, Field.CONTAINER_ID),
	PUT(11, Field.CHAIN_ID, Field.REQUEST_ID, Field.CONTAINER_ID, Field.CONTAINER_BYTES),
	PUSH_QUERY(12, Field.CHAIN_ID, Field.REQUEST_ID, Field.DEADLINE, Field.CONTAINER_ID, Field.CONTAINER_BYTES),
	PULL_QUERY(13, Field.CHAIN_ID, Field.REQUEST_ID, Field.DEADLINE, Field.CONTAINER_ID),
	CHITS(14, Field.CHAIN_ID, Field.REQUEST_ID, Field.CONTAINER_IDS),

	// Ancestry
	GET_ANCESTORS(15, Field.CHAIN_ID, Field.REQUEST_ID, Field.DEADLINE, Field.CONTAINER_ID),
	MULTI_PUT(16, Field.CHAIN_ID, Field.REQUEST_ID, Field.MULTI_CONTAINER_BYTES);

	public final int value;
	private final List<Field> fields;

	private static final Map<Integer, Op> map = stream(Op.values()).collect(toMap(op -> op.value, op -> op));

	Op(int value, Field... fields) {
		this.value = value;
		this.fields = Collections.unmodifiableList(Arrays.asList(fields));
	}

	/** Fields carried by this operation, in wire order. */
	public List<Field> getFields() {
		return this.fields;
	}

	/** Operations handled by the transport itself, never passed up to the message handler. */
	public boolean isNetworkOp() {
		return this.value <= PONG.value;
	}

	public static Op valueOf(int value) {
		return map.get(value);
	}
}
