package org.stakenet.network.message;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Convenience factories for each protocol operation.
 * <p>
 * Arguments are validated as for {@link MessageCodec#pack(Op, Map)}, but failures
 * surface as {@link IllegalArgumentException} since they indicate a programming error.
 */
public class MessageBuilder {

	private MessageBuilder() {
	}

	// Handshake and membership

	public static Message getVersion() {
		return build(Op.GET_VERSION, Collections.emptyMap());
	}

	public static Message version(int networkId, long myTime, String ip, String versionStr) {
		Map<Field, Object> fields = new EnumMap<>(Field.class);
		fields.put(Field.NETWORK_ID, networkId);
		fields.put(Field.MY_TIME, myTime);
		fields.put(Field.IP, ip);
		fields.put(Field.VERSION_STR, versionStr);
		return build(Op.VERSION, fields);
	}

	public static Message getPeerList() {
		return build(Op.GET_PEER_LIST, Collections.emptyMap());
	}

	public static Message peerList(List<String> peers) {
		return build(Op.PEER_LIST, Collections.singletonMap(Field.PEERS, peers));
	}

	// Keepalive

	public static Message ping() {
		return build(Op.PING, Collections.emptyMap());
	}

	public static Message pong() {
		return build(Op.PONG, Collections.emptyMap());
	}

	// Bootstrapping

	public static Message getAcceptedFrontier(byte[] chainId, int requestId, long deadline) {
		Map<Field, Object> fields = request(chainId, requestId);
		fields.put(Field.DEADLINE, deadline);
		return build(Op.GET_ACCEPTED_FRONTIER, fields);
	}

	public static Message acceptedFrontier(byte[] chainId, int requestId, List<byte[]> containerIds) {
		Map<Field, Object> fields = request(chainId, requestId);
		fields.put(Field.CONTAINER_IDS, containerIds);
		return build(Op.ACCEPTED_FRONTIER, fields);
	}

	public static Message getAccepted(byte[] chainId, int requestId, long deadline, List<byte[]> containerIds) {
		Map<Field, Object> fields = request(chainId, requestId);
		fields.put(Field.DEADLINE, deadline);
		fields.put(Field.CONTAINER_IDS, containerIds);
		return build(Op.GET_ACCEPTED, fields);
	}

	public static Message accepted(byte[] chainId, int requestId, List<byte[]> containerIds) {
		Map<Field, Object> fields = request(chainId, requestId);
		fields.put(Field.CONTAINER_IDS, containerIds);
		return build(Op.ACCEPTED, fields);
	}

	// Consensus

	public static Message get(byte[] chainId, int requestId, long deadline, byte[] containerId) {
		Map<Field, Object> fields = request(chainId, requestId);
		fields.put(Field.DEADLINE, deadline);
		fields.put(Field.CONTAINER_ID, containerId);
		return build(Op.GET, fields);
	}

	public static Message put(byte[] chainId, int requestId, byte[] containerId, byte[] container) {
		Map<Field, Object> fields = request(chainId, requestId);
		fields.put(Field.CONTAINER_ID, containerId);
		fields.put(Field.CONTAINER_BYTES, container);
		return build(Op.PUT, fields);
	}

	public static Message pushQuery(byte[] chainId, int requestId, long deadline, byte[] containerId, byte[] container) {
		Map<Field, Object> fields = request(chainId, requestId);
		fields.put(Field.DEADLINE, deadline);
		fields.put(Field.CONTAINER_ID, containerId);
		fields.put(Field.CONTAINER_BYTES, container);
		return build(Op.PUSH_QUERY, fields);
	}

	public static Message pullQuery(byte[] chainId, int requestId, long deadline, byte[] containerId) {
		Map<Field, Object> fields = request(chainId, requestId);
		fields.put(Field.DEADLINE, deadline);
		fields.put(Field.CONTAINER_ID, containerId);
		return build(Op.PULL_QUERY, fields);
	}

	public static Message chits(byte[] chainId, int requestId, List<byte[]> votes) {
		Map<Field, Object> fields = request(chainId, requestId);
		fields.put(Field.CONTAINER_IDS, votes);
		return build(Op.CHITS, fields);
	}

	// Ancestry

	public static Message getAncestors(byte[] chainId, int requestId, long deadline, byte[] containerId) {
		Map<Field, Object> fields = request(chainId, requestId);
		fields.put(Field.DEADLINE, deadline);
		fields.put(Field.CONTAINER_ID, containerId);
		return build(Op.GET_ANCESTORS, fields);
	}

	public static Message multiPut(byte[] chainId, int requestId, List<byte[]> containers) {
		Map<Field, Object> fields = request(chainId, requestId);
		fields.put(Field.MULTI_CONTAINER_BYTES, containers);
		return build(Op.MULTI_PUT, fields);
	}

	private static Map<Field, Object> request(byte[] chainId, int requestId) {
		Map<Field, Object> fields = new EnumMap<>(Field.class);
		fields.put(Field.CHAIN_ID, chainId);
		fields.put(Field.REQUEST_ID, requestId);
		return fields;
	}

	private static Message build(Op op, Map<Field, ?> fields) {
		try {
			return MessageCodec.pack(op, fields);
		} catch (MessageException e) {
			throw new IllegalArgumentException(e.getMessage(), e);
		}
	}

}
