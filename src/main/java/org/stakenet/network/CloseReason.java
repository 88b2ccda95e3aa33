package org.stakenet.network;

/** Why a peer connection was closed. */
public enum CloseReason {
	LOCAL(false),
	NETWORK_SHUTDOWN(false),
	IO_ERROR(false),
	DECODE_ERROR(false),
	TLS_ERROR(true),
	HANDSHAKE_TIMEOUT(true),
	INCOMPATIBLE_NETWORK(true),
	INCOMPATIBLE_VERSION(true),
	CLOCK_SKEW(true),
	SELF_CONNECTION(true),
	DUPLICATE(true),
	BENCHED(true),
	MAX_PEERS(true),
	PING_TIMEOUT(false);

	/** Whether this reason counts as a failure to establish the connection */
	public final boolean isHandshakeFailure;

	CloseReason(boolean isHandshakeFailure) {
		this.isHandshakeFailure = isHandshakeFailure;
	}
}
