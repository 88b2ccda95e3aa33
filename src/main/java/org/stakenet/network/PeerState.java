package org.stakenet.network;

/**
 * Peer connection lifecycle. States only ever move forwards.
 */
public enum PeerState {
	/** Socket connected, TLS upgrade in progress */
	CONNECTING,
	/** TLS established, exchanging VERSION */
	HANDSHAKING,
	/** Handshake complete, registered with network */
	CONNECTED,
	/** Close requested, waiting for read/write loops to exit */
	CLOSING,
	/** Terminal */
	CLOSED;

	public boolean canTransitionTo(PeerState next) {
		switch (this) {
			case CONNECTING:
				return next == HANDSHAKING || next == CLOSING;

			case HANDSHAKING:
				return next == CONNECTED || next == CLOSING;

			case CONNECTED:
				return next == CLOSING;

			case CLOSING:
				return next == CLOSED;

			default:
				return false;
		}
	}

	public boolean isClosing() {
		return this == CLOSING || this == CLOSED;
	}
}
