package org.stakenet.network;

import java.io.IOException;

/** Peer connection closed before, or instead of, reaching {@link PeerState#CONNECTED}. */
@SuppressWarnings("serial")
public class PeerClosedException extends IOException {

	private final CloseReason reason;

	public PeerClosedException(CloseReason reason, String detail, Throwable cause) {
		super(detail == null ? reason.name() : reason.name() + ": " + detail, cause);
		this.reason = reason;
	}

	public PeerClosedException(CloseReason reason, String detail) {
		this(reason, detail, null);
	}

	public CloseReason getReason() {
		return this.reason;
	}

}
