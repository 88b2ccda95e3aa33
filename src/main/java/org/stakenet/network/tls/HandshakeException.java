package org.stakenet.network.tls;

import java.io.IOException;

/** TLS handshake failed, or the remote presented no usable certificate. */
@SuppressWarnings("serial")
public class HandshakeException extends IOException {

	public HandshakeException(String message) {
		super(message);
	}

	public HandshakeException(String message, Throwable cause) {
		super(message, cause);
	}

}
