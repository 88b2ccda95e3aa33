package org.stakenet.network.tls;

import java.io.IOException;
import java.net.Socket;

/**
 * Upgrades a raw connection to a mutually authenticated TLS session.
 * <p>
 * Implementations never retry. On failure the raw socket is left for the caller to close.
 */
public interface Upgrader {

	/**
	 * @throws DeadlineExceededException if handshake did not complete within <tt>timeout</tt> ms
	 * @throws HandshakeException for any other handshake failure, including a missing remote certificate
	 */
	UpgradedConnection upgrade(Socket socket, int timeout) throws IOException;

}
