package org.stakenet.network;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

/** Opens raw outbound connections. */
public interface Dialer {

	/**
	 * @throws org.stakenet.network.tls.DeadlineExceededException if not connected within <tt>timeout</tt> ms
	 */
	Socket dial(InetSocketAddress address, int timeout) throws IOException;

}
