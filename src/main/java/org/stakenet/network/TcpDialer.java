package org.stakenet.network;

import org.stakenet.network.tls.DeadlineExceededException;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;

public class TcpDialer implements Dialer {

	@Override
	public Socket dial(InetSocketAddress address, int timeout) throws IOException {
		Socket socket = new Socket();

		try {
			socket.setTcpNoDelay(true);
			socket.setKeepAlive(true);
			socket.connect(address, timeout);
			return socket;
		} catch (SocketTimeoutException e) {
			socket.close();
			throw new DeadlineExceededException(String.format("Connect to %s timed out after %dms", address, timeout), e);
		} catch (IOException e) {
			socket.close();
			throw e;
		}
	}

}
