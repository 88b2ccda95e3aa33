package org.stakenet.network.task;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.stakenet.network.Network;
import org.stakenet.utils.Task;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;

/**
 * Accept loop: hands each accepted connection to the network until the listener is closed.
 * <p>
 * Transient accept failures are retried with bounded exponential backoff.
 */
public class ChannelAcceptTask implements Task {
	private static final Logger LOGGER = LogManager.getLogger(ChannelAcceptTask.class);

	private static final long MIN_BACKOFF = 10L; // ms
	private static final long MAX_BACKOFF = 1000L; // ms

	private final Network network;
	private final ServerSocket serverSocket;

	public ChannelAcceptTask(Network network, ServerSocket serverSocket) {
		this.network = network;
		this.serverSocket = serverSocket;
	}

	@Override
	public String getName() {
		return "ChannelAcceptTask";
	}

	@Override
	public void perform() throws InterruptedException {
		long backoff = MIN_BACKOFF;

		while (!this.network.isClosing()) {
			Socket socket;
			try {
				socket = this.serverSocket.accept();
			} catch (IOException e) {
				if (this.network.isClosing() || this.serverSocket.isClosed())
					return;

				LOGGER.warn("Failed to accept connection, retrying in {}ms: {}", backoff, e.getMessage());
				Thread.sleep(backoff);
				backoff = Math.min(backoff * 2, MAX_BACKOFF);
				continue;
			}

			backoff = MIN_BACKOFF;
			this.network.onInboundConnection(socket);
		}
	}
}
