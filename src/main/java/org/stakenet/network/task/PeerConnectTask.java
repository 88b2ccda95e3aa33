package org.stakenet.network.task;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.stakenet.network.CloseReason;
import org.stakenet.network.Network;
import org.stakenet.network.Peer;
import org.stakenet.network.PeerAddress;
import org.stakenet.network.PeerClosedException;
import org.stakenet.settings.NetworkSettings;
import org.stakenet.utils.Task;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.UnknownHostException;
import java.util.concurrent.CompletableFuture;

/**
 * Dials an outbound connection, retrying transient failures with bounded exponential backoff,
 * then upgrades it to TLS and starts the handshake.
 */
public class PeerConnectTask implements Task {
	private static final Logger LOGGER = LogManager.getLogger(PeerConnectTask.class);

	private final Network network;
	private final PeerAddress address;
	private final CompletableFuture<Peer> future;
	private final String name;

	public PeerConnectTask(Network network, PeerAddress address, CompletableFuture<Peer> future) {
		this.network = network;
		this.address = address;
		this.future = future;
		this.name = "PeerConnectTask::" + address;
	}

	@Override
	public String getName() {
		return this.name;
	}

	@Override
	public void perform() throws InterruptedException {
		Socket socket;
		try {
			socket = dial();
		} catch (InterruptedException e) {
			this.future.completeExceptionally(new PeerClosedException(CloseReason.NETWORK_SHUTDOWN, "interrupted while dialling"));
			throw e;
		} catch (IOException e) {
			LOGGER.debug("Failed to connect to peer {}: {}", this.address, e.getMessage());
			this.network.onDialFailed(this.address);
			this.future.completeExceptionally(e);
			return;
		}

		Peer peer = new Peer(this.network, socket, this.address, this.future);
		if (!this.network.addPendingPeer(peer))
			return;

		peer.upgrade();
	}

	private Socket dial() throws IOException, InterruptedException {
		NetworkSettings settings = this.network.getSettings();
		long backoff = settings.getDialRetryBackoff();

		for (int attempt = 0; ; ++attempt) {
			try {
				InetSocketAddress socketAddress = this.address.toSocketAddress();
				return this.network.getDialer().dial(socketAddress, settings.getDialTimeout());
			} catch (UnknownHostException e) {
				// Not transient
				throw e;
			} catch (IOException e) {
				if (attempt >= settings.getDialRetryAttempts() || this.network.isClosing())
					throw e;

				LOGGER.trace("Dial attempt {} to {} failed, retrying in {}ms: {}", attempt + 1, this.address, backoff, e.getMessage());
				Thread.sleep(backoff);
				backoff = Math.min(backoff * 2, settings.getDialRetryMaxBackoff());
			}
		}
	}
}
