package org.stakenet.network.task;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.stakenet.network.Network;
import org.stakenet.network.Peer;
import org.stakenet.utils.Task;

/**
 * Sends PING to every connected peer, keeping reads alive so that silent peers hit the read timeout.
 */
public class PingTask implements Task {
	private static final Logger LOGGER = LogManager.getLogger(PingTask.class);

	private final Network network;

	public PingTask(Network network) {
		this.network = network;
	}

	@Override
	public String getName() {
		return "PingTask";
	}

	@Override
	public void perform() throws InterruptedException {
		for (Peer peer : this.network.getConnectedPeers()) {
			LOGGER.trace("[{}] Sending PING to peer {}", peer.getPeerConnectionId(), peer);
			peer.ping();
		}
	}
}
