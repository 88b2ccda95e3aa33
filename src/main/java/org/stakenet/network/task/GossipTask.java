package org.stakenet.network.task;

import org.stakenet.network.Network;
import org.stakenet.utils.Task;

/** Periodic peer-list gossip. */
public class GossipTask implements Task {

	private final Network network;

	public GossipTask(Network network) {
		this.network = network;
	}

	@Override
	public String getName() {
		return "GossipTask";
	}

	@Override
	public void perform() throws InterruptedException {
		this.network.gossipPeerList();
	}
}
