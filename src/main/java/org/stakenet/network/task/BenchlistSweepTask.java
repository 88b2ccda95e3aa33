package org.stakenet.network.task;

import org.stakenet.network.Network;
import org.stakenet.utils.Task;

/** Expires benched peers, stale throttling records and decayed uptime meters. */
public class BenchlistSweepTask implements Task {

	private final Network network;

	public BenchlistSweepTask(Network network) {
		this.network = network;
	}

	@Override
	public String getName() {
		return "BenchlistSweepTask";
	}

	@Override
	public void perform() throws InterruptedException {
		long now = System.currentTimeMillis();

		this.network.getBenchlist().sweep(now);
		this.network.getInboundConnectionThrottler().cleanup(now);
		this.network.getUptimeTracker().sweep(now);
	}
}
