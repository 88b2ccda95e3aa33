package org.stakenet.network.throttling;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.InetAddress;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Limits how often inbound connections are accepted.
 * <p>
 * Each remote IP may connect at most once per <tt>cooldown</tt>, and at most <tt>maxRecent</tt>
 * connections in total are accepted per <tt>cooldown</tt>. A cooldown of zero disables throttling.
 */
public class InboundConnectionThrottler {

	private static final Logger LOGGER = LogManager.getLogger(InboundConnectionThrottler.class);

	private final long cooldown;
	private final int maxRecent;

	private final Object lock = new Object();
	/** Most recent accepted attempt per IP */
	private final Map<InetAddress, Long> recentByAddress = new HashMap<>();
	/** Timestamps of all recently accepted attempts, oldest first */
	private final Deque<Long> recent = new ArrayDeque<>();

	public InboundConnectionThrottler(long cooldown, int maxRecent) {
		this.cooldown = cooldown;
		this.maxRecent = maxRecent;
	}

	public boolean allow(InetAddress address) {
		return allow(address, System.currentTimeMillis());
	}

	public boolean allow(InetAddress address, long now) {
		if (this.cooldown <= 0)
			return true;

		synchronized (this.lock) {
			expireLocked(now);

			if (this.recentByAddress.containsKey(address)) {
				LOGGER.trace("Refusing inbound connection from {}: too soon after previous attempt", address);
				return false;
			}

			if (this.maxRecent > 0 && this.recent.size() >= this.maxRecent) {
				LOGGER.trace("Refusing inbound connection from {}: too many recent connections", address);
				return false;
			}

			this.recentByAddress.put(address, now);
			this.recent.addLast(now);
			return true;
		}
	}

	/** Drops records older than the cooldown. */
	public void cleanup(long now) {
		synchronized (this.lock) {
			expireLocked(now);
		}
	}

	private void expireLocked(long now) {
		long cutoff = now - this.cooldown;

		while (!this.recent.isEmpty() && this.recent.peekFirst() <= cutoff)
			this.recent.removeFirst();

		this.recentByAddress.values().removeIf(timestamp -> timestamp <= cutoff);
	}

}
