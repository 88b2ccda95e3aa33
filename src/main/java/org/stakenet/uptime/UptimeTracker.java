package org.stakenet.uptime;

import org.stakenet.network.PeerId;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * One {@link IntervalMeter} per tracked peer.
 * <p>
 * Meters survive disconnection so a returning peer keeps its history,
 * until {@link #sweep(long)} finds them stopped and fully decayed.
 */
public class UptimeTracker {

	private final long halflife;
	private final int maxSkippedIntervals;
	private final Map<PeerId, Meter> meters = new HashMap<>();

	public UptimeTracker(long halflife, int maxSkippedIntervals) {
		this.halflife = halflife;
		this.maxSkippedIntervals = maxSkippedIntervals;
	}

	public synchronized void start(PeerId peerId, long now) {
		this.meters.computeIfAbsent(peerId, id -> new IntervalMeter(this.halflife, this.maxSkippedIntervals)).start(now);
	}

	public synchronized void stop(PeerId peerId, long now) {
		Meter meter = this.meters.get(peerId);
		if (meter != null)
			meter.stop(now);
	}

	/** Returns uptime estimate for peer, or 0 if never tracked. */
	public synchronized double getUptime(PeerId peerId, long now) {
		Meter meter = this.meters.get(peerId);
		if (meter == null)
			return 0.0;

		return meter.read(now);
	}

	public synchronized Map<PeerId, Double> getUptimes(long now) {
		Map<PeerId, Double> uptimes = new HashMap<>();
		for (Map.Entry<PeerId, Meter> entry : this.meters.entrySet())
			uptimes.put(entry.getKey(), entry.getValue().read(now));

		return uptimes;
	}

	/**
	 * Forgets stopped meters whose value has decayed to zero.
	 *
	 * @return number of meters removed
	 */
	public synchronized int sweep(long now) {
		int removed = 0;

		Iterator<Meter> iterator = this.meters.values().iterator();
		while (iterator.hasNext()) {
			Meter meter = iterator.next();
			if (meter.isRunning() || meter.read(now) > 0.0)
				continue;

			iterator.remove();
			++removed;
		}

		return removed;
	}

	public synchronized int size() {
		return this.meters.size();
	}

}
