package org.stakenet.benchlist;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.stakenet.network.PeerId;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Temporarily excludes peers that repeatedly fail to respond.
 * <p>
 * Failures are counted within a sliding window. Reaching the threshold benches the peer
 * for a fixed duration, after which it is automatically unbenched. A threshold of zero disables benching.
 * <p>
 * Benching is independent of transport health: a benched peer can remain connected.
 * <p>
 * Thread-safe. Listeners are notified outside of the internal lock.
 */
public class Benchlist {

	private static final Logger LOGGER = LogManager.getLogger(Benchlist.class);

	private static class Entry {
		final Deque<Long> failures = new ArrayDeque<>();
		long benchedUntil = 0L;

		boolean isBenched(long now) {
			return this.benchedUntil > now;
		}

		void pruneFailures(long cutoff) {
			while (!this.failures.isEmpty() && this.failures.peekFirst() <= cutoff)
				this.failures.removeFirst();
		}
	}

	private final int threshold;
	private final long window;
	private final long duration;

	private final Object lock = new Object();
	private final Map<PeerId, Entry> entries = new HashMap<>();
	private final List<BenchlistListener> listeners = new CopyOnWriteArrayList<>();

	/**
	 * @param threshold failures within <tt>window</tt> that cause benching, or 0 to disable
	 * @param window sliding failure window (ms)
	 * @param duration how long a peer stays benched (ms)
	 */
	public Benchlist(int threshold, long window, long duration) {
		if (threshold < 0 || window < 0 || duration < 0)
			throw new IllegalArgumentException("Benchlist parameters must be non-negative");

		this.threshold = threshold;
		this.window = window;
		this.duration = duration;
	}

	public void addListener(BenchlistListener listener) {
		this.listeners.add(listener);
	}

	public void removeListener(BenchlistListener listener) {
		this.listeners.remove(listener);
	}

	public boolean registerFailure(PeerId peerId) {
		return registerFailure(peerId, System.currentTimeMillis());
	}

	/**
	 * Records a failure, such as an unanswered query, by peer.
	 *
	 * @return true if this failure caused peer to become benched
	 */
	public boolean registerFailure(PeerId peerId, long now) {
		if (this.threshold == 0)
			return false;

		boolean benched = false;
		long benchedUntil = 0L;
		List<PeerId> expired;

		synchronized (this.lock) {
			expired = expireLocked(peerId, now);

			Entry entry = this.entries.computeIfAbsent(peerId, id -> new Entry());
			if (!entry.isBenched(now)) {
				entry.pruneFailures(now - this.window);
				entry.failures.addLast(now);

				if (entry.failures.size() >= this.threshold) {
					entry.failures.clear();
					entry.benchedUntil = now + this.duration;
					benchedUntil = entry.benchedUntil;
					benched = true;
				}
			}
		}

		notifyUnbenched(expired);

		if (!benched)
			return false;

		LOGGER.debug("Benching peer {} until {} after {} failures", peerId, benchedUntil, this.threshold);
		for (BenchlistListener listener : this.listeners)
			listener.benched(peerId, benchedUntil);

		return true;
	}

	/** Records a successful response from peer, which resets its failure streak. */
	public void registerResponse(PeerId peerId) {
		synchronized (this.lock) {
			Entry entry = this.entries.get(peerId);
			if (entry == null)
				return;

			entry.failures.clear();
			if (entry.benchedUntil == 0L)
				this.entries.remove(peerId);
		}
	}

	public boolean isBenched(PeerId peerId) {
		return isBenched(peerId, System.currentTimeMillis());
	}

	public boolean isBenched(PeerId peerId, long now) {
		List<PeerId> expired;
		boolean benched;

		synchronized (this.lock) {
			expired = expireLocked(peerId, now);

			Entry entry = this.entries.get(peerId);
			benched = entry != null && entry.isBenched(now);
		}

		notifyUnbenched(expired);
		return benched;
	}

	/** Administrative override: forgets peer's failures and unbenches it immediately. */
	public void clear(PeerId peerId) {
		Entry entry;
		synchronized (this.lock) {
			entry = this.entries.remove(peerId);
		}

		if (entry != null && entry.benchedUntil != 0L)
			notifyUnbenched(Collections.singletonList(peerId));
	}

	/** Unbenches expired peers and discards failures that have left the window. */
	public void sweep(long now) {
		List<PeerId> expired = new ArrayList<>();

		synchronized (this.lock) {
			Iterator<Map.Entry<PeerId, Entry>> iterator = this.entries.entrySet().iterator();
			while (iterator.hasNext()) {
				Map.Entry<PeerId, Entry> mapEntry = iterator.next();
				Entry entry = mapEntry.getValue();

				if (entry.benchedUntil != 0L) {
					if (entry.isBenched(now))
						continue;

					expired.add(mapEntry.getKey());
					entry.benchedUntil = 0L;
				}

				entry.pruneFailures(now - this.window);
				if (entry.failures.isEmpty())
					iterator.remove();
			}
		}

		notifyUnbenched(expired);
	}

	public Set<PeerId> getBenched(long now) {
		synchronized (this.lock) {
			Set<PeerId> benched = new HashSet<>();
			for (Map.Entry<PeerId, Entry> mapEntry : this.entries.entrySet())
				if (mapEntry.getValue().isBenched(now))
					benched.add(mapEntry.getKey());

			return benched;
		}
	}

	/** Lazily unbenches a single peer whose bench has expired. Call with lock held. */
	private List<PeerId> expireLocked(PeerId peerId, long now) {
		Entry entry = this.entries.get(peerId);
		if (entry == null || entry.benchedUntil == 0L || entry.isBenched(now))
			return Collections.emptyList();

		this.entries.remove(peerId);
		return Collections.singletonList(peerId);
	}

	private void notifyUnbenched(List<PeerId> peerIds) {
		for (PeerId peerId : peerIds) {
			LOGGER.debug("Peer {} no longer benched", peerId);

			for (BenchlistListener listener : this.listeners)
				listener.unbenched(peerId);
		}
	}

}
