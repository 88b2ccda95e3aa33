package org.stakenet.network.throttling;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.stakenet.network.PeerId;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Byte-count message throttler with a global cap and a per-peer cap.
 * <p>
 * A single message larger than a cap is admitted only when nothing else is reserved against that cap,
 * so oversized messages cannot wait forever.
 */
public class ByteMessageThrottler implements MessageThrottler {

	private static final Logger LOGGER = LogManager.getLogger(ByteMessageThrottler.class);

	private final String name;
	private final long maxBytes;
	private final long nodeMaxBytes;

	private final ReentrantLock lock = new ReentrantLock();
	private final Condition released = this.lock.newCondition();
	private final Map<PeerId, Long> usedByPeer = new HashMap<>();
	private long usedBytes = 0L;

	public ByteMessageThrottler(String name, long maxBytes, long nodeMaxBytes) {
		if (maxBytes <= 0 || nodeMaxBytes <= 0)
			throw new IllegalArgumentException("Throttler limits must be positive");

		this.name = name;
		this.maxBytes = maxBytes;
		this.nodeMaxBytes = nodeMaxBytes;
	}

	@Override
	public boolean acquire(PeerId peerId, int bytes, long timeout) throws InterruptedException {
		long remainingNanos = TimeUnit.MILLISECONDS.toNanos(timeout);

		this.lock.lockInterruptibly();
		try {
			while (!canAcquireLocked(peerId, bytes)) {
				if (remainingNanos <= 0L) {
					LOGGER.trace("{} throttler refused {} bytes for peer {}", this.name, bytes, peerId);
					return false;
				}

				remainingNanos = this.released.awaitNanos(remainingNanos);
			}

			this.usedBytes += bytes;
			this.usedByPeer.merge(peerId, (long) bytes, Long::sum);
			return true;
		} finally {
			this.lock.unlock();
		}
	}

	@Override
	public void release(PeerId peerId, int bytes) {
		this.lock.lock();
		try {
			Long peerUsed = this.usedByPeer.get(peerId);
			if (peerUsed == null || peerUsed < bytes || this.usedBytes < bytes)
				throw new IllegalStateException(String.format("%s throttler: releasing %d bytes not acquired by peer %s", this.name, bytes, peerId));

			this.usedBytes -= bytes;
			if (peerUsed == bytes)
				this.usedByPeer.remove(peerId);
			else
				this.usedByPeer.put(peerId, peerUsed - bytes);

			this.released.signalAll();
		} finally {
			this.lock.unlock();
		}
	}

	@Override
	public long getUsedBytes() {
		this.lock.lock();
		try {
			return this.usedBytes;
		} finally {
			this.lock.unlock();
		}
	}

	public long getUsedBytes(PeerId peerId) {
		this.lock.lock();
		try {
			return this.usedByPeer.getOrDefault(peerId, 0L);
		} finally {
			this.lock.unlock();
		}
	}

	private boolean canAcquireLocked(PeerId peerId, int bytes) {
		long peerUsed = this.usedByPeer.getOrDefault(peerId, 0L);

		boolean withinNode = peerUsed + bytes <= this.nodeMaxBytes || peerUsed == 0L;
		boolean withinTotal = this.usedBytes + bytes <= this.maxBytes || this.usedBytes == 0L;

		return withinNode && withinTotal;
	}

}
