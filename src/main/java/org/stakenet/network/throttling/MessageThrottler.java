package org.stakenet.network.throttling;

import org.stakenet.network.PeerId;

/**
 * Bounds the bytes of messages in flight, in total and per peer.
 * <p>
 * Every successful acquire must eventually be matched by a release of the same byte count.
 */
public interface MessageThrottler {

	/**
	 * Reserves <tt>bytes</tt> for <tt>peerId</tt>.
	 *
	 * @param timeout maximum time to wait (ms), or 0 to return immediately
	 * @return true if reserved
	 */
	boolean acquire(PeerId peerId, int bytes, long timeout) throws InterruptedException;

	void release(PeerId peerId, int bytes);

	/** Bytes currently reserved across all peers. */
	long getUsedBytes();

	/** Throttler that never throttles. */
	MessageThrottler UNLIMITED = new MessageThrottler() {
		@Override
		public boolean acquire(PeerId peerId, int bytes, long timeout) {
			return true;
		}

		@Override
		public void release(PeerId peerId, int bytes) {
		}

		@Override
		public long getUsedBytes() {
			return 0L;
		}
	};

}
