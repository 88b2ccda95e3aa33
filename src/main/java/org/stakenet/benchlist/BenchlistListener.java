package org.stakenet.benchlist;

import org.stakenet.network.PeerId;

/** Notified when peers are benched and when their bench expires or is cleared. */
public interface BenchlistListener {

	void benched(PeerId peerId, long benchedUntil);

	default void unbenched(PeerId peerId) {
	}

}
