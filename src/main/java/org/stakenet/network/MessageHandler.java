package org.stakenet.network;

import org.stakenet.network.message.Message;

/**
 * Consumer of messages that the transport doesn't handle itself.
 * <p>
 * Called on the peer's reader thread: at most one call at a time per peer, in receive order.
 * Calls for different peers may be concurrent. Slow handlers stall that peer's reads.
 */
public interface MessageHandler {

	void handleMessage(PeerId peerId, Message message);

	/** Peer completed handshake. */
	default void connected(PeerId peerId) {
	}

	/** Previously connected peer has closed. */
	default void disconnected(PeerId peerId) {
	}

}
