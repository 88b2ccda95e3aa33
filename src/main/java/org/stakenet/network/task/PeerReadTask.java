package org.stakenet.network.task;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.stakenet.network.CloseReason;
import org.stakenet.network.Peer;
import org.stakenet.network.message.Message;
import org.stakenet.network.message.MessageCodec;
import org.stakenet.network.message.MessageException;
import org.stakenet.utils.Task;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.SocketTimeoutException;

/**
 * Reader loop: decodes frames from the peer's socket and dispatches them, in order, until the peer closes.
 */
public class PeerReadTask implements Task {
	private static final Logger LOGGER = LogManager.getLogger(PeerReadTask.class);

	private final Peer peer;
	private final String name;

	public PeerReadTask(Peer peer) {
		this.peer = peer;
		this.name = "PeerReadTask::" + peer;
	}

	@Override
	public String getName() {
		return this.name;
	}

	@Override
	public void perform() throws InterruptedException {
		DataInputStream in = this.peer.getInputStream();
		int maxMessageSize = this.peer.getNetwork().getSettings().getMaxMessageSize();

		try {
			while (!this.peer.isClosing()) {
				byte[] frame = MessageCodec.readFrame(in, maxMessageSize);
				Message message = MessageCodec.parse(frame, maxMessageSize);

				this.peer.onMessage(message);
			}
		} catch (SocketTimeoutException e) {
			this.peer.close(CloseReason.PING_TIMEOUT, "nothing received for " + this.peer.getNetwork().getSettings().getPingTimeout() + "ms");
		} catch (EOFException e) {
			this.peer.close(CloseReason.IO_ERROR, "connection closed by peer");
		} catch (IOException e) {
			if (!this.peer.isClosing())
				LOGGER.debug("[{}] Read failure from peer {}: {}", this.peer.getPeerConnectionId(), this.peer, e.getMessage());

			this.peer.close(CloseReason.IO_ERROR, e.getMessage(), e);
		} catch (MessageException e) {
			LOGGER.debug("[{}] Undecodable message from peer {}: {}", this.peer.getPeerConnectionId(), this.peer, e.getMessage());
			this.peer.getNetwork().peerMisbehaved(this.peer);
			this.peer.close(CloseReason.DECODE_ERROR, e.getMessage(), e);
		} catch (InterruptedException e) {
			this.peer.close(CloseReason.NETWORK_SHUTDOWN, "interrupted");
			throw e;
		} finally {
			this.peer.onLoopExited();
		}
	}
}
