package org.stakenet.network.task;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.stakenet.network.CloseReason;
import org.stakenet.network.Peer;
import org.stakenet.network.message.Message;
import org.stakenet.network.message.MessageCodec;
import org.stakenet.utils.Task;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Writer loop: drains the peer's send queue in FIFO order until the peer closes.
 * <p>
 * Output is flushed whenever the queue runs dry.
 */
public class PeerWriteTask implements Task {
	private static final Logger LOGGER = LogManager.getLogger(PeerWriteTask.class);

	private final Peer peer;
	private final String name;

	public PeerWriteTask(Peer peer) {
		this.peer = peer;
		this.name = "PeerWriteTask::" + peer;
	}

	@Override
	public String getName() {
		return this.name;
	}

	@Override
	public void perform() throws InterruptedException {
		OutputStream out = this.peer.getOutputStream();

		try {
			Message message;
			while ((message = this.peer.takeNextMessage()) != null) {
				try {
					MessageCodec.writeFrame(out, message);

					if (!this.peer.hasQueuedMessages())
						out.flush();
				} finally {
					this.peer.onMessageWritten();
				}

				LOGGER.trace("[{}] Sent {} to peer {}", this.peer.getPeerConnectionId(), message, this.peer);
			}

			// Closing: push out anything buffered before the socket goes
			out.flush();
		} catch (IOException e) {
			if (!this.peer.isClosing())
				LOGGER.debug("[{}] Write failure to peer {}: {}", this.peer.getPeerConnectionId(), this.peer, e.getMessage());

			this.peer.close(CloseReason.IO_ERROR, e.getMessage(), e);
		} catch (InterruptedException e) {
			this.peer.close(CloseReason.NETWORK_SHUTDOWN, "interrupted");
			throw e;
		} finally {
			this.peer.closeSocket();
			this.peer.onLoopExited();
		}
	}
}
