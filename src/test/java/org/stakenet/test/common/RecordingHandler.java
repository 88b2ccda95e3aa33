package org.stakenet.test.common;

import org.stakenet.network.MessageHandler;
import org.stakenet.network.PeerId;
import org.stakenet.network.message.Message;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/** Records everything delivered by a network. */
public class RecordingHandler implements MessageHandler {

	public final BlockingQueue<Message> messages = new LinkedBlockingQueue<>();
	public final List<PeerId> connected = new CopyOnWriteArrayList<>();
	public final List<PeerId> disconnected = new CopyOnWriteArrayList<>();

	@Override
	public void handleMessage(PeerId peerId, Message message) {
		this.messages.add(message);
	}

	@Override
	public void connected(PeerId peerId) {
		this.connected.add(peerId);
	}

	@Override
	public void disconnected(PeerId peerId) {
		this.disconnected.add(peerId);
	}

	public Message nextMessage() throws InterruptedException {
		Message message = this.messages.poll(NetworkTestUtils.WAIT_TIMEOUT, TimeUnit.MILLISECONDS);
		if (message == null)
			throw new AssertionError("No message received");

		return message;
	}

}
