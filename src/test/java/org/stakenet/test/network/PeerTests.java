package org.stakenet.test.network;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.stakenet.network.CloseReason;
import org.stakenet.network.Network;
import org.stakenet.network.Peer;
import org.stakenet.network.PeerAddress;
import org.stakenet.network.PeerClosedException;
import org.stakenet.network.PeerState;
import org.stakenet.network.message.Message;
import org.stakenet.network.message.MessageBuilder;
import org.stakenet.test.common.NetworkTestUtils;
import org.stakenet.test.common.RecordingHandler;

import java.net.Socket;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.Assert.*;

/** Peer send queue and close semantics, without any I/O. */
public class PeerTests {

	private static final int SEND_QUEUE_SIZE = 2;

	private Network network;
	private Peer peer;
	private CompletableFuture<Peer> connectFuture;

	@Before
	public void beforeTest() throws Exception {
		this.network = new Network(NetworkTestUtils.settings("sendQueueSize", SEND_QUEUE_SIZE), NetworkTestUtils.credentials(), new RecordingHandler());

		this.connectFuture = new CompletableFuture<>();
		this.peer = new Peer(this.network, new Socket(), PeerAddress.fromString("127.0.0.1:9651", 0), this.connectFuture);
	}

	@After
	public void afterTest() {
		this.network.close();
	}

	@Test
	public void testNonBlockingSendDropsWhenFull() {
		assertTrue(this.peer.send(MessageBuilder.ping(), false));
		assertTrue(this.peer.send(MessageBuilder.pong(), false));

		assertFalse(this.peer.send(MessageBuilder.getPeerList(), false));

		// Queue unchanged by the dropped send
		assertEquals(SEND_QUEUE_SIZE, this.peer.getSendQueueSize());
		assertEquals(1, this.network.getStats().droppedSends);
	}

	@Test
	public void testSendOrder() throws InterruptedException {
		Message first = MessageBuilder.ping();
		Message second = MessageBuilder.pong();

		this.peer.send(first, false);
		this.peer.send(second, false);

		assertSame(first, this.peer.takeNextMessage());
		this.peer.onMessageWritten();
		assertSame(second, this.peer.takeNextMessage());
		this.peer.onMessageWritten();
		assertFalse(this.peer.hasQueuedMessages());
	}

	@Test
	public void testBlockingSendWaitsForSpace() throws Exception {
		this.peer.send(MessageBuilder.ping(), false);
		this.peer.send(MessageBuilder.ping(), false);

		CompletableFuture<Boolean> blockedSend = CompletableFuture.supplyAsync(() -> this.peer.send(MessageBuilder.pong(), true));

		Thread.sleep(200L);
		assertFalse(blockedSend.isDone());

		// Writer takes a message, freeing space
		this.peer.takeNextMessage();
		this.peer.onMessageWritten();

		assertTrue(blockedSend.get(5, TimeUnit.SECONDS));
		assertEquals(SEND_QUEUE_SIZE, this.peer.getSendQueueSize());
	}

	@Test
	public void testBlockingSendReleasedByClose() throws Exception {
		this.peer.send(MessageBuilder.ping(), false);
		this.peer.send(MessageBuilder.ping(), false);

		CompletableFuture<Boolean> blockedSend = CompletableFuture.supplyAsync(() -> this.peer.send(MessageBuilder.pong(), true));

		Thread.sleep(200L);
		assertFalse(blockedSend.isDone());

		this.peer.close();

		assertFalse(blockedSend.get(5, TimeUnit.SECONDS));
		assertEquals(PeerState.CLOSED, this.peer.getState());
		// Queued messages are discarded
		assertEquals(0, this.peer.getSendQueueSize());
	}

	@Test
	public void testSendAfterCloseRejected() {
		this.peer.close();

		assertFalse(this.peer.send(MessageBuilder.ping(), false));
		assertEquals(0, this.network.getStats().droppedSends);
	}

	@Test
	public void testConcurrentCloseHappensOnce() throws Exception {
		int threadCount = 8;
		CountDownLatch startLatch = new CountDownLatch(1);
		List<Thread> threads = new ArrayList<>();
		AtomicBoolean failed = new AtomicBoolean();

		for (int i = 0; i < threadCount; ++i) {
			CloseReason reason = i % 2 == 0 ? CloseReason.LOCAL : CloseReason.IO_ERROR;

			Thread thread = new Thread(() -> {
				try {
					startLatch.await();
					this.peer.close(reason, "test");
				} catch (InterruptedException | RuntimeException e) {
					failed.set(true);
				}
			});
			thread.start();
			threads.add(thread);
		}

		startLatch.countDown();
		for (Thread thread : threads)
			thread.join(5000L);

		assertFalse(failed.get());
		assertTrue(this.peer.awaitClosed(5000L));
		assertEquals(PeerState.CLOSED, this.peer.getState());
		assertEquals(1, this.network.getStats().closedPeers);

		// Later closes are no-ops
		CloseReason reason = this.peer.getCloseReason();
		this.peer.close(CloseReason.PING_TIMEOUT, "again");
		assertEquals(reason, this.peer.getCloseReason());
		assertEquals(1, this.network.getStats().closedPeers);
	}

	@Test
	public void testConnectFutureFailsOnClose() throws InterruptedException {
		this.peer.close(CloseReason.TLS_ERROR, "bad certificate");

		try {
			this.connectFuture.get(5, TimeUnit.SECONDS);
			fail("Expected connect future to fail");
		} catch (ExecutionException e) {
			assertTrue(e.getCause() instanceof PeerClosedException);
			assertEquals(CloseReason.TLS_ERROR, ((PeerClosedException) e.getCause()).getReason());
		} catch (TimeoutException e) {
			fail("Connect future not completed");
		}

		assertEquals(1, this.network.getStats().handshakeFailures);
	}

}
