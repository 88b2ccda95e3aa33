package org.stakenet.test.network.throttling;

import org.junit.Test;
import org.stakenet.network.PeerId;
import org.stakenet.network.throttling.ByteMessageThrottler;
import org.stakenet.network.throttling.InboundConnectionThrottler;

import java.net.InetAddress;
import java.util.Arrays;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.Assert.*;

public class ThrottlerTests {

	private static PeerId peerId(int n) {
		byte[] bytes = new byte[PeerId.LENGTH];
		Arrays.fill(bytes, (byte) n);
		return PeerId.fromBytes(bytes);
	}

	@Test
	public void testPerPeerLimit() throws InterruptedException {
		ByteMessageThrottler throttler = new ByteMessageThrottler("test", 1000, 100);
		PeerId peer1 = peerId(1);
		PeerId peer2 = peerId(2);

		assertTrue(throttler.acquire(peer1, 60, 0L));
		assertFalse(throttler.acquire(peer1, 60, 0L));
		// Other peers unaffected
		assertTrue(throttler.acquire(peer2, 60, 0L));

		throttler.release(peer1, 60);
		assertTrue(throttler.acquire(peer1, 60, 0L));

		assertEquals(120, throttler.getUsedBytes());
		assertEquals(60, throttler.getUsedBytes(peer1));
	}

	@Test
	public void testTotalLimit() throws InterruptedException {
		ByteMessageThrottler throttler = new ByteMessageThrottler("test", 100, 100);

		assertTrue(throttler.acquire(peerId(1), 60, 0L));
		assertFalse(throttler.acquire(peerId(2), 60, 0L));
	}

	@Test
	public void testOversizedMessageAdmittedWhenIdle() throws InterruptedException {
		ByteMessageThrottler throttler = new ByteMessageThrottler("test", 100, 50);

		assertTrue(throttler.acquire(peerId(1), 500, 0L));
		assertFalse(throttler.acquire(peerId(2), 10, 0L));

		throttler.release(peerId(1), 500);
		assertEquals(0, throttler.getUsedBytes());
	}

	@Test
	public void testBlockedAcquireWokenByRelease() throws InterruptedException {
		ByteMessageThrottler throttler = new ByteMessageThrottler("test", 100, 100);
		PeerId peer = peerId(1);
		assertTrue(throttler.acquire(peer, 100, 0L));

		CountDownLatch acquired = new CountDownLatch(1);
		AtomicBoolean result = new AtomicBoolean();
		Thread thread = new Thread(() -> {
			try {
				result.set(throttler.acquire(peer, 50, 10_000L));
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
			acquired.countDown();
		});
		thread.start();

		assertFalse(acquired.await(200, TimeUnit.MILLISECONDS));

		throttler.release(peer, 100);
		assertTrue(acquired.await(5, TimeUnit.SECONDS));
		assertTrue(result.get());
	}

	@Test(expected = IllegalStateException.class)
	public void testReleaseWithoutAcquire() {
		new ByteMessageThrottler("test", 100, 100).release(peerId(1), 10);
	}

	@Test
	public void testInboundConnectionCooldown() throws Exception {
		InboundConnectionThrottler throttler = new InboundConnectionThrottler(1000L, 2);
		InetAddress address1 = InetAddress.getByName("10.0.0.1");
		InetAddress address2 = InetAddress.getByName("10.0.0.2");
		InetAddress address3 = InetAddress.getByName("10.0.0.3");

		assertTrue(throttler.allow(address1, 0L));
		assertFalse(throttler.allow(address1, 500L));
		assertTrue(throttler.allow(address2, 500L));
		// Too many recent connections overall
		assertFalse(throttler.allow(address3, 600L));

		assertTrue(throttler.allow(address1, 1000L));
		assertTrue(throttler.allow(address3, 1500L));
	}

	@Test
	public void testInboundConnectionThrottlingDisabled() throws Exception {
		InboundConnectionThrottler throttler = new InboundConnectionThrottler(0L, 1);
		InetAddress address = InetAddress.getByName("10.0.0.1");

		for (int i = 0; i < 10; ++i)
			assertTrue(throttler.allow(address, i));
	}

}
