package org.stakenet.test.benchlist;

import org.junit.Before;
import org.junit.Test;
import org.stakenet.benchlist.Benchlist;
import org.stakenet.benchlist.BenchlistListener;
import org.stakenet.network.PeerId;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.Assert.*;

public class BenchlistTests {

	private static final int THRESHOLD = 3;
	private static final long WINDOW = 1000L;
	private static final long DURATION = 5000L;

	private final PeerId peerId = peerId(1);
	private final PeerId otherPeerId = peerId(2);

	private Benchlist benchlist;
	private final List<PeerId> benched = new ArrayList<>();
	private final List<PeerId> unbenched = new ArrayList<>();

	private static PeerId peerId(int n) {
		byte[] bytes = new byte[PeerId.LENGTH];
		Arrays.fill(bytes, (byte) n);
		return PeerId.fromBytes(bytes);
	}

	@Before
	public void beforeTest() {
		this.benchlist = new Benchlist(THRESHOLD, WINDOW, DURATION);
		this.benchlist.addListener(new BenchlistListener() {
			@Override
			public void benched(PeerId peerId, long benchedUntil) {
				BenchlistTests.this.benched.add(peerId);
			}

			@Override
			public void unbenched(PeerId peerId) {
				BenchlistTests.this.unbenched.add(peerId);
			}
		});
	}

	@Test
	public void testBenchedAtThreshold() {
		assertFalse(this.benchlist.registerFailure(this.peerId, 0L));
		assertFalse(this.benchlist.registerFailure(this.peerId, 100L));
		assertTrue(this.benchlist.registerFailure(this.peerId, 200L));

		assertTrue(this.benchlist.isBenched(this.peerId, 300L));
		assertFalse(this.benchlist.isBenched(this.otherPeerId, 300L));
		assertEquals(List.of(this.peerId), this.benched);
	}

	@Test
	public void testBenchExpires() {
		for (long now = 0L; now < THRESHOLD; ++now)
			this.benchlist.registerFailure(this.peerId, now);

		assertTrue(this.benchlist.isBenched(this.peerId, DURATION));
		assertFalse(this.benchlist.isBenched(this.peerId, DURATION + THRESHOLD));
		assertEquals(List.of(this.peerId), this.unbenched);

		// Failure streak starts afresh
		assertFalse(this.benchlist.registerFailure(this.peerId, DURATION + 10L));
	}

	@Test
	public void testFailuresOutsideWindowForgotten() {
		this.benchlist.registerFailure(this.peerId, 0L);
		this.benchlist.registerFailure(this.peerId, 500L);

		// Earlier failures have left the window
		assertFalse(this.benchlist.registerFailure(this.peerId, 1600L));
		assertFalse(this.benchlist.isBenched(this.peerId, 1600L));
	}

	@Test
	public void testResponseResetsStreak() {
		this.benchlist.registerFailure(this.peerId, 0L);
		this.benchlist.registerFailure(this.peerId, 100L);
		this.benchlist.registerResponse(this.peerId);

		assertFalse(this.benchlist.registerFailure(this.peerId, 200L));
		assertFalse(this.benchlist.isBenched(this.peerId, 300L));
	}

	@Test
	public void testZeroThresholdDisables() {
		Benchlist disabled = new Benchlist(0, WINDOW, DURATION);

		for (long now = 0L; now < 100L; ++now)
			assertFalse(disabled.registerFailure(this.peerId, now));

		assertFalse(disabled.isBenched(this.peerId, 100L));
	}

	@Test
	public void testSweep() {
		for (long now = 0L; now < THRESHOLD; ++now)
			this.benchlist.registerFailure(this.peerId, now);

		this.benchlist.sweep(1000L);
		assertTrue(this.unbenched.isEmpty());
		assertEquals(1, this.benchlist.getBenched(1000L).size());

		this.benchlist.sweep(DURATION + 1000L);
		assertEquals(List.of(this.peerId), this.unbenched);
		assertTrue(this.benchlist.getBenched(DURATION + 1000L).isEmpty());
	}

	@Test
	public void testUnbenchListenerCalledWithoutLock() {
		for (long now = 0L; now < THRESHOLD; ++now)
			this.benchlist.registerFailure(this.peerId, now);

		AtomicBoolean otherThreadProceeded = new AtomicBoolean();
		this.benchlist.addListener(new BenchlistListener() {
			@Override
			public void benched(PeerId peerId, long benchedUntil) {
			}

			@Override
			public void unbenched(PeerId peerId) {
				Thread other = new Thread(() -> BenchlistTests.this.benchlist.getBenched(0L));
				other.start();

				try {
					other.join(2000L);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}

				otherThreadProceeded.set(!other.isAlive());
			}
		});

		// Expiry is noticed while registering a new failure
		assertFalse(this.benchlist.registerFailure(this.peerId, DURATION + 10L));

		assertEquals(List.of(this.peerId), this.unbenched);
		assertTrue(otherThreadProceeded.get());
	}

	@Test
	public void testClear() {
		for (long now = 0L; now < THRESHOLD; ++now)
			this.benchlist.registerFailure(this.peerId, now);

		this.benchlist.clear(this.peerId);

		assertFalse(this.benchlist.isBenched(this.peerId, 10L));
		assertEquals(List.of(this.peerId), this.unbenched);
	}

}
