package org.stakenet.test.uptime;

import org.junit.Test;
import org.stakenet.network.PeerId;
import org.stakenet.uptime.IntervalMeter;
import org.stakenet.uptime.Meter;
import org.stakenet.uptime.UptimeTracker;

import java.nio.ByteBuffer;
import java.util.Random;

import static org.junit.Assert.*;

public class IntervalMeterTests {

	private static final double DELTA = 1e-9;
	private static final long HALFLIFE = 1000L;

	@Test
	public void testHalflifeScenario() {
		Meter meter = new IntervalMeter(HALFLIFE);

		meter.start(0L);
		assertEquals(0.5, meter.read(1000L), DELTA);

		meter.stop(1000L);
		assertEquals(0.25, meter.read(2000L), DELTA);
	}

	@Test
	public void testOneHalflifeRunning() {
		Meter meter = new IntervalMeter(HALFLIFE);

		meter.start(0L);
		double value = meter.read(1000L);

		// Continuously running for one more half-life moves value halfway to 1
		assertEquals((value + 1.0) / 2, meter.read(2000L), DELTA);
	}

	@Test
	public void testLongGapRunning() {
		Meter meter = new IntervalMeter(HALFLIFE);

		meter.start(0L);
		assertEquals(1.0, meter.read(100_000L), 0.0);
	}

	@Test
	public void testLongGapStopped() {
		Meter meter = new IntervalMeter(HALFLIFE);

		meter.start(0L);
		meter.stop(500L);
		assertEquals(0.0, meter.read(100_000L), 0.0);
	}

	@Test
	public void testConfigurableSkipCeiling() {
		IntervalMeter meter = new IntervalMeter(HALFLIFE, 4);

		meter.start(0L);
		// 10 skipped periods exceeds ceiling of 4
		assertEquals(1.0, meter.read(10_500L), 0.0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidSkipCeiling() {
		new IntervalMeter(HALFLIFE, 63);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidHalflife() {
		new IntervalMeter(0L);
	}

	@Test
	public void testStartStopIdempotent() {
		Meter once = new IntervalMeter(HALFLIFE);
		once.start(0L);

		Meter twice = new IntervalMeter(HALFLIFE);
		twice.start(0L);
		twice.start(500L);

		assertEquals(once.read(1000L), twice.read(1000L), DELTA);

		once.stop(1000L);
		twice.stop(1000L);
		twice.stop(1500L);

		assertFalse(twice.isRunning());
		assertEquals(once.read(2000L), twice.read(2000L), DELTA);
	}

	@Test
	public void testReadAtSameTimeUnchanged() {
		Meter meter = new IntervalMeter(HALFLIFE);
		meter.start(0L);

		double value = meter.read(1234L);
		assertEquals(value, meter.read(1234L), 0.0);
		// Time going backwards doesn't change value either
		assertEquals(value, meter.read(1000L), 0.0);
	}

	@Test
	public void testValueBounds() {
		Random random = new Random(1234L);

		for (int run = 0; run < 100; ++run) {
			Meter meter = new IntervalMeter(HALFLIFE);
			long now = 0L;

			for (int step = 0; step < 200; ++step) {
				now += random.nextInt(5000);

				switch (random.nextInt(3)) {
					case 0:
						meter.start(now);
						break;

					case 1:
						meter.stop(now);
						break;

					default:
						break;
				}

				double value = meter.read(now);
				assertTrue("value below 0: " + value, value >= 0.0);
				assertTrue("value above 1: " + value, value <= 1.0);
			}
		}
	}

	@Test
	public void testUptimeTracker() {
		UptimeTracker tracker = new UptimeTracker(HALFLIFE, IntervalMeter.DEFAULT_MAX_SKIPPED_INTERVALS);
		PeerId peerId = PeerId.fromBytes(new byte[PeerId.LENGTH]);

		assertEquals(0.0, tracker.getUptime(peerId, 0L), 0.0);

		tracker.start(peerId, 0L);
		assertEquals(0.5, tracker.getUptime(peerId, 1000L), DELTA);

		tracker.stop(peerId, 1000L);
		assertEquals(0.25, tracker.getUptimes(2000L).get(peerId), DELTA);
		assertEquals(1, tracker.size());
	}

	@Test
	public void testTrackerSweepsDecayedMeters() {
		final int maxSkipped = IntervalMeter.DEFAULT_MAX_SKIPPED_INTERVALS;
		UptimeTracker tracker = new UptimeTracker(HALFLIFE, maxSkipped);

		// Many short-lived peers, each seen once
		for (int i = 0; i < 5000; ++i) {
			PeerId peerId = peerId(i);
			tracker.start(peerId, 0L);
			tracker.stop(peerId, HALFLIFE);
		}

		long later = HALFLIFE + HALFLIFE * (maxSkipped + 2);

		PeerId runningPeerId = peerId(-1);
		tracker.start(runningPeerId, 0L);

		PeerId recentPeerId = peerId(-2);
		tracker.start(recentPeerId, 0L);
		tracker.stop(recentPeerId, later - 1L);

		assertEquals(5002, tracker.size());

		// Nothing has decayed yet
		assertEquals(0, tracker.sweep(2 * HALFLIFE));

		assertEquals(5000, tracker.sweep(later));
		assertEquals(2, tracker.size());
		assertTrue(tracker.getUptime(runningPeerId, later) > 0.0);
		assertTrue(tracker.getUptime(recentPeerId, later) > 0.0);
	}

	private static PeerId peerId(int n) {
		byte[] bytes = new byte[PeerId.LENGTH];
		ByteBuffer.wrap(bytes).putInt(n);
		return PeerId.fromBytes(bytes);
	}

}
