package org.stakenet.uptime;

/**
 * Exponentially-decaying uptime estimate.
 * <p>
 * Time is split into periods of one half-life. At each period boundary the accumulated value is halved
 * and the running time within the finished period contributes at most 0.5, so the value always stays in [0, 1].
 * <p>
 * If a meter is left unread for more than <tt>maxSkippedIntervals</tt> half-lives, its history is
 * discarded and the value jumps straight to 1 (running) or 0 (stopped). This is an intentional approximation
 * that keeps the closed-form decay within range of a 64-bit shift.
 * <p>
 * Not thread-safe: callers synchronize.
 */
public class IntervalMeter implements Meter {

	public static final int DEFAULT_MAX_SKIPPED_INTERVALS = 32;

	private final long halflife;
	private final int maxSkippedIntervals;

	private boolean running;
	private double value;
	private long lastUpdated;
	private long nextHalvening;

	public IntervalMeter(long halflife, int maxSkippedIntervals) {
		if (halflife <= 0)
			throw new IllegalArgumentException("Halflife must be positive");

		if (maxSkippedIntervals < 1 || maxSkippedIntervals > 62)
			throw new IllegalArgumentException("Max skipped intervals must be within 1..62");

		this.halflife = halflife;
		this.maxSkippedIntervals = maxSkippedIntervals;
	}

	public IntervalMeter(long halflife) {
		this(halflife, DEFAULT_MAX_SKIPPED_INTERVALS);
	}

	@Override
	public void start(long now) {
		if (this.running)
			return;

		read(now);
		this.running = true;
	}

	@Override
	public void stop(long now) {
		if (!this.running)
			return;

		read(now);
		this.running = false;
	}

	@Override
	public boolean isRunning() {
		return this.running;
	}

	public long getHalflife() {
		return this.halflife;
	}

	@Override
	public double read(long now) {
		if (now <= this.lastUpdated)
			return this.value;

		// Finish current period
		if (now > this.nextHalvening) {
			if (this.running) {
				double additionalRunningTime = (double) (this.nextHalvening - this.lastUpdated) / this.halflife;
				this.value += additionalRunningTime / 2;
			}

			this.lastUpdated = this.nextHalvening;
			this.nextHalvening += this.halflife;
			this.value /= 2;

			// Skip whole periods in one step
			long totalTime = now - this.lastUpdated;
			if (totalTime > this.halflife) {
				long skippedPeriods = totalTime / this.halflife;

				if (skippedPeriods > this.maxSkippedIntervals) {
					this.value = this.running ? 1.0 : 0.0;
					this.lastUpdated = now;
					this.nextHalvening = now + this.halflife;
					return this.value;
				}

				double factor = 1.0 / (1L << skippedPeriods);
				this.value *= factor;
				if (this.running)
					this.value += 1.0 - factor;
				this.value /= 2;

				long skippedDuration = this.halflife * skippedPeriods;
				this.lastUpdated += skippedDuration;
				this.nextHalvening += skippedDuration;
			}
		}

		// Current, partial period
		if (this.running) {
			double additionalRunningTime = (double) (now - this.lastUpdated) / this.halflife;
			this.value += additionalRunningTime / 2;
		}

		this.lastUpdated = now;
		return this.value;
	}

}
