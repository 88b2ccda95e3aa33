package org.stakenet.uptime;

/**
 * Tracks the fraction of recent time something was observed running.
 * <p>
 * All times are milliseconds. Callers supply <tt>now</tt> so tests can control time.
 */
public interface Meter {

	/** Marks as running from <tt>now</tt>. No-op if already running. */
	void start(long now);

	/** Marks as stopped from <tt>now</tt>. No-op if not running. */
	void stop(long now);

	/** Returns current estimate in [0, 1], settling accounting up to <tt>now</tt>. */
	double read(long now);

	boolean isRunning();

}
