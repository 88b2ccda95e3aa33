package org.stakenet.version;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Version compatibility policy with a scheduled minimum-version upgrade.
 * <p>
 * Before <tt>minCompatibleTime</tt>, peers at or above <tt>prevMinCompatible</tt> are tolerated even if they
 * are below <tt>minCompatible</tt>. From <tt>minCompatibleTime</tt> onwards, only <tt>minCompatible</tt> applies.
 */
public class Compatibility {

	private static final Logger LOGGER = LogManager.getLogger(Compatibility.class);

	private final Version current;
	private final Version minCompatible;
	private final long minCompatibleTime;
	private final Version prevMinCompatible;

	public Compatibility(Version current, Version minCompatible, long minCompatibleTime, Version prevMinCompatible) {
		this.current = Objects.requireNonNull(current);
		this.minCompatible = Objects.requireNonNull(minCompatible);
		this.minCompatibleTime = minCompatibleTime;
		this.prevMinCompatible = Objects.requireNonNull(prevMinCompatible);

		if (minCompatible.compareTo(current) > 0)
			throw new IllegalArgumentException(String.format("Minimum compatible version %s is newer than current version %s", minCompatible, current));

		if (prevMinCompatible.compareTo(minCompatible) > 0)
			throw new IllegalArgumentException(String.format("Previous minimum compatible version %s is newer than minimum %s", prevMinCompatible, minCompatible));
	}

	/** Single-version policy: no pending upgrade. */
	public Compatibility(Version current, Version minCompatible) {
		this(current, minCompatible, 0L, minCompatible);
	}

	public Version getCurrent() {
		return this.current;
	}

	public Version getMinCompatible() {
		return this.minCompatible;
	}

	public VersionCompatibility.Result check(Version remote, long now) {
		VersionCompatibility.Result result = VersionCompatibility.check(this.current, remote, this.minCompatible);
		if (result == VersionCompatibility.Result.COMPATIBLE)
			return result;

		if (now >= this.minCompatibleTime)
			return VersionCompatibility.Result.INCOMPATIBLE;

		if (VersionCompatibility.check(this.current, remote, this.prevMinCompatible) != VersionCompatibility.Result.COMPATIBLE)
			return VersionCompatibility.Result.INCOMPATIBLE;

		LOGGER.debug("Tolerating deprecated version {} until {}", remote, this.minCompatibleTime);
		return VersionCompatibility.Result.DEPRECATED;
	}

}
