package org.stakenet.version;

import java.util.Objects;

/**
 * Application version: application name plus major/minor/patch triple.
 * <p>
 * Ordering compares the numeric triple only.
 */
public final class Version implements Comparable<Version> {

	private final String app;
	private final int major;
	private final int minor;
	private final int patch;

	public Version(String app, int major, int minor, int patch) {
		if (major < 0 || minor < 0 || patch < 0)
			throw new IllegalArgumentException("Version components must be non-negative");

		this.app = Objects.requireNonNull(app);
		this.major = major;
		this.minor = minor;
		this.patch = patch;
	}

	public String getApp() {
		return this.app;
	}

	public int getMajor() {
		return this.major;
	}

	public int getMinor() {
		return this.minor;
	}

	public int getPatch() {
		return this.patch;
	}

	public boolean isBefore(Version other) {
		return this.compareTo(other) < 0;
	}

	@Override
	public int compareTo(Version other) {
		int result = Integer.compare(this.major, other.major);
		if (result != 0)
			return result;

		result = Integer.compare(this.minor, other.minor);
		if (result != 0)
			return result;

		return Integer.compare(this.patch, other.patch);
	}

	@Override
	public boolean equals(Object other) {
		if (this == other)
			return true;

		if (!(other instanceof Version))
			return false;

		Version otherVersion = (Version) other;
		return this.app.equals(otherVersion.app)
				&& this.major == otherVersion.major
				&& this.minor == otherVersion.minor
				&& this.patch == otherVersion.patch;
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.app, this.major, this.minor, this.patch);
	}

	/** Returns version in the same form accepted by {@link VersionParser#parse(String)}. */
	@Override
	public String toString() {
		return String.format("%s/%d.%d.%d", this.app, this.major, this.minor, this.patch);
	}

}
