package org.stakenet.version;

public class VersionCompatibility {

	public enum Result {
		COMPATIBLE,
		/** Below current minimum but still tolerated until the minimum activates. */
		DEPRECATED,
		INCOMPATIBLE;

		public boolean isAcceptable() {
			return this != INCOMPATIBLE;
		}
	}

	private VersionCompatibility() {
	}

	/**
	 * Compares remote version against our own and the minimum we accept.
	 * <p>
	 * Any remote version strictly below <tt>minCompatible</tt>, or with a different major version to <tt>local</tt>,
	 * is incompatible.
	 */
	public static Result check(Version local, Version remote, Version minCompatible) {
		if (remote.getMajor() != local.getMajor())
			return Result.INCOMPATIBLE;

		if (remote.isBefore(minCompatible))
			return Result.INCOMPATIBLE;

		return Result.COMPATIBLE;
	}

}
