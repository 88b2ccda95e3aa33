package org.stakenet.test.version;

import org.junit.Test;
import org.stakenet.version.Compatibility;
import org.stakenet.version.Version;
import org.stakenet.version.VersionCompatibility;
import org.stakenet.version.VersionException;
import org.stakenet.version.VersionParser;

import static org.junit.Assert.*;

public class VersionTests {

	private static Version v(String versionString) {
		try {
			return VersionParser.parse(versionString);
		} catch (VersionException e) {
			throw new AssertionError(e);
		}
	}

	@Test
	public void testParse() throws VersionException {
		Version version = VersionParser.parse("stakenet/1.4.2");

		assertEquals("stakenet", version.getApp());
		assertEquals(1, version.getMajor());
		assertEquals(4, version.getMinor());
		assertEquals(2, version.getPatch());
		assertEquals("stakenet/1.4.2", version.toString());
	}

	@Test
	public void testParseInvalid() {
		String[] invalid = { null, "", "stakenet", "stakenet/1.2", "stakenet/1.2.x", "1.2.3", "stakenet/1.2.3.4", "stake net/1.2.3" };

		for (String versionString : invalid)
			try {
				VersionParser.parse(versionString);
				fail("Expected VersionException for " + versionString);
			} catch (VersionException e) {
				// expected
			}
	}

	@Test
	public void testOrdering() {
		assertTrue(v("stakenet/1.2.3").isBefore(v("stakenet/1.2.4")));
		assertTrue(v("stakenet/1.2.9").isBefore(v("stakenet/1.3.0")));
		assertTrue(v("stakenet/1.9.9").isBefore(v("stakenet/2.0.0")));
		assertFalse(v("stakenet/1.2.3").isBefore(v("stakenet/1.2.3")));
		assertEquals(0, v("stakenet/1.2.3").compareTo(v("stakenet/1.2.3")));
	}

	@Test
	public void testCheck() {
		Version local = v("stakenet/1.4.0");
		Version minCompatible = v("stakenet/1.2.0");

		assertEquals(VersionCompatibility.Result.COMPATIBLE, VersionCompatibility.check(local, v("stakenet/1.2.0"), minCompatible));
		assertEquals(VersionCompatibility.Result.COMPATIBLE, VersionCompatibility.check(local, v("stakenet/1.9.0"), minCompatible));
		assertEquals(VersionCompatibility.Result.INCOMPATIBLE, VersionCompatibility.check(local, v("stakenet/1.1.9"), minCompatible));
		// Different major version
		assertEquals(VersionCompatibility.Result.INCOMPATIBLE, VersionCompatibility.check(local, v("stakenet/2.0.0"), minCompatible));
	}

	@Test
	public void testScheduledMinimum() {
		long minCompatibleTime = 1_000_000L;
		Compatibility compatibility = new Compatibility(v("stakenet/1.4.0"), v("stakenet/1.3.0"), minCompatibleTime, v("stakenet/1.2.0"));

		// Before activation, previous minimum is tolerated
		assertEquals(VersionCompatibility.Result.COMPATIBLE, compatibility.check(v("stakenet/1.3.0"), 0L));
		assertEquals(VersionCompatibility.Result.DEPRECATED, compatibility.check(v("stakenet/1.2.5"), 0L));
		assertEquals(VersionCompatibility.Result.INCOMPATIBLE, compatibility.check(v("stakenet/1.1.0"), 0L));
		assertTrue(VersionCompatibility.Result.DEPRECATED.isAcceptable());

		// After activation, only new minimum applies
		assertEquals(VersionCompatibility.Result.INCOMPATIBLE, compatibility.check(v("stakenet/1.2.5"), minCompatibleTime));
		assertEquals(VersionCompatibility.Result.COMPATIBLE, compatibility.check(v("stakenet/1.3.1"), minCompatibleTime));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMinimumAboveCurrent() {
		new Compatibility(v("stakenet/1.0.0"), v("stakenet/1.1.0"));
	}

}
