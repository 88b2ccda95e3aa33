package org.stakenet.version;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class VersionParser {

	/** Application version strings look like <tt>stakenet/1.4.2</tt>. */
	public static final Pattern VERSION_PATTERN = Pattern.compile("([A-Za-z0-9_.-]+)/(\\d{1,5})\\.(\\d{1,5})\\.(\\d{1,5})");

	private VersionParser() {
	}

	public static Version parse(String versionString) throws VersionException {
		if (versionString == null)
			throw new VersionException("Missing version string");

		Matcher matcher = VERSION_PATTERN.matcher(versionString);
		if (!matcher.matches())
			throw new VersionException(String.format("Unparseable version string \"%s\"", versionString));

		try {
			return new Version(matcher.group(1),
					Integer.parseInt(matcher.group(2)),
					Integer.parseInt(matcher.group(3)),
					Integer.parseInt(matcher.group(4)));
		} catch (NumberFormatException e) {
			throw new VersionException(String.format("Invalid version number in \"%s\"", versionString), e);
		}
	}

}
