package express.mvp.midrpc;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed middleware version.
 *
 * <p>Release strings look like {@code TrueNAS-SCALE-24.10.2.1} or {@code 25.04.0}; the first
 * {@code major.minor.patch[.build]} group is used and the flavor is taken from the marker word
 * anywhere in the string.
 *
 * @param major major release (e.g. 25)
 * @param minor minor release (e.g. 4)
 * @param patch patch level
 * @param build build number, 0 when absent
 * @param flavor product flavor
 * @param raw the string the version was parsed from
 */
public record Version(int major, int minor, int patch, int build, Flavor flavor, String raw)
        implements Comparable<Version> {

    private static final Pattern VERSION = Pattern.compile("(\\d+)\\.(\\d+)\\.(\\d+)(?:\\.(\\d+))?");

    /** Product flavor reported in the release string. */
    public enum Flavor {
        SCALE,
        COMMUNITY,
        UNKNOWN
    }

    /**
     * Parses a release string.
     *
     * @param raw the release string
     * @return the parsed version
     * @throws IllegalArgumentException if no numeric version is present
     */
    public static Version parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        Flavor flavor;
        if (raw.contains("SCALE")) {
            flavor = Flavor.SCALE;
        } else if (raw.contains("COMMUNITY")) {
            flavor = Flavor.COMMUNITY;
        } else {
            flavor = Flavor.UNKNOWN;
        }

        Matcher m = VERSION.matcher(raw);
        if (!m.find()) {
            throw new IllegalArgumentException("unable to parse version from \"" + raw + "\"");
        }
        try {
            return new Version(
                    Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)),
                    m.group(4) != null ? Integer.parseInt(m.group(4)) : 0,
                    flavor,
                    raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid version number in \"" + raw + "\"", e);
        }
    }

    /**
     * Checks whether this version is at least {@code major.minor}; patch and build are ignored.
     *
     * @param major required major release
     * @param minor required minor release
     * @return true if this version is the same or newer
     */
    public boolean atLeast(int major, int minor) {
        if (this.major != major) {
            return this.major > major;
        }
        return this.minor >= minor;
    }

    @Override
    public int compareTo(Version other) {
        int c = Integer.compare(major, other.major);
        if (c == 0) {
            c = Integer.compare(minor, other.minor);
        }
        if (c == 0) {
            c = Integer.compare(patch, other.patch);
        }
        if (c == 0) {
            c = Integer.compare(build, other.build);
        }
        return c;
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch + "." + build;
    }
}
