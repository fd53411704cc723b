package com.tempeh.plugin.version;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Semantic version {@code major.minor.patch[-prerelease][+build]}.
 * <p>
 * Ordering follows semver precedence: numeric fields first, then a version with a prerelease sorts
 * before the same version without one; prerelease identifiers compare numerically when both are
 * numeric, numeric identifiers sort before alphanumeric ones, and a shorter identifier list sorts first
 * when all shared identifiers are equal. Build metadata is ignored by ordering and equality.
 */
public final class SemanticVersion implements Comparable<SemanticVersion> {

    private static final Pattern PATTERN =
            Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)(?:-([0-9A-Za-z.-]+))?(?:\\+([0-9A-Za-z.-]+))?$");

    private final int major;
    private final int minor;
    private final int patch;
    private final List<String> prerelease;
    private final String build;

    private SemanticVersion(int major, int minor, int patch, List<String> prerelease, String build) {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version numbers must be non-negative");
        }
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.prerelease = prerelease != null ? List.copyOf(prerelease) : List.of();
        this.build = build;
    }

    public static SemanticVersion of(int major, int minor, int patch) {
        return new SemanticVersion(major, minor, patch, List.of(), null);
    }

    static SemanticVersion of(int major, int minor, int patch, String prerelease) {
        return new SemanticVersion(major, minor, patch, splitPrerelease(prerelease), null);
    }

    /**
     * Parses a semantic version string.
     *
     * @param version version string like "1.2.3" or "2.0.0-rc.1+build.5"
     * @return parsed version
     * @throws IllegalArgumentException if the format is invalid
     */
    public static SemanticVersion parse(String version) {
        Objects.requireNonNull(version, "version");
        Matcher m = PATTERN.matcher(version.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid version format: " + version
                    + " (expected major.minor.patch[-prerelease][+build])");
        }
        String pre = m.group(4);
        if (pre != null && (pre.startsWith(".") || pre.endsWith(".") || pre.contains(".."))) {
            throw new IllegalArgumentException("Invalid prerelease in version: " + version);
        }
        try {
            return new SemanticVersion(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3)), splitPrerelease(pre), m.group(5));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid version numbers in: " + version, e);
        }
    }

    public static boolean isValid(String version) {
        if (version == null) {
            return false;
        }
        try {
            parse(version);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static List<String> splitPrerelease(String prerelease) {
        if (prerelease == null || prerelease.isEmpty()) {
            return List.of();
        }
        return List.of(prerelease.split("\\."));
    }

    public int getMajor() {
        return major;
    }

    public int getMinor() {
        return minor;
    }

    public int getPatch() {
        return patch;
    }

    public List<String> getPrerelease() {
        return prerelease;
    }

    public boolean isPrerelease() {
        return !prerelease.isEmpty();
    }

    /** Same major, minor and patch, ignoring prerelease and build. */
    public boolean sameCore(SemanticVersion other) {
        return major == other.major && minor == other.minor && patch == other.patch;
    }

    public boolean isAtLeast(SemanticVersion minimum) {
        return compareTo(minimum) >= 0;
    }

    @Override
    public int compareTo(SemanticVersion other) {
        Objects.requireNonNull(other, "other");
        int c = Integer.compare(major, other.major);
        if (c != 0) return c;
        c = Integer.compare(minor, other.minor);
        if (c != 0) return c;
        c = Integer.compare(patch, other.patch);
        if (c != 0) return c;
        if (prerelease.isEmpty() || other.prerelease.isEmpty()) {
            // release outranks any prerelease of the same core
            return Boolean.compare(prerelease.isEmpty(), other.prerelease.isEmpty());
        }
        int n = Math.min(prerelease.size(), other.prerelease.size());
        for (int i = 0; i < n; i++) {
            c = compareIdentifier(prerelease.get(i), other.prerelease.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(prerelease.size(), other.prerelease.size());
    }

    private static int compareIdentifier(String a, String b) {
        boolean aNum = isNumeric(a);
        boolean bNum = isNumeric(b);
        if (aNum && bNum) {
            int c = Integer.compare(a.length(), b.length());
            return c != 0 ? c : a.compareTo(b);
        }
        if (aNum) return -1;
        if (bNum) return 1;
        return a.compareTo(b);
    }

    private static boolean isNumeric(String s) {
        if (s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SemanticVersion)) return false;
        return compareTo((SemanticVersion) obj) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch, prerelease);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(major).append('.').append(minor).append('.').append(patch);
        if (!prerelease.isEmpty()) {
            sb.append('-').append(String.join(".", prerelease));
        }
        if (build != null) {
            sb.append('+').append(build);
        }
        return sb.toString();
    }
}
