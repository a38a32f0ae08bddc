package de.bsommerfeld.htmlview.launcher.version;

import de.bsommerfeld.htmlview.launcher.error.InvalidResponseException;

/**
 * A {@code major.minor.patch} triple as reported by the viewer.
 *
 * <p>
 * A pre-release or build suffix ({@code 1.2.3-rc.1+b.7}) is accepted and
 * discarded; it has no effect on compatibility. Segments are ASCII digits only.
 */
public record SemanticVersion(int major, int minor, int patch) {

    public static SemanticVersion parse(String version) throws InvalidResponseException {
        if (version == null) {
            throw new InvalidResponseException("Invalid version format: <missing>");
        }
        String[] parts = stripSuffix(version.trim()).split("\\.", -1);
        if (parts.length != 3) {
            throw new InvalidResponseException("Invalid version format: " + version);
        }
        int major = segment(parts[0], "major", version);
        int minor = segment(parts[1], "minor", version);
        int patch = segment(parts[2], "patch", version);
        return new SemanticVersion(major, minor, patch);
    }

    /** Cuts the string at the first {@code -} or {@code +}; suffixes may contain dots. */
    private static String stripSuffix(String version) {
        int end = version.length();
        int dash = version.indexOf('-');
        int plus = version.indexOf('+');
        if (dash >= 0)
            end = Math.min(end, dash);
        if (plus >= 0)
            end = Math.min(end, plus);
        return version.substring(0, end);
    }

    private static int segment(String value, String name, String version) throws InvalidResponseException {
        if (value.isEmpty() || !value.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new InvalidResponseException("Invalid " + name + " version in '" + version + "'");
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidResponseException("Invalid " + name + " version in '" + version + "'", e);
        }
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
