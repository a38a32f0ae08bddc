package de.bsommerfeld.htmlview.protocol;

/**
 * Version of the file protocol spoken by this build.
 *
 * <p>
 * Bumped together with the project version. While the major version is
 * {@code 0}, every minor bump is treated as breaking by the launcher.
 */
public final class ProtocolVersion {

    public static final String CURRENT = "0.1.0";

    /** Reported by viewers that predate version reporting. */
    public static final String LEGACY = "0.0.0";

    private ProtocolVersion() {
    }
}
