package de.bsommerfeld.htmlview.launcher.version;

import de.bsommerfeld.htmlview.launcher.error.InvalidResponseException;
import de.bsommerfeld.htmlview.launcher.error.VersionMismatchException;
import de.bsommerfeld.htmlview.protocol.ProtocolVersion;

/**
 * Decides whether this library may accept a result from a viewer reporting a
 * given protocol version.
 *
 * <h3>Rules, applied in order</h3>
 * <ol>
 * <li>{@code 0.0.x} marks a legacy viewer that predates version reporting and
 * is always rejected.</li>
 * <li>Different major versions never talk to each other.</li>
 * <li>Below {@code 1.0.0} every minor bump is breaking, so minors must
 * match.</li>
 * <li>Anything else is compatible. Patch levels are ignored.</li>
 * </ol>
 *
 * Malformed version strings are a protocol violation
 * ({@link InvalidResponseException}), not a mismatch.
 */
public final class VersionNegotiator {

    public enum Compatibility {
        COMPATIBLE,
        LEGACY,
        MAJOR_MISMATCH,
        MINOR_MISMATCH
    }

    private final String libraryVersion;

    public VersionNegotiator() {
        this(ProtocolVersion.CURRENT);
    }

    public VersionNegotiator(String libraryVersion) {
        this.libraryVersion = libraryVersion;
    }

    public String libraryVersion() {
        return libraryVersion;
    }

    public Compatibility negotiate(String viewerVersion) throws InvalidResponseException {
        SemanticVersion library = SemanticVersion.parse(libraryVersion);
        SemanticVersion viewer = SemanticVersion.parse(viewerVersion);

        if (viewer.major() == 0 && viewer.minor() == 0)
            return Compatibility.LEGACY;
        if (library.major() != viewer.major())
            return Compatibility.MAJOR_MISMATCH;
        if (library.major() == 0 && library.minor() != viewer.minor())
            return Compatibility.MINOR_MISMATCH;
        return Compatibility.COMPATIBLE;
    }

    /**
     * Same as {@link #negotiate(String)} but raises a
     * {@link VersionMismatchException} with upgrade guidance for anything
     * other than {@link Compatibility#COMPATIBLE}.
     */
    public void requireCompatible(String viewerVersion) throws InvalidResponseException, VersionMismatchException {
        Compatibility compatibility = negotiate(viewerVersion);
        if (compatibility == Compatibility.COMPATIBLE)
            return;

        SemanticVersion library = SemanticVersion.parse(libraryVersion);
        SemanticVersion viewer = SemanticVersion.parse(viewerVersion);
        throw new VersionMismatchException(libraryVersion, viewerVersion,
                suggestion(compatibility, library, viewer));
    }

    private static String suggestion(Compatibility compatibility, SemanticVersion library, SemanticVersion viewer) {
        String wanted = library.major() + "." + library.minor() + ".x";
        return switch (compatibility) {
            case LEGACY -> "The viewer binary is outdated and does not report its protocol version. "
                    + "Install viewer " + wanted + ".";
            case MAJOR_MISMATCH, MINOR_MISMATCH -> isOlder(viewer, library)
                    ? "The viewer is too old. Install viewer " + wanted + "."
                    : "The viewer is too new. Downgrade the viewer to " + wanted
                            + " or upgrade this library to " + viewer.major() + "." + viewer.minor() + ".x.";
            case COMPATIBLE -> "";
        };
    }

    private static boolean isOlder(SemanticVersion viewer, SemanticVersion library) {
        if (viewer.major() != library.major())
            return viewer.major() < library.major();
        return viewer.minor() < library.minor();
    }
}
