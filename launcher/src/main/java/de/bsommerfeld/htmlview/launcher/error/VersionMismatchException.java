package de.bsommerfeld.htmlview.launcher.error;

/**
 * The viewer speaks a protocol version this library cannot talk to.
 */
public class VersionMismatchException extends ViewerException {

    private final String libraryVersion;
    private final String viewerVersion;
    private final String suggestion;

    public VersionMismatchException(String libraryVersion, String viewerVersion, String suggestion) {
        super(ViewerErrorKind.VERSION_MISMATCH,
                "Version mismatch: library " + libraryVersion + ", viewer " + viewerVersion + ". " + suggestion);
        this.libraryVersion = libraryVersion;
        this.viewerVersion = viewerVersion;
        this.suggestion = suggestion;
    }

    public String libraryVersion() {
        return libraryVersion;
    }

    public String viewerVersion() {
        return viewerVersion;
    }

    /** Human-readable upgrade advice. */
    public String suggestion() {
        return suggestion;
    }
}
