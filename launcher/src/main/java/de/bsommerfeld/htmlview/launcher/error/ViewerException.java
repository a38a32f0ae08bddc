package de.bsommerfeld.htmlview.launcher.error;

/**
 * Base of every failure raised while launching or talking to a viewer.
 *
 * <p>
 * Callers that need to branch on the failure either catch the concrete
 * subclass or switch over {@link #kind()}. A viewer that closes because its
 * configured timeout elapsed is <em>not</em> a failure and never surfaces as a
 * {@code ViewerException}.
 */
public class ViewerException extends Exception {

    private final ViewerErrorKind kind;

    public ViewerException(ViewerErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ViewerException(ViewerErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ViewerErrorKind kind() {
        return kind;
    }
}
