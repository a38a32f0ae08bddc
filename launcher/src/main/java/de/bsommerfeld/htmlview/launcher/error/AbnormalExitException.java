package de.bsommerfeld.htmlview.launcher.error;

/**
 * The viewer exited with a non-zero code without reporting an error itself.
 */
public class AbnormalExitException extends ViewerException {

    private final int exitCode;

    public AbnormalExitException(int exitCode, String message) {
        super(ViewerErrorKind.ABNORMAL_EXIT, message);
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
