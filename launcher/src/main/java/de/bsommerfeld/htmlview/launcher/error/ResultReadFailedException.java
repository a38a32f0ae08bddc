package de.bsommerfeld.htmlview.launcher.error;

import java.nio.file.Path;

/**
 * The viewer's result file never became readable within the allotted attempts.
 */
public class ResultReadFailedException extends ViewerException {

    private final Path path;
    private final int attempts;

    public ResultReadFailedException(String message, Path path, int attempts, Throwable cause) {
        super(ViewerErrorKind.RESULT_READ_FAILED, message, cause);
        this.path = path;
        this.attempts = attempts;
    }

    public Path path() {
        return path;
    }

    public int attempts() {
        return attempts;
    }
}
