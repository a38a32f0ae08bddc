package de.bsommerfeld.htmlview.launcher.error;

/**
 * Filesystem or process I/O failed outside the more specific cases.
 */
public class ViewerIoException extends ViewerException {

    public ViewerIoException(String message, Throwable cause) {
        super(ViewerErrorKind.IO, message, cause);
    }
}
