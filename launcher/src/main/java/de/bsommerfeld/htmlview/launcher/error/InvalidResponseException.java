package de.bsommerfeld.htmlview.launcher.error;

/**
 * The viewer wrote something that is not a valid protocol message: malformed
 * JSON, a mismatched request id or an unparsable version string.
 */
public class InvalidResponseException extends ViewerException {

    public InvalidResponseException(String message) {
        super(ViewerErrorKind.INVALID_RESPONSE, message);
    }

    public InvalidResponseException(String message, Throwable cause) {
        super(ViewerErrorKind.INVALID_RESPONSE, message, cause);
    }
}
