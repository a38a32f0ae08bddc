package de.bsommerfeld.htmlview.launcher.error;

/**
 * The working area or the request file could not be written.
 */
public class ConfigWriteFailedException extends ViewerException {

    public ConfigWriteFailedException(String message, Throwable cause) {
        super(ViewerErrorKind.CONFIG_WRITE_FAILED, message, cause);
    }
}
