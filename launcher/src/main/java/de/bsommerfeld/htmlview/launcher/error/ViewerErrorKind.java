package de.bsommerfeld.htmlview.launcher.error;

/**
 * Machine-readable classification of a {@link ViewerException}.
 */
public enum ViewerErrorKind {
    BINARY_NOT_FOUND,
    SPAWN_FAILED,
    CONFIG_WRITE_FAILED,
    SERIALIZATION,
    RESULT_READ_FAILED,
    INVALID_RESPONSE,
    VERSION_MISMATCH,
    ABNORMAL_EXIT,
    COMMAND_TIMEOUT,
    COMMAND_FAILED,
    REFRESH_NOT_SUPPORTED,
    IO
}
