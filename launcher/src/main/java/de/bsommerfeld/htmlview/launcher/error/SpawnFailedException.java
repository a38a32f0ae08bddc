package de.bsommerfeld.htmlview.launcher.error;

/**
 * The viewer executable was found but the operating system refused to start it.
 */
public class SpawnFailedException extends ViewerException {

    public SpawnFailedException(String message, Throwable cause) {
        super(ViewerErrorKind.SPAWN_FAILED, message, cause);
    }
}
