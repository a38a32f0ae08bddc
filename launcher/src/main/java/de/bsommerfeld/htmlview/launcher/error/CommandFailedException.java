package de.bsommerfeld.htmlview.launcher.error;

/**
 * A live command was rejected by the viewer or could not be delivered because
 * the viewer is gone.
 */
public class CommandFailedException extends ViewerException {

    private final long seq;

    public CommandFailedException(long seq, String message) {
        super(ViewerErrorKind.COMMAND_FAILED, message);
        this.seq = seq;
    }

    /** Sequence number of the failed command, {@code 0} if none was issued. */
    public long seq() {
        return seq;
    }
}
