package de.bsommerfeld.htmlview.launcher.error;

import java.time.Duration;

/**
 * No response to a live command arrived before the deadline.
 */
public class CommandTimeoutException extends ViewerException {

    private final long seq;
    private final Duration timeout;

    public CommandTimeoutException(long seq, Duration timeout) {
        super(ViewerErrorKind.COMMAND_TIMEOUT,
                "Command " + seq + " was not acknowledged within " + timeout.toMillis() + " ms");
        this.seq = seq;
        this.timeout = timeout;
    }

    public long seq() {
        return seq;
    }

    public Duration timeout() {
        return timeout;
    }
}
