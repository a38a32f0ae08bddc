package de.bsommerfeld.htmlview.launcher.event;

import de.bsommerfeld.htmlview.protocol.ViewerExitStatus;

import java.util.UUID;

/**
 * Lifecycle events posted on the {@link ViewerEventBus}.
 */
public class ViewerEvents {

    /** The viewer process was started. {@code blocking} tells whether the caller waits for it. */
    public record ViewerLaunchedEvent(UUID id, long pid, boolean blocking) {
    }

    /** A result file was read and accepted. */
    public record ViewerExitedEvent(UUID id, ViewerExitStatus status) {
    }

    public record CommandAcknowledgedEvent(UUID id, long seq) {
    }
}
