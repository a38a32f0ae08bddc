package de.bsommerfeld.htmlview.launcher;

import de.bsommerfeld.htmlview.protocol.ViewerExitStatus;

import java.util.Objects;

/**
 * Outcome of a launch: the final status for blocking launches, a live handle
 * for non-blocking ones.
 */
public interface ViewerResult {

    record Completed(ViewerExitStatus status) implements ViewerResult {
        public Completed {
            Objects.requireNonNull(status, "status");
        }
    }

    record Running(ViewerHandle handle) implements ViewerResult {
        public Running {
            Objects.requireNonNull(handle, "handle");
        }
    }
}
