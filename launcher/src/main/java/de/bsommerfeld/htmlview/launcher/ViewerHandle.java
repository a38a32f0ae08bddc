package de.bsommerfeld.htmlview.launcher;

import de.bsommerfeld.htmlview.launcher.error.AbnormalExitException;
import de.bsommerfeld.htmlview.launcher.error.RefreshNotSupportedException;
import de.bsommerfeld.htmlview.launcher.error.ResultReadFailedException;
import de.bsommerfeld.htmlview.launcher.error.ViewerException;
import de.bsommerfeld.htmlview.launcher.error.ViewerIoException;
import de.bsommerfeld.htmlview.launcher.event.ViewerEventBus;
import de.bsommerfeld.htmlview.launcher.event.ViewerEvents;
import de.bsommerfeld.htmlview.protocol.ViewerCommandResponse;
import de.bsommerfeld.htmlview.protocol.ViewerContent;
import de.bsommerfeld.htmlview.protocol.ViewerExitStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Control over a running viewer.
 *
 * <p>
 * The handle owns the viewer's working area. {@link #close()} removes it and,
 * if the viewer is still running at that point, kills the viewer first.
 *
 * <h3>Exit reconciliation</h3>
 * {@link #tryWait()} and {@link #waitFor()} read the result file once the
 * process is gone. A non-zero exit code is accepted only if the viewer itself
 * reported an {@code error} reason; otherwise the call fails with
 * {@link AbnormalExitException}. The first accepted status is remembered and
 * returned by every later call. A failed collection is remembered the same way
 * and rethrown without reading the result file again; only an interrupt while
 * polling leaves the handle free to try again.
 */
public final class ViewerHandle implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ViewerHandle.class);

    private static final long CLOSE_GRACE_SECONDS = 5;

    private final UUID id;
    private final Process process;
    private final WorkingArea workingArea;
    private final ExitStatusReader reader;
    private final CommandChannel commands;
    private final ViewerEventBus events;

    private ViewerExitStatus exitStatus;
    private ViewerException failure;

    ViewerHandle(UUID id, Process process, WorkingArea workingArea, ExitStatusReader reader,
            CommandChannel commands, ViewerEventBus events) {
        this.id = id;
        this.process = process;
        this.workingArea = workingArea;
        this.reader = reader;
        this.commands = commands;
        this.events = events;
    }

    public UUID id() {
        return id;
    }

    public long pid() {
        return process.pid();
    }

    public boolean isRunning() {
        return process.isAlive();
    }

    public Path workingDirectory() {
        return workingArea.directory();
    }

    /** Whether the viewer was launched with a command channel. */
    public boolean supportsRefresh() {
        return commands != null;
    }

    /**
     * Returns the exit status if the viewer has exited, without blocking on
     * the process. Reading the result may still retry briefly.
     */
    public Optional<ViewerExitStatus> tryWait() throws ViewerException {
        synchronized (this) {
            if (exitStatus != null)
                return Optional.of(exitStatus);
            if (failure != null)
                throw failure;
        }
        if (process.isAlive())
            return Optional.empty();
        return Optional.of(collect(process.exitValue()));
    }

    /**
     * Blocks until the viewer exits and returns its status.
     *
     * <p>
     * If the calling thread is interrupted the viewer is killed, the interrupt
     * flag is restored and a {@link ViewerIoException} is thrown.
     */
    public ViewerExitStatus waitFor() throws ViewerException {
        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ViewerIoException("Interrupted while waiting for viewer " + id + ", viewer was killed", e);
        }
        return collect(exitCode);
    }

    /** Kills the viewer process. Its result file, if any, can still be collected afterwards. */
    public void terminate() {
        if (process.isAlive()) {
            LOG.info("Terminating viewer {} (pid {})", id, process.pid());
            process.destroyForcibly();
        }
    }

    /**
     * Replaces the displayed content and waits for the viewer to confirm.
     *
     * @throws RefreshNotSupportedException if the viewer was launched without live updates
     */
    public void refresh(ViewerContent content) throws ViewerException {
        if (commands == null) {
            throw new RefreshNotSupportedException(
                    "Viewer " + id + " was launched without live updates, refresh is not available");
        }
        ViewerCommandResponse response = commands.refresh(content);
        events.post(new ViewerEvents.CommandAcknowledgedEvent(id, response.seq()));
    }

    public void refreshHtml(String html) throws ViewerException {
        refresh(ViewerContent.html(html));
    }

    @Override
    public void close() {
        if (process.isAlive()) {
            LOG.debug("Closing handle of running viewer {}, killing it", id);
            process.destroyForcibly();
            try {
                process.waitFor(CLOSE_GRACE_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.debug("Interrupted while waiting for viewer {} to die", id);
            }
        }
        workingArea.close();
    }

    // =====================================================================
    // Exit collection
    // =====================================================================

    private synchronized ViewerExitStatus collect(int exitCode) throws ViewerException {
        if (exitStatus != null)
            return exitStatus;
        if (failure != null)
            throw failure;

        ViewerExitStatus status;
        try {
            status = reconcile(exitCode);
        } catch (ViewerIoException e) {
            // interrupted while polling, a later call may still succeed
            throw e;
        } catch (ViewerException e) {
            failure = e;
            LOG.debug("Collecting exit status of viewer {} failed ({})", id, e.kind());
            throw e;
        }

        exitStatus = status;
        LOG.info("Viewer {} exited: {}", id, status.reason());
        events.post(new ViewerEvents.ViewerExitedEvent(id, status));
        return status;
    }

    private ViewerExitStatus reconcile(int exitCode) throws ViewerException {
        ViewerExitStatus status;
        try {
            status = reader.read(workingArea.resultFile(), id);
        } catch (ResultReadFailedException e) {
            if (exitCode == 0)
                throw e;
            throw new ResultReadFailedException(e.getMessage() + " Viewer exit code was " + exitCode + ".",
                    e.path(), e.attempts(), e.getCause());
        }

        if (exitCode != 0 && !status.isError()) {
            throw new AbnormalExitException(exitCode, "Viewer " + id + " exited with code " + exitCode
                    + " but reported " + status.reason());
        }
        return status;
    }

    @Override
    public String toString() {
        return "ViewerHandle[" + id + ", pid " + process.pid() + "]";
    }
}
