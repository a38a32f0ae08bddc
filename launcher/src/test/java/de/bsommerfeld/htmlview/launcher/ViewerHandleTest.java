package de.bsommerfeld.htmlview.launcher;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.htmlview.launcher.error.AbnormalExitException;
import de.bsommerfeld.htmlview.launcher.error.RefreshNotSupportedException;
import de.bsommerfeld.htmlview.launcher.error.ResultReadFailedException;
import de.bsommerfeld.htmlview.launcher.error.ViewerIoException;
import de.bsommerfeld.htmlview.launcher.event.ViewerEventBus;
import de.bsommerfeld.htmlview.launcher.event.ViewerEvents;
import de.bsommerfeld.htmlview.launcher.version.VersionNegotiator;
import de.bsommerfeld.htmlview.protocol.ViewerContent;
import de.bsommerfeld.htmlview.protocol.ViewerExitReason;
import de.bsommerfeld.htmlview.protocol.ViewerExitStatus;
import de.bsommerfeld.htmlview.protocol.json.ProtocolJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ViewerHandleTest {

    @TempDir
    Path root;

    private final UUID id = UUID.randomUUID();
    private final ViewerEventBus events = new ViewerEventBus();
    private final ExitStatusReader reader = new ExitStatusReader(
            new Backoff(Duration.ofMillis(1), Duration.ofMillis(5), 3), new VersionNegotiator());

    private Process process;
    private WorkingArea area;

    @BeforeEach
    void setUp() throws Exception {
        process = mock(Process.class);
        when(process.pid()).thenReturn(4711L);
        area = WorkingArea.create(root, id);
    }

    private ViewerHandle handle() {
        return new ViewerHandle(id, process, area, reader, null, events);
    }

    private void writeResult(ViewerExitReason reason) throws Exception {
        Files.writeString(area.resultFile(), ProtocolJson.toJson(ViewerExitStatus.of(id, reason)));
    }

    private void exitedWith(int code) throws Exception {
        when(process.isAlive()).thenReturn(false);
        when(process.exitValue()).thenReturn(code);
        when(process.waitFor()).thenReturn(code);
    }

    // -- polling --

    @Test
    void tryWait_shouldReturnEmptyWhileRunning() throws Exception {
        when(process.isAlive()).thenReturn(true);

        assertEquals(Optional.empty(), handle().tryWait());
        assertTrue(handle().isRunning());
    }

    @Test
    void tryWait_shouldRememberFirstAcceptedStatus() throws Exception {
        exitedWith(0);
        writeResult(ViewerExitReason.closedByUser());
        ViewerHandle handle = handle();

        ViewerExitStatus first = handle.tryWait().orElseThrow();
        Files.delete(area.resultFile());

        assertSame(first, handle.tryWait().orElseThrow());
        assertSame(first, handle.waitFor());
    }

    // -- exit reconciliation --

    @Test
    void waitFor_shouldRejectNonZeroExitWithoutErrorReason() throws Exception {
        exitedWith(2);
        writeResult(ViewerExitReason.closedByUser());

        AbnormalExitException e = assertThrows(AbnormalExitException.class, () -> handle().waitFor());

        assertEquals(2, e.exitCode());
        assertTrue(e.getMessage().contains("closed_by_user"));
    }

    @Test
    void waitFor_shouldPreferReportedErrorOverExitCode() throws Exception {
        exitedWith(1);
        writeResult(ViewerExitReason.error("renderer crashed"));

        ViewerExitStatus status = handle().waitFor();

        assertTrue(status.isError());
        assertEquals("renderer crashed", status.reason().message());
    }

    @Test
    void waitFor_shouldFailWhenCleanExitLeavesNoResult() throws Exception {
        exitedWith(0);

        assertThrows(ResultReadFailedException.class, () -> handle().waitFor());
    }

    @Test
    void waitFor_shouldMentionExitCodeWhenCrashLeavesNoResult() throws Exception {
        exitedWith(137);

        ResultReadFailedException e = assertThrows(ResultReadFailedException.class, () -> handle().waitFor());

        assertTrue(e.getMessage().contains("137"));
        assertEquals(3, e.attempts());
    }

    @Test
    void tryWait_shouldRethrowRememberedFailureWithoutReadingAgain() throws Exception {
        exitedWith(137);
        ExitStatusReader slowReader = spy(new ExitStatusReader(
                new Backoff(Duration.ofMillis(100), Duration.ofMillis(400), 4), new VersionNegotiator()));
        ViewerHandle handle = new ViewerHandle(id, process, area, slowReader, null, events);

        ResultReadFailedException first = assertThrows(ResultReadFailedException.class, handle::tryWait);

        long start = System.nanoTime();
        ResultReadFailedException second = assertThrows(ResultReadFailedException.class, handle::tryWait);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertSame(first, second);
        assertTrue(elapsedMillis < 100, "second tryWait took " + elapsedMillis + " ms");
        assertSame(first, assertThrows(ResultReadFailedException.class, handle::waitFor));
        verify(slowReader, times(1)).read(area.resultFile(), id);
    }

    @Test
    void waitFor_shouldRememberAbnormalExit() throws Exception {
        exitedWith(2);
        writeResult(ViewerExitReason.closedByUser());
        ViewerHandle handle = handle();

        AbnormalExitException first = assertThrows(AbnormalExitException.class, handle::waitFor);
        writeResult(ViewerExitReason.error("late"));

        assertSame(first, assertThrows(AbnormalExitException.class, handle::tryWait));
    }

    @Test
    void waitFor_shouldKillViewerAndRestoreFlagWhenInterrupted() throws Exception {
        when(process.waitFor()).thenThrow(new InterruptedException());

        try {
            assertThrows(ViewerIoException.class, () -> handle().waitFor());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
        verify(process).destroyForcibly();
    }

    @Test
    void waitFor_shouldPostExitedEvent() throws Exception {
        exitedWith(0);
        writeResult(ViewerExitReason.timedOut());
        List<Object> received = new ArrayList<>();
        events.register(new Object() {
            @Subscribe
            public void onExit(ViewerEvents.ViewerExitedEvent event) {
                received.add(event);
            }
        });

        ViewerExitStatus status = handle().waitFor();

        assertEquals(List.of(new ViewerEvents.ViewerExitedEvent(id, status)), received);
    }

    // -- commands --

    @Test
    void refresh_shouldBeUnsupportedWithoutCommandChannel() {
        ViewerHandle handle = handle();

        assertFalse(handle.supportsRefresh());
        assertThrows(RefreshNotSupportedException.class, () -> handle.refresh(ViewerContent.html("x")));
        assertThrows(RefreshNotSupportedException.class, () -> handle.refreshHtml("x"));
    }

    // -- lifecycle --

    @Test
    void terminate_shouldKillRunningViewer() {
        when(process.isAlive()).thenReturn(true);

        handle().terminate();

        verify(process).destroyForcibly();
    }

    @Test
    void terminate_shouldIgnoreExitedViewer() {
        when(process.isAlive()).thenReturn(false);

        handle().terminate();

        verify(process, never()).destroyForcibly();
    }

    @Test
    void close_shouldKillRunningViewerAndRemoveWorkingArea() throws Exception {
        when(process.isAlive()).thenReturn(true);
        when(process.waitFor(anyLong(), any(TimeUnit.class))).thenReturn(true);

        handle().close();

        verify(process).destroyForcibly();
        assertFalse(Files.exists(area.directory()));
    }

    @Test
    void close_shouldOnlyRemoveWorkingAreaOfExitedViewer() throws Exception {
        exitedWith(0);

        handle().close();

        verify(process, never()).destroyForcibly();
        assertFalse(Files.exists(area.directory()));
    }

    @Test
    void accessors_shouldExposeIdentity() {
        ViewerHandle handle = handle();

        assertEquals(id, handle.id());
        assertEquals(4711L, handle.pid());
        assertEquals(area.directory(), handle.workingDirectory());
    }
}
