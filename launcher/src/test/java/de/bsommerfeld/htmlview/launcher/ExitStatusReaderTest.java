package de.bsommerfeld.htmlview.launcher;

import de.bsommerfeld.htmlview.launcher.error.InvalidResponseException;
import de.bsommerfeld.htmlview.launcher.error.ResultReadFailedException;
import de.bsommerfeld.htmlview.launcher.error.VersionMismatchException;
import de.bsommerfeld.htmlview.launcher.error.ViewerErrorKind;
import de.bsommerfeld.htmlview.launcher.version.VersionNegotiator;
import de.bsommerfeld.htmlview.protocol.ViewerExitReason;
import de.bsommerfeld.htmlview.protocol.ViewerExitStatus;
import de.bsommerfeld.htmlview.protocol.json.ProtocolJson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ExitStatusReaderTest {

    private static final Backoff FAST = new Backoff(Duration.ofMillis(5), Duration.ofMillis(20), 4);

    @TempDir
    Path dir;

    private final UUID id = UUID.randomUUID();
    private final ExitStatusReader reader = new ExitStatusReader(FAST, new VersionNegotiator("0.1.0"));

    private Path resultFile() {
        return dir.resolve("result.json");
    }

    private void writeResult(String json) throws Exception {
        Files.writeString(resultFile(), json);
    }

    // -- success --

    @Test
    void read_shouldReturnStatusOfCompatibleViewer() throws Exception {
        writeResult(ProtocolJson.toJson(new ViewerExitStatus(id, ViewerExitReason.closedByUser(), "0.1.4")));

        ViewerExitStatus status = reader.read(resultFile(), id);

        assertTrue(status.isClosedByUser());
        assertEquals("0.1.4", status.viewerVersion());
    }

    @Test
    void read_shouldWaitForLateResult() throws Exception {
        ExitStatusReader patient = new ExitStatusReader(
                new Backoff(Duration.ofMillis(20), Duration.ofMillis(100), 20), new VersionNegotiator("0.1.0"));
        String json = ProtocolJson.toJson(new ViewerExitStatus(id, ViewerExitReason.timedOut(), "0.1.0"));

        Thread writer = new Thread(() -> {
            try {
                Thread.sleep(150);
                writeResult(json);
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        writer.start();

        ViewerExitStatus status = patient.read(resultFile(), id);
        writer.join();

        assertTrue(status.isTimedOut());
    }

    @Test
    void read_shouldTreatEmptyFileAsNotYetWritten() throws Exception {
        writeResult("");

        ResultReadFailedException e = assertThrows(ResultReadFailedException.class,
                () -> reader.read(resultFile(), id));

        assertTrue(e.getMessage().contains("empty"));
    }

    // -- exhaustion --

    @Test
    void read_shouldNamePathAndAttemptsWhenResultNeverAppears() {
        ResultReadFailedException e = assertThrows(ResultReadFailedException.class,
                () -> reader.read(resultFile(), id));

        assertEquals(ViewerErrorKind.RESULT_READ_FAILED, e.kind());
        assertEquals(4, e.attempts());
        assertEquals(resultFile(), e.path());
        assertTrue(e.getMessage().contains(resultFile().toString()));
        assertTrue(e.getMessage().contains("4 attempts"));
        assertTrue(e.getMessage().contains("crashed"));
        assertNotNull(e.getCause());
    }

    @Test
    void read_shouldSleepOnlyBetweenAttempts() {
        Backoff slowLast = new Backoff(Duration.ofMillis(1), Duration.ofMillis(1), 2);
        ExitStatusReader quick = new ExitStatusReader(slowLast, new VersionNegotiator("0.1.0"));

        long start = System.nanoTime();
        assertThrows(ResultReadFailedException.class, () -> quick.read(resultFile(), id));
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertTrue(elapsedMillis < 1000, "two attempts with one 1 ms pause took " + elapsedMillis + " ms");
    }

    @Test
    void read_shouldRestoreInterruptFlag() {
        Thread.currentThread().interrupt();
        try {
            assertThrows(de.bsommerfeld.htmlview.launcher.error.ViewerIoException.class,
                    () -> reader.read(resultFile(), id));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    // -- rejection --

    @Test
    void read_shouldRejectMalformedJsonWithoutRetrying() throws Exception {
        ExitStatusReader slow = new ExitStatusReader(
                new Backoff(Duration.ofSeconds(5), Duration.ofSeconds(5), 10), new VersionNegotiator("0.1.0"));
        writeResult("{not json");

        long start = System.nanoTime();
        assertThrows(InvalidResponseException.class, () -> slow.read(resultFile(), id));

        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 5000);
    }

    @Test
    void read_shouldRejectForeignRequestId() throws Exception {
        writeResult(ProtocolJson.toJson(ViewerExitStatus.of(UUID.randomUUID(), ViewerExitReason.closedByUser())));

        InvalidResponseException e = assertThrows(InvalidResponseException.class,
                () -> reader.read(resultFile(), id));

        assertTrue(e.getMessage().contains(id.toString()));
    }

    @Test
    void read_shouldRejectStatusWithoutVersionAsLegacy() throws Exception {
        writeResult("{\"id\":\"" + id + "\",\"reason\":{\"reason\":\"closed_by_user\"}}");

        VersionMismatchException e = assertThrows(VersionMismatchException.class,
                () -> reader.read(resultFile(), id));

        assertEquals("0.0.0", e.viewerVersion());
        assertEquals("0.1.0", e.libraryVersion());
    }

    @Test
    void read_shouldRejectIncompatibleViewer() throws Exception {
        writeResult(ProtocolJson.toJson(new ViewerExitStatus(id, ViewerExitReason.closedByUser(), "1.0.0")));

        assertThrows(VersionMismatchException.class, () -> reader.read(resultFile(), id));
    }

    @Test
    void read_shouldRejectMalformedVersionAsInvalidResponse() throws Exception {
        writeResult(ProtocolJson.toJson(new ViewerExitStatus(id, ViewerExitReason.closedByUser(), "0.1")));

        assertThrows(InvalidResponseException.class, () -> reader.read(resultFile(), id));
    }

    @Test
    void constructor_shouldRejectUnboundedBackoff() {
        assertThrows(IllegalArgumentException.class,
                () -> new ExitStatusReader(Backoff.COMMAND_POLL, new VersionNegotiator()));
    }
}
