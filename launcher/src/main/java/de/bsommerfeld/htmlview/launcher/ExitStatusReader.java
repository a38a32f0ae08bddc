package de.bsommerfeld.htmlview.launcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import de.bsommerfeld.htmlview.launcher.error.InvalidResponseException;
import de.bsommerfeld.htmlview.launcher.error.ResultReadFailedException;
import de.bsommerfeld.htmlview.launcher.error.ViewerException;
import de.bsommerfeld.htmlview.launcher.error.ViewerIoException;
import de.bsommerfeld.htmlview.launcher.version.VersionNegotiator;
import de.bsommerfeld.htmlview.protocol.ProtocolVersion;
import de.bsommerfeld.htmlview.protocol.ViewerExitStatus;
import de.bsommerfeld.htmlview.protocol.json.ProtocolJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;

/**
 * Reads the viewer's {@code result.json} after the process has exited.
 *
 * <h3>Retry policy</h3>
 * The file may appear slightly after the process is reported dead (buffered
 * writes, slow filesystems). Only "not yet available" is retried: a missing,
 * unreadable or empty file. Each attempt that finds content parses it exactly
 * once; malformed JSON, a foreign request id or an incompatible version fail
 * immediately.
 *
 * <h3>Version</h3>
 * A status without {@code viewer_version} is treated as
 * {@value ProtocolVersion#LEGACY} and therefore rejected as legacy.
 */
public final class ExitStatusReader {

    private static final Logger LOG = LoggerFactory.getLogger(ExitStatusReader.class);

    private final Backoff backoff;
    private final VersionNegotiator negotiator;

    public ExitStatusReader(Backoff backoff, VersionNegotiator negotiator) {
        if (!backoff.isBounded()) {
            throw new IllegalArgumentException("Result reading needs a bounded backoff");
        }
        this.backoff = backoff;
        this.negotiator = negotiator;
    }

    /**
     * @param resultFile the result artifact of the working area
     * @param expectedId id of the request the status must answer
     * @throws ResultReadFailedException if no content appeared within the allotted attempts
     * @throws InvalidResponseException  if the content is not a valid status for this request
     * @throws ViewerIoException         if the calling thread was interrupted while waiting
     */
    public ViewerExitStatus read(Path resultFile, UUID expectedId) throws ViewerException {
        int attempts = backoff.maxAttempts();
        IOException lastError = null;

        for (int attempt = 0; attempt < attempts; attempt++) {
            try {
                String content = Files.readString(resultFile, StandardCharsets.UTF_8);
                if (!content.isBlank()) {
                    return accept(parse(content, resultFile), expectedId, resultFile);
                }
                lastError = new IOException("Result file is empty");
            } catch (NoSuchFileException e) {
                lastError = new NoSuchFileException(resultFile.toString(), null, "result file not written yet");
            } catch (IOException e) {
                lastError = e;
            }

            LOG.trace("Result file {} not available (attempt {}/{}): {}", resultFile, attempt + 1, attempts,
                    lastError.getMessage());
            if (attempt < attempts - 1) {
                sleep(backoff.delayForAttempt(attempt), resultFile);
            }
        }

        throw new ResultReadFailedException("Failed to read result file " + resultFile + " after " + attempts
                + " attempts: " + lastError.getMessage()
                + ". The viewer may have crashed or been killed before writing its result.",
                resultFile, attempts, lastError);
    }

    private ViewerExitStatus parse(String content, Path resultFile) throws InvalidResponseException {
        try {
            return ProtocolJson.fromJson(content, ViewerExitStatus.class);
        } catch (JsonProcessingException e) {
            throw new InvalidResponseException(
                    "Result file " + resultFile + " is not a valid exit status: " + e.getOriginalMessage(), e);
        }
    }

    private ViewerExitStatus accept(ViewerExitStatus status, UUID expectedId, Path resultFile)
            throws ViewerException {
        if (!expectedId.equals(status.id())) {
            throw new InvalidResponseException("Result file " + resultFile + " answers request " + status.id()
                    + " but request " + expectedId + " was expected");
        }
        String version = status.viewerVersion() == null ? ProtocolVersion.LEGACY : status.viewerVersion();
        negotiator.requireCompatible(version);
        LOG.debug("Viewer {} exited: {} (viewer {})", expectedId, status.reason(), version);
        return status;
    }

    private static void sleep(Duration delay, Path resultFile) throws ViewerIoException {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ViewerIoException("Interrupted while waiting for " + resultFile, e);
        }
    }
}
