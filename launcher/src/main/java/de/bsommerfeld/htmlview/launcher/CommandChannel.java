package de.bsommerfeld.htmlview.launcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import de.bsommerfeld.htmlview.launcher.error.CommandFailedException;
import de.bsommerfeld.htmlview.launcher.error.CommandTimeoutException;
import de.bsommerfeld.htmlview.launcher.error.InvalidResponseException;
import de.bsommerfeld.htmlview.launcher.error.ProtocolSerializationException;
import de.bsommerfeld.htmlview.launcher.error.ViewerException;
import de.bsommerfeld.htmlview.launcher.error.ViewerIoException;
import de.bsommerfeld.htmlview.protocol.ViewerCommand;
import de.bsommerfeld.htmlview.protocol.ViewerCommandResponse;
import de.bsommerfeld.htmlview.protocol.ViewerContent;
import de.bsommerfeld.htmlview.protocol.json.ProtocolJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

/**
 * Synchronous request/response exchange of live commands over two files.
 *
 * <h3>Protocol</h3>
 * <ol>
 * <li>Take the next sequence number (first is {@code 1}, never reused).</li>
 * <li>Write the command to a fresh temp file next to {@code commands.json} and
 * rename it over the command file, so the viewer never observes a partial
 * write.</li>
 * <li>Poll {@code command_responses.json} with exponential backoff until a
 * response carrying the same sequence number appears. Responses to earlier
 * commands still lying in the file are skipped.</li>
 * </ol>
 *
 * <h3>Termination</h3>
 * A call ends with the matching response, at the deadline
 * ({@link CommandTimeoutException}) or as soon as the viewer process is seen
 * dead without having answered ({@link CommandFailedException}). Callers must
 * await each call before issuing the next; the channel is not meant for
 * concurrent senders.
 */
public final class CommandChannel {

    private static final Logger LOG = LoggerFactory.getLogger(CommandChannel.class);

    private final Path commandFile;
    private final Path responseFile;
    private final Duration timeout;
    private final Backoff backoff;
    private final BooleanSupplier viewerAlive;
    private final AtomicLong sequence = new AtomicLong();

    public CommandChannel(Path commandFile, Path responseFile, Duration timeout, Backoff backoff,
            BooleanSupplier viewerAlive) {
        this.commandFile = commandFile;
        this.responseFile = responseFile;
        this.timeout = timeout;
        this.backoff = backoff;
        this.viewerAlive = viewerAlive;
    }

    public Path commandFile() {
        return commandFile;
    }

    /** The sequence number most recently issued, {@code 0} before the first send. */
    public long lastSequence() {
        return sequence.get();
    }

    /**
     * Sends a refresh command and waits for its acknowledgement.
     *
     * @return the viewer's successful response
     * @throws CommandFailedException  if the viewer rejected the command or is gone
     * @throws CommandTimeoutException if no matching response arrived in time
     * @throws InvalidResponseException if the response file holds malformed JSON
     */
    public ViewerCommandResponse refresh(ViewerContent content) throws ViewerException {
        if (!viewerAlive.getAsBoolean()) {
            throw new CommandFailedException(0, "Viewer has already exited, command not sent");
        }

        long seq = sequence.incrementAndGet();
        write(ViewerCommand.refresh(seq, content));
        LOG.debug("Sent command {} to {}", seq, commandFile);
        return awaitResponse(seq);
    }

    // =====================================================================
    // Command write
    // =====================================================================

    private void write(ViewerCommand command) throws ViewerException {
        String json;
        try {
            json = ProtocolJson.toJson(command);
        } catch (JsonProcessingException e) {
            throw new ProtocolSerializationException("Could not serialize command " + command.seq(), e);
        }

        Path temp = null;
        try {
            temp = Files.createTempFile(commandFile.getParent(), commandFile.getFileName() + ".", ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            moveIntoPlace(temp);
        } catch (IOException e) {
            deleteTemp(temp);
            throw new ViewerIoException("Could not write command " + command.seq() + " to " + commandFile, e);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, commandFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported for {}, falling back to plain replace", commandFile);
            Files.move(temp, commandFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemp(Path temp) {
        if (temp == null)
            return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.debug("Failed to delete temp command file {}", temp, e);
        }
    }

    // =====================================================================
    // Response poll
    // =====================================================================

    private ViewerCommandResponse awaitResponse(long seq) throws ViewerException {
        long deadline = System.nanoTime() + timeout.toNanos();
        int attempt = 0;

        while (true) {
            Optional<ViewerCommandResponse> response = readResponse(seq);
            if (response.isPresent())
                return complete(response.get());

            if (!viewerAlive.getAsBoolean()) {
                // the viewer may have answered right before exiting
                response = readResponse(seq);
                if (response.isPresent())
                    return complete(response.get());
                throw new CommandFailedException(seq, "Viewer exited before acknowledging command " + seq);
            }

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new CommandTimeoutException(seq, timeout);
            }

            long delay = Math.min(backoff.delayForAttempt(attempt++).toNanos(), remaining);
            sleep(Duration.ofNanos(delay), seq);
        }
    }

    /** Reads the response file and returns it only if it answers {@code seq}. */
    private Optional<ViewerCommandResponse> readResponse(long seq) throws InvalidResponseException {
        String content;
        try {
            content = Files.readString(responseFile, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            LOG.trace("Response file {} not readable yet", responseFile, e);
            return Optional.empty();
        }
        if (content.isBlank())
            return Optional.empty();

        ViewerCommandResponse response;
        try {
            response = ProtocolJson.fromJson(content, ViewerCommandResponse.class);
        } catch (JsonProcessingException e) {
            throw new InvalidResponseException(
                    "Response file " + responseFile + " is not a valid command response: " + e.getOriginalMessage(), e);
        }

        if (response.seq() != seq) {
            LOG.trace("Ignoring stale response {} while waiting for {}", response.seq(), seq);
            return Optional.empty();
        }
        return Optional.of(response);
    }

    private static ViewerCommandResponse complete(ViewerCommandResponse response) throws CommandFailedException {
        if (!response.success()) {
            String reason = response.error() == null ? "no reason given" : response.error();
            throw new CommandFailedException(response.seq(),
                    "Viewer rejected command " + response.seq() + ": " + reason);
        }
        LOG.debug("Command {} acknowledged", response.seq());
        return response;
    }

    private static void sleep(Duration delay, long seq) throws ViewerIoException {
        try {
            Thread.sleep(delay.toMillis(), (int) (delay.toNanos() % 1_000_000));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ViewerIoException("Interrupted while waiting for response to command " + seq, e);
        }
    }
}
