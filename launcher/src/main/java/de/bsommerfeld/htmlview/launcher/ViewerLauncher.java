package de.bsommerfeld.htmlview.launcher;

import com.fasterxml.jackson.core.JsonProcessingException;
import de.bsommerfeld.htmlview.launcher.config.ViewerSettings;
import de.bsommerfeld.htmlview.launcher.error.ConfigWriteFailedException;
import de.bsommerfeld.htmlview.launcher.error.ProtocolSerializationException;
import de.bsommerfeld.htmlview.launcher.error.SpawnFailedException;
import de.bsommerfeld.htmlview.launcher.error.ViewerException;
import de.bsommerfeld.htmlview.launcher.event.ViewerEventBus;
import de.bsommerfeld.htmlview.launcher.event.ViewerEvents;
import de.bsommerfeld.htmlview.launcher.locate.AppLocator;
import de.bsommerfeld.htmlview.launcher.version.VersionNegotiator;
import de.bsommerfeld.htmlview.protocol.ProtocolFiles;
import de.bsommerfeld.htmlview.protocol.ViewerRequest;
import de.bsommerfeld.htmlview.protocol.json.ProtocolJson;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Starts viewer processes.
 *
 * <h3>Launch sequence</h3>
 * <ol>
 * <li>Pick the request id (caller-supplied or random) and create the working
 * area {@code <temp root>/html_view_<id>}.</li>
 * <li>Write {@code config.json}. The command file path is included only for
 * non-blocking launches with live updates enabled.</li>
 * <li>Locate the viewer executable and start it with
 * {@code --config-path <config> --result-path <result>}.</li>
 * <li>Blocking: wait, collect the result and remove the working area.
 * Non-blocking: hand the working area to a {@link ViewerHandle} and return.</li>
 * </ol>
 *
 * Every failure before the handle takes over removes the working area again.
 * Nothing is retried here; only the result and response polls retry.
 */
public class ViewerLauncher {

    private static final Logger LOG = LoggerFactory.getLogger(ViewerLauncher.class);

    private final AppLocator locator;
    private final ViewerSettings settings;
    private final ViewerEventBus events;

    @Inject
    public ViewerLauncher(AppLocator locator, ViewerSettings settings, ViewerEventBus events) {
        this.locator = locator;
        this.settings = settings;
        this.events = events;
    }

    public ViewerResult launch(ViewerOptions options) throws ViewerException {
        UUID id = options.getId() != null ? options.getId() : UUID.randomUUID();
        boolean blocking = options.getWaitMode() == ViewerWaitMode.BLOCKING;
        boolean liveUpdates = !blocking && options.isLiveUpdates();

        WorkingArea area = createWorkingArea(id);
        try {
            ViewerRequest request = new ViewerRequest(id, options.getContent(), options.getWindow(),
                    options.getBehaviour(), options.getEnvironment(), options.getDialog(),
                    liveUpdates ? area.commandFile() : null);
            writeConfig(area, request);

            Path binary = locator.locate();
            Process process = spawn(binary, area);
            LOG.info("Viewer {} started (pid {}, {})", id, process.pid(), blocking ? "blocking" : "non-blocking");
            events.post(new ViewerEvents.ViewerLaunchedEvent(id, process.pid(), blocking));

            CommandChannel commands = liveUpdates
                    ? new CommandChannel(area.commandFile(), area.commandResponseFile(), settings.commandTimeout(),
                            settings.commandBackoff(), process::isAlive)
                    : null;
            ViewerHandle handle = new ViewerHandle(id, process, area.transfer(), newReader(), commands, events);

            if (!blocking)
                return new ViewerResult.Running(handle);

            try (handle) {
                return new ViewerResult.Completed(handle.waitFor());
            }
        } finally {
            area.close();
        }
    }

    ExitStatusReader newReader() {
        return new ExitStatusReader(settings.resultBackoff(), new VersionNegotiator());
    }

    // =====================================================================
    // Launch steps
    // =====================================================================

    private WorkingArea createWorkingArea(UUID id) throws ConfigWriteFailedException {
        try {
            return WorkingArea.create(settings.tempRoot(), id);
        } catch (IOException e) {
            throw new ConfigWriteFailedException(
                    "Could not create working area " + WorkingArea.pathFor(settings.tempRoot(), id), e);
        }
    }

    private static void writeConfig(WorkingArea area, ViewerRequest request) throws ViewerException {
        String json;
        try {
            json = ProtocolJson.toPrettyJson(request);
        } catch (JsonProcessingException e) {
            throw new ProtocolSerializationException("Could not serialize request " + request.id(), e);
        }
        try {
            Files.writeString(area.configFile(), json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigWriteFailedException("Could not write " + area.configFile(), e);
        }
    }

    private static Process spawn(Path binary, WorkingArea area) throws SpawnFailedException {
        List<String> command = List.of(binary.toString(),
                ProtocolFiles.CONFIG_PATH_FLAG, area.configFile().toString(),
                ProtocolFiles.RESULT_PATH_FLAG, area.resultFile().toString());

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.inheritIO();
        LOG.debug("Spawning {}", command);
        try {
            return pb.start();
        } catch (IOException e) {
            throw new SpawnFailedException("Failed to start viewer " + binary + ": " + e.getMessage(), e);
        }
    }
}
