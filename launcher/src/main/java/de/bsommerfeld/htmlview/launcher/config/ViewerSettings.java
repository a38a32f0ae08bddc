package de.bsommerfeld.htmlview.launcher.config;

import de.bsommerfeld.htmlview.launcher.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Runtime settings of the launcher.
 *
 * <h3>Resolution</h3>
 * Each value is looked up as a system property first, then as an environment
 * variable, then falls back to its default. Unparsable values are logged and
 * replaced by the default rather than failing the launch.
 *
 * <pre>
 * html.view.app.path            HTML_VIEW_APP_PATH            (discovery)
 * html.view.temp.dir            HTML_VIEW_TEMP_DIR            java.io.tmpdir
 * html.view.command.timeout.ms  HTML_VIEW_COMMAND_TIMEOUT_MS  5000
 * </pre>
 *
 * @param appPath        explicit viewer executable, {@code null} to use discovery
 * @param tempRoot       directory under which working areas are created
 * @param commandTimeout how long a live command may wait for its response
 * @param resultBackoff  retry schedule for reading the result file
 * @param commandBackoff poll schedule for command responses
 */
public record ViewerSettings(
        Path appPath,
        Path tempRoot,
        Duration commandTimeout,
        Backoff resultBackoff,
        Backoff commandBackoff) {

    private static final Logger LOG = LoggerFactory.getLogger(ViewerSettings.class);

    public static final String APP_PATH_PROPERTY = "html.view.app.path";
    public static final String APP_PATH_ENV = "HTML_VIEW_APP_PATH";
    public static final String TEMP_DIR_PROPERTY = "html.view.temp.dir";
    public static final String TEMP_DIR_ENV = "HTML_VIEW_TEMP_DIR";
    public static final String COMMAND_TIMEOUT_PROPERTY = "html.view.command.timeout.ms";
    public static final String COMMAND_TIMEOUT_ENV = "HTML_VIEW_COMMAND_TIMEOUT_MS";

    public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(5);

    public ViewerSettings {
        Objects.requireNonNull(tempRoot, "tempRoot");
        Objects.requireNonNull(commandTimeout, "commandTimeout");
        Objects.requireNonNull(resultBackoff, "resultBackoff");
        Objects.requireNonNull(commandBackoff, "commandBackoff");
    }

    /** Defaults only, ignoring system properties and environment. */
    public static ViewerSettings defaults() {
        return new ViewerSettings(null, defaultTempRoot(), DEFAULT_COMMAND_TIMEOUT,
                Backoff.RESULT_READ, Backoff.COMMAND_POLL);
    }

    public static ViewerSettings fromEnvironment() {
        return resolve(System::getProperty, System::getenv);
    }

    /**
     * Resolves settings from the given lookups. Exposed separately from
     * {@link #fromEnvironment()} so that the environment can be substituted.
     */
    public static ViewerSettings resolve(UnaryOperator<String> properties, UnaryOperator<String> environment) {
        String appPath = lookup(properties, environment, APP_PATH_PROPERTY, APP_PATH_ENV);
        String tempDir = lookup(properties, environment, TEMP_DIR_PROPERTY, TEMP_DIR_ENV);
        String timeout = lookup(properties, environment, COMMAND_TIMEOUT_PROPERTY, COMMAND_TIMEOUT_ENV);

        return new ViewerSettings(
                parsePath(appPath, APP_PATH_PROPERTY, null),
                parsePath(tempDir, TEMP_DIR_PROPERTY, defaultTempRoot()),
                parseMillis(timeout),
                Backoff.RESULT_READ,
                Backoff.COMMAND_POLL);
    }

    public ViewerSettings withAppPath(Path appPath) {
        return new ViewerSettings(appPath, tempRoot, commandTimeout, resultBackoff, commandBackoff);
    }

    public ViewerSettings withTempRoot(Path tempRoot) {
        return new ViewerSettings(appPath, tempRoot, commandTimeout, resultBackoff, commandBackoff);
    }

    public ViewerSettings withCommandTimeout(Duration commandTimeout) {
        return new ViewerSettings(appPath, tempRoot, commandTimeout, resultBackoff, commandBackoff);
    }

    public ViewerSettings withResultBackoff(Backoff resultBackoff) {
        return new ViewerSettings(appPath, tempRoot, commandTimeout, resultBackoff, commandBackoff);
    }

    public ViewerSettings withCommandBackoff(Backoff commandBackoff) {
        return new ViewerSettings(appPath, tempRoot, commandTimeout, resultBackoff, commandBackoff);
    }

    // =====================================================================
    // Parsing
    // =====================================================================

    private static String lookup(UnaryOperator<String> properties, UnaryOperator<String> environment,
            String property, String env) {
        String value = properties.apply(property);
        if (value == null || value.isBlank()) {
            value = environment.apply(env);
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Path parsePath(String value, String key, Path fallback) {
        if (value == null)
            return fallback;
        try {
            return Path.of(value);
        } catch (InvalidPathException e) {
            LOG.warn("Invalid path '{}' for {}. Using {}.", value, key, fallback == null ? "discovery" : fallback);
            return fallback;
        }
    }

    private static Duration parseMillis(String value) {
        if (value == null)
            return DEFAULT_COMMAND_TIMEOUT;
        try {
            long millis = Long.parseLong(value);
            if (millis > 0)
                return Duration.ofMillis(millis);
        } catch (NumberFormatException e) {
            LOG.debug("Command timeout '{}' is not a number", value, e);
        }
        LOG.warn("Invalid command timeout '{}' for {}. Defaulting to {} ms.", value, COMMAND_TIMEOUT_PROPERTY,
                DEFAULT_COMMAND_TIMEOUT.toMillis());
        return DEFAULT_COMMAND_TIMEOUT;
    }

    private static Path defaultTempRoot() {
        return Path.of(System.getProperty("java.io.tmpdir"));
    }
}
