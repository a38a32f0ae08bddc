package de.bsommerfeld.htmlview.launcher.locate;

import java.nio.file.Path;
import java.util.function.UnaryOperator;

/**
 * Per-user install location searched by {@link DefaultAppLocator} and named in
 * its "not found" guidance.
 *
 * <table>
 * <caption>Data directory per platform</caption>
 * <tr><td>Windows</td><td>{@code %APPDATA%\html-view}</td></tr>
 * <tr><td>macOS</td><td>{@code ~/Library/Application Support/html-view}</td></tr>
 * <tr><td>other</td><td>{@code $XDG_DATA_HOME/html-view}, else {@code ~/.local/share/html-view}</td></tr>
 * </table>
 *
 * The viewer executable is expected in its {@code bin} subdirectory. Nothing
 * here touches the filesystem.
 */
final class StorageResolver {

    static final String APP_DIR_NAME = "html-view";
    static final String BIN_DIR_NAME = "bin";

    private StorageResolver() {
    }

    /** Directory a user installs {@code html_view_app} into. */
    static Path binDirectory() {
        return dataDirectory().resolve(BIN_DIR_NAME);
    }

    static Path dataDirectory() {
        return resolve(System.getProperty("os.name", ""), System::getenv, System.getProperty("user.home"));
    }

    static Path resolve(String osName, UnaryOperator<String> env, String userHome) {
        String os = osName.toLowerCase();
        if (os.contains("win")) {
            String appData = env.apply("APPDATA");
            Path base = appData != null ? Path.of(appData) : Path.of(userHome, "AppData", "Roaming");
            return base.resolve(APP_DIR_NAME);
        }
        if (os.contains("mac")) {
            return Path.of(userHome, "Library", "Application Support", APP_DIR_NAME);
        }
        String xdgDataHome = env.apply("XDG_DATA_HOME");
        Path base = xdgDataHome != null && !xdgDataHome.isBlank()
                ? Path.of(xdgDataHome)
                : Path.of(userHome, ".local", "share");
        return base.resolve(APP_DIR_NAME);
    }
}
