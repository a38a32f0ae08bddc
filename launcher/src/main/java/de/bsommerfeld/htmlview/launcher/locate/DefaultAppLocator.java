package de.bsommerfeld.htmlview.launcher.locate;

import de.bsommerfeld.htmlview.launcher.config.ViewerSettings;
import de.bsommerfeld.htmlview.launcher.error.BinaryNotFoundException;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Locates the viewer executable.
 *
 * <h3>Search order</h3>
 * <ol>
 * <li>The explicit override from {@link ViewerSettings#appPath()}
 * ({@code html.view.app.path} / {@code HTML_VIEW_APP_PATH}). Never cached.</li>
 * <li>The remembered result of an earlier discovery, if still executable. The
 * search directories are not enumerated in that case.</li>
 * <li>Discovery: every {@code PATH} entry, {@code ~/.cargo/bin} (or
 * {@code $CARGO_HOME/bin}), {@code <app data>/html-view/bin} and
 * {@code target/debug}, {@code target/release} under the working directory.</li>
 * </ol>
 *
 * An override that does not point at an executable file is logged and
 * ignored, and discovery continues.
 */
public class DefaultAppLocator implements AppLocator {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultAppLocator.class);

    public static final String BINARY_NAME = "html_view_app";

    private final ViewerSettings settings;
    private final BinaryPathCache cache;
    private final Supplier<List<Path>> candidates;

    @Inject
    public DefaultAppLocator(ViewerSettings settings) {
        this(settings, BinaryPathCache.shared(), DefaultAppLocator::defaultCandidates);
    }

    DefaultAppLocator(ViewerSettings settings, BinaryPathCache cache, Supplier<List<Path>> candidates) {
        this.settings = settings;
        this.cache = cache;
        this.candidates = candidates;
    }

    @Override
    public Path locate() throws BinaryNotFoundException {
        Path override = settings.appPath();
        if (override != null) {
            if (BinaryPathCache.isUsable(override)) {
                LOG.debug("Using viewer override {}", override);
                return override;
            }
            LOG.warn("Viewer override {} is not an executable file, falling back to discovery", override);
        }

        List<Path> searched = new ArrayList<>();
        Optional<Path> found = cache.get(() -> {
            searched.addAll(candidates.get());
            return searched.stream().filter(BinaryPathCache::isUsable).findFirst();
        });
        if (found.isPresent()) {
            LOG.debug("Located viewer at {}", found.get());
            return found.get();
        }

        throw new BinaryNotFoundException("Could not locate the " + BINARY_NAME + " binary. "
                + "Install it into " + StorageResolver.binDirectory()
                + " or any directory on PATH, or set " + ViewerSettings.APP_PATH_ENV
                + " (system property " + ViewerSettings.APP_PATH_PROPERTY + ") to its location.",
                List.copyOf(searched));
    }

    // =====================================================================
    // Candidate Discovery
    // =====================================================================

    static List<Path> defaultCandidates() {
        String binary = binaryFileName();
        List<Path> dirs = new ArrayList<>();

        String path = System.getenv("PATH");
        if (path != null) {
            for (String entry : path.split(File.pathSeparator)) {
                addDir(dirs, entry);
            }
        }

        String cargoHome = System.getenv("CARGO_HOME");
        if (cargoHome != null && !cargoHome.isBlank()) {
            addDir(dirs, Path.of(cargoHome, "bin").toString());
        } else {
            addDir(dirs, Path.of(System.getProperty("user.home"), ".cargo", "bin").toString());
        }

        dirs.add(StorageResolver.binDirectory());

        Path workingDir = Path.of("").toAbsolutePath();
        dirs.add(workingDir.resolve("target").resolve("debug"));
        dirs.add(workingDir.resolve("target").resolve("release"));

        return dirs.stream().map(dir -> dir.resolve(binary)).toList();
    }

    static String binaryFileName() {
        boolean windows = System.getProperty("os.name", "").toLowerCase().contains("win");
        return windows ? BINARY_NAME + ".exe" : BINARY_NAME;
    }

    private static void addDir(List<Path> dirs, String dir) {
        if (dir == null || dir.isBlank())
            return;
        try {
            dirs.add(Path.of(dir));
        } catch (InvalidPathException e) {
            LOG.debug("Skipping invalid search directory '{}'", dir, e);
        }
    }
}
