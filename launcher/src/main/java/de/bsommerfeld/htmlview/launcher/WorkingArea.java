package de.bsommerfeld.htmlview.launcher;

import de.bsommerfeld.htmlview.protocol.ProtocolFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Comparator;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Owns the per-request directory {@code html_view_<id>} and deletes it when
 * closed.
 *
 * <h3>Ownership</h3>
 * A guard starts <em>armed</em>. Exactly one armed guard exists per directory
 * at any time:
 * <ul>
 * <li>{@link #transfer()} disarms this guard and returns a new armed one for
 * the same directory, used when a non-blocking launch hands the directory to
 * its {@link ViewerHandle};</li>
 * <li>{@link #disableCleanup()} disarms without a successor, leaving the
 * directory on disk.</li>
 * </ul>
 * {@link #close()} deletes the tree only while armed and at most once.
 * Deletion failures are logged at debug level and never propagate.
 */
public final class WorkingArea implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(WorkingArea.class);

    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rwx------");

    private final Path directory;
    private final AtomicBoolean armed;

    private WorkingArea(Path directory) {
        this.directory = directory;
        this.armed = new AtomicBoolean(true);
    }

    /** The directory a request with the given id uses under {@code root}. */
    public static Path pathFor(Path root, UUID id) {
        return root.resolve(ProtocolFiles.WORKING_DIR_PREFIX + id);
    }

    /**
     * Creates the working directory with owner-only permissions where the
     * filesystem supports POSIX attributes.
     *
     * @throws IOException if the directory cannot be created
     */
    public static WorkingArea create(Path root, UUID id) throws IOException {
        Path directory = pathFor(root, id);
        Files.createDirectories(root);
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.createDirectory(directory, PosixFilePermissions.asFileAttribute(OWNER_ONLY));
        } else {
            Files.createDirectory(directory);
        }
        LOG.debug("Created working area {}", directory);
        return new WorkingArea(directory);
    }

    public Path directory() {
        return directory;
    }

    public Path configFile() {
        return directory.resolve(ProtocolFiles.CONFIG_FILE);
    }

    public Path resultFile() {
        return directory.resolve(ProtocolFiles.RESULT_FILE);
    }

    public Path commandFile() {
        return directory.resolve(ProtocolFiles.COMMAND_FILE);
    }

    public Path commandResponseFile() {
        return directory.resolve(ProtocolFiles.COMMAND_RESPONSE_FILE);
    }

    public boolean isArmed() {
        return armed.get();
    }

    /** Keeps the directory on disk. Closing this guard afterwards is a no-op. */
    public void disableCleanup() {
        armed.set(false);
    }

    /**
     * Hands cleanup responsibility to a new guard.
     *
     * @throws IllegalStateException if this guard was already disarmed or closed
     */
    public WorkingArea transfer() {
        if (!armed.compareAndSet(true, false)) {
            throw new IllegalStateException("Working area " + directory + " is no longer owned by this guard");
        }
        LOG.debug("Transferred ownership of {}", directory);
        return new WorkingArea(directory);
    }

    @Override
    public void close() {
        if (!armed.compareAndSet(true, false))
            return;

        if (!Files.exists(directory))
            return;

        try (Stream<Path> tree = Files.walk(directory)) {
            tree.sorted(Comparator.reverseOrder()).forEach(WorkingArea::deleteQuietly);
        } catch (IOException e) {
            LOG.debug("Failed to walk working area {}", directory, e);
        }
        if (Files.exists(directory)) {
            LOG.debug("Working area {} could not be removed completely", directory);
        } else {
            LOG.debug("Removed working area {}", directory);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.debug("Failed to delete {}", path, e);
        }
    }

    @Override
    public String toString() {
        return "WorkingArea[" + directory + (isArmed() ? ", armed" : "") + "]";
    }
}
