package de.bsommerfeld.htmlview.launcher.locate;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Remembers the outcome of binary discovery so that repeated launches skip
 * the filesystem scan.
 *
 * <p>
 * A remembered path is re-checked for executability before every reuse; a
 * stale entry (binary removed or replaced by a non-executable file) triggers a
 * fresh discovery. Concurrent first callers serialize on the discovery, so it
 * runs once.
 */
public final class BinaryPathCache {

    private static final BinaryPathCache SHARED = new BinaryPathCache();

    private final AtomicReference<Path> cached = new AtomicReference<>();
    private final Object discoveryLock = new Object();

    /** Process-wide cache used by the default locator. */
    public static BinaryPathCache shared() {
        return SHARED;
    }

    public Optional<Path> get(Supplier<Optional<Path>> discovery) {
        Path hit = cached.get();
        if (isUsable(hit))
            return Optional.of(hit);

        synchronized (discoveryLock) {
            hit = cached.get();
            if (isUsable(hit))
                return Optional.of(hit);

            Optional<Path> found = discovery.get();
            cached.set(found.orElse(null));
            return found;
        }
    }

    public void clear() {
        cached.set(null);
    }

    Optional<Path> peek() {
        return Optional.ofNullable(cached.get());
    }

    static boolean isUsable(Path path) {
        return path != null && Files.isRegularFile(path) && Files.isExecutable(path);
    }
}
