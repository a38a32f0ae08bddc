package de.bsommerfeld.htmlview.launcher.locate;

import de.bsommerfeld.htmlview.launcher.config.ViewerSettings;
import de.bsommerfeld.htmlview.launcher.error.BinaryNotFoundException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({ OS.LINUX, OS.MAC })
class DefaultAppLocatorTest {

    @TempDir
    Path dir;

    private Path executable(String name) throws Exception {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "#!/bin/sh\n");
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwx------"));
        return file;
    }

    private DefaultAppLocator locator(Path override, List<Path> candidates) {
        return new DefaultAppLocator(ViewerSettings.defaults().withAppPath(override), new BinaryPathCache(),
                () -> candidates);
    }

    @Test
    void locate_shouldPreferOverride() throws Exception {
        Path override = executable("override/html_view_app");
        Path discovered = executable("bin/html_view_app");

        assertEquals(override, locator(override, List.of(discovered)).locate());
    }

    @Test
    void locate_shouldFallBackToDiscoveryForUnusableOverride() throws Exception {
        Path discovered = executable("bin/html_view_app");

        assertEquals(discovered, locator(dir.resolve("missing"), List.of(discovered)).locate());
    }

    @Test
    void locate_shouldTakeFirstExecutableCandidateInOrder() throws Exception {
        Path missing = dir.resolve("a/html_view_app");
        Path plainFile = dir.resolve("b/html_view_app");
        Files.createDirectories(plainFile.getParent());
        Files.writeString(plainFile, "not executable");
        Path first = executable("c/html_view_app");
        Path second = executable("d/html_view_app");

        assertEquals(first, locator(null, List.of(missing, plainFile, first, second)).locate());
    }

    @Test
    void locate_shouldNotEnumerateCandidatesWhenCacheHolds() throws Exception {
        Path discovered = executable("bin/html_view_app");
        AtomicInteger enumerations = new AtomicInteger();
        DefaultAppLocator locator = new DefaultAppLocator(ViewerSettings.defaults(), new BinaryPathCache(), () -> {
            enumerations.incrementAndGet();
            return List.of(discovered);
        });

        assertEquals(discovered, locator.locate());
        assertEquals(discovered, locator.locate());
        assertEquals(1, enumerations.get());
    }

    @Test
    void locate_shouldEnumerateAgainAfterCachedBinaryVanished() throws Exception {
        Path discovered = executable("bin/html_view_app");
        AtomicInteger enumerations = new AtomicInteger();
        DefaultAppLocator locator = new DefaultAppLocator(ViewerSettings.defaults(), new BinaryPathCache(), () -> {
            enumerations.incrementAndGet();
            return List.of(discovered);
        });
        locator.locate();
        Files.delete(discovered);

        assertThrows(BinaryNotFoundException.class, locator::locate);
        assertEquals(2, enumerations.get());
    }

    @Test
    void locate_shouldListSearchedPathsWhenNothingFound() {
        List<Path> candidates = List.of(dir.resolve("x/html_view_app"), dir.resolve("y/html_view_app"));

        BinaryNotFoundException e = assertThrows(BinaryNotFoundException.class,
                () -> locator(null, candidates).locate());

        assertEquals(candidates, e.searched());
        assertTrue(e.getMessage().contains("HTML_VIEW_APP_PATH"));
    }

    @Test
    void defaultCandidates_shouldEndWithTargetDirectories() {
        List<Path> candidates = DefaultAppLocator.defaultCandidates();
        Path cwd = Path.of("").toAbsolutePath();
        String binary = DefaultAppLocator.binaryFileName();

        assertEquals(cwd.resolve("target/release").resolve(binary), candidates.get(candidates.size() - 1));
        assertEquals(cwd.resolve("target/debug").resolve(binary), candidates.get(candidates.size() - 2));
        assertEquals(StorageResolver.binDirectory().resolve(binary), candidates.get(candidates.size() - 3));
        assertTrue(candidates.stream().allMatch(p -> p.getFileName().toString().equals(binary)));
    }
}
