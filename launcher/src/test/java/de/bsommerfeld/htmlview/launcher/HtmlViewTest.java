package de.bsommerfeld.htmlview.launcher;

import de.bsommerfeld.htmlview.launcher.config.ViewerSettings;
import de.bsommerfeld.htmlview.launcher.fake.FakeViewers;
import de.bsommerfeld.htmlview.protocol.ViewerExitStatus;
import de.bsommerfeld.htmlview.protocol.WindowOptions;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The facade resolves its settings once per JVM, so the override has to be in
 * place before the first call. No other test touches {@link HtmlView}.
 */
@EnabledOnOs({ OS.LINUX, OS.MAC })
class HtmlViewTest {

    @TempDir
    static Path dir;

    private static String originalAppPath;
    private static String originalTempDir;

    @BeforeAll
    static void installFakeViewer() throws Exception {
        originalAppPath = System.getProperty(ViewerSettings.APP_PATH_PROPERTY);
        originalTempDir = System.getProperty(ViewerSettings.TEMP_DIR_PROPERTY);
        Path script = FakeViewers.install(dir.resolve("bin"), "close");
        System.setProperty(ViewerSettings.APP_PATH_PROPERTY, script.toString());
        System.setProperty(ViewerSettings.TEMP_DIR_PROPERTY, dir.resolve("work").toString());
    }

    @AfterAll
    static void restoreProperties() {
        restore(ViewerSettings.APP_PATH_PROPERTY, originalAppPath);
        restore(ViewerSettings.TEMP_DIR_PROPERTY, originalTempDir);
    }

    private static void restore(String key, String value) {
        if (value != null)
            System.setProperty(key, value);
        else
            System.clearProperty(key);
    }

    @Test
    void show_shouldBlockUntilViewerCloses() throws Exception {
        ViewerExitStatus status = HtmlView.show("<h1>Hello</h1>");

        assertTrue(status.isClosedByUser());
        try (var leftovers = Files.list(dir.resolve("work"))) {
            assertEquals(0, leftovers.count());
        }
    }

    @Test
    void showWithOptions_shouldPassWindowThrough() throws Exception {
        WindowOptions window = new WindowOptions();
        window.setTitle("Custom");

        assertTrue(HtmlView.showWithOptions("<p>x</p>", window).isClosedByUser());
    }

    @Test
    void builderShowHtml_shouldAwaitNonBlockingResult() throws Exception {
        ViewerResult result = ViewerOptions.builder().title("Builder").nonBlocking().showHtml("<p>x</p>");

        try (ViewerHandle handle = assertInstanceOf(ViewerResult.Running.class, result).handle()) {
            assertTrue(handle.waitFor().isClosedByUser());
        }
    }
}
