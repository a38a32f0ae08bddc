package de.bsommerfeld.htmlview.launcher;

import com.google.inject.Guice;
import de.bsommerfeld.htmlview.launcher.config.HtmlViewModule;
import de.bsommerfeld.htmlview.launcher.error.ViewerException;
import de.bsommerfeld.htmlview.protocol.ViewerExitStatus;
import de.bsommerfeld.htmlview.protocol.WindowOptions;

/**
 * Static entry points for callers that do not use dependency injection.
 *
 * <p>
 * The underlying {@link ViewerLauncher} is created on first use from
 * {@link HtmlViewModule} with settings taken from system properties and the
 * environment.
 */
public final class HtmlView {

    private HtmlView() {
    }

    /** Shows inline HTML and blocks until the window is closed. */
    public static ViewerExitStatus show(String html) throws ViewerException {
        return await(open(ViewerOptions.inlineHtml(html)));
    }

    public static ViewerExitStatus showWithOptions(String html, WindowOptions window) throws ViewerException {
        ViewerOptions options = ViewerOptions.inlineHtml(html);
        options.setWindow(window);
        return await(open(options));
    }

    public static ViewerResult open(ViewerOptions options) throws ViewerException {
        return LauncherHolder.LAUNCHER.launch(options);
    }

    private static ViewerExitStatus await(ViewerResult result) throws ViewerException {
        if (result instanceof ViewerResult.Completed completed)
            return completed.status();
        try (ViewerHandle handle = ((ViewerResult.Running) result).handle()) {
            return handle.waitFor();
        }
    }

    private static final class LauncherHolder {
        private static final ViewerLauncher LAUNCHER = Guice.createInjector(new HtmlViewModule())
                .getInstance(ViewerLauncher.class);
    }
}
