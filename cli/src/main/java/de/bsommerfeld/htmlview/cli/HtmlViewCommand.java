package de.bsommerfeld.htmlview.cli;

import de.bsommerfeld.htmlview.launcher.ViewerHandle;
import de.bsommerfeld.htmlview.launcher.ViewerLauncher;
import de.bsommerfeld.htmlview.launcher.ViewerOptions;
import de.bsommerfeld.htmlview.launcher.ViewerResult;
import de.bsommerfeld.htmlview.launcher.ViewerWaitMode;
import de.bsommerfeld.htmlview.launcher.error.ViewerException;
import de.bsommerfeld.htmlview.protocol.ProtocolVersion;
import de.bsommerfeld.htmlview.protocol.ViewerContent;
import de.bsommerfeld.htmlview.protocol.ViewerExitStatus;
import de.bsommerfeld.htmlview.protocol.WindowOptions;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.net.URI;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * {@code html-view [options] (html | file | dir | url)}: opens a viewer and
 * blocks until it exits.
 *
 * <h3>Exit codes</h3>
 * <ul>
 * <li>{@code 0} the viewer was closed or timed out</li>
 * <li>{@code 1} the viewer reported an error or could not be launched</li>
 * <li>{@code 2} invalid command line</li>
 * </ul>
 */
@CommandLine.Command(
        name = "html-view",
        description = "Display HTML in a separate viewer window.",
        mixinStandardHelpOptions = true,
        version = "html-view " + ProtocolVersion.CURRENT,
        subcommands = {
                HtmlViewCommand.HtmlCommand.class,
                HtmlViewCommand.FileCommand.class,
                HtmlViewCommand.DirCommand.class,
                HtmlViewCommand.UrlCommand.class
        })
public class HtmlViewCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(HtmlViewCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final ViewerLauncher launcher;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = "--width", description = "Window width in logical pixels.")
    Integer width;

    @CommandLine.Option(names = "--height", description = "Window height in logical pixels.")
    Integer height;

    @CommandLine.Option(names = "--title", description = "Window title.")
    String title;

    @CommandLine.Option(names = "--devtools", description = "Enable the developer tools.")
    boolean devtools;

    @CommandLine.Option(names = "--timeout", paramLabel = "SECONDS", description = "Close the viewer after this many seconds.")
    Long timeout;

    @CommandLine.Option(names = "--no-decorations", description = "Hide title bar and borders.")
    boolean noDecorations;

    @CommandLine.Option(names = "--transparent", description = "Transparent window background.")
    boolean transparent;

    @CommandLine.Option(names = "--always-on-top", description = "Keep the window above all others.")
    boolean alwaysOnTop;

    @CommandLine.Option(names = "--show-toolbar", description = "Show the custom toolbar.")
    boolean showToolbar;

    @CommandLine.Option(names = "--toolbar-title", description = "Toolbar title text, used with --show-toolbar.")
    String toolbarTitle;

    @Inject
    public HtmlViewCommand(ViewerLauncher launcher) {
        this.launcher = launcher;
    }

    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(),
                "Missing subcommand: one of html, file, dir or url is required");
    }

    /** Translates the global options into launch options for the given content. */
    ViewerOptions buildOptions(ViewerContent content) {
        ViewerOptions options = new ViewerOptions();
        options.setContent(content);
        options.setWaitMode(ViewerWaitMode.BLOCKING);

        WindowOptions window = options.getWindow();
        if (width != null)
            window.setWidth(width);
        if (height != null)
            window.setHeight(height);
        if (title != null)
            window.setTitle(title);
        window.setDecorations(!noDecorations);
        window.setTransparent(transparent);
        window.setAlwaysOnTop(alwaysOnTop);
        if (showToolbar) {
            window.getToolbar().setShow(true);
            window.getToolbar().setTitleText(toolbarTitle);
        }

        options.getBehaviour().setEnableDevtools(devtools);
        options.getBehaviour().setAllowRemoteContent(content instanceof ViewerContent.RemoteUrl);
        options.getEnvironment().setTimeoutSeconds(timeout);
        return options;
    }

    int open(ViewerContent content) {
        try {
            ViewerExitStatus status = await(launcher.launch(buildOptions(content)));
            spec.commandLine().getOut().println("Viewer exited: " + status.reason());
            return status.isError() ? EXIT_FAILURE : EXIT_OK;
        } catch (ViewerException e) {
            LOG.debug("Viewer launch failed ({})", e.kind(), e);
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static ViewerExitStatus await(ViewerResult result) throws ViewerException {
        if (result instanceof ViewerResult.Completed completed)
            return completed.status();
        try (ViewerHandle handle = ((ViewerResult.Running) result).handle()) {
            return handle.waitFor();
        }
    }

    // =====================================================================
    // Subcommands
    // =====================================================================

    @CommandLine.Command(name = "html", description = "Display inline HTML.", mixinStandardHelpOptions = true)
    static class HtmlCommand implements Callable<Integer> {

        @CommandLine.ParentCommand
        HtmlViewCommand parent;

        @CommandLine.Parameters(paramLabel = "HTML", description = "Markup to display.")
        String html;

        @Override
        public Integer call() {
            return parent.open(ViewerContent.html(html));
        }
    }

    @CommandLine.Command(name = "file", description = "Display a local HTML file.", mixinStandardHelpOptions = true)
    static class FileCommand implements Callable<Integer> {

        @CommandLine.ParentCommand
        HtmlViewCommand parent;

        @CommandLine.Parameters(paramLabel = "PATH", description = "HTML file to display.")
        Path path;

        @Override
        public Integer call() {
            return parent.open(new ViewerContent.LocalFile(path));
        }
    }

    @CommandLine.Command(name = "dir", description = "Display a static web application directory.", mixinStandardHelpOptions = true)
    static class DirCommand implements Callable<Integer> {

        @CommandLine.ParentCommand
        HtmlViewCommand parent;

        @CommandLine.Parameters(paramLabel = "ROOT", description = "Application root directory.")
        Path root;

        @CommandLine.Option(names = "--entry", description = "Entry document relative to ROOT (default: index.html).")
        String entry;

        @Override
        public Integer call() {
            return parent.open(new ViewerContent.AppDir(root, entry));
        }
    }

    @CommandLine.Command(name = "url", description = "Display a remote URL.", mixinStandardHelpOptions = true)
    static class UrlCommand implements Callable<Integer> {

        @CommandLine.ParentCommand
        HtmlViewCommand parent;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Parameters(paramLabel = "URL", description = "Absolute URL to display.")
        URI url;

        @Override
        public Integer call() {
            if (!url.isAbsolute()) {
                throw new CommandLine.ParameterException(spec.commandLine(), "URL must be absolute: " + url);
            }
            return parent.open(new ViewerContent.RemoteUrl(url));
        }
    }
}
