package de.bsommerfeld.htmlview.launcher;

import de.bsommerfeld.htmlview.launcher.error.ViewerException;
import de.bsommerfeld.htmlview.protocol.BehaviourOptions;
import de.bsommerfeld.htmlview.protocol.DialogOptions;
import de.bsommerfeld.htmlview.protocol.EnvironmentOptions;
import de.bsommerfeld.htmlview.protocol.ToolbarOptions;
import de.bsommerfeld.htmlview.protocol.ViewerContent;
import de.bsommerfeld.htmlview.protocol.WindowOptions;

import java.net.URI;
import java.nio.file.Path;
import java.util.Objects;
import java.util.UUID;

/**
 * Everything needed to launch one viewer.
 *
 * <p>
 * The static factories cover the four content kinds with default option
 * blocks and {@link ViewerWaitMode#BLOCKING}. {@link #remoteUrl(URI)} also
 * enables remote content, without which the viewer refuses to load it. For
 * anything else use {@link #builder()}.
 *
 * <p>
 * Live updates are on by default but only take effect for non-blocking
 * launches, since a blocking launch never hands out a handle to send them
 * through.
 */
public class ViewerOptions {

    private UUID id;
    private ViewerContent content = ViewerContent.html("");
    private WindowOptions window = new WindowOptions();
    private BehaviourOptions behaviour = new BehaviourOptions();
    private EnvironmentOptions environment = new EnvironmentOptions();
    private DialogOptions dialog = new DialogOptions();
    private ViewerWaitMode waitMode = ViewerWaitMode.BLOCKING;
    private boolean liveUpdates = true;

    public static ViewerOptions inlineHtml(String html) {
        return withContent(ViewerContent.html(html));
    }

    public static ViewerOptions localFile(Path path) {
        return withContent(new ViewerContent.LocalFile(path));
    }

    public static ViewerOptions appDir(Path root) {
        return withContent(new ViewerContent.AppDir(root, null));
    }

    public static ViewerOptions remoteUrl(URI url) {
        ViewerOptions options = withContent(new ViewerContent.RemoteUrl(url));
        options.behaviour.setAllowRemoteContent(true);
        return options;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static ViewerOptions withContent(ViewerContent content) {
        ViewerOptions options = new ViewerOptions();
        options.setContent(content);
        return options;
    }

    /** Caller-chosen request id, {@code null} to have one generated at launch. */
    public UUID getId() {
        return id;
    }

    public ViewerContent getContent() {
        return content;
    }

    public WindowOptions getWindow() {
        return window;
    }

    public BehaviourOptions getBehaviour() {
        return behaviour;
    }

    public EnvironmentOptions getEnvironment() {
        return environment;
    }

    public DialogOptions getDialog() {
        return dialog;
    }

    public ViewerWaitMode getWaitMode() {
        return waitMode;
    }

    public boolean isLiveUpdates() {
        return liveUpdates;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public void setContent(ViewerContent content) {
        this.content = Objects.requireNonNull(content, "content");
    }

    public void setWindow(WindowOptions window) {
        this.window = Objects.requireNonNull(window, "window");
    }

    public void setBehaviour(BehaviourOptions behaviour) {
        this.behaviour = Objects.requireNonNull(behaviour, "behaviour");
    }

    public void setEnvironment(EnvironmentOptions environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    public void setDialog(DialogOptions dialog) {
        this.dialog = Objects.requireNonNull(dialog, "dialog");
    }

    public void setWaitMode(ViewerWaitMode waitMode) {
        this.waitMode = Objects.requireNonNull(waitMode, "waitMode");
    }

    public void setLiveUpdates(boolean liveUpdates) {
        this.liveUpdates = liveUpdates;
    }

    /**
     * Fluent construction of {@link ViewerOptions}. Content defaults to empty
     * inline HTML until set.
     */
    public static final class Builder {

        private final ViewerOptions options = new ViewerOptions();

        private Builder() {
        }

        public Builder content(ViewerContent content) {
            options.setContent(content);
            return this;
        }

        public Builder id(UUID id) {
            options.setId(id);
            return this;
        }

        public Builder title(String title) {
            options.window.setTitle(title);
            return this;
        }

        public Builder size(int width, int height) {
            options.window.setWidth(width);
            options.window.setHeight(height);
            return this;
        }

        public Builder position(int x, int y) {
            options.window.setX(x);
            options.window.setY(y);
            return this;
        }

        public Builder noDecorations() {
            options.window.setDecorations(false);
            return this;
        }

        public Builder transparent() {
            options.window.setTransparent(true);
            return this;
        }

        public Builder alwaysOnTop() {
            options.window.setAlwaysOnTop(true);
            return this;
        }

        public Builder devtools() {
            options.behaviour.setEnableDevtools(true);
            return this;
        }

        public Builder allowNavigation() {
            options.behaviour.setAllowExternalNavigation(true);
            return this;
        }

        /** Auto-close after the given number of seconds, reported as {@code timed_out}. */
        public Builder timeout(long seconds) {
            options.environment.setTimeoutSeconds(seconds);
            return this;
        }

        public Builder enableNotifications() {
            options.behaviour.setAllowNotifications(true);
            return this;
        }

        public Builder enableDialogs() {
            options.dialog.setAllowFileDialogs(true);
            options.dialog.setAllowMessageDialogs(true);
            return this;
        }

        public Builder toolbar(ToolbarOptions toolbar) {
            options.window.setToolbar(toolbar);
            return this;
        }

        public Builder nonBlocking() {
            options.setWaitMode(ViewerWaitMode.NON_BLOCKING);
            return this;
        }

        public Builder withoutLiveUpdates() {
            options.setLiveUpdates(false);
            return this;
        }

        public ViewerOptions build() {
            return options;
        }

        /** Builds the options and opens the viewer through {@link HtmlView#open(ViewerOptions)}. */
        public ViewerResult show() throws ViewerException {
            return HtmlView.open(build());
        }

        public ViewerResult showHtml(String html) throws ViewerException {
            options.setContent(ViewerContent.html(html));
            return HtmlView.open(build());
        }
    }
}
