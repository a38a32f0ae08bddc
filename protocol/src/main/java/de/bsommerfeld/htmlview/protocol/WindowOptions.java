package de.bsommerfeld.htmlview.protocol;

import java.util.Objects;

/**
 * Window configuration interpreted by the viewer.
 *
 * <p>
 * Defaults: titled {@value #DEFAULT_TITLE}, 1024x768, resizable and decorated.
 * Position, theme and background colour are left to the platform unless set.
 */
public class WindowOptions {

    public static final String DEFAULT_TITLE = "HTML Viewer";

    private String title = DEFAULT_TITLE;
    private Integer width = 1024;
    private Integer height = 768;
    private Integer x;
    private Integer y;
    private boolean resizable = true;
    private boolean maximised = false;
    private boolean fullscreen = false;
    private boolean decorations = true;
    private boolean transparent = false;
    private boolean alwaysOnTop = false;
    // "light", "dark" or "system"
    private String theme;
    private String backgroundColor;
    private ToolbarOptions toolbar = new ToolbarOptions();

    public String getTitle() {
        return title;
    }

    public Integer getWidth() {
        return width;
    }

    public Integer getHeight() {
        return height;
    }

    public Integer getX() {
        return x;
    }

    public Integer getY() {
        return y;
    }

    public boolean isResizable() {
        return resizable;
    }

    public boolean isMaximised() {
        return maximised;
    }

    public boolean isFullscreen() {
        return fullscreen;
    }

    public boolean isDecorations() {
        return decorations;
    }

    public boolean isTransparent() {
        return transparent;
    }

    public boolean isAlwaysOnTop() {
        return alwaysOnTop;
    }

    public String getTheme() {
        return theme;
    }

    public String getBackgroundColor() {
        return backgroundColor;
    }

    public ToolbarOptions getToolbar() {
        return toolbar;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public void setWidth(Integer width) {
        this.width = width;
    }

    public void setHeight(Integer height) {
        this.height = height;
    }

    public void setX(Integer x) {
        this.x = x;
    }

    public void setY(Integer y) {
        this.y = y;
    }

    public void setResizable(boolean resizable) {
        this.resizable = resizable;
    }

    public void setMaximised(boolean maximised) {
        this.maximised = maximised;
    }

    public void setFullscreen(boolean fullscreen) {
        this.fullscreen = fullscreen;
    }

    public void setDecorations(boolean decorations) {
        this.decorations = decorations;
    }

    public void setTransparent(boolean transparent) {
        this.transparent = transparent;
    }

    public void setAlwaysOnTop(boolean alwaysOnTop) {
        this.alwaysOnTop = alwaysOnTop;
    }

    public void setTheme(String theme) {
        this.theme = theme;
    }

    public void setBackgroundColor(String backgroundColor) {
        this.backgroundColor = backgroundColor;
    }

    public void setToolbar(ToolbarOptions toolbar) {
        this.toolbar = toolbar == null ? new ToolbarOptions() : toolbar;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WindowOptions that)) return false;
        return resizable == that.resizable
                && maximised == that.maximised
                && fullscreen == that.fullscreen
                && decorations == that.decorations
                && transparent == that.transparent
                && alwaysOnTop == that.alwaysOnTop
                && Objects.equals(title, that.title)
                && Objects.equals(width, that.width)
                && Objects.equals(height, that.height)
                && Objects.equals(x, that.x)
                && Objects.equals(y, that.y)
                && Objects.equals(theme, that.theme)
                && Objects.equals(backgroundColor, that.backgroundColor)
                && Objects.equals(toolbar, that.toolbar);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, width, height, x, y, resizable, maximised, fullscreen, decorations,
                transparent, alwaysOnTop, theme, backgroundColor, toolbar);
    }
}
