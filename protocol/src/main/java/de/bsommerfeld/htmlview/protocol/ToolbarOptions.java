package de.bsommerfeld.htmlview.protocol;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Custom toolbar shown above the content. Hidden by default.
 */
public class ToolbarOptions {

    private boolean show = false;
    private String titleText;
    private String backgroundColor;
    private String textColor;
    private List<ToolbarButton> buttons = new ArrayList<>();

    public boolean isShow() {
        return show;
    }

    public String getTitleText() {
        return titleText;
    }

    public String getBackgroundColor() {
        return backgroundColor;
    }

    public String getTextColor() {
        return textColor;
    }

    public List<ToolbarButton> getButtons() {
        return buttons;
    }

    public void setShow(boolean show) {
        this.show = show;
    }

    public void setTitleText(String titleText) {
        this.titleText = titleText;
    }

    public void setBackgroundColor(String backgroundColor) {
        this.backgroundColor = backgroundColor;
    }

    public void setTextColor(String textColor) {
        this.textColor = textColor;
    }

    public void setButtons(List<ToolbarButton> buttons) {
        this.buttons = buttons == null ? new ArrayList<>() : new ArrayList<>(buttons);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ToolbarOptions that)) return false;
        return show == that.show
                && Objects.equals(titleText, that.titleText)
                && Objects.equals(backgroundColor, that.backgroundColor)
                && Objects.equals(textColor, that.textColor)
                && Objects.equals(buttons, that.buttons);
    }

    @Override
    public int hashCode() {
        return Objects.hash(show, titleText, backgroundColor, textColor, buttons);
    }
}
