package de.bsommerfeld.htmlview.protocol;

import java.util.Objects;

/**
 * A button in the viewer's custom toolbar.
 *
 * @param id    action identifier reported back by the viewer
 * @param label visible text
 * @param icon  optional icon name, may be {@code null}
 */
public record ToolbarButton(String id, String label, String icon) {

    public ToolbarButton {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(label, "label");
    }

    public static ToolbarButton of(String id, String label) {
        return new ToolbarButton(id, label, null);
    }
}
