package de.bsommerfeld.htmlview.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A live-update command written to {@code commands.json}.
 *
 * @param type    command kind, currently only {@code refresh}
 * @param seq     sequence number echoed back in the matching response
 * @param content replacement content
 */
public record ViewerCommand(Type type, long seq, ViewerContent content) {

    public enum Type {
        @JsonProperty("refresh")
        REFRESH
    }

    public ViewerCommand {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(content, "content");
    }

    public static ViewerCommand refresh(long seq, ViewerContent content) {
        return new ViewerCommand(Type.REFRESH, seq, content);
    }
}
