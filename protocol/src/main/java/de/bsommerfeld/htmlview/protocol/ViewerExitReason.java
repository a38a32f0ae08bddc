package de.bsommerfeld.htmlview.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Why the viewer exited. Serialized as {@code {"reason":"closed_by_user"}},
 * {@code {"reason":"timed_out"}} or {@code {"reason":"error","message":"..."}}.
 *
 * @param kind    the reason tag
 * @param message error description, present only for {@link Kind#ERROR}
 */
public record ViewerExitReason(
        @JsonProperty("reason") Kind kind,
        @JsonInclude(JsonInclude.Include.NON_NULL) String message) {

    public enum Kind {
        @JsonProperty("closed_by_user")
        CLOSED_BY_USER,
        @JsonProperty("timed_out")
        TIMED_OUT,
        @JsonProperty("error")
        ERROR
    }

    public ViewerExitReason {
        Objects.requireNonNull(kind, "kind");
    }

    public static ViewerExitReason closedByUser() {
        return new ViewerExitReason(Kind.CLOSED_BY_USER, null);
    }

    public static ViewerExitReason timedOut() {
        return new ViewerExitReason(Kind.TIMED_OUT, null);
    }

    public static ViewerExitReason error(String message) {
        return new ViewerExitReason(Kind.ERROR, message == null ? "" : message);
    }

    @JsonIgnore
    public boolean isError() {
        return kind == Kind.ERROR;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case CLOSED_BY_USER -> "closed_by_user";
            case TIMED_OUT -> "timed_out";
            case ERROR -> "error: " + message;
        };
    }
}
