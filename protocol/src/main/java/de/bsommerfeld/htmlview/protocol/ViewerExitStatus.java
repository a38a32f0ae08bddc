package de.bsommerfeld.htmlview.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.UUID;

/**
 * Final report written by the viewer to {@code result.json} when it exits.
 *
 * @param id            id of the request this status answers
 * @param reason        why the viewer exited
 * @param viewerVersion protocol version of the viewer; {@code null} for viewers
 *                      that predate version reporting
 */
public record ViewerExitStatus(
        UUID id,
        ViewerExitReason reason,
        @JsonProperty("viewer_version") String viewerVersion) {

    public ViewerExitStatus {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(reason, "reason");
    }

    public static ViewerExitStatus of(UUID id, ViewerExitReason reason) {
        return new ViewerExitStatus(id, reason, ProtocolVersion.CURRENT);
    }

    @JsonIgnore
    public boolean isTimedOut() {
        return reason.kind() == ViewerExitReason.Kind.TIMED_OUT;
    }

    @JsonIgnore
    public boolean isClosedByUser() {
        return reason.kind() == ViewerExitReason.Kind.CLOSED_BY_USER;
    }

    @JsonIgnore
    public boolean isError() {
        return reason.isError();
    }
}
