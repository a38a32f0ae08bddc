package de.bsommerfeld.htmlview.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Acknowledgement written by the viewer to {@code command_responses.json}.
 */
public record ViewerCommandResponse(
        long seq,
        boolean success,
        @JsonInclude(JsonInclude.Include.NON_NULL) String error) {

    public static ViewerCommandResponse ok(long seq) {
        return new ViewerCommandResponse(seq, true, null);
    }

    public static ViewerCommandResponse failed(long seq, String error) {
        return new ViewerCommandResponse(seq, false, error);
    }
}
