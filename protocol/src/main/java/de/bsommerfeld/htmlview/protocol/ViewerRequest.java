package de.bsommerfeld.htmlview.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.Objects;
import java.util.UUID;

/**
 * Complete request handed to the viewer through {@code config.json}.
 *
 * <p>
 * The option blocks are consumed by the viewer only. {@code commandPath} is set
 * when the caller wants to push live updates; a viewer that finds it
 * {@code null} never polls for commands.
 */
public record ViewerRequest(
        UUID id,
        ViewerContent content,
        WindowOptions window,
        BehaviourOptions behaviour,
        EnvironmentOptions environment,
        DialogOptions dialog,
        @JsonProperty("command_path") @JsonInclude(JsonInclude.Include.NON_NULL) Path commandPath) {

    public ViewerRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(content, "content");
        window = window == null ? new WindowOptions() : window;
        behaviour = behaviour == null ? new BehaviourOptions() : behaviour;
        environment = environment == null ? new EnvironmentOptions() : environment;
        dialog = dialog == null ? new DialogOptions() : dialog;
    }

    /** Request with default option blocks and no command channel. */
    public static ViewerRequest of(UUID id, ViewerContent content) {
        return new ViewerRequest(id, content, null, null, null, null, null);
    }

    public ViewerRequest withCommandPath(Path commandPath) {
        return new ViewerRequest(id, content, window, behaviour, environment, dialog, commandPath);
    }
}
