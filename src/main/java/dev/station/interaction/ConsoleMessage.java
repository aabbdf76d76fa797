package dev.station.interaction;

import dev.station.model.LogStream;

/**
 * Messages exchanged with the operator console.
 * Engine to console: {@link Log}, {@link Request}. Console to engine: {@link Response}.
 */
public sealed interface ConsoleMessage {

    record Log(LogStream stream, String text) implements ConsoleMessage {}

    record Request(String id, InteractionRequest request) implements ConsoleMessage {}

    /** Selection is a scalar value, or a list of values for multi-choice prompts. */
    record Response(String id, Object selection) implements ConsoleMessage {}
}
