package dev.station.interaction;

import java.util.List;

/**
 * A prompt sent to the operator console.
 */
public record InteractionRequest(
    InteractionKind kind,
    String prompt, // nullable, button rows may have no prompt
    List<Option> options,
    boolean allowMultiple,
    int size       // text input width in characters; 0 for other kinds
) {
    public static final int DEFAULT_TEXT_INPUT_SIZE = 50;
    public static final Option PASS = Option.of("Pass", Boolean.TRUE);
    public static final Option FAIL = Option.of("Fail", Boolean.FALSE);

    public InteractionRequest {
        options = List.copyOf(options);
        if (kind.optionBased() && options.isEmpty()) {
            throw new IllegalArgumentException(kind.wireName() + " request needs at least one option");
        }
        if (kind == InteractionKind.TEXT_INPUT && size <= 0) {
            throw new IllegalArgumentException("Text input size must be positive: " + size);
        }
    }

    public static InteractionRequest buttons(String prompt, List<?> options) {
        return new InteractionRequest(InteractionKind.BUTTONS, prompt, Options.normalize(options), false, 0);
    }

    public static InteractionRequest passFail(String prompt) {
        return new InteractionRequest(InteractionKind.PASS_FAIL, prompt, List.of(PASS, FAIL), false, 0);
    }

    public static InteractionRequest textInput(String prompt, int size) {
        return new InteractionRequest(InteractionKind.TEXT_INPUT, prompt, List.of(), false, size);
    }

    public static InteractionRequest radios(String prompt, List<?> options) {
        return new InteractionRequest(InteractionKind.RADIOS, prompt, Options.normalize(options), false, 0);
    }

    public static InteractionRequest checkboxes(String prompt, List<?> options) {
        return new InteractionRequest(InteractionKind.CHECKBOXES, prompt, Options.normalize(options), true, 0);
    }

    public static InteractionRequest select(String prompt, List<?> options, boolean allowMultiple) {
        return new InteractionRequest(InteractionKind.SELECT, prompt, Options.normalize(options), allowMultiple, 0);
    }

    /**
     * Whether the operator answers with a set of options rather than one value.
     */
    public boolean expectsMultiple() {
        return kind == InteractionKind.CHECKBOXES || (kind == InteractionKind.SELECT && allowMultiple);
    }
}
