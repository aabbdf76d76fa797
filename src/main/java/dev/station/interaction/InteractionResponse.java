package dev.station.interaction;

import java.util.List;

/**
 * A validated operator answer, shaped by the kind of the originating request.
 */
public sealed interface InteractionResponse {

    /** Buttons and pass/fail: the value of the clicked button. */
    record Chosen(Object value) implements InteractionResponse {}

    /** Text input: what the operator typed. */
    record Text(String text) implements InteractionResponse {}

    /** Radios and single select. */
    record Single(Option option) implements InteractionResponse {}

    /** Checkboxes and multi-select: ordered, no duplicate names. May be empty. */
    record Multiple(List<Option> options) implements InteractionResponse {
        public Multiple {
            options = List.copyOf(options);
        }
    }
}
