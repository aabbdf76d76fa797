package dev.station.interaction;

import java.util.Objects;

/**
 * A selectable choice in an operator prompt: the label shown and the value
 * returned when it is chosen.
 */
public record Option(String name, Object value) {

    public Option {
        Objects.requireNonNull(name, "name");
    }

    /** A bare label; its value is the label itself. */
    public static Option of(String label) {
        return new Option(label, label);
    }

    public static Option of(String name, Object value) {
        return new Option(name, value);
    }
}
