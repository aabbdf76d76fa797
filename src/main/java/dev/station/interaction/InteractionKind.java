package dev.station.interaction;

/**
 * The kinds of operator prompt a step can issue.
 */
public enum InteractionKind {
    BUTTONS("buttons"),
    PASS_FAIL("pass_fail"),
    TEXT_INPUT("text_input"),
    RADIOS("radios"),
    CHECKBOXES("checkboxes"),
    SELECT("select");

    private final String wireName;

    InteractionKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    public boolean optionBased() {
        return this != TEXT_INPUT;
    }

    public static InteractionKind fromWire(String name) {
        for (InteractionKind kind : values()) {
            if (kind.wireName.equals(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown interaction kind: " + name);
    }
}
