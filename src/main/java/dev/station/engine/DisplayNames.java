package dev.station.engine;

import java.util.regex.Pattern;

/**
 * Derives human-readable step names from identifiers.
 */
public final class DisplayNames {

    // lower/digit followed by upper, or an acronym followed by a capitalised word
    private static final Pattern CASE_BOUNDARY =
        Pattern.compile("(?<=[a-z0-9])(?=[A-Z])|(?<=[A-Z])(?=[A-Z][a-z])");

    private DisplayNames() {}

    /**
     * Split an identifier on case boundaries and underscores:
     * {@code StepWithDisplayName} becomes {@code Step With Display Name},
     * {@code ConnectToDUTNow} becomes {@code Connect To DUT Now}.
     */
    public static String fromIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Identifier must not be empty");
        }
        String spaced = CASE_BOUNDARY.matcher(identifier.replace('_', ' ')).replaceAll(" ");
        return spaced.trim().replaceAll("\\s+", " ");
    }
}
