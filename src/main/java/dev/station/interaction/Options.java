package dev.station.interaction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Normalizes author-supplied option lists into {@link Option}s and compares
 * option values.
 */
public final class Options {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Options() {}

    /**
     * Normalize a list of option specifiers. Each element may be a bare label
     * ({@link CharSequence}), an {@link Option}, or a {@link Map.Entry} of
     * label to value.
     *
     * @throws IllegalArgumentException for unsupported elements, values the console cannot
     *                                  carry, or duplicate names or values
     */
    public static List<Option> normalize(List<?> specifiers) {
        Objects.requireNonNull(specifiers, "options");
        var options = new ArrayList<Option>(specifiers.size());
        for (Object spec : specifiers) {
            Option option = toOption(spec);
            wireForm(option.value());
            options.add(option);
        }
        requireUnique(options);
        return List.copyOf(options);
    }

    /**
     * Value equality as seen over the console wire, where integral numbers
     * lose their Java width and enums, UUIDs and the like arrive as strings.
     */
    public static boolean sameValue(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            if (isIntegral(x) && isIntegral(y)) {
                return toBigInteger(x).equals(toBigInteger(y));
            }
            return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
        }
        if (Objects.equals(a, b)) {
            return true;
        }
        if (a == null || b == null || a instanceof Number || b instanceof Number) {
            return false;
        }
        return wireForm(a).equals(wireForm(b));
    }

    /**
     * The JSON a value is sent as.
     *
     * @throws IllegalArgumentException if the value cannot be encoded
     */
    static JsonNode wireForm(Object value) {
        try {
            return MAPPER.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Option value cannot be sent to the console: " + value, e);
        }
    }

    private static Option toOption(Object spec) {
        if (spec instanceof Option option) {
            return option;
        }
        if (spec instanceof CharSequence label) {
            return Option.of(label.toString());
        }
        if (spec instanceof Map.Entry<?, ?> pair) {
            if (!(pair.getKey() instanceof CharSequence name)) {
                throw new IllegalArgumentException("Option label must be a string: " + pair.getKey());
            }
            return Option.of(name.toString(), pair.getValue());
        }
        throw new IllegalArgumentException("Unsupported option specifier: " + spec);
    }

    private static void requireUnique(List<Option> options) {
        var names = new HashSet<String>();
        for (int i = 0; i < options.size(); i++) {
            Option option = options.get(i);
            if (!names.add(option.name())) {
                throw new IllegalArgumentException("Duplicate option name: " + option.name());
            }
            for (int j = 0; j < i; j++) {
                if (sameValue(options.get(j).value(), option.value())) {
                    throw new IllegalArgumentException("Duplicate option value: " + option.value());
                }
            }
        }
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
            || n instanceof BigInteger;
    }

    private static BigInteger toBigInteger(Number n) {
        return n instanceof BigInteger big ? big : BigInteger.valueOf(n.longValue());
    }
}
