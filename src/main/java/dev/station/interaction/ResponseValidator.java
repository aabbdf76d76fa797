package dev.station.interaction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Checks a raw console selection against the request it answers and resolves
 * it into a typed {@link InteractionResponse}.
 */
public final class ResponseValidator {

    private ResponseValidator() {}

    /**
     * Resolve a raw selection.
     *
     * @param requestId correlation id, used in error messages
     * @param request   the originating request
     * @param selection a scalar value, or a collection of values for multi-choice kinds
     * @return the resolved response; option values are the author's originals
     * @throws ResponseValidationException if the selection names a value the request did not offer,
     *                                     repeats a value, or has the wrong shape
     */
    public static InteractionResponse resolve(String requestId, InteractionRequest request, Object selection) {
        if (request.kind() == InteractionKind.TEXT_INPUT) {
            if (!(selection instanceof CharSequence text)) {
                throw new ResponseValidationException(requestId, "text input expects a string, got " + describe(selection));
            }
            return new InteractionResponse.Text(text.toString());
        }

        if (request.expectsMultiple()) {
            if (!(selection instanceof Collection<?> values)) {
                throw new ResponseValidationException(requestId,
                    "%s expects a list of values, got %s".formatted(request.kind().wireName(), describe(selection)));
            }
            return new InteractionResponse.Multiple(resolveAll(requestId, request, values));
        }

        if (selection instanceof Collection<?>) {
            throw new ResponseValidationException(requestId,
                "%s expects a single value, got a list".formatted(request.kind().wireName()));
        }
        Option option = lookup(request, selection).orElseThrow(() -> unknownValue(requestId, request, selection));
        return switch (request.kind()) {
            case BUTTONS, PASS_FAIL -> new InteractionResponse.Chosen(option.value());
            default -> new InteractionResponse.Single(option);
        };
    }

    private static List<Option> resolveAll(String requestId, InteractionRequest request, Collection<?> values) {
        var chosen = new ArrayList<Option>();
        for (Object value : values) {
            Option option = lookup(request, value).orElseThrow(() -> unknownValue(requestId, request, value));
            if (chosen.contains(option)) {
                throw new ResponseValidationException(requestId, "option '%s' selected twice".formatted(option.name()));
            }
            chosen.add(option);
        }
        // Present the selection in the order the options were offered
        chosen.sort((a, b) -> Integer.compare(request.options().indexOf(a), request.options().indexOf(b)));
        return chosen;
    }

    private static Optional<Option> lookup(InteractionRequest request, Object value) {
        return request.options().stream()
            .filter(o -> Options.sameValue(o.value(), value))
            .findFirst();
    }

    private static ResponseValidationException unknownValue(String requestId, InteractionRequest request, Object value) {
        List<Object> offered = request.options().stream().map(Option::value).toList();
        return new ResponseValidationException(requestId,
            "value %s not among offered values %s".formatted(describe(value), offered));
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        return value instanceof CharSequence ? "'" + value + "'" : value.toString();
    }
}
