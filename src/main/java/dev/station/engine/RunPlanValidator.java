package dev.station.engine;

import dev.station.model.PlanDeclaration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates a plan declaration against a registry before any step runs.
 */
public final class RunPlanValidator {

    private RunPlanValidator() {}

    /**
     * Validate a declaration. Returns an empty list if valid,
     * or a list of error messages if invalid.
     */
    public static List<String> validate(PlanDeclaration plan, StepRegistry registry) {
        var errors = new ArrayList<String>();

        if (plan.stepIds().isEmpty()) {
            errors.add("Plan has no steps");
        }

        for (int i = 0; i < plan.stepIds().size(); i++) {
            String id = plan.stepIds().get(i);
            if (id == null || id.isBlank()) {
                errors.add("Step %d has an empty id".formatted(i + 1));
            } else if (!registry.contains(id)) {
                errors.add("Step %d: no step registered with id '%s'".formatted(i + 1, id));
            }
        }

        if (plan.finalizerId() != null && !registry.contains(plan.finalizerId())) {
            errors.add("Finalizer: no step registered with id '%s'".formatted(plan.finalizerId()));
        }

        Duration timeout = plan.settings().requestTimeout();
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            errors.add("Request timeout must be positive, got " + timeout);
        }

        return errors;
    }
}
