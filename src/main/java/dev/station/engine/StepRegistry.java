package dev.station.engine;

import dev.station.model.PlanDeclaration;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Explicit, ordered table of the steps a station can run, built at startup.
 */
public final class StepRegistry {

    private final Map<String, StepDefinition> steps = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if a step with the same id is already registered
     */
    public StepRegistry register(StepDefinition definition) {
        StepDefinition previous = steps.putIfAbsent(definition.id(), definition);
        if (previous != null) {
            throw new IllegalArgumentException("Step already registered: " + definition.id());
        }
        return this;
    }

    public StepRegistry register(String id, Supplier<? extends Step> factory) {
        return register(StepDefinition.of(id, factory));
    }

    public Optional<StepDefinition> find(String id) {
        return Optional.ofNullable(steps.get(id));
    }

    /**
     * @throws IllegalArgumentException if no step is registered under the id
     */
    public StepDefinition get(String id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException("No step registered with id: '" + id + "'"));
    }

    public boolean contains(String id) {
        return steps.containsKey(id);
    }

    /** All definitions, in registration order. */
    public Collection<StepDefinition> definitions() {
        return Collections.unmodifiableCollection(steps.values());
    }

    public int size() {
        return steps.size();
    }

    /**
     * Turn a declared plan into a runnable one. Validate first with
     * {@link RunPlanValidator}; unknown ids fail here.
     */
    public RunPlan resolve(PlanDeclaration declaration) {
        List<StepDefinition> resolved = new ArrayList<>();
        for (String id : declaration.stepIds()) {
            resolved.add(get(id));
        }
        StepDefinition finalizer = declaration.finalizerId() == null ? null : get(declaration.finalizerId());
        return new RunPlan(resolved, finalizer, declaration.settings());
    }
}
