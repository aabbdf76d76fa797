package dev.station.engine;

import dev.station.model.SequencerSettings;

import java.util.Arrays;
import java.util.List;

/**
 * The ordered steps of one run plus an optional finalizer. Immutable.
 */
public record RunPlan(
    List<StepDefinition> steps,
    StepDefinition finalizer, // nullable, no finalizer
    SequencerSettings settings
) {
    public RunPlan {
        steps = List.copyOf(steps);
        if (settings == null) {
            settings = SequencerSettings.defaults();
        }
    }

    public static RunPlan of(StepDefinition... steps) {
        return new RunPlan(Arrays.asList(steps), null, SequencerSettings.defaults());
    }

    public RunPlan withFinalizer(StepDefinition finalizer) {
        return new RunPlan(steps, finalizer, settings);
    }

    public RunPlan withSettings(SequencerSettings settings) {
        return new RunPlan(steps, finalizer, settings);
    }
}
