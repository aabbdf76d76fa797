package dev.station.model;

import java.util.List;

/**
 * A run plan as declared in a plan file: step identifiers still to be
 * resolved against a step registry.
 */
public record PlanDeclaration(
    List<String> stepIds,
    String finalizerId, // nullable, no finalizer
    SequencerSettings settings
) {
    public PlanDeclaration {
        stepIds = List.copyOf(stepIds);
        if (settings == null) {
            settings = SequencerSettings.defaults();
        }
    }
}
