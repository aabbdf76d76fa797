package dev.station.model;

/**
 * Static, per-step presentation and policy data. Resolved once when a step is
 * registered and never changed while the step runs.
 */
public record StepMetadata(
    String displayName,
    String description,
    String image, // nullable, repository-relative path of a static image
    Link link,    // nullable
    boolean stopOnFail
) {
    public static final boolean DEFAULT_STOP_ON_FAIL = true;

    public StepMetadata {
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("Display name must not be empty");
        }
        if (description == null || description.isBlank()) {
            description = displayName;
        }
    }

    public static StepMetadata named(String displayName) {
        return new StepMetadata(displayName, null, null, null, DEFAULT_STOP_ON_FAIL);
    }
}
