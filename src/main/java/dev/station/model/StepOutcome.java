package dev.station.model;

/**
 * Classified result of one step invocation.
 */
public sealed interface StepOutcome {

    /** The step completed without signalling failure. */
    record Passed() implements StepOutcome {}

    /** The step signalled failure explicitly. */
    record Failed(String detail) implements StepOutcome {}

    /** The step raised an error from its own logic. */
    record Errored(Throwable cause) implements StepOutcome {}

    /** Engine plumbing failed while the step was running. */
    record Aborted(InfrastructureException cause) implements StepOutcome {}

    /** The step was never instantiated. */
    record Skipped(String reason) implements StepOutcome {}

    /**
     * Whether this outcome counts against the run verdict.
     */
    default boolean isFailure() {
        return this instanceof Failed || this instanceof Errored || this instanceof Aborted;
    }

    default String tag() {
        if (this instanceof Passed) return "passed";
        if (this instanceof Failed) return "failed";
        if (this instanceof Errored) return "errored";
        if (this instanceof Aborted) return "aborted";
        return "skipped";
    }
}
