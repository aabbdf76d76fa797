package dev.station.model;

import java.time.Instant;
import java.util.List;

/**
 * Everything a run produced: per-step records, the finalizer record, the
 * aggregate verdict and why the step loop stopped.
 */
public record RunResult(
    String runId,
    List<StepExecution> steps,
    StepExecution finalizer,                      // nullable, plan had no finalizer
    Verdict verdict,
    StopReason stopReason,
    InfrastructureException infrastructureError, // nullable
    Instant startedAt,
    Instant finishedAt
) {
    public RunResult {
        steps = List.copyOf(steps);
    }

    public boolean passed() {
        return verdict == Verdict.PASSED;
    }

    public boolean aborted() {
        return stopReason == StopReason.INFRASTRUCTURE_ERROR;
    }

    /**
     * True when there was no finalizer, or it ran without failing.
     */
    public boolean finalizerSucceeded() {
        return finalizer == null || !finalizer.outcome().isFailure();
    }
}
