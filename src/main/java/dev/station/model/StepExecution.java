package dev.station.model;

import java.time.Instant;
import java.util.List;

/**
 * Execution record of one step within a run.
 */
public record StepExecution(
    String stepId,
    StepMetadata metadata,
    StepOutcome outcome,
    List<LogLine> logs,
    Instant startedAt, // null for skipped steps
    Instant finishedAt // null for skipped steps
) {
    public StepExecution {
        logs = List.copyOf(logs);
    }

    public static StepExecution skipped(String stepId, StepMetadata metadata, String reason) {
        return new StepExecution(stepId, metadata, new StepOutcome.Skipped(reason), List.of(), null, null);
    }

    public String displayName() { return metadata.displayName(); }

    public boolean stopOnFail() { return metadata.stopOnFail(); }

    public boolean skipped() { return outcome instanceof StepOutcome.Skipped; }
}
