package dev.station.engine;

import dev.station.model.RunResult;
import dev.station.model.StepExecution;
import dev.station.model.StepOutcome;

/**
 * Renders a run result as plain text for operators and station logs.
 */
public final class RunSummary {

    private RunSummary() {}

    public static String render(RunResult result) {
        var sb = new StringBuilder();
        sb.append("Run ").append(result.runId()).append(": ").append(result.verdict());
        sb.append(" (").append(result.stopReason()).append(")\n");

        int index = 1;
        for (StepExecution step : result.steps()) {
            sb.append(String.format("%3d. ", index++));
            appendStep(sb, step);
        }
        if (result.finalizer() != null) {
            sb.append("  F. ");
            appendStep(sb, result.finalizer());
        }
        if (result.infrastructureError() != null) {
            sb.append("Infrastructure error: ").append(result.infrastructureError().getMessage()).append('\n');
        }
        return sb.toString();
    }

    private static void appendStep(StringBuilder sb, StepExecution step) {
        sb.append(String.format("%-8s", step.outcome().tag().toUpperCase()));
        sb.append(step.displayName());
        String detail = detail(step.outcome());
        if (detail != null) {
            sb.append(" - ").append(detail);
        }
        sb.append('\n');
    }

    private static String detail(StepOutcome outcome) {
        if (outcome instanceof StepOutcome.Failed failed) {
            return failed.detail();
        }
        if (outcome instanceof StepOutcome.Errored errored) {
            Throwable cause = errored.cause();
            return cause.getClass().getSimpleName() + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
        }
        if (outcome instanceof StepOutcome.Aborted aborted) {
            return aborted.cause().getMessage();
        }
        if (outcome instanceof StepOutcome.Skipped skipped) {
            return skipped.reason();
        }
        return null;
    }
}
