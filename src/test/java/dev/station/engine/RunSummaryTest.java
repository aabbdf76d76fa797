package dev.station.engine;

import dev.station.model.InfrastructureException;
import dev.station.model.RunResult;
import dev.station.model.StepExecution;
import dev.station.model.StepMetadata;
import dev.station.model.StepOutcome;
import dev.station.model.StopReason;
import dev.station.model.Verdict;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RunSummaryTest {

    private static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");

    @Test
    void rendersHeaderAndNumberedSteps() {
        var result = new RunResult("run-7",
            List.of(
                record("PowerOn", new StepOutcome.Passed()),
                record("CheckRail", new StepOutcome.Failed("3.1 V out of range")),
                StepExecution.skipped("Flash", StepMetadata.named("Flash"), "Stopped after 'CheckRail' failed")),
            record("Shutdown", new StepOutcome.Passed()),
            Verdict.FAILED, StopReason.STOPPED_ON_FAILURE, null, T0, T0);

        String text = RunSummary.render(result);

        assertThat(text.lines()).containsExactly(
            "Run run-7: FAILED (STOPPED_ON_FAILURE)",
            "  1. PASSED  PowerOn",
            "  2. FAILED  CheckRail - 3.1 V out of range",
            "  3. SKIPPED Flash - Stopped after 'CheckRail' failed",
            "  F. PASSED  Shutdown");
    }

    @Test
    void includesErrorTypeAndInfrastructureCause() {
        var abort = new InfrastructureException("Operator disconnected");
        var result = new RunResult("run-8",
            List.of(
                record("ReadSerial", new StepOutcome.Errored(new IllegalStateException("no serial"))),
                record("AskOperator", new StepOutcome.Aborted(abort))),
            null, Verdict.FAILED, StopReason.INFRASTRUCTURE_ERROR, abort, T0, T0);

        String text = RunSummary.render(result);

        assertThat(text)
            .contains("ERRORED ReadSerial - IllegalStateException: no serial")
            .contains("ABORTED AskOperator - Operator disconnected")
            .contains("Infrastructure error: Operator disconnected")
            .doesNotContain("  F. ");
    }

    private static StepExecution record(String name, StepOutcome outcome) {
        return new StepExecution(name, StepMetadata.named(name), outcome, List.of(), T0, T0);
    }
}
