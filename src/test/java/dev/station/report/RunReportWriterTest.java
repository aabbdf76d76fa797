package dev.station.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.station.model.InfrastructureException;
import dev.station.model.Link;
import dev.station.model.LogLine;
import dev.station.model.LogStream;
import dev.station.model.RunResult;
import dev.station.model.StepExecution;
import dev.station.model.StepMetadata;
import dev.station.model.StepOutcome;
import dev.station.model.StopReason;
import dev.station.model.Verdict;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RunReportWriterTest {

    private static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");
    private static final Instant T1 = Instant.parse("2026-01-01T10:00:05Z");

    @TempDir
    Path tempDir;

    @Test
    void reportsStepsMetadataAndLogs() {
        var metadata = new StepMetadata("Inspect label", "Check the serial label", "label.png",
            new Link("https://example.com/label", null), false);
        var inspect = new StepExecution("InspectLabel", metadata, new StepOutcome.Failed("Label crooked"),
            List.of(new LogLine(LogStream.ERR, "crooked by 4 deg", T0)), T0, T1);
        var result = new RunResult("run-1", List.of(inspect), null, Verdict.FAILED, StopReason.COMPLETED,
            null, T0, T1);

        var tree = RunReportWriter.toTree(result);

        assertThat(tree.get("runId").asText()).isEqualTo("run-1");
        assertThat(tree.get("verdict").asText()).isEqualTo("FAILED");
        assertThat(tree.get("stopReason").asText()).isEqualTo("COMPLETED");
        assertThat(tree.has("infrastructureError")).isFalse();
        assertThat(tree.get("finalizer").isNull()).isTrue();
        assertThat(tree.get("finalizerSucceeded").asBoolean()).isTrue();

        var step = tree.get("steps").get(0);
        assertThat(step.get("id").asText()).isEqualTo("InspectLabel");
        assertThat(step.get("description").asText()).isEqualTo("Check the serial label");
        assertThat(step.get("image").asText()).isEqualTo("label.png");
        assertThat(step.get("link").get("text").asText()).isEqualTo("https://example.com/label");
        assertThat(step.get("stopOnFail").asBoolean()).isFalse();
        assertThat(step.get("outcome").asText()).isEqualTo("failed");
        assertThat(step.get("detail").asText()).isEqualTo("Label crooked");
        assertThat(step.get("startedAt").asText()).isEqualTo("2026-01-01T10:00:00Z");
        assertThat(step.get("logs").get(0).get("stream").asText()).isEqualTo("err");
        assertThat(step.get("logs").get(0).get("text").asText()).isEqualTo("crooked by 4 deg");
    }

    @Test
    void reportsAbortAndSkippedSteps() throws Exception {
        var abort = new InfrastructureException("Operator disconnected");
        var result = new RunResult("run-2",
            List.of(
                new StepExecution("AskOperator", StepMetadata.named("Ask operator"), new StepOutcome.Aborted(abort),
                    List.of(), T0, T1),
                StepExecution.skipped("Flash", StepMetadata.named("Flash"), "Run aborted: Operator disconnected")),
            new StepExecution("Shutdown", StepMetadata.named("Shutdown"), new StepOutcome.Errored(new IllegalStateException("relay stuck")),
                List.of(), T1, T1),
            Verdict.FAILED, StopReason.INFRASTRUCTURE_ERROR, abort, T0, T1);
        Path file = tempDir.resolve("report.json");

        RunReportWriter.write(result, file);

        var tree = new ObjectMapper().readTree(file.toFile());
        assertThat(tree.get("infrastructureError").asText()).isEqualTo("Operator disconnected");
        assertThat(tree.get("steps").get(0).get("outcome").asText()).isEqualTo("aborted");
        assertThat(tree.get("steps").get(1).get("outcome").asText()).isEqualTo("skipped");
        assertThat(tree.get("steps").get(1).get("startedAt").isNull()).isTrue();
        assertThat(tree.get("finalizer").get("detail").asText()).contains("relay stuck");
        assertThat(tree.get("finalizerSucceeded").asBoolean()).isFalse();
    }
}
