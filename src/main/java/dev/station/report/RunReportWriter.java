package dev.station.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.station.model.LogLine;
import dev.station.model.RunResult;
import dev.station.model.StepExecution;
import dev.station.model.StepMetadata;
import dev.station.model.StepOutcome;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * Serializes a {@link RunResult} to the JSON run report consumed by station
 * reporting (exit status, UI banner, audit log).
 */
public final class RunReportWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private RunReportWriter() {}

    public static String toJson(RunResult result) {
        try {
            return MAPPER.writeValueAsString(toTree(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize run report for " + result.runId(), e);
        }
    }

    public static void write(RunResult result, Path path) throws IOException {
        Files.writeString(path, toJson(result));
    }

    static ObjectNode toTree(RunResult result) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("runId", result.runId());
        root.put("verdict", result.verdict().name());
        root.put("stopReason", result.stopReason().name());
        putInstant(root, "startedAt", result.startedAt());
        putInstant(root, "finishedAt", result.finishedAt());
        if (result.infrastructureError() != null) {
            root.put("infrastructureError", result.infrastructureError().getMessage());
        }

        ArrayNode steps = root.putArray("steps");
        for (StepExecution step : result.steps()) {
            steps.add(stepNode(step));
        }
        if (result.finalizer() != null) {
            root.set("finalizer", stepNode(result.finalizer()));
        } else {
            root.putNull("finalizer");
        }
        root.put("finalizerSucceeded", result.finalizerSucceeded());
        return root;
    }

    private static ObjectNode stepNode(StepExecution step) {
        ObjectNode node = MAPPER.createObjectNode();
        StepMetadata metadata = step.metadata();
        node.put("id", step.stepId());
        node.put("displayName", metadata.displayName());
        node.put("description", metadata.description());
        if (metadata.image() != null) {
            node.put("image", metadata.image());
        }
        if (metadata.link() != null) {
            ObjectNode link = node.putObject("link");
            link.put("url", metadata.link().url());
            link.put("text", metadata.link().displayText());
        }
        node.put("stopOnFail", metadata.stopOnFail());

        StepOutcome outcome = step.outcome();
        node.put("outcome", outcome.tag());
        if (outcome instanceof StepOutcome.Failed failed) {
            node.put("detail", failed.detail());
        } else if (outcome instanceof StepOutcome.Errored errored) {
            node.put("detail", String.valueOf(errored.cause()));
        } else if (outcome instanceof StepOutcome.Aborted aborted) {
            node.put("detail", aborted.cause().getMessage());
        } else if (outcome instanceof StepOutcome.Skipped skipped) {
            node.put("detail", skipped.reason());
        }

        putInstant(node, "startedAt", step.startedAt());
        putInstant(node, "finishedAt", step.finishedAt());

        ArrayNode logs = node.putArray("logs");
        for (LogLine line : step.logs()) {
            ObjectNode l = logs.addObject();
            l.put("stream", line.stream().wireName());
            l.put("text", line.text());
            putInstant(l, "at", line.at());
        }
        return node;
    }

    private static void putInstant(ObjectNode node, String field, Instant instant) {
        if (instant == null) {
            node.putNull(field);
        } else {
            node.put(field, instant.toString());
        }
    }
}
