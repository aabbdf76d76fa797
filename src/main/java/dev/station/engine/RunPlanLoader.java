package dev.station.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.station.model.PlanDeclaration;
import dev.station.model.SequencerSettings;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads run plan declarations from JSON:
 *
 * <pre>
 * {
 *   "steps": ["EmptyStep", "StepThatSetsState"],
 *   "finalizer": "Shutdown",
 *   "settings": { "requestTimeoutSeconds": 300, "finalizerAffectsVerdict": false }
 * }
 * </pre>
 */
public final class RunPlanLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RunPlanLoader() {}

    public static PlanDeclaration loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parsePlan(root);
    }

    public static PlanDeclaration loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parsePlan(root);
    }

    private static PlanDeclaration parsePlan(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Run plan must be a JSON object");
        }
        JsonNode stepsNode = root.get("steps");
        if (stepsNode == null || !stepsNode.isArray()) {
            throw new IllegalArgumentException("Run plan needs a 'steps' array");
        }
        List<String> stepIds = new ArrayList<>();
        for (JsonNode s : stepsNode) {
            if (!s.isTextual()) {
                throw new IllegalArgumentException("Step entries must be strings, got: " + s);
            }
            stepIds.add(s.asText());
        }

        JsonNode finalizerNode = root.get("finalizer");
        if (finalizerNode != null && !finalizerNode.isNull() && !finalizerNode.isTextual()) {
            throw new IllegalArgumentException("'finalizer' must be a string, got: " + finalizerNode);
        }
        String finalizerId = finalizerNode == null || finalizerNode.isNull() ? null : finalizerNode.asText();

        return new PlanDeclaration(stepIds, finalizerId, parseSettings(root.get("settings")));
    }

    private static SequencerSettings parseSettings(JsonNode node) {
        if (node == null) {
            return SequencerSettings.defaults();
        }
        boolean finalizerAffectsVerdict = node.has("finalizerAffectsVerdict")
            ? node.get("finalizerAffectsVerdict").asBoolean() : SequencerSettings.DEFAULT_FINALIZER_AFFECTS_VERDICT;
        Duration requestTimeout = node.has("requestTimeoutSeconds") && !node.get("requestTimeoutSeconds").isNull()
            ? Duration.ofMillis(Math.round(node.get("requestTimeoutSeconds").asDouble() * 1000))
            : SequencerSettings.DEFAULT_REQUEST_TIMEOUT;
        return new SequencerSettings(finalizerAffectsVerdict, requestTimeout);
    }
}
