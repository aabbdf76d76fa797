package dev.station.engine;

import dev.station.model.PlanDeclaration;
import dev.station.model.SequencerSettings;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunPlanLoaderTest {

    @Test
    void loadsPlanFromJsonString() throws IOException {
        String json = """
            {
              "steps": [
                "EmptyStep",
                "StepWithDisplayName",
                "StepThatSetsState",
                "StepThatReadsState",
                "StepThatCanFail"
              ],
              "finalizer": "Shutdown",
              "settings": {
                "requestTimeoutSeconds": 300,
                "finalizerAffectsVerdict": true
              }
            }
            """;

        PlanDeclaration plan = RunPlanLoader.loadFromString(json);

        assertThat(plan.stepIds()).containsExactly(
            "EmptyStep", "StepWithDisplayName", "StepThatSetsState", "StepThatReadsState", "StepThatCanFail");
        assertThat(plan.finalizerId()).isEqualTo("Shutdown");
        assertThat(plan.settings().requestTimeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(plan.settings().finalizerAffectsVerdict()).isTrue();
    }

    @Test
    void defaultsSettingsWhenMissing() throws IOException {
        String json = """
            { "steps": ["EmptyStep"] }
            """;

        PlanDeclaration plan = RunPlanLoader.loadFromString(json);

        assertThat(plan.finalizerId()).isNull();
        assertThat(plan.settings()).isEqualTo(SequencerSettings.defaults());
        assertThat(plan.settings().requestTimeout()).isNull();
    }

    @Test
    void fractionalTimeoutIsKept() throws IOException {
        String json = """
            { "steps": ["EmptyStep"], "settings": { "requestTimeoutSeconds": 1.5 } }
            """;

        PlanDeclaration plan = RunPlanLoader.loadFromString(json);

        assertThat(plan.settings().requestTimeout()).isEqualTo(Duration.ofMillis(1500));
        assertThat(plan.settings().finalizerAffectsVerdict())
            .isEqualTo(SequencerSettings.DEFAULT_FINALIZER_AFFECTS_VERDICT);
    }

    @Test
    void rejectsPlanWithoutStepsArray() {
        assertThatThrownBy(() -> RunPlanLoader.loadFromString("{ \"finalizer\": \"Shutdown\" }"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'steps'");
    }

    @Test
    void rejectsNonStringStepEntries() {
        assertThatThrownBy(() -> RunPlanLoader.loadFromString("{ \"steps\": [\"EmptyStep\", null] }"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be strings");
        assertThatThrownBy(() -> RunPlanLoader.loadFromString("{ \"steps\": [1] }"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RunPlanLoader.loadFromString("{ \"steps\": [{}] }"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonStringFinalizer() {
        assertThatThrownBy(() -> RunPlanLoader.loadFromString("{ \"steps\": [\"EmptyStep\"], \"finalizer\": 7 }"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'finalizer'");
    }
}
