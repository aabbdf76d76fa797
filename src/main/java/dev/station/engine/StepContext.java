package dev.station.engine;

import dev.station.interaction.InteractionChannel;
import dev.station.interaction.InteractionRequest;
import dev.station.interaction.InteractionResponse;
import dev.station.interaction.Option;
import dev.station.model.InfrastructureException;
import dev.station.model.StepMetadata;
import dev.station.secret.SecretStore;

import java.time.Duration;
import java.util.List;

/**
 * Everything a running step can reach: run state, operator interaction,
 * secrets, and its own log.
 *
 * <p>Infrastructure failures raised through this context are latched for
 * the sequencer before they propagate, so catching them does not keep a
 * run going.
 */
public final class StepContext {
    private final String stepId;
    private final StepMetadata metadata;
    private final RunState state;
    private final InteractionChannel channel;
    private final SecretStore secrets;
    private final StepLog log;
    private final Duration defaultTimeout;
    private final FaultLatch faults;

    StepContext(String stepId, StepMetadata metadata, RunState state, InteractionChannel channel,
                SecretStore secrets, StepLog log, Duration defaultTimeout, FaultLatch faults) {
        this.stepId = stepId;
        this.metadata = metadata;
        this.state = state;
        this.channel = channel;
        this.secrets = secrets;
        this.log = log;
        this.defaultTimeout = defaultTimeout;
        this.faults = faults;
    }

    public String stepId() { return stepId; }
    public StepMetadata metadata() { return metadata; }
    public String runId() { return state.runId(); }
    public RunState state() { return state; }
    public StepLog log() { return log; }

    /** Write a line to the operator's stdout pane. */
    public void log(String text) {
        log.out(text);
    }

    /** Write a line to the operator's stderr pane. */
    public void logError(String text) {
        log.err(text);
    }

    /**
     * @throws dev.station.secret.SecretNotFoundException if the secret is not declared for this run
     */
    public String secret(String name) {
        try {
            return secrets.get(name);
        } catch (InfrastructureException e) {
            throw faults.trip(e);
        }
    }

    // ------------------------------------------------------------------
    // Operator interaction
    // ------------------------------------------------------------------

    public InteractionResponse request(InteractionRequest request) {
        return request(request, defaultTimeout);
    }

    public InteractionResponse request(InteractionRequest request, Duration timeout) {
        try {
            return channel.request(request, timeout);
        } catch (InfrastructureException e) {
            throw faults.trip(e);
        }
    }

    /** Show a row of buttons; returns the value of the one clicked. */
    public Object presentButtons(List<?> options) {
        return presentButtons(null, options);
    }

    public Object presentButtons(String prompt, List<?> options) {
        return expect(request(InteractionRequest.buttons(prompt, options)), InteractionResponse.Chosen.class).value();
    }

    /** Show Pass (green) and Fail (red) buttons; true when the operator clicks Pass. */
    public boolean presentPassFail(String prompt) {
        Object value = expect(request(InteractionRequest.passFail(prompt)), InteractionResponse.Chosen.class).value();
        return Boolean.TRUE.equals(value);
    }

    public boolean presentPassFail() {
        return presentPassFail(null);
    }

    public String presentTextInput(String prompt) {
        return presentTextInput(prompt, InteractionRequest.DEFAULT_TEXT_INPUT_SIZE);
    }

    public String presentTextInput(String prompt, int size) {
        return expect(request(InteractionRequest.textInput(prompt, size)), InteractionResponse.Text.class).text();
    }

    /** Exactly one choice. */
    public Option presentRadios(String prompt, List<?> options) {
        return expect(request(InteractionRequest.radios(prompt, options)), InteractionResponse.Single.class).option();
    }

    /** Any number of choices, possibly none. */
    public List<Option> presentCheckboxes(String prompt, List<?> options) {
        return expect(request(InteractionRequest.checkboxes(prompt, options)), InteractionResponse.Multiple.class).options();
    }

    /** Drop-down allowing one choice. */
    public Option presentSelect(String prompt, List<?> options) {
        return expect(request(InteractionRequest.select(prompt, options, false)), InteractionResponse.Single.class).option();
    }

    /** Drop-down allowing several choices. */
    public List<Option> presentMultiSelect(String prompt, List<?> options) {
        return expect(request(InteractionRequest.select(prompt, options, true)), InteractionResponse.Multiple.class).options();
    }

    private <R extends InteractionResponse> R expect(InteractionResponse response, Class<R> type) {
        if (!type.isInstance(response)) {
            throw faults.trip(new InfrastructureException(
                "Channel answered with " + response + " where " + type.getSimpleName() + " was expected"));
        }
        return type.cast(response);
    }
}
