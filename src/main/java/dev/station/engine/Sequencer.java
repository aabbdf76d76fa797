package dev.station.engine;

import dev.station.interaction.InteractionChannel;
import dev.station.model.InfrastructureException;
import dev.station.model.RunResult;
import dev.station.model.SequencerSettings;
import dev.station.model.StepExecution;
import dev.station.model.StepOutcome;
import dev.station.model.StopReason;
import dev.station.model.Verdict;
import dev.station.secret.SecretStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Drives a {@link RunPlan} on the calling thread: each step is instantiated,
 * run and classified in plan order, stop-on-fail and infrastructure aborts
 * skip what remains, and the finalizer always runs last.
 *
 * <p>One sequencer serves one station. Each call to {@link #execute} gets
 * fresh {@link RunState}.
 */
public final class Sequencer {

    private static final Logger log = LoggerFactory.getLogger(Sequencer.class);

    private final InteractionChannel channel;
    private final SecretStore secrets;
    private final Clock clock;

    public Sequencer(InteractionChannel channel, SecretStore secrets) {
        this(channel, secrets, Clock.systemUTC());
    }

    public Sequencer(InteractionChannel channel, SecretStore secrets, Clock clock) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.secrets = Objects.requireNonNull(secrets, "secrets");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Run the plan to completion. Never throws for step or infrastructure
     * failures; they are reported in the result.
     */
    public RunResult execute(RunPlan plan) {
        String runId = UUID.randomUUID().toString();
        RunState state = RunState.fresh(runId);
        SequencerSettings settings = plan.settings();
        FaultLatch faults = new FaultLatch();
        Instant startedAt = clock.instant();

        log.info("Run {} starting: {} step(s), finalizer: {}", runId, plan.steps().size(),
            plan.finalizer() != null ? plan.finalizer().id() : "none");

        var records = new ArrayList<StepExecution>();
        StopReason stopReason = StopReason.COMPLETED;
        String skipReason = null;
        List<StepDefinition> steps = plan.steps();
        int next = 0;

        while (next < steps.size()) {
            StepDefinition definition = steps.get(next++);
            StepExecution record = invoke(definition, state, settings, faults);
            records.add(record);

            if (faults.tripped()) {
                stopReason = StopReason.INFRASTRUCTURE_ERROR;
                skipReason = "Run aborted: " + faults.get().getMessage();
                log.error("Run {} aborted during step '{}'", runId, definition.id(), faults.get());
                break;
            }
            if (record.outcome().isFailure() && record.stopOnFail()) {
                stopReason = StopReason.STOPPED_ON_FAILURE;
                skipReason = "Stopped after '" + record.displayName() + "' failed";
                log.info("Run {} stopping: step '{}' failed with stopOnFail", runId, definition.id());
                break;
            }
        }

        for (int i = next; i < steps.size(); i++) {
            StepDefinition skipped = steps.get(i);
            records.add(StepExecution.skipped(skipped.id(), skipped.metadata(), skipReason));
        }

        StepExecution finalizer = null;
        if (plan.finalizer() != null) {
            // Own latch: a finalizer abort is reported on its record, not as the run's stop reason
            finalizer = invoke(plan.finalizer(), state, settings, new FaultLatch());
        }

        Verdict verdict = verdict(records, finalizer, settings);
        RunResult result = new RunResult(runId, records, finalizer, verdict, stopReason,
            faults.get(), startedAt, clock.instant());
        log.info("Run {} finished: {} ({})", runId, verdict, stopReason);
        return result;
    }

    private StepExecution invoke(StepDefinition definition, RunState state, SequencerSettings settings,
                                 FaultLatch faults) {
        var stepLog = new StepLog(channel, clock);
        var context = new StepContext(definition.id(), definition.metadata(), state, channel, secrets,
            stepLog, settings.requestTimeout(), faults);

        boolean transportHealthy = channel.transportFailure().isEmpty();
        Instant started = clock.instant();
        log.info("Step '{}' starting", definition.id());
        StepOutcome outcome;
        try {
            Step step = definition.instantiate();
            StepResult result = step.run(context);
            outcome = result == null || result.passed()
                ? new StepOutcome.Passed()
                : new StepOutcome.Failed(result.detail() != null ? result.detail() : "Step reported failure");
        } catch (InfrastructureException e) {
            outcome = new StepOutcome.Aborted(faults.trip(e));
        } catch (Throwable e) {
            outcome = new StepOutcome.Errored(e);
        }

        if (transportHealthy) {
            // Failure while delivering this step's logs or prompts
            channel.transportFailure().ifPresent(faults::trip);
        }
        if (faults.tripped() && !(outcome instanceof StepOutcome.Aborted)) {
            // The step caught an infrastructure failure; it still ends the run
            outcome = new StepOutcome.Aborted(faults.get());
        }

        Instant finished = clock.instant();
        logOutcome(definition, outcome, Duration.between(started, finished));
        return new StepExecution(definition.id(), definition.metadata(), outcome, stepLog.lines(), started, finished);
    }

    private static Verdict verdict(List<StepExecution> records, StepExecution finalizer, SequencerSettings settings) {
        boolean failed = records.stream().anyMatch(r -> r.outcome().isFailure());
        if (settings.finalizerAffectsVerdict() && finalizer != null && finalizer.outcome().isFailure()) {
            failed = true;
        }
        return failed ? Verdict.FAILED : Verdict.PASSED;
    }

    private static void logOutcome(StepDefinition definition, StepOutcome outcome, Duration took) {
        if (outcome instanceof StepOutcome.Errored errored) {
            log.warn("Step '{}' errored after {} ms", definition.id(), took.toMillis(), errored.cause());
        } else if (outcome instanceof StepOutcome.Failed failed) {
            log.info("Step '{}' failed after {} ms: {}", definition.id(), took.toMillis(), failed.detail());
        } else if (outcome instanceof StepOutcome.Aborted aborted) {
            log.error("Step '{}' aborted after {} ms: {}", definition.id(), took.toMillis(),
                aborted.cause().getMessage());
        } else {
            log.info("Step '{}' {} in {} ms", definition.id(), outcome.tag(), took.toMillis());
        }
    }
}
