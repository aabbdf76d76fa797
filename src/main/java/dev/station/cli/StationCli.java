package dev.station.cli;

import dev.station.engine.RunPlan;
import dev.station.engine.RunPlanLoader;
import dev.station.engine.RunPlanValidator;
import dev.station.engine.RunSummary;
import dev.station.engine.Sequencer;
import dev.station.engine.StepDefinition;
import dev.station.engine.StepRegistry;
import dev.station.interaction.JsonLinesConsole;
import dev.station.interaction.QueuedInteractionChannel;
import dev.station.model.LogLine;
import dev.station.model.PlanDeclaration;
import dev.station.model.RunResult;
import dev.station.model.SequencerSettings;
import dev.station.model.StepExecution;
import dev.station.report.RunReportWriter;
import dev.station.secret.CompositeSecretStore;
import dev.station.secret.FileSecretStore;
import dev.station.secret.MapSecretStore;
import dev.station.secret.SecretStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for a factory test station. The operator console speaks
 * JSON lines on stdin/stdout while a plan runs; diagnostics go to stderr.
 */
@Command(
    name = "station",
    mixinStandardHelpOptions = true,
    description = "Run a factory acceptance-test plan against a device under test."
)
public class StationCli implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(StationCli.class);

    static final int EXIT_PASSED = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_INVALID = 2;
    static final int EXIT_ABORTED = 3;

    @Spec
    private CommandSpec spec;

    @Option(names = "--plan", description = "Run plan JSON file")
    private Path plan;

    @Option(names = "--list", description = "List all registered steps")
    private boolean list;

    @Option(names = "--dry-run", description = "Print plan structure without executing")
    private boolean dryRun;

    @Option(names = "--secret", paramLabel = "NAME=VALUE",
        description = "Developer secret override; may be repeated")
    private List<String> secretOverrides = new ArrayList<>();

    @Option(names = "--secrets-file", description = "JSON file of secrets, consulted after --secret overrides")
    private Path secretsFile;

    @Option(names = "--request-timeout", paramLabel = "SECONDS",
        description = "Override how long a prompt waits for the operator (default: forever)")
    private Double requestTimeoutSeconds;

    @Option(names = "--finalizer-affects-verdict", arity = "0..1", description = "Fail the run when the finalizer fails")
    private Boolean finalizerAffectsVerdict;

    @Option(names = "--report", description = "Write the JSON run report to this file")
    private Path report;

    @Option(names = "--verbose", description = "Include captured step output in the summary")
    private boolean verbose;

    private final StepRegistry registry;
    private final InputStream consoleIn;
    private final OutputStream consoleOut;

    public StationCli() {
        this(StepCatalog.loadRegistry(), System.in, System.out);
    }

    public StationCli(StepRegistry registry, InputStream consoleIn, OutputStream consoleOut) {
        this.registry = registry;
        this.consoleIn = consoleIn;
        this.consoleOut = consoleOut;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (list) {
            out.println("Registered steps:");
            for (StepDefinition definition : registry.definitions()) {
                out.printf("  %-32s %s%n", definition.id(), definition.metadata().displayName());
            }
            out.flush();
            return EXIT_PASSED;
        }

        if (plan == null) {
            err.println("Error: --plan is required. Use --list to see registered steps.");
            return EXIT_INVALID;
        }

        PlanDeclaration declaration;
        try {
            declaration = withOverrides(RunPlanLoader.loadFromFile(plan));
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: cannot load plan " + plan + ": " + e.getMessage());
            return EXIT_INVALID;
        }

        List<String> errors = RunPlanValidator.validate(declaration, registry);
        if (!errors.isEmpty()) {
            err.println("Invalid plan " + plan + ":");
            errors.forEach(e -> err.println("  - " + e));
            return EXIT_INVALID;
        }
        RunPlan runPlan = registry.resolve(declaration);

        if (dryRun) {
            printPlan(out, runPlan);
            return EXIT_PASSED;
        }

        SecretStore secrets;
        try {
            secrets = secretStore();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_INVALID;
        }

        RunResult result;
        var channel = new QueuedInteractionChannel();
        try (var console = new JsonLinesConsole(channel, consoleIn, consoleOut)) {
            console.start();
            result = new Sequencer(channel, secrets).execute(runPlan);
        }

        err.print(RunSummary.render(result));
        if (verbose) {
            printLogs(err, result);
        }
        err.flush();

        if (report != null) {
            try {
                RunReportWriter.write(result, report);
            } catch (IOException e) {
                log.error("Cannot write run report to {}", report, e);
            }
        }
        return exitCode(result);
    }

    static int exitCode(RunResult result) {
        if (result.aborted()) {
            return EXIT_ABORTED;
        }
        return result.passed() ? EXIT_PASSED : EXIT_FAILED;
    }

    private PlanDeclaration withOverrides(PlanDeclaration declaration) {
        SequencerSettings settings = declaration.settings();
        if (requestTimeoutSeconds != null) {
            settings = settings.withRequestTimeout(Duration.ofMillis(Math.round(requestTimeoutSeconds * 1000)));
        }
        if (finalizerAffectsVerdict != null) {
            settings = settings.withFinalizerAffectsVerdict(finalizerAffectsVerdict);
        }
        return new PlanDeclaration(declaration.stepIds(), declaration.finalizerId(), settings);
    }

    private SecretStore secretStore() {
        SecretStore overrides = MapSecretStore.fromOverrides(secretOverrides);
        if (secretsFile == null) {
            return overrides;
        }
        return new CompositeSecretStore(List.of(overrides, new FileSecretStore(secretsFile)));
    }

    private static void printPlan(PrintWriter out, RunPlan runPlan) {
        out.println("Plan: " + runPlan.steps().size() + " step(s)");
        int index = 1;
        for (StepDefinition step : runPlan.steps()) {
            out.printf("%3d. %s [%s]%s%n", index++, step.metadata().displayName(), step.id(),
                step.metadata().stopOnFail() ? "" : " (continues on failure)");
        }
        if (runPlan.finalizer() != null) {
            out.printf("  F. %s [%s]%n", runPlan.finalizer().metadata().displayName(), runPlan.finalizer().id());
        }
        Duration timeout = runPlan.settings().requestTimeout();
        out.println("Request timeout: " + (timeout == null ? "none" : timeout.toString()));
        out.println("Finalizer affects verdict: " + runPlan.settings().finalizerAffectsVerdict());
        out.flush();
    }

    private static void printLogs(PrintWriter err, RunResult result) {
        List<StepExecution> all = new ArrayList<>(result.steps());
        if (result.finalizer() != null) {
            all.add(result.finalizer());
        }
        for (StepExecution step : all) {
            if (step.logs().isEmpty()) {
                continue;
            }
            err.println("--- " + step.displayName());
            for (LogLine line : step.logs()) {
                err.println("[" + line.stream().wireName() + "] " + line.text());
            }
        }
    }
}
