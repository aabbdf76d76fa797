package dev.station.cli;

import dev.station.engine.StepDefinition;
import dev.station.engine.StepRegistry;
import dev.station.engine.StepResult;

/**
 * Small demo station used by the CLI tests and discovered through the
 * service registration under src/test/resources.
 */
public class DemoStepCatalog implements StepCatalog {

    static final String STATE_KEY = "Foo";

    @Override
    public void register(StepRegistry registry) {
        registry
            .register("EmptyStep", () -> ctx -> null)
            .register(StepDefinition.builder("StepWithDisplayName", () -> ctx -> {
                    ctx.log("Hello from a named step");
                    return StepResult.pass();
                })
                .displayName("Step with a display name")
                .link("https://example.com/docs/named-step", "Step docs")
                .build())
            .register("StepThatSetsState", () -> ctx -> {
                ctx.state().set(STATE_KEY, "Bar");
                return StepResult.pass();
            })
            .register("StepThatReadsState", () -> ctx ->
                StepResult.check("Bar".equals(ctx.state().get(STATE_KEY).orElse(null)), "State was not set"))
            .register(StepDefinition.builder("StepThatCanFail", () -> ctx -> {
                    ctx.logError("Simulated fault");
                    return StepResult.fail("Simulated fault");
                })
                .stopOnFail(false)
                .build())
            .register("StepThatNeedsSecret", () -> ctx -> {
                ctx.log("Token length " + ctx.secret("DUT_TOKEN").length());
                return StepResult.pass();
            })
            .register("AskOperator", () -> ctx -> ctx.presentPassFail("Is the LED green?") ? StepResult.pass()
                : StepResult.fail("Operator saw no LED"))
            .register("Shutdown", () -> ctx -> {
                ctx.log("Powering down");
                return StepResult.pass();
            });
    }
}
