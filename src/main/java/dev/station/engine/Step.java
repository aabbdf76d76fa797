package dev.station.engine;

/**
 * A unit of test logic run against the device under test.
 *
 * <p>Return {@link StepResult#fail(String)} to fail explicitly. Returning
 * {@link StepResult#pass()} or null counts as a pass. Any exception thrown
 * marks the step errored.
 */
@FunctionalInterface
public interface Step {

    StepResult run(StepContext context) throws Exception;
}
