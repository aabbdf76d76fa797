package dev.station.engine;

/**
 * Explicit pass/fail signal returned by {@link Step#run}.
 */
public record StepResult(boolean passed, String detail) {

    private static final StepResult PASS = new StepResult(true, null);

    public static StepResult pass() {
        return PASS;
    }

    public static StepResult fail(String detail) {
        return new StepResult(false, detail);
    }

    /** Pass when the condition holds, otherwise fail with the given detail. */
    public static StepResult check(boolean condition, String failureDetail) {
        return condition ? PASS : fail(failureDetail);
    }
}
