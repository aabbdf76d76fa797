package dev.station.model;

/**
 * Why the main step loop ended.
 */
public enum StopReason {
    /** Every step in the plan was executed. */
    COMPLETED,
    /** A failing step with stopOnFail halted the plan. */
    STOPPED_ON_FAILURE,
    /** Engine plumbing failed; remaining steps were skipped. */
    INFRASTRUCTURE_ERROR
}
