package dev.station.model;

/**
 * Failure in engine plumbing rather than in a step's own test logic:
 * console transport, response validation, cancellation, timeout, or an
 * unreachable secret store.
 *
 * Always aborts the remaining regular steps of a run; the finalizer still runs.
 */
public class InfrastructureException extends RuntimeException {

    public InfrastructureException(String message) {
        super(message);
    }

    public InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
