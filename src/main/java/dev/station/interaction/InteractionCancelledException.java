package dev.station.interaction;

import dev.station.model.InfrastructureException;

/**
 * A pending request was torn down before the operator answered: the channel
 * closed, the operator disconnected, or the waiting thread was interrupted.
 */
public class InteractionCancelledException extends InfrastructureException {

    public InteractionCancelledException(String message) {
        super(message);
    }

    public InteractionCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
