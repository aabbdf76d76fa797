package dev.station.interaction;

import dev.station.model.InfrastructureException;

/**
 * The console transport failed to carry a message.
 */
public class InteractionTransportException extends InfrastructureException {

    public InteractionTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
