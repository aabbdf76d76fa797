package dev.station.interaction;

import dev.station.model.InfrastructureException;

import java.time.Duration;

public class InteractionTimeoutException extends InfrastructureException {

    public InteractionTimeoutException(String requestId, Duration timeout) {
        super("No operator response to " + requestId + " within " + timeout);
    }
}
