package dev.station.interaction;

import dev.station.model.InfrastructureException;

/**
 * An operator response did not fit the request it answered.
 */
public class ResponseValidationException extends InfrastructureException {

    private final String requestId;

    public ResponseValidationException(String requestId, String message) {
        super("Invalid response to " + requestId + ": " + message);
        this.requestId = requestId;
    }

    public String getRequestId() { return requestId; }
}
