package dev.station.secret;

import dev.station.model.InfrastructureException;

public class SecretStoreUnavailableException extends InfrastructureException {

    public SecretStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
