package dev.station.secret;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup of named secrets for the current run.
 */
public interface SecretStore {

    /**
     * @throws SecretNotFoundException        if the secret is not declared for this run
     * @throws SecretStoreUnavailableException if the backing store cannot be read
     */
    String get(String name);

    default Optional<String> find(String name) {
        try {
            return Optional.of(get(name));
        } catch (SecretNotFoundException e) {
            return Optional.empty();
        }
    }

    static SecretStore empty() {
        return new MapSecretStore(Map.of());
    }
}
