package dev.station.secret;

import java.util.List;

/**
 * Consults stores in order; the first that declares a name wins.
 * Typically the developer override table followed by the keystore.
 */
public final class CompositeSecretStore implements SecretStore {

    private final List<SecretStore> stores;

    public CompositeSecretStore(List<SecretStore> stores) {
        this.stores = List.copyOf(stores);
    }

    @Override
    public String get(String name) {
        for (SecretStore store : stores) {
            try {
                return store.get(name);
            } catch (SecretNotFoundException e) {
                // try the next store
            }
        }
        throw new SecretNotFoundException(name);
    }
}
