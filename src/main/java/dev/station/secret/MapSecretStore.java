package dev.station.secret;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Developer override table: secrets given literally, e.g. {@code --secret FOO=BAR}.
 */
public final class MapSecretStore implements SecretStore {

    private final Map<String, String> secrets;

    public MapSecretStore(Map<String, String> secrets) {
        this.secrets = Map.copyOf(secrets);
    }

    /**
     * Build a store from {@code NAME=VALUE} overrides. The value may itself contain '='.
     *
     * @throws IllegalArgumentException on an entry without '=' or with an empty name
     */
    public static MapSecretStore fromOverrides(List<String> overrides) {
        var secrets = new LinkedHashMap<String, String>();
        for (String override : overrides) {
            int eq = override.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Secret override must be NAME=VALUE: " + override);
            }
            secrets.put(override.substring(0, eq), override.substring(eq + 1));
        }
        return new MapSecretStore(secrets);
    }

    @Override
    public String get(String name) {
        String value = secrets.get(name);
        if (value == null) {
            throw new SecretNotFoundException(name);
        }
        return value;
    }

    public int size() { return secrets.size(); }
}
