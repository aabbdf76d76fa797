package dev.station.secret;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Secrets read from a JSON object file of name to string value, loaded on first use.
 */
public final class FileSecretStore implements SecretStore {

    private static final Logger log = LoggerFactory.getLogger(FileSecretStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path path;
    private Map<String, String> secrets;

    public FileSecretStore(Path path) {
        this.path = path;
    }

    @Override
    public synchronized String get(String name) {
        if (secrets == null) {
            secrets = load();
        }
        String value = secrets.get(name);
        if (value == null) {
            throw new SecretNotFoundException(name);
        }
        return value;
    }

    private Map<String, String> load() {
        JsonNode root;
        try {
            root = MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new SecretStoreUnavailableException("Cannot read secrets file " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new SecretStoreUnavailableException("Secrets file " + path + " is not a JSON object", null);
        }
        var loaded = new HashMap<String, String>();
        for (var entry : root.properties()) {
            if (!entry.getValue().isTextual()) {
                throw new SecretStoreUnavailableException(
                    "Secret '%s' in %s is not a string".formatted(entry.getKey(), path), null);
            }
            loaded.put(entry.getKey(), entry.getValue().asText());
        }
        log.info("Loaded {} secret(s) from {}", loaded.size(), path);
        return loaded;
    }
}
