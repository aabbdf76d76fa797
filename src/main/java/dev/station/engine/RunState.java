package dev.station.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable key/value state shared by every step of one run.
 *
 * <p>Created empty when the run starts and handed by reference to each step
 * and the finalizer. Never shared between runs. Not thread-safe: steps of a
 * run execute one at a time.
 */
public final class RunState {
    private final String runId;
    private final Map<String, Object> values;

    public RunState(String runId) {
        this.runId = runId;
        this.values = new LinkedHashMap<>();
    }

    public String runId() { return runId; }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Typed lookup for a key an earlier step must have set.
     *
     * @throws NoSuchElementException if the key is absent
     * @throws ClassCastException     if the value has another type
     */
    public <T> T require(String key, Class<T> type) {
        Object value = values.get(key);
        if (value == null) {
            throw new NoSuchElementException("Run state has no value for '" + key + "'");
        }
        return type.cast(value);
    }

    /** Setting null removes the key. */
    public void set(String key, Object value) {
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public Object remove(String key) {
        return values.remove(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    /** Copy of the current contents, in insertion order. */
    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Create empty state for a new run.
     */
    public static RunState fresh(String runId) {
        return new RunState(runId);
    }
}
