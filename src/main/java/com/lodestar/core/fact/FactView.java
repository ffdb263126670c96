package com.lodestar.core.fact;

import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only view over a set of facts, as handed to actions.
 */
public interface FactView {

    boolean contains(String key);

    Optional<Fact> get(String key);

    Set<String> keys();

    /**
     * Returns the value of a fact that must be present.
     *
     * @throws NoSuchElementException if no fact has this key
     */
    default FactValue value(String key) {
        return get(key).map(Fact::value)
                .orElseThrow(() -> new NoSuchElementException("No fact with key '" + key + "'"));
    }

    default Optional<FactValue> find(String key) {
        return get(key).map(Fact::value);
    }

    /**
     * Plain-value projection, keyed by fully-qualified key.
     */
    Map<String, Object> asMap();
}
