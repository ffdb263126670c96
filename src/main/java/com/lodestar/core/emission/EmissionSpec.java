package com.lodestar.core.emission;

import com.lodestar.core.fact.Fact;
import com.lodestar.core.fact.FactValue;
import com.lodestar.core.fact.Facts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Schema of the facts an action may emit, and the only way to construct them.
 * <p>
 * Each declared key maps either to an {@link Emission} or to a nested
 * EmissionSpec grouping related keys. {@link #build(Map)} turns raw values
 * into {@link Facts} whose scope and kind are taken from the declaration, so
 * the emitted facts cannot drift from what the spec validators checked.
 *
 * <pre>{@code
 * static final EmissionSpec EMITS = EmissionSpec.builder()
 *         .emit("plan", Emission.of(Scope.SESSION, FactKind.KNOWLEDGE))
 *         .emit("plan_ready", Emission.of(Scope.SESSION, FactKind.PROGRESS))
 *         .group("repo", EmissionSpec.builder()
 *                 .emit("file_count", Emission.of(Scope.SESSION, FactKind.KNOWLEDGE))
 *                 .build())
 *         .build();
 *
 * Facts facts = EMITS.build(Map.of(
 *         "plan", steps,
 *         "plan_ready", true,
 *         "repo", Map.of("file_count", 42)));
 * }</pre>
 */
public final class EmissionSpec {

    private static final EmissionSpec NONE = new EmissionSpec(Map.of());

    /** Each value is an {@link Emission} or a nested {@link EmissionSpec}. */
    private final Map<String, Object> nodes;
    private final Map<String, Emission> flattened;

    private EmissionSpec(Map<String, Object> nodes) {
        this.nodes = nodes;
        var flat = new LinkedHashMap<String, Emission>();
        flatten("", nodes, flat);
        this.flattened = Collections.unmodifiableMap(flat);
    }

    /** A spec for actions that emit nothing. */
    public static EmissionSpec none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds the facts for the supplied values.
     *
     * @param values key to raw value; values for group keys must be maps
     * @throws EmissionException if a key is undeclared, a required key is missing,
     *                           or a value cannot be represented as a fact value
     */
    public Facts build(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        var facts = new ArrayList<Fact>();
        collect("", nodes, values, facts);
        return Facts.of(facts);
    }

    public Facts build() {
        return build(Map.of());
    }

    public Facts build(String key, Object value) {
        var values = new LinkedHashMap<String, Object>();
        values.put(key, value);
        return build(values);
    }

    /**
     * Checks facts that were not produced by {@link #build} against this spec.
     *
     * @return one message per discrepancy; empty when the facts conform
     */
    public List<String> conformanceProblems(Facts facts) {
        var problems = new ArrayList<String>();
        for (Fact fact : facts) {
            Emission declared = flattened.get(fact.key());
            if (declared == null) {
                problems.add("emitted undeclared key '" + fact.key() + "'");
                continue;
            }
            if (declared.scope() != fact.scope()) {
                problems.add("key '" + fact.key() + "' declared with scope " + declared.scope().wireName()
                        + " but emitted with scope " + fact.scope().wireName());
            }
            if (declared.kind() != fact.kind()) {
                problems.add("key '" + fact.key() + "' declared as " + declared.kind()
                        + " but emitted as " + fact.kind());
            }
        }
        flattened.forEach((key, emission) -> {
            if (emission.required() && !facts.contains(key)) {
                problems.add("required key '" + key + "' was not emitted");
            }
        });
        return problems;
    }

    /**
     * Flattened view: fully-qualified key to its emission.
     */
    public Map<String, Emission> toMap() {
        return flattened;
    }

    public Set<String> keys() {
        return flattened.keySet();
    }

    public boolean contains(String key) {
        return flattened.containsKey(key);
    }

    /**
     * @return the emission for a fully-qualified key, or {@code null} if undeclared
     */
    public Emission get(String key) {
        return flattened.get(key);
    }

    public boolean isEmpty() {
        return flattened.isEmpty();
    }

    private static void collect(String prefix, Map<String, Object> declared, Map<String, ?> values, List<Fact> out) {
        for (String key : values.keySet()) {
            if (!declared.containsKey(key)) {
                throw new EmissionException(prefix + key,
                        "Undeclared emission key '" + prefix + key + "' (declared: " + declared.keySet() + ")");
            }
        }
        for (var entry : declared.entrySet()) {
            String key = entry.getKey();
            String qualified = prefix + key;
            boolean supplied = values.containsKey(key);
            Object node = entry.getValue();

            if (node instanceof EmissionSpec group) {
                if (!supplied) {
                    Optional<String> missing = group.firstRequiredKey();
                    if (missing.isPresent()) {
                        String missingKey = qualified + Facts.SEPARATOR + missing.get();
                        throw new EmissionException(missingKey, "Missing required emission key '" + missingKey + "'");
                    }
                    continue;
                }
                if (!(values.get(key) instanceof Map<?, ?> nested)) {
                    throw new EmissionException(qualified,
                            "Emission group '" + qualified + "' expects a map of values");
                }
                collect(qualified + Facts.SEPARATOR, group.nodes, asStringKeyed(qualified, nested), out);
                continue;
            }

            Emission emission = (Emission) node;
            if (!supplied) {
                if (emission.required()) {
                    throw new EmissionException(qualified, "Missing required emission key '" + qualified + "'");
                }
                continue;
            }
            FactValue value;
            try {
                value = FactValue.of(values.get(key));
            } catch (IllegalArgumentException e) {
                throw new EmissionException(qualified,
                        "Invalid value for emission key '" + qualified + "': " + e.getMessage(), e);
            }
            out.add(new Fact(qualified, value, emission.scope(), emission.kind()));
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> asStringKeyed(String qualified, Map<?, ?> map) {
        for (Object k : map.keySet()) {
            if (!(k instanceof String)) {
                throw new EmissionException(qualified, "Emission group '" + qualified + "' has a non-string key: " + k);
            }
        }
        return (Map<String, ?>) map;
    }

    private Optional<String> firstRequiredKey() {
        return flattened.entrySet().stream()
                .filter(e -> e.getValue().required())
                .map(Map.Entry::getKey)
                .findFirst();
    }

    private static void flatten(String prefix, Map<String, Object> nodes, Map<String, Emission> out) {
        nodes.forEach((key, node) -> {
            if (node instanceof EmissionSpec group) {
                flatten(prefix + key + Facts.SEPARATOR, group.nodes, out);
            } else {
                out.put(prefix + key, (Emission) node);
            }
        });
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmissionSpec other)) return false;
        return flattened.equals(other.flattened);
    }

    @Override
    public int hashCode() {
        return flattened.hashCode();
    }

    @Override
    public String toString() {
        return "EmissionSpec" + flattened;
    }

    public static final class Builder {

        private final Map<String, Object> nodes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder emit(String key, Emission emission) {
            return put(key, Objects.requireNonNull(emission, () -> "emission for '" + key + "'"));
        }

        public Builder group(String key, EmissionSpec group) {
            return put(key, Objects.requireNonNull(group, () -> "group '" + key + "'"));
        }

        private Builder put(String key, Object node) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("Emission keys must not be blank");
            }
            if (key.contains(Facts.SEPARATOR)) {
                throw new IllegalArgumentException(
                        "Emission key '" + key + "' must not contain '" + Facts.SEPARATOR + "'; use group() for nesting");
            }
            if (nodes.putIfAbsent(key, node) != null) {
                throw new IllegalArgumentException("Emission key '" + key + "' declared twice");
            }
            return this;
        }

        public EmissionSpec build() {
            return nodes.isEmpty() ? NONE : new EmissionSpec(Collections.unmodifiableMap(new LinkedHashMap<>(nodes)));
        }
    }
}
