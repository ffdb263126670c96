package com.lodestar.core.fact;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Immutable, key-unique bundle of {@link Fact}s, in insertion order.
 * <p>
 * Nested groups are represented by fully-qualified keys joined with
 * {@link #SEPARATOR}, e.g. {@code repo.file_count}; {@link #group(String)}
 * recovers a group as its own bundle.
 */
public final class Facts implements FactView, Iterable<Fact> {

    public static final String SEPARATOR = ".";

    private static final Facts EMPTY = new Facts(Map.of());

    private final Map<String, Fact> byKey;

    private Facts(Map<String, Fact> byKey) {
        this.byKey = byKey;
    }

    public static Facts empty() {
        return EMPTY;
    }

    public static Facts of(Fact... facts) {
        return of(List.of(facts));
    }

    /**
     * @throws IllegalArgumentException if two facts share a key
     */
    public static Facts of(Collection<Fact> facts) {
        if (facts.isEmpty()) {
            return EMPTY;
        }
        var map = new LinkedHashMap<String, Fact>();
        for (Fact fact : facts) {
            if (map.putIfAbsent(fact.key(), fact) != null) {
                throw new IllegalArgumentException("Duplicate fact key: '" + fact.key() + "'");
            }
        }
        return new Facts(Collections.unmodifiableMap(map));
    }

    @Override
    public boolean contains(String key) {
        return byKey.containsKey(key);
    }

    @Override
    public Optional<Fact> get(String key) {
        return Optional.ofNullable(byKey.get(key));
    }

    @Override
    public Set<String> keys() {
        return byKey.keySet();
    }

    public int size() {
        return byKey.size();
    }

    public boolean isEmpty() {
        return byKey.isEmpty();
    }

    public Stream<Fact> stream() {
        return byKey.values().stream();
    }

    @Override
    public Iterator<Fact> iterator() {
        return byKey.values().iterator();
    }

    /**
     * Returns a bundle holding this bundle's facts overlaid with {@code other}'s;
     * on a shared key the fact from {@code other} wins.
     */
    public Facts merge(Facts other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        var map = new LinkedHashMap<>(byKey);
        other.byKey.forEach(map::put);
        return new Facts(Collections.unmodifiableMap(map));
    }

    /** Session and persistent facts only. */
    public Facts durable() {
        return filter(Fact::isDurable);
    }

    public Facts withScope(Scope scope) {
        return filter(f -> f.scope() == scope);
    }

    public Facts without(Scope scope) {
        return filter(f -> f.scope() != scope);
    }

    /**
     * Returns the facts below {@code prefix}, with the prefix and separator stripped from their keys.
     */
    public Facts group(String prefix) {
        String qualified = prefix + SEPARATOR;
        return of(byKey.values().stream()
                .filter(f -> f.key().startsWith(qualified))
                .map(f -> f.withKey(f.key().substring(qualified.length())))
                .toList());
    }

    public Facts filter(Predicate<Fact> predicate) {
        return of(byKey.values().stream().filter(predicate).toList());
    }

    @Override
    public Map<String, Object> asMap() {
        var out = new LinkedHashMap<String, Object>();
        byKey.forEach((k, f) -> out.put(k, f.value().unwrap()));
        return Collections.unmodifiableMap(out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Facts other)) return false;
        return byKey.equals(other.byKey);
    }

    @Override
    public int hashCode() {
        return byKey.hashCode();
    }

    @Override
    public String toString() {
        return "Facts" + byKey.values();
    }
}
