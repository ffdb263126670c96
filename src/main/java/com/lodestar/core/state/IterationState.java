package com.lodestar.core.state;

import com.lodestar.core.fact.Fact;
import com.lodestar.core.fact.FactView;
import com.lodestar.core.fact.Facts;
import com.lodestar.core.fact.Scope;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Working state of one iteration: the durable facts loaded at its start plus
 * every fact emitted so far, applied eagerly after each action.
 * <p>
 * Durable and iteration-scoped facts are kept apart. An iteration-scoped fact
 * shadows a durable fact of the same key for reads only; the durable fact is
 * still persisted. Of two emissions of one key, the later one is read.
 */
public final class IterationState implements FactView {

    private Facts durable;
    private Facts iteration = Facts.empty();
    private Facts emitted = Facts.empty();
    private Facts merged;

    public IterationState(Facts durableAtStart) {
        this.durable = Objects.requireNonNull(durableAtStart, "durableAtStart").durable();
        this.merged = this.durable;
    }

    /**
     * Applies one action's output. A key emitted again later in the iteration overrides the earlier value.
     */
    public void apply(Facts facts) {
        emitted = emitted.merge(facts);
        Facts durableOut = facts.durable();
        iteration = iteration.filter(f -> !durableOut.contains(f.key()))
                .merge(facts.withScope(Scope.ITERATION));
        durable = durable.merge(durableOut);
        merged = durable.merge(iteration);
    }

    /** Immutable view of the state as it stands now; later {@link #apply} calls do not affect it. */
    public FactView snapshot() {
        return merged;
    }

    /** Facts emitted during this iteration only. */
    public Facts emitted() {
        return emitted;
    }

    /** What would be persisted if the iteration ended now. */
    public Facts durableFacts() {
        return durable;
    }

    @Override
    public boolean contains(String key) {
        return merged.contains(key);
    }

    @Override
    public Optional<Fact> get(String key) {
        return merged.get(key);
    }

    @Override
    public Set<String> keys() {
        return merged.keys();
    }

    @Override
    public Map<String, Object> asMap() {
        return merged.asMap();
    }
}
