package com.lodestar.core.persistence;

import com.lodestar.core.fact.Fact;
import com.lodestar.core.fact.Facts;
import com.lodestar.core.fact.Scope;
import com.lodestar.core.state.IterationFacts;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Durable storage for agent sessions.
 * <p>
 * Each {@link SessionKey} owns a current-state record holding its
 * session-scoped facts, overwritten on every save, and an append-only history
 * of {@link IterationFacts}. Persistent facts are kept once per agent and are
 * seen by every session of that agent, including sessions started later.
 * {@link #load} overlays the session's facts on the agent's persistent facts.
 * <p>
 * Iteration-scoped facts are never accepted. Implementations must make
 * {@link #save} atomic per key and must propagate failures as
 * {@link StateStoreException}.
 */
public interface StateStore {

    /**
     * Creates the session with the given seed facts, unless it already exists.
     * Persistent seed facts are added to the agent's persistent facts where
     * the agent has no fact of that key yet.
     *
     * @return {@code true} if the session was created, {@code false} if it already existed
     * @throws IllegalArgumentException if the seed holds iteration-scoped facts
     */
    boolean bootstrap(SessionKey key, Facts seed);

    boolean exists(SessionKey key);

    /**
     * @return the agent's persistent facts overlaid with the session's facts;
     *         only the persistent facts for an unknown session
     */
    Facts load(SessionKey key);

    /**
     * @return the persistent facts shared by every session of the agent
     */
    Facts loadPersistent(String agentId);

    /**
     * Replaces the session's facts, merges its persistent facts into the
     * agent's and appends one history record, atomically.
     *
     * @throws IllegalArgumentException if {@code durable} holds iteration-scoped facts
     * @throws StateStoreException      if the record does not follow the latest stored iteration
     */
    void save(SessionKey key, IterationFacts record, Facts durable);

    /**
     * @return the session's history, oldest first; phase identities are not restored
     */
    List<IterationFacts> history(SessionKey key);

    /**
     * @return session ids stored for the agent, sorted
     * @throws IllegalArgumentException if the agent id is invalid
     */
    List<String> sessions(String agentId);

    /**
     * Removes every durable fact of the given scope. Session facts are removed
     * from this session only; persistent facts are removed from the agent, and
     * so from all of its sessions. History is untouched.
     */
    void clearScope(SessionKey key, Scope scope);

    static Facts requireDurable(Facts facts) {
        Facts iterationScoped = facts.withScope(Scope.ITERATION);
        if (!iterationScoped.isEmpty()) {
            throw new IllegalArgumentException("Iteration-scoped facts cannot be persisted: "
                    + iterationScoped.stream().map(Fact::key).collect(Collectors.joining(", ")));
        }
        return facts;
    }

    /** The part of a durable fact set stored with the session itself. */
    static Facts sessionPart(Facts durable) {
        return durable.withScope(Scope.SESSION);
    }

    /** What {@link #load} returns: persistent facts, with session facts winning on a shared key. */
    static Facts overlay(Facts persistent, Facts session) {
        return persistent.merge(session);
    }

    static String requireAgentId(String agentId) {
        if (!SessionKey.isValidId(agentId)) {
            throw new IllegalArgumentException("Invalid agentId '" + agentId + "': must match [A-Za-z0-9._-]+");
        }
        return agentId;
    }

    static void requireDurableScope(Scope scope) {
        if (!scope.isDurable()) {
            throw new IllegalArgumentException("Only session or persistent facts are stored, not " + scope.wireName());
        }
    }

    static void requireNextIteration(SessionKey key, List<IterationFacts> history, IterationFacts record) {
        int latest = history.isEmpty() ? 0 : history.get(history.size() - 1).iteration();
        if (record.iteration() <= latest) {
            throw new StateStoreException("History of " + key + " is append-only: iteration "
                    + record.iteration() + " does not follow " + latest);
        }
    }
}
