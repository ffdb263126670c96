package com.lodestar.core.persistence;

import com.lodestar.core.fact.Facts;
import com.lodestar.core.fact.Scope;
import com.lodestar.core.state.IterationFacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link StateStore} held in process memory. Suitable for development and
 * tests; state is lost on restart.
 * <p>
 * Session mutations run inside {@link ConcurrentHashMap#compute}, which
 * serializes writers per key; the agent's persistent facts are updated from
 * within the same computation.
 */
public class InMemoryStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStateStore.class);

    private record Session(Facts facts, List<IterationFacts> history) {}

    private final Map<SessionKey, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, Facts> persistent = new ConcurrentHashMap<>();

    @Override
    public boolean bootstrap(SessionKey key, Facts seed) {
        Facts durable = StateStore.requireDurable(seed);
        boolean[] created = {false};
        sessions.computeIfAbsent(key, k -> {
            created[0] = true;
            persistent.merge(k.agentId(), durable.withScope(Scope.PERSISTENT), (current, seeded) -> seeded.merge(current));
            return new Session(StateStore.sessionPart(durable), List.of());
        });
        if (created[0]) {
            log.debug("Bootstrapped session {} with {} seed facts", key, durable.size());
        }
        return created[0];
    }

    @Override
    public boolean exists(SessionKey key) {
        return sessions.containsKey(key);
    }

    @Override
    public Facts load(SessionKey key) {
        Session session = sessions.get(key);
        return StateStore.overlay(loadPersistent(key.agentId()), session != null ? session.facts() : Facts.empty());
    }

    @Override
    public Facts loadPersistent(String agentId) {
        return persistent.getOrDefault(agentId, Facts.empty());
    }

    @Override
    public void save(SessionKey key, IterationFacts record, Facts durable) {
        StateStore.requireDurable(durable);
        sessions.compute(key, (k, session) -> {
            List<IterationFacts> history = session != null ? session.history() : List.of();
            StateStore.requireNextIteration(key, history, record);
            var appended = new ArrayList<>(history);
            appended.add(record.withoutPhaseIdentity());
            persistent.merge(k.agentId(), durable.withScope(Scope.PERSISTENT), Facts::merge);
            return new Session(StateStore.sessionPart(durable), List.copyOf(appended));
        });
        log.debug("Saved iteration {} of {} ({} durable facts)", record.iteration(), key, durable.size());
    }

    @Override
    public List<IterationFacts> history(SessionKey key) {
        Session session = sessions.get(key);
        return session != null ? session.history() : List.of();
    }

    @Override
    public List<String> sessions(String agentId) {
        StateStore.requireAgentId(agentId);
        return sessions.keySet().stream()
                .filter(k -> k.agentId().equals(agentId))
                .map(SessionKey::sessionId)
                .sorted()
                .toList();
    }

    @Override
    public void clearScope(SessionKey key, Scope scope) {
        StateStore.requireDurableScope(scope);
        if (scope == Scope.PERSISTENT) {
            persistent.remove(key.agentId());
        } else {
            sessions.computeIfPresent(key, (k, session) ->
                    new Session(session.facts().without(scope), session.history()));
        }
        log.debug("Cleared {} facts of {}", scope.wireName(), key);
    }
}
