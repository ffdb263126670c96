package com.lodestar.core.events;

import com.lodestar.core.persistence.SessionKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe for iteration events.
 * <p>
 * Subscribers either follow one session, optionally limited to some event
 * types, or receive every event. Delivery is synchronous on the publishing
 * thread; a subscriber that throws is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private record Listener(Set<LodestarEvent.Type> types, Consumer<LodestarEvent> consumer) {
        boolean accepts(LodestarEvent event) {
            return types.contains(event.type());
        }
    }

    private final ConcurrentHashMap<SessionKey, List<Listener>> sessionListeners = new ConcurrentHashMap<>();
    private final List<Listener> globalListeners = new CopyOnWriteArrayList<>();

    public void publish(LodestarEvent event) {
        log.debug("Publishing {} for {} iteration {}", event.type().wireName(), event.session(), event.iteration());
        List<Listener> listeners = sessionListeners.get(event.session());
        if (listeners != null) {
            listeners.forEach(listener -> deliver(listener, event));
        }
        globalListeners.forEach(listener -> deliver(listener, event));
    }

    public Subscription subscribe(SessionKey session, Consumer<LodestarEvent> consumer) {
        return subscribe(session, EnumSet.allOf(LodestarEvent.Type.class), consumer);
    }

    /**
     * Follows one session, receiving only events of the given types.
     */
    public Subscription subscribe(SessionKey session, Set<LodestarEvent.Type> types, Consumer<LodestarEvent> consumer) {
        var listener = new Listener(EnumSet.copyOf(types), consumer);
        sessionListeners.compute(session, (k, listeners) -> {
            List<Listener> updated = listeners != null ? listeners : new CopyOnWriteArrayList<>();
            updated.add(listener);
            return updated;
        });
        log.debug("Subscribed to {} events of {}", types.size(), session);
        return () -> sessionListeners.computeIfPresent(session, (k, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    /**
     * Receives every event of every session.
     */
    public Subscription subscribeAll(Consumer<LodestarEvent> consumer) {
        var listener = new Listener(EnumSet.allOf(LodestarEvent.Type.class), consumer);
        globalListeners.add(listener);
        return () -> globalListeners.remove(listener);
    }

    /** Number of sessions with at least one subscriber. */
    public int followedSessions() {
        return sessionListeners.size();
    }

    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }

    private void deliver(Listener listener, LodestarEvent event) {
        if (!listener.accepts(event)) {
            return;
        }
        try {
            listener.consumer().accept(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on {} for {}: {}", event.type().wireName(), event.session(), e.getMessage(), e);
        }
    }
}
