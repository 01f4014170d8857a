package org.terminalheist.game.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Synchronous fan-out of {@link GameEvent}s to listeners, in subscription order.
 * <p>
 * Events are delivered on the caller's thread before the publishing step returns. A listener
 * that throws is logged and skipped; the simulation step carries on.
 */
public final class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final List<GameEventListener> listeners = new ArrayList<>();

    public void publish(GameEvent event) {
        Objects.requireNonNull(event, "event");
        log.trace("Publishing {}", event);

        for (GameEventListener listener : List.copyOf(listeners)) {
            deliverSafely(listener, event);
        }
    }

    /**
     * @return a handle that removes the listener again
     */
    public Subscription subscribe(GameEventListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(GameEventListener listener, GameEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("Listener threw while handling {}: {}", event.getClass().getSimpleName(), e.getMessage(), e);
        }
    }
}
