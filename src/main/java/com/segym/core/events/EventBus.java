package com.segym.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Routes repair-loop events to the listeners of their run.
 * <p>
 * A run's entry exists only while it has listeners; the last unsubscribe removes it, so a
 * long-lived process that starts many runs does not accumulate them.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, List<Consumer<SegymEvent>>> listeners = new ConcurrentHashMap<>();

    /** Delivers {@code event} to the listeners of its run; a failing listener is logged and skipped. */
    public void publish(SegymEvent event) {
        List<Consumer<SegymEvent>> runListeners = listeners.get(event.runId());
        if (runListeners == null) {
            log.trace("No listeners for {} of run {}", event.eventType(), event.runId());
            return;
        }
        for (Consumer<SegymEvent> listener : runListeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener of run {} failed on {}: {}", event.runId(), event.eventType(), e.getMessage(), e);
            }
        }
    }

    /**
     * @return handle that detaches {@code listener}; calling it more than once is harmless
     */
    public Subscription subscribe(String runId, Consumer<SegymEvent> listener) {
        listeners.compute(runId, (k, runListeners) -> {
            var updated = runListeners != null ? runListeners : new CopyOnWriteArrayList<Consumer<SegymEvent>>();
            updated.add(listener);
            return updated;
        });
        log.debug("Listening to run {}", runId);
        return () -> listeners.computeIfPresent(runId, (k, runListeners) -> {
            runListeners.remove(listener);
            return runListeners.isEmpty() ? null : runListeners;
        });
    }

    boolean hasSubscribers(String runId) {
        return listeners.containsKey(runId);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
