package com.ailab.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous in-process fan-out of {@link EnvironmentEvent}s to every subscriber,
 * in subscription order, on the publishing thread.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Consumer<EnvironmentEvent>> subscribers = new CopyOnWriteArrayList<>();

    /**
     * Delivers {@code event} to each subscriber. A subscriber that throws is logged and skipped.
     */
    public void publish(EnvironmentEvent event) {
        log.debug("Event {} for {}", event.eventType(), event.envId() != null ? event.envId() : "(pass)");
        for (Consumer<EnvironmentEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                log.warn("Subscriber failed on {} for {}: {}", event.eventType(), event.envId(), e.getMessage(), e);
            }
        }
    }

    public Subscription subscribe(Consumer<EnvironmentEvent> consumer) {
        subscribers.add(consumer);
        return () -> subscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
