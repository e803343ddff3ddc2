package com.shipwright.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for deployment events.
 * <p>
 * Every subscriber sees every event, in publish order, on the publishing thread.
 * A failing subscriber is logged and never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Consumer<DeploymentEvent>> subscribers = new CopyOnWriteArrayList<>();

    public void publish(DeploymentEvent event) {
        log.debug("Publishing {} for attempt {}", event.eventType(), event.attemptId());
        for (Consumer<DeploymentEvent> subscriber : subscribers) {
            deliver(subscriber, event);
        }
    }

    /**
     * Registers a subscriber for all events.
     *
     * @return a handle that removes the subscriber again
     */
    public Subscription subscribeAll(Consumer<DeploymentEvent> consumer) {
        subscribers.add(consumer);
        return () -> subscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static void deliver(Consumer<DeploymentEvent> subscriber, DeploymentEvent event) {
        try {
            subscriber.accept(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on {} for attempt {}: {}",
                    event.eventType(), event.attemptId(), e.getMessage(), e);
        }
    }
}
