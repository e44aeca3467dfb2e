package com.funnelforge.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-memory pub/sub event bus for engine events.
 * <p>
 * Subscribers either receive every event or only those whose type starts with a prefix
 * (e.g. {@code "task."}). Thread-safe for concurrent publish and subscribe.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Registration> subscribers = new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers.
     *
     * @param event the event to publish
     */
    public void publish(FunnelEvent event) {
        log.debug("Publishing event: {} for {}", event.eventType(), event.subjectId());
        for (Registration registration : subscribers) {
            if (registration.filter().test(event)) {
                deliverSafely(registration.consumer(), event);
            }
        }
    }

    /**
     * Subscribe to events whose type starts with the given prefix.
     *
     * @param typePrefix event type prefix, e.g. "spend."
     * @param consumer   callback invoked for each matching event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String typePrefix, Consumer<FunnelEvent> consumer) {
        return register(new Registration(e -> e.eventType().startsWith(typePrefix), consumer));
    }

    /**
     * Subscribe to every event.
     *
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<FunnelEvent> consumer) {
        return register(new Registration(e -> true, consumer));
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription register(Registration registration) {
        subscribers.add(registration);
        log.debug("Subscriber registered ({} total)", subscribers.size());
        return () -> subscribers.remove(registration);
    }

    private void deliverSafely(Consumer<FunnelEvent> subscriber, FunnelEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }

    private record Registration(Predicate<FunnelEvent> filter, Consumer<FunnelEvent> consumer) {}
}
