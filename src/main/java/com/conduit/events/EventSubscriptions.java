package com.conduit.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Subscription registry for in-process event handlers, keyed by owner.
 *
 * An owner is one started instance of an extension, so a replacement instance under
 * the same extension id never shares handlers with the instance it supersedes.
 * <p>
 * Handlers subscribe with a pattern understood by {@link EventPatterns}. The registry
 * only stores and matches; invoking handlers is left to the caller so that each
 * delivery can be isolated.
 */
public class EventSubscriptions {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventSubscriptions.class);

    private static final int WARN_LISTENERS_PER_OWNER = 500;

    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Subscribes a handler on behalf of an owner.
     *
     * @param ownerId the owner of the subscription
     * @param pattern the event pattern
     * @param handler the handler to invoke for matching events
     * @return a handle that removes exactly this subscription
     */
    public Subscription subscribe(String ownerId, String pattern, EventHandler handler) {
        Objects.requireNonNull(ownerId, "ownerId");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(handler, "handler");

        Listener listener = new Listener(ownerId, pattern, handler);
        listeners.add(listener);

        long ownerCount = listeners.stream().filter(l -> l.ownerId.equals(ownerId)).count();
        if (ownerCount > WARN_LISTENERS_PER_OWNER) {
            LOGGER.warn("Extension '{}' has {} event handlers (exceeds recommended limit of {})",
                ownerId, ownerCount, WARN_LISTENERS_PER_OWNER);
        }

        LOGGER.debug("Extension '{}' subscribed to '{}'", ownerId, pattern);
        return () -> {
            if (listeners.remove(listener)) {
                LOGGER.debug("Extension '{}' unsubscribed from '{}'", ownerId, pattern);
            }
        };
    }

    /**
     * Removes every handler registered by an owner.
     */
    public void removeOwner(String ownerId) {
        listeners.removeIf(listener -> listener.ownerId.equals(ownerId));
        LOGGER.debug("Removed all event handlers for extension '{}'", ownerId);
    }

    /**
     * Collects an owner's handlers whose pattern matches the event type, in registration order.
     *
     * @param ownerId the owner whose handlers are considered
     * @param eventType the event type
     * @return matching deliveries
     */
    public List<Delivery> match(String ownerId, String eventType) {
        List<Delivery> matches = new ArrayList<>();
        for (Listener listener : listeners) {
            if (listener.ownerId.equals(ownerId) && EventPatterns.matches(eventType, listener.pattern)) {
                matches.add(new Delivery(listener.ownerId, listener.pattern, listener.handler));
            }
        }
        return matches;
    }

    /**
     * Gets the number of handlers registered by an owner.
     */
    public int countFor(String ownerId) {
        return (int) listeners.stream().filter(l -> l.ownerId.equals(ownerId)).count();
    }

    public int size() {
        return listeners.size();
    }

    /**
     * Callback invoked for a matching event.
     */
    @FunctionalInterface
    public interface EventHandler {
        void handle(GatewayEvent event) throws Exception;
    }

    /**
     * Removes a single subscription. Calling it more than once is harmless.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    /**
     * A handler selected for delivery of one event.
     */
    public record Delivery(String ownerId, String pattern, EventHandler handler) {}

    private static final class Listener {
        final String ownerId;
        final String pattern;
        final EventHandler handler;

        Listener(String ownerId, String pattern, EventHandler handler) {
            this.ownerId = ownerId;
            this.pattern = pattern;
            this.handler = handler;
        }
    }
}
