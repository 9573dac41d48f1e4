package com.conduit.server;

import com.conduit.events.EventPatterns;
import com.conduit.events.GatewayEvent;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * State of one connected client.
 *
 * Holds the client's subscription patterns and optional scope, and serializes its
 * requests: each request starts once the previous one has been answered, so responses
 * leave in the order the requests arrived.
 */
public class ClientConnection {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClientConnection.class);

    private final String id;
    private final Outbound outbound;
    private final Executor requestExecutor;
    private final Set<String> subscriptions = new CopyOnWriteArraySet<>();

    private volatile String sessionScope;
    private volatile String extensionScope;
    private CompletableFuture<Void> responseChain = CompletableFuture.completedFuture(null);

    /**
     * @param id unique connection id
     * @param outbound writes text messages to the client
     * @param requestExecutor runs request handling off the I/O thread
     */
    public ClientConnection(String id, Outbound outbound, Executor requestExecutor) {
        this.id = id;
        this.outbound = outbound;
        this.requestExecutor = requestExecutor;
    }

    public String getId() {
        return id;
    }

    /**
     * Replaces the subscription set.
     */
    public void replaceSubscriptions(Collection<String> patterns) {
        Set<String> next = new LinkedHashSet<>(patterns);
        subscriptions.retainAll(next);
        subscriptions.addAll(next);
    }

    public void removeSubscriptions(Collection<String> patterns) {
        subscriptions.removeAll(patterns);
    }

    public Set<String> getSubscriptions() {
        return Set.copyOf(subscriptions);
    }

    /**
     * Checks whether any subscription pattern matches an event type.
     */
    public boolean isSubscribed(String eventType) {
        return EventPatterns.matchesAny(eventType, subscriptions);
    }

    /**
     * Restricts delivery to events of one session and/or one originating extension.
     * Null lifts the corresponding restriction.
     */
    public void setScope(String sessionId, String extensionId) {
        this.sessionScope = sessionId;
        this.extensionScope = extensionId;
    }

    public String getSessionScope() {
        return sessionScope;
    }

    public String getExtensionScope() {
        return extensionScope;
    }

    /**
     * Checks the connection's scope against an event. Events without a session id pass a
     * session scope.
     */
    public boolean acceptsScope(GatewayEvent event) {
        String session = sessionScope;
        if (session != null) {
            String eventSession = event.getSessionId();
            if (eventSession != null && !eventSession.equals(session)) {
                return false;
            }
        }
        String extension = extensionScope;
        return extension == null || extension.equals(event.getOrigin());
    }

    /**
     * Queues a request. The task starts after every earlier request has been answered and
     * its response is sent before any later one.
     *
     * @param task produces the response message; must not fail
     */
    public void enqueue(Supplier<CompletableFuture<JsonObject>> task) {
        synchronized (this) {
            responseChain = responseChain
                .thenComposeAsync(ignored -> task.get(), requestExecutor)
                .thenAccept(this::send)
                .exceptionally(e -> {
                    LOGGER.error("Request processing failed on connection {}", id, e);
                    return null;
                });
        }
    }

    public void send(JsonObject message) {
        outbound.send(ProtocolMessages.serialize(message));
    }

    /**
     * Pushes an event to the client.
     */
    public void sendEvent(GatewayEvent event) {
        send(ProtocolMessages.event(event));
    }

    @Override
    public String toString() {
        return "ClientConnection{id='" + id + "', subscriptions=" + List.copyOf(subscriptions) + '}';
    }

    /**
     * Writes text messages to the client.
     */
    @FunctionalInterface
    public interface Outbound {
        void send(String text);
    }
}
