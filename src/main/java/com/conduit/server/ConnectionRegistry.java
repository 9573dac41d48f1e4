package com.conduit.server;

import com.conduit.events.EventPatterns;
import com.conduit.events.GatewayEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Registry of connected clients and router of events to them.
 *
 * An event addressed to a connection goes to that connection only, whatever it is
 * subscribed to. An event matching an exclusive pattern goes only to the connection that
 * most recently claimed that pattern. Every other event goes to each connection with a
 * matching subscription whose scope accepts it.
 */
public class ConnectionRegistry implements Consumer<GatewayEvent> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, String> exclusiveOwners = new ConcurrentHashMap<>();

    public void add(ClientConnection connection) {
        connections.put(connection.getId(), connection);
        LOGGER.info("Client connected: {} ({} total)", connection.getId(), connections.size());
    }

    /**
     * Removes a connection along with its exclusive claims.
     */
    public void remove(String connectionId) {
        if (connections.remove(connectionId) != null) {
            exclusiveOwners.values().removeIf(owner -> owner.equals(connectionId));
            LOGGER.info("Client disconnected: {} ({} total)", connectionId, connections.size());
        }
    }

    public ClientConnection get(String connectionId) {
        return connections.get(connectionId);
    }

    public int size() {
        return connections.size();
    }

    /**
     * Makes a connection the exclusive receiver of events matching the given patterns,
     * superseding any earlier claim.
     */
    public void claimExclusive(String connectionId, Collection<String> patterns) {
        for (String pattern : patterns) {
            String previous = exclusiveOwners.put(pattern, connectionId);
            if (previous != null && !previous.equals(connectionId)) {
                LOGGER.debug("Exclusive subscription '{}' moved from {} to {}", pattern, previous, connectionId);
            }
        }
    }

    /**
     * Drops a connection's exclusive claims on the given patterns.
     */
    public void releaseExclusive(String connectionId, Collection<String> patterns) {
        for (String pattern : patterns) {
            exclusiveOwners.remove(pattern, connectionId);
        }
    }

    /**
     * Gets the connection holding an exclusive pattern, or null.
     */
    public String getExclusiveOwner(String pattern) {
        return exclusiveOwners.get(pattern);
    }

    @Override
    public void accept(GatewayEvent event) {
        deliver(event);
    }

    /**
     * Delivers an event to the connections entitled to it.
     *
     * @return the ids of the connections it was sent to
     */
    public List<String> deliver(GatewayEvent event) {
        String target = event.getConnectionId();
        if (target != null) {
            ClientConnection connection = connections.get(target);
            if (connection == null) {
                LOGGER.debug("Target connection {} for {} is gone", target, event.getType());
                return List.of();
            }
            send(connection, event);
            return List.of(target);
        }

        Set<String> exclusiveReceivers = new LinkedHashSet<>();
        for (Map.Entry<String, String> claim : exclusiveOwners.entrySet()) {
            if (EventPatterns.matches(event.getType(), claim.getKey())) {
                exclusiveReceivers.add(claim.getValue());
            }
        }
        if (!exclusiveReceivers.isEmpty()) {
            for (String receiver : exclusiveReceivers) {
                ClientConnection connection = connections.get(receiver);
                if (connection != null) {
                    send(connection, event);
                }
            }
            return List.copyOf(exclusiveReceivers);
        }

        Set<String> receivers = new LinkedHashSet<>();
        for (ClientConnection connection : connections.values()) {
            if (connection.isSubscribed(event.getType()) && connection.acceptsScope(event)) {
                send(connection, event);
                receivers.add(connection.getId());
            }
        }
        return List.copyOf(receivers);
    }

    private static void send(ClientConnection connection, GatewayEvent event) {
        try {
            connection.sendEvent(event);
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to send {} to client {}: {}", event.getType(), connection.getId(), e.getMessage());
        }
    }
}
