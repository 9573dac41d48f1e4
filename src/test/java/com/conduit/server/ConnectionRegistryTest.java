package com.conduit.server;

import com.conduit.events.GatewayEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionRegistryTest {

    private ConnectionRegistry registry;
    private ClientConnection first;
    private ClientConnection second;
    private final List<String> firstSent = new ArrayList<>();
    private final List<String> secondSent = new ArrayList<>();

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
        first = new ClientConnection("first", firstSent::add, Runnable::run);
        second = new ClientConnection("second", secondSent::add, Runnable::run);
        registry.add(first);
        registry.add(second);
    }

    @Test
    void testSubscribedDelivery() {
        first.replaceSubscriptions(List.of("session.*"));
        second.replaceSubscriptions(List.of("voice.*"));

        assertEquals(List.of("first"), registry.deliver(GatewayEvent.of("session.abc.delta", null)));
        assertEquals(1, firstSent.size());
        assertTrue(secondSent.isEmpty());
        assertTrue(registry.deliver(GatewayEvent.of("imessage.received", null)).isEmpty());
    }

    @Test
    @DisplayName("An event addressed to a connection reaches only that connection")
    void testTargetedDelivery() {
        first.replaceSubscriptions(List.of("*"));

        List<String> receivers = registry.deliver(GatewayEvent.builder("voice.done").connectionId("second").build());

        assertEquals(List.of("second"), receivers);
        assertTrue(firstSent.isEmpty());
        assertEquals(1, secondSent.size());
        assertTrue(registry.deliver(GatewayEvent.builder("voice.done").connectionId("gone").build()).isEmpty());
    }

    @Test
    @DisplayName("The latest exclusive claim wins")
    void testExclusiveLastWins() {
        first.replaceSubscriptions(List.of("session.*"));
        second.replaceSubscriptions(List.of("session.*"));
        registry.claimExclusive("first", List.of("session.*"));
        registry.claimExclusive("second", List.of("session.*"));

        List<String> receivers = registry.deliver(GatewayEvent.of("session.abc.delta", null));

        assertEquals(List.of("second"), receivers);
        assertTrue(firstSent.isEmpty());
        assertEquals("second", registry.getExclusiveOwner("session.*"));
    }

    @Test
    @DisplayName("Exclusive claims are dropped when their owner disconnects")
    void testExclusiveReleasedOnDisconnect() {
        first.replaceSubscriptions(List.of("session.*"));
        second.replaceSubscriptions(List.of("session.*"));
        registry.claimExclusive("second", List.of("session.*"));

        registry.remove("second");

        assertNull(registry.getExclusiveOwner("session.*"));
        assertEquals(List.of("first"), registry.deliver(GatewayEvent.of("session.abc", null)));
        assertEquals(1, registry.size());
    }

    @Test
    void testReleaseOnlyOwnClaim() {
        registry.claimExclusive("second", List.of("session.*"));

        registry.releaseExclusive("first", List.of("session.*"));

        assertEquals("second", registry.getExclusiveOwner("session.*"));
    }

    @Test
    void testScopeFiltersDelivery() {
        first.replaceSubscriptions(List.of("session.*"));
        first.setScope("s1", null);
        second.replaceSubscriptions(List.of("session.*"));

        List<String> receivers = registry.deliver(GatewayEvent.builder("session.s2.delta").sessionId("s2").build());

        assertEquals(List.of("second"), receivers);
    }

    @Test
    @DisplayName("A connection that fails to send does not affect the others")
    void testSendFailureIsolated() {
        ClientConnection broken = new ClientConnection("broken", text -> {
            throw new IllegalStateException("channel closed");
        }, Runnable::run);
        broken.replaceSubscriptions(List.of("*"));
        second.replaceSubscriptions(List.of("*"));
        registry.add(broken);

        registry.accept(GatewayEvent.of("voice.done", null));

        assertEquals(1, secondSent.size());
    }
}
