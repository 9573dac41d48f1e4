package com.conduit.rpc;

import com.google.gson.JsonPrimitive;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PendingCallRegistryTest {

    private PendingCallRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PendingCallRegistry("voice");
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void testResolve() throws Exception {
        CompletableFuture<?> future = registry.register("1", "voice.speak", 10_000);

        assertTrue(registry.isPending("1"));
        assertTrue(registry.resolve("1", new JsonPrimitive("done")));

        assertEquals(new JsonPrimitive("done"), future.get(1, TimeUnit.SECONDS));
        assertEquals(0, registry.getPendingCount());
    }

    @Test
    void testReject() {
        CompletableFuture<?> future = registry.register("1", "voice.speak", 10_000);

        assertTrue(registry.reject("1", new ExtensionCallException("boom")));

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        assertInstanceOf(ExtensionCallException.class, e.getCause());
    }

    @Test
    @DisplayName("A call times out and its late response is dropped")
    void testTimeoutThenLateResponse() {
        CompletableFuture<?> future = registry.register("1", "voice.speak", 50);

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));
        assertInstanceOf(RpcTimeoutException.class, e.getCause());

        assertFalse(registry.resolve("1", new JsonPrimitive("late")));
        assertFalse(registry.isPending("1"));
    }

    @Test
    @DisplayName("A call whose deadline already passed fails without being registered")
    void testNonPositiveTimeout() {
        CompletableFuture<?> future = registry.register("1", "voice.speak", 0);

        assertTrue(future.isCompletedExceptionally());
        assertEquals(0, registry.getPendingCount());
    }

    @Test
    void testUnknownIdIgnored() {
        assertFalse(registry.resolve("missing", new JsonPrimitive(1)));
        assertFalse(registry.reject("missing", new ExtensionCallException("x")));
    }

    @Test
    void testRejectAll() {
        CompletableFuture<?> first = registry.register("1", "voice.speak", 10_000);
        CompletableFuture<?> second = registry.register("2", "voice.listen", 10_000);

        registry.rejectAll(method -> new HostUnavailableException("voice", "exited during " + method));

        assertTrue(first.isCompletedExceptionally());
        assertTrue(second.isCompletedExceptionally());
        assertEquals(0, registry.getPendingCount());
        ExecutionException e = assertThrows(ExecutionException.class, second::get);
        assertTrue(e.getCause().getMessage().contains("voice.listen"));
    }
}
