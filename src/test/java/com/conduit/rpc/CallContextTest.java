package com.conduit.rpc;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CallContextTest {

    @Test
    @DisplayName("Nested contexts keep the trace and deadline one level deeper")
    void testNested() {
        CallContext root = CallContext.root(Duration.ofSeconds(30));
        CallContext nested = root.nested();

        assertEquals(0, root.depth());
        assertEquals(1, nested.depth());
        assertEquals(root.traceId(), nested.traceId());
        assertEquals(root.deadlineMs(), nested.deadlineMs());
    }

    @Test
    void testRootsHaveDistinctTraces() {
        assertNotEquals(CallContext.root(Duration.ofSeconds(1)).traceId(),
            CallContext.root(Duration.ofSeconds(1)).traceId());
    }

    @Test
    @DisplayName("Depth beyond the maximum is rejected")
    void testDepthCheck() {
        CallContext atMax = new CallContext("t", CallContext.MAX_DEPTH, System.currentTimeMillis() + 10_000);
        assertDoesNotThrow(() -> atMax.check("voice.speak"));

        CallDepthExceededException e = assertThrows(CallDepthExceededException.class,
            () -> atMax.nested().check("voice.speak"));
        assertEquals(CallDepthExceededException.CODE, e.getCode());
    }

    @Test
    @DisplayName("An expired deadline is rejected with a timeout")
    void testDeadlineCheck() {
        CallContext expired = new CallContext("trace-1", 0, System.currentTimeMillis() - 1);

        assertTrue(expired.isExpired());
        RpcTimeoutException e = assertThrows(RpcTimeoutException.class, () -> expired.check("voice.speak"));
        assertTrue(e.getMessage().contains("voice.speak"));
        assertTrue(e.getMessage().contains("trace-1"));
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new CallContext("", 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new CallContext("t", -1, 0));
    }
}
