package com.conduit.rpc;

import java.time.Duration;
import java.util.UUID;

/**
 * Trace metadata attached to a call made on behalf of another call.
 *
 * @param traceId correlation id shared by every call in the chain
 * @param depth number of hops from the originating call, starting at 0
 * @param deadlineMs absolute wall-clock deadline in epoch milliseconds
 */
public record CallContext(String traceId, int depth, long deadlineMs) {

    /**
     * Deepest nesting allowed before a call is rejected.
     */
    public static final int MAX_DEPTH = 8;

    public CallContext {
        if (traceId == null || traceId.isBlank()) {
            throw new IllegalArgumentException("traceId cannot be null or empty");
        }
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be non-negative: " + depth);
        }
    }

    /**
     * Starts a new chain with a fresh trace id.
     */
    public static CallContext root(Duration timeout) {
        return new CallContext(UUID.randomUUID().toString(), 0, System.currentTimeMillis() + timeout.toMillis());
    }

    /**
     * Derives the context for a call made while handling this one.
     * The trace id and deadline are inherited.
     */
    public CallContext nested() {
        return new CallContext(traceId, depth + 1, deadlineMs);
    }

    public long remainingMillis() {
        return deadlineMs - System.currentTimeMillis();
    }

    public boolean isExpired() {
        return remainingMillis() <= 0;
    }

    public boolean exceedsMaxDepth() {
        return depth > MAX_DEPTH;
    }

    /**
     * Rejects the call if the chain is too deep or its deadline has passed.
     *
     * @param method the method about to be invoked, for the error message
     */
    public void check(String method) throws GatewayException {
        if (exceedsMaxDepth()) {
            throw new CallDepthExceededException(depth);
        }
        if (isExpired()) {
            throw new RpcTimeoutException(String.format("Call deadline exceeded for %s (trace %s)", method, traceId));
        }
    }
}
