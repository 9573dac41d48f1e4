package com.conduit.rpc;

import com.google.gson.JsonElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Registry for calls awaiting a response across a message boundary.
 * Handles timeouts and future resolution; responses that arrive after a call has
 * timed out or been rejected are dropped.
 */
public class PendingCallRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(PendingCallRegistry.class);

    private final String owner;
    private final Map<String, PendingCall> pending = new ConcurrentHashMap<>();
    private final ScheduledExecutorService timeoutExecutor;

    public PendingCallRegistry(String owner) {
        this.owner = owner;
        this.timeoutExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "pending-calls-" + owner);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Registers a pending call.
     *
     * @param id the correlation id written with the request
     * @param method the method name, for diagnostics
     * @param timeoutMs time to wait before failing with {@link RpcTimeoutException}
     * @return a future completed by {@link #resolve}, {@link #reject} or the timeout
     */
    public CompletableFuture<JsonElement> register(String id, String method, long timeoutMs) {
        CompletableFuture<JsonElement> future = new CompletableFuture<>();
        if (timeoutMs <= 0) {
            future.completeExceptionally(new RpcTimeoutException(
                String.format("Request %s to %s exceeded its deadline before being sent", method, owner)));
            return future;
        }

        PendingCall call = new PendingCall(method, future);
        pending.put(id, call);

        call.timeout = timeoutExecutor.schedule(() -> {
            PendingCall expiredCall = pending.remove(id);
            if (expiredCall != null) {
                expiredCall.future.completeExceptionally(new RpcTimeoutException(
                    String.format("Request %s to %s timed out after %dms", method, owner, timeoutMs)));
                LOGGER.debug("Call timed out: {} ({})", id, method);
            }
        }, timeoutMs, TimeUnit.MILLISECONDS);

        LOGGER.debug("Registered pending call: {} ({})", id, method);
        return future;
    }

    /**
     * Resolves a pending call with a successful result.
     *
     * @return false if the call was unknown, already timed out, or already completed
     */
    public boolean resolve(String id, JsonElement result) {
        PendingCall call = take(id);
        if (call == null) {
            LOGGER.debug("Dropping late or unknown response for call: {}", id);
            return false;
        }
        call.future.complete(result);
        LOGGER.debug("Resolved call: {}", id);
        return true;
    }

    /**
     * Rejects a pending call with an error.
     *
     * @return false if the call was unknown, already timed out, or already completed
     */
    public boolean reject(String id, GatewayException error) {
        PendingCall call = take(id);
        if (call == null) {
            LOGGER.debug("Dropping late or unknown error for call: {}", id);
            return false;
        }
        call.future.completeExceptionally(error);
        LOGGER.debug("Rejected call: {}, error: {}", id, error.getMessage());
        return true;
    }

    /**
     * Rejects every pending call, e.g. when the peer process exits.
     *
     * @param errorFactory builds the error for each call from its method name
     */
    public void rejectAll(Function<String, GatewayException> errorFactory) {
        List<String> ids = new ArrayList<>(pending.keySet());
        for (String id : ids) {
            PendingCall call = take(id);
            if (call != null) {
                call.future.completeExceptionally(errorFactory.apply(call.method));
            }
        }
    }

    /**
     * Gets the number of pending calls.
     */
    public int getPendingCount() {
        return pending.size();
    }

    /**
     * Checks whether a call id is still awaiting a response.
     */
    public boolean isPending(String id) {
        return pending.containsKey(id);
    }

    /**
     * Releases the timeout thread. Pending calls are left to {@link #rejectAll}.
     */
    public void close() {
        timeoutExecutor.shutdownNow();
    }

    private PendingCall take(String id) {
        PendingCall call = pending.remove(id);
        if (call != null && call.timeout != null) {
            call.timeout.cancel(false);
        }
        return call;
    }

    /**
     * Represents a pending call.
     */
    private static class PendingCall {
        final String method;
        final CompletableFuture<JsonElement> future;
        volatile ScheduledFuture<?> timeout;

        PendingCall(String method, CompletableFuture<JsonElement> future) {
            this.method = method;
            this.future = future;
        }
    }
}
