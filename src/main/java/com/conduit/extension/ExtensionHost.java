package com.conduit.extension;

import com.conduit.events.GatewayEvent;
import com.conduit.rpc.CallContext;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Gateway-side adapter for one extension running in a child process.
 *
 * Implementations never block the caller: every round trip is exposed as a future
 * bounded by the call deadline.
 */
public interface ExtensionHost {

    /**
     * Gets the id of the extension this host runs.
     */
    String extensionId();

    /**
     * Forwards a method call to the child.
     *
     * @param method the method name
     * @param params the params, forwarded unchanged
     * @param connectionId the originating client connection, may be null
     * @param callContext trace metadata; never null
     * @param tags request tags, may be empty
     * @return the result; fails with {@link com.conduit.rpc.RpcTimeoutException} when the
     *     deadline elapses or {@link com.conduit.rpc.HostUnavailableException} when the
     *     child is not running
     */
    CompletableFuture<JsonElement> callMethod(String method, JsonObject params, String connectionId,
                                              CallContext callContext, List<String> tags);

    /**
     * Forwards an event to the child. Never blocks; dropped when the child is not running.
     */
    void sendEvent(GatewayEvent event);

    /**
     * Asks the child to deliver an event to an external source.
     *
     * @return a future completing with true when delivered; never completes exceptionally
     */
    CompletableFuture<Boolean> routeToSource(String source, GatewayEvent event);

    /**
     * Whether the child process is currently running.
     */
    boolean isRunning();

    /**
     * Terminates the child gracefully. Completes once it has exited or the grace period
     * has passed. A killed host is never restarted automatically.
     */
    CompletableFuture<Void> kill();

    /**
     * Terminates the child immediately.
     */
    void forceKill();

    /**
     * Restarts the child and waits for it to register again.
     *
     * @return the new registration
     */
    CompletableFuture<ExtensionRegistration> restart();
}
