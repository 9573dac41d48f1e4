package com.conduit.extension;

import com.conduit.events.GatewayEvent;
import com.conduit.rpc.CallContext;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The manager's handle on one registered extension.
 *
 * There are exactly two variants: {@link LocalHandle} for extensions running inside the
 * gateway and {@link RemoteHandle} for extensions running in a child process.
 */
public abstract class ExtensionHandle {

    private final ExtensionRegistration registration;

    ExtensionHandle(ExtensionRegistration registration) {
        this.registration = registration;
    }

    public ExtensionRegistration registration() {
        return registration;
    }

    public String id() {
        return registration.id();
    }

    public abstract boolean isRemote();

    abstract CompletableFuture<JsonElement> invoke(MethodDefinition method, JsonObject params, String connectionId,
                                                   CallContext callContext, List<String> tags);

    abstract void deliver(GatewayEvent event);

    abstract CompletableFuture<Boolean> routeToSource(String source, GatewayEvent event);

    abstract HealthStatus health();

    /**
     * Releases the extension. Local extensions are stopped; remote hosts are terminated.
     */
    abstract CompletableFuture<Void> destroy();
}
