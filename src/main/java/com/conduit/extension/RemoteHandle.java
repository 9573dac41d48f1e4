package com.conduit.extension;

import com.conduit.events.GatewayEvent;
import com.conduit.rpc.CallContext;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Handle for an extension running in a child process. Params are forwarded unchanged;
 * the child validates them.
 */
final class RemoteHandle extends ExtensionHandle {

    private final ExtensionHost host;

    RemoteHandle(ExtensionRegistration registration, ExtensionHost host) {
        super(registration);
        this.host = host;
    }

    ExtensionHost host() {
        return host;
    }

    @Override
    public boolean isRemote() {
        return true;
    }

    @Override
    CompletableFuture<JsonElement> invoke(MethodDefinition method, JsonObject params, String connectionId,
                                          CallContext callContext, List<String> tags) {
        return host.callMethod(method.name(), params != null ? params : new JsonObject(), connectionId,
            callContext, tags);
    }

    @Override
    void deliver(GatewayEvent event) {
        host.sendEvent(event);
    }

    @Override
    CompletableFuture<Boolean> routeToSource(String source, GatewayEvent event) {
        return host.routeToSource(source, event);
    }

    @Override
    HealthStatus health() {
        return new HealthStatus(host.isRunning(), Map.of("remote", true));
    }

    @Override
    CompletableFuture<Void> destroy() {
        return host.kill();
    }
}
