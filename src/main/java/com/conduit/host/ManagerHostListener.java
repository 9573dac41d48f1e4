package com.conduit.host;

import com.conduit.events.GatewayEvent;
import com.conduit.extension.ExtensionManager;
import com.conduit.extension.ExtensionRegistration;
import com.conduit.rpc.CallContext;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Connects extension host processes to the {@link ExtensionManager}: registrations are
 * registered, emitted events are published and nested calls are dispatched.
 */
public class ManagerHostListener implements HostListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(ManagerHostListener.class);

    private final ExtensionManager manager;

    public ManagerHostListener(ExtensionManager manager) {
        this.manager = manager;
    }

    @Override
    public void onRegister(ExtensionHostProcess host, ExtensionRegistration registration) {
        manager.registerRemote(registration, host);
    }

    @Override
    public void onEvent(ExtensionHostProcess host, GatewayEvent event) {
        manager.publish(event);
    }

    @Override
    public CompletableFuture<JsonElement> onCall(String callerId, String method, JsonObject params,
                                                 String connectionId, CallContext callContext) {
        LOGGER.debug("Extension '{}' calling {} (trace {}, depth {})", callerId, method, callContext.traceId(),
            callContext.depth());
        return manager.handleMethodAsync(method, params, connectionId, callContext, List.of());
    }

    @Override
    public void onGiveUp(ExtensionHostProcess host) {
        LOGGER.warn("Removing extension '{}' after repeated crashes", host.extensionId());
        manager.unregisterRemote(host.extensionId());
    }
}
