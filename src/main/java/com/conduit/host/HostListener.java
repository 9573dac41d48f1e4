package com.conduit.host;

import com.conduit.events.GatewayEvent;
import com.conduit.extension.ExtensionRegistration;
import com.conduit.rpc.CallContext;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.concurrent.CompletableFuture;

/**
 * Receives what an extension host process reports to the gateway.
 */
public interface HostListener {

    /**
     * Called every time the child registers, including after a restart.
     *
     * @throws com.conduit.extension.ExtensionRegistrationException if the gateway rejects
     *     the registration
     */
    void onRegister(ExtensionHostProcess host, ExtensionRegistration registration);

    /**
     * Called for every event the child emits. The event's origin is the host's extension id.
     */
    void onEvent(ExtensionHostProcess host, GatewayEvent event);

    /**
     * Called when the extension calls a method through the gateway.
     *
     * @param callerId the calling extension
     * @param callContext trace metadata of the nested call
     * @return the result of the call
     */
    CompletableFuture<JsonElement> onCall(String callerId, String method, JsonObject params, String connectionId,
                                          CallContext callContext);

    /**
     * Called once the host has exhausted its restarts.
     */
    default void onGiveUp(ExtensionHostProcess host) {
    }
}
