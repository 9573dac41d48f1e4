package com.conduit.extension;

import com.conduit.events.EventSubscriptions;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.slf4j.Logger;

import java.util.concurrent.CompletableFuture;

/**
 * Context handed to an extension when it starts.
 * 
 * Grants event subscription and emission, a read-only view of the extension's own
 * configuration, a logger, and (out of process only) calls to other extensions.
 */
public interface ExtensionContext {
    
    /**
     * Gets the id of the extension this context belongs to.
     */
    String extensionId();
    
    /**
     * Subscribes to events matching a pattern.
     * 
     * @param pattern the event pattern, e.g. "session.*"
     * @param handler the handler to invoke
     * @return a handle that removes this subscription
     */
    EventSubscriptions.Subscription on(String pattern, EventSubscriptions.EventHandler handler);
    
    /**
     * Emits an event with no routing metadata.
     */
    default void emit(String type, Object payload) {
        emit(type, payload, EmitOptions.NONE);
    }
    
    /**
     * Emits an event.
     * 
     * @param type the event type
     * @param payload the payload, serialized to JSON
     * @param options routing metadata
     */
    void emit(String type, Object payload, EmitOptions options);
    
    /**
     * Gets a copy of this extension's configuration.
     */
    JsonObject config();
    
    /**
     * Gets the logger for this extension.
     */
    Logger log();
    
    /**
     * Calls a method on another extension through the gateway.
     * 
     * @param method the method to call
     * @param params the params
     * @return the result; for in-process extensions, a future already failed with
     *     {@link UnsupportedOperationException}
     */
    CompletableFuture<JsonElement> call(String method, JsonObject params);
}
