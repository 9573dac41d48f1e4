package com.conduit.extension;

import com.conduit.events.GatewayEvent;
import com.google.gson.JsonObject;

import java.util.List;

/**
 * Contract every extension satisfies, whether it runs inside the gateway or in an
 * extension host process.
 * 
 * Extensions are instantiated from configuration by class name, either with a public
 * constructor taking the extension's {@link JsonObject} config or a no-arg constructor.
 */
public interface Extension {
    
    /**
     * Gets the unique extension id (e.g. "voice").
     */
    String id();
    
    /**
     * Gets the display name.
     */
    String name();
    
    /**
     * Gets the methods this extension handles.
     */
    List<MethodDefinition> methods();
    
    /**
     * Gets the event patterns this extension may emit. Informational only.
     */
    default List<String> events() {
        return List.of();
    }
    
    /**
     * Gets the source prefixes this extension owns (e.g. "imessage").
     */
    default List<String> sourceRoutes() {
        return List.of();
    }
    
    /**
     * Starts the extension. Called once, before any method is dispatched to it.
     * 
     * @param context the extension's view of the gateway
     */
    void start(ExtensionContext context) throws Exception;
    
    /**
     * Stops the extension and releases its resources.
     */
    void stop() throws Exception;
    
    /**
     * Handles a method call.
     * 
     * @param method the fully-qualified method name
     * @param params the validated params
     * @return the result, serialized to JSON by the gateway
     * @throws com.conduit.rpc.UnknownMethodException if the method is not one this extension declared
     */
    Object handleMethod(String method, JsonObject params) throws Exception;
    
    /**
     * Delivers a response event to an external channel this extension owns.
     * 
     * @param source the full source address, e.g. "imessage/+15551234567"
     * @param event the event to deliver
     */
    default void handleSourceResponse(String source, GatewayEvent event) throws Exception {
        throw new UnsupportedOperationException("Extension " + id() + " does not handle source responses");
    }
    
    /**
     * Reports extension health.
     */
    default HealthStatus health() {
        return HealthStatus.healthy();
    }
}
