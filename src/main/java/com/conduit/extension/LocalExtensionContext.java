package com.conduit.extension;

import com.conduit.events.EventSubscriptions;
import com.conduit.events.GatewayEvent;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Context for an extension running inside the gateway process.
 *
 * Subscriptions are registered under the instance's owner key, so they are dropped
 * together when this instance is stopped or replaced.
 */
final class LocalExtensionContext implements ExtensionContext {

    private static final Gson GSON = new Gson();

    private final String extensionId;
    private final String ownerKey;
    private final JsonObject config;
    private final ExtensionManager manager;
    private final Logger logger;

    LocalExtensionContext(String extensionId, String ownerKey, JsonObject config, ExtensionManager manager) {
        this.extensionId = extensionId;
        this.ownerKey = ownerKey;
        this.config = config.deepCopy();
        this.manager = manager;
        this.logger = LoggerFactory.getLogger("extension." + extensionId);
    }

    @Override
    public String extensionId() {
        return extensionId;
    }

    @Override
    public EventSubscriptions.Subscription on(String pattern, EventSubscriptions.EventHandler handler) {
        return manager.subscribe(ownerKey, pattern, handler);
    }

    @Override
    public void emit(String type, Object payload, EmitOptions options) {
        EmitOptions actual = options != null ? options : EmitOptions.NONE;
        GatewayEvent event = GatewayEvent.builder(type)
            .payload(toJson(payload))
            .origin(extensionId)
            .source(actual.source())
            .connectionId(actual.connectionId())
            .sessionId(actual.sessionId())
            .tags(actual.tags())
            .build();
        manager.publish(event);
    }

    @Override
    public JsonObject config() {
        return config.deepCopy();
    }

    @Override
    public Logger log() {
        return logger;
    }

    @Override
    public CompletableFuture<JsonElement> call(String method, JsonObject params) {
        return CompletableFuture.failedFuture(new UnsupportedOperationException(
            String.format("ctx.call(%s) is not supported for in-process extensions", method)));
    }

    private static JsonElement toJson(Object payload) {
        if (payload == null) {
            return JsonNull.INSTANCE;
        }
        if (payload instanceof JsonElement element) {
            return element;
        }
        return GSON.toJsonTree(payload);
    }
}
