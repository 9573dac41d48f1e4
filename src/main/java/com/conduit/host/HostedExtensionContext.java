package com.conduit.host;

import com.conduit.events.EventSubscriptions;
import com.conduit.events.GatewayEvent;
import com.conduit.extension.EmitOptions;
import com.conduit.extension.ExtensionContext;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Context for an extension running in an extension host process. Events and nested calls
 * travel to the gateway over the host's protocol stream.
 */
final class HostedExtensionContext implements ExtensionContext {

    private static final Gson GSON = new Gson();

    private final ExtensionHostRunner runner;
    private final String extensionId;
    private final JsonObject config;
    private final Logger logger;

    HostedExtensionContext(ExtensionHostRunner runner, String extensionId, JsonObject config) {
        this.runner = runner;
        this.extensionId = extensionId;
        this.config = config.deepCopy();
        this.logger = LoggerFactory.getLogger("extension." + extensionId);
    }

    @Override
    public String extensionId() {
        return extensionId;
    }

    @Override
    public EventSubscriptions.Subscription on(String pattern, EventSubscriptions.EventHandler handler) {
        return runner.subscribe(pattern, handler);
    }

    @Override
    public void emit(String type, Object payload, EmitOptions options) {
        EmitOptions actual = options != null ? options : EmitOptions.NONE;
        JsonElement json = payload == null ? JsonNull.INSTANCE
            : payload instanceof JsonElement element ? element : GSON.toJsonTree(payload);
        runner.emit(GatewayEvent.builder(type)
            .payload(json)
            .source(actual.source())
            .connectionId(actual.connectionId())
            .sessionId(actual.sessionId())
            .tags(actual.tags())
            .build());
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
        return runner.call(method, params != null ? params : new JsonObject());
    }
}
