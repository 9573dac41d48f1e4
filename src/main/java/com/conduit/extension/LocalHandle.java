package com.conduit.extension;

import com.conduit.events.EventSubscriptions;
import com.conduit.events.GatewayEvent;
import com.conduit.rpc.CallContext;
import com.conduit.rpc.ExtensionCallException;
import com.conduit.rpc.GatewayException;
import com.conduit.rpc.ParamValidationException;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Handle for an extension running inside the gateway process.
 */
final class LocalHandle extends ExtensionHandle {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalHandle.class);
    private static final Gson GSON = new Gson();

    private final Extension extension;
    private final String ownerKey;
    private final EventSubscriptions subscriptions;
    private final Executor deliveryExecutor;

    LocalHandle(ExtensionRegistration registration, Extension extension, String ownerKey,
                EventSubscriptions subscriptions, Executor deliveryExecutor) {
        super(registration);
        this.extension = extension;
        this.ownerKey = ownerKey;
        this.subscriptions = subscriptions;
        this.deliveryExecutor = deliveryExecutor;
    }

    @Override
    public boolean isRemote() {
        return false;
    }

    @Override
    CompletableFuture<JsonElement> invoke(MethodDefinition method, JsonObject params, String connectionId,
                                          CallContext callContext, List<String> tags) {
        JsonObject actual = params != null ? params : new JsonObject();
        List<String> problems = method.inputSchema().validate(actual);
        if (!problems.isEmpty()) {
            return CompletableFuture.failedFuture(new ParamValidationException(method.name(), problems));
        }

        try {
            Object result = extension.handleMethod(method.name(), actual);
            return CompletableFuture.completedFuture(toJson(result));
        } catch (GatewayException e) {
            return CompletableFuture.failedFuture(e);
        } catch (Exception e) {
            LOGGER.debug("Method {} of extension '{}' failed", method.name(), id(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return CompletableFuture.failedFuture(new ExtensionCallException(message, e));
        }
    }

    @Override
    void deliver(GatewayEvent event) {
        for (EventSubscriptions.Delivery delivery : subscriptions.match(ownerKey, event.getType())) {
            try {
                deliveryExecutor.execute(() -> {
                    try {
                        delivery.handler().handle(event);
                    } catch (Exception e) {
                        LOGGER.error("Event handler for '{}' in extension '{}' failed on {}",
                            delivery.pattern(), id(), event.getType(), e);
                    }
                });
            } catch (RejectedExecutionException e) {
                LOGGER.warn("Dropping event {} for extension '{}': delivery executor rejected it",
                    event.getType(), id());
            }
        }
    }

    @Override
    CompletableFuture<Boolean> routeToSource(String source, GatewayEvent event) {
        try {
            extension.handleSourceResponse(source, event);
            return CompletableFuture.completedFuture(true);
        } catch (Exception e) {
            LOGGER.error("Failed to route to source {} via extension '{}'", source, id(), e);
            return CompletableFuture.completedFuture(false);
        }
    }

    @Override
    HealthStatus health() {
        try {
            HealthStatus status = extension.health();
            return status != null ? status : HealthStatus.healthy();
        } catch (RuntimeException e) {
            LOGGER.warn("Health check of extension '{}' failed: {}", id(), e.getMessage());
            return HealthStatus.unhealthy("health_check_failed");
        }
    }

    @Override
    CompletableFuture<Void> destroy() {
        subscriptions.removeOwner(ownerKey);
        try {
            extension.stop();
            LOGGER.info("Stopped extension '{}'", id());
        } catch (Exception e) {
            LOGGER.error("Error stopping extension '{}'", id(), e);
        }
        return CompletableFuture.completedFuture(null);
    }

    private static JsonElement toJson(Object result) {
        if (result == null) {
            return JsonNull.INSTANCE;
        }
        if (result instanceof JsonElement element) {
            return element;
        }
        return GSON.toJsonTree(result);
    }
}
