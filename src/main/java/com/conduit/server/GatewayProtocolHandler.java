package com.conduit.server;

import com.conduit.extension.ExtensionManager;
import com.conduit.extension.ExtensionRegistration;
import com.conduit.rpc.GatewayException;
import com.conduit.rpc.ParamValidationException;
import com.conduit.schema.MethodSchema;
import com.conduit.schema.MethodSchema.FieldType;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Handles the client protocol: every {@code req} is answered by exactly one {@code res}.
 *
 * Built-in gateway methods are served here and take precedence over extension methods;
 * everything else is dispatched through the {@link ExtensionManager}.
 */
public class GatewayProtocolHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(GatewayProtocolHandler.class);
    private static final Gson GSON = new Gson();

    static final String LIST_METHODS = "gateway.list_methods";
    static final String LIST_EXTENSIONS = "gateway.list_extensions";
    static final String SUBSCRIBE = "gateway.subscribe";
    static final String UNSUBSCRIBE = "gateway.unsubscribe";
    static final String RESTART_EXTENSION = "gateway.restart_extension";
    static final String HEALTH = "gateway.health";

    private static final MethodSchema SUBSCRIBE_SCHEMA = MethodSchema.builder()
        .required("events", FieldType.ARRAY)
        .optional("exclusive", FieldType.BOOLEAN)
        .optional("sessionId", FieldType.STRING)
        .optional("extensionId", FieldType.STRING)
        .build();

    private static final MethodSchema UNSUBSCRIBE_SCHEMA = MethodSchema.builder()
        .required("events", FieldType.ARRAY)
        .build();

    private static final MethodSchema RESTART_SCHEMA = MethodSchema.builder()
        .required("extension", FieldType.STRING)
        .build();

    private final ExtensionManager manager;
    private final ConnectionRegistry connections;
    private final HealthReport healthReport;

    public GatewayProtocolHandler(ExtensionManager manager, ConnectionRegistry connections) {
        this.manager = manager;
        this.connections = connections;
        this.healthReport = new HealthReport(manager, connections);
    }

    /**
     * Handles one text message from a client.
     */
    public void handleMessage(ClientConnection connection, String text) {
        JsonObject message;
        try {
            JsonElement element = JsonParser.parseString(text);
            message = element.isJsonObject() ? element.getAsJsonObject() : null;
        } catch (JsonParseException e) {
            message = null;
        }
        if (message == null) {
            LOGGER.warn("Invalid message from client {}", connection.getId());
            connection.send(ProtocolMessages.failure("unknown",
                new GatewayException("INVALID_MESSAGE", "Invalid message format")));
            return;
        }

        String type = stringField(message, "type");
        if (!ProtocolMessages.TYPE_REQUEST.equals(type)) {
            LOGGER.debug("Ignoring message of type {} from client {}", type, connection.getId());
            return;
        }

        String id = stringField(message, "id");
        String method = stringField(message, "method");
        String requestId = id != null ? id : "unknown";
        if (method == null) {
            connection.send(ProtocolMessages.failure(requestId,
                new GatewayException("INVALID_MESSAGE", "Request has no method")));
            return;
        }
        JsonObject params = message.has("params") && message.get("params").isJsonObject()
            ? message.getAsJsonObject("params")
            : new JsonObject();
        List<String> tags = stringList(message.get("tags"));

        connection.enqueue(() -> dispatch(connection, method, params, tags)
            .handle((result, error) -> error == null
                ? ProtocolMessages.success(requestId, result)
                : ProtocolMessages.failure(requestId, GatewayException.from(error))));
    }

    /**
     * Dispatches a request on behalf of a connection.
     *
     * @return the result; failed with a {@link GatewayException} when the request fails
     */
    public CompletableFuture<JsonElement> dispatch(ClientConnection connection, String method, JsonObject params,
                                                   List<String> tags) {
        try {
            return switch (method) {
                case LIST_METHODS -> CompletableFuture.completedFuture(listMethods());
                case LIST_EXTENSIONS -> CompletableFuture.completedFuture(listExtensions());
                case SUBSCRIBE, "subscribe" -> CompletableFuture.completedFuture(subscribe(connection, method, params));
                case UNSUBSCRIBE, "unsubscribe" ->
                    CompletableFuture.completedFuture(unsubscribe(connection, method, params));
                case RESTART_EXTENSION -> restartExtension(method, params);
                case HEALTH -> CompletableFuture.completedFuture(healthReport.build());
                default -> manager.handleMethodAsync(method, params, connection.getId(), null, tags);
            };
        } catch (GatewayException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private JsonElement listMethods() {
        JsonArray methods = new JsonArray();
        for (ExtensionManager.MethodInfo info : manager.getMethodDefinitions()) {
            JsonObject method = new JsonObject();
            method.addProperty("extensionId", info.extensionId());
            method.addProperty("extensionName", info.extensionName());
            method.addProperty("name", info.method().name());
            method.addProperty("description", info.method().description());
            method.add("inputSchema", info.method().inputSchema().toJson());
            methods.add(method);
        }
        JsonObject result = new JsonObject();
        result.add("methods", methods);
        return result;
    }

    private JsonElement listExtensions() {
        JsonObject result = new JsonObject();
        result.add("extensions", GSON.toJsonTree(manager.getExtensionList()));
        return result;
    }

    private JsonElement subscribe(ClientConnection connection, String method, JsonObject params)
            throws GatewayException {
        validate(method, SUBSCRIBE_SCHEMA, params);
        List<String> events = stringList(params.get("events"));
        boolean exclusive = params.has("exclusive") && params.get("exclusive").getAsBoolean();

        Set<String> dropped = new HashSet<>(connection.getSubscriptions());
        dropped.removeAll(events);
        connections.releaseExclusive(connection.getId(), dropped);

        connection.replaceSubscriptions(events);
        connection.setScope(stringField(params, "sessionId"), stringField(params, "extensionId"));
        if (exclusive) {
            connections.claimExclusive(connection.getId(), events);
        }
        LOGGER.debug("Client {} subscribed to {}{}", connection.getId(), events, exclusive ? " (exclusive)" : "");

        JsonObject result = new JsonObject();
        result.add("subscribed", GSON.toJsonTree(events));
        result.addProperty("exclusive", exclusive);
        return result;
    }

    private JsonElement unsubscribe(ClientConnection connection, String method, JsonObject params)
            throws GatewayException {
        validate(method, UNSUBSCRIBE_SCHEMA, params);
        List<String> events = stringList(params.get("events"));
        connection.removeSubscriptions(events);
        connections.releaseExclusive(connection.getId(), events);

        JsonObject result = new JsonObject();
        result.add("unsubscribed", GSON.toJsonTree(events));
        return result;
    }

    private CompletableFuture<JsonElement> restartExtension(String method, JsonObject params)
            throws GatewayException {
        validate(method, RESTART_SCHEMA, params);
        String extensionId = params.get("extension").getAsString();
        return manager.restartExtension(extensionId).thenApply(registration -> restarted(registration));
    }

    private static JsonElement restarted(ExtensionRegistration registration) {
        JsonObject result = new JsonObject();
        result.addProperty("restarted", registration.id());
        result.add("methods", GSON.toJsonTree(registration.methodNames()));
        return result;
    }

    private static void validate(String method, MethodSchema schema, JsonObject params)
            throws ParamValidationException {
        List<String> problems = schema.validate(params);
        if (!problems.isEmpty()) {
            throw new ParamValidationException(method, problems);
        }
    }

    private static String stringField(JsonObject object, String field) {
        JsonElement value = object.get(field);
        return value != null && value.isJsonPrimitive() ? value.getAsString() : null;
    }

    private static List<String> stringList(JsonElement element) {
        List<String> values = new ArrayList<>();
        if (element != null && element.isJsonArray()) {
            for (JsonElement value : element.getAsJsonArray()) {
                if (value.isJsonPrimitive()) {
                    values.add(value.getAsString());
                }
            }
        }
        return values;
    }
}
