package com.conduit.host;

import com.conduit.events.GatewayEvent;
import com.conduit.extension.ExtensionRegistration;
import com.conduit.extension.MethodDefinition;
import com.conduit.rpc.CallContext;
import com.conduit.rpc.ExtensionCallException;
import com.conduit.rpc.GatewayException;
import com.conduit.schema.MethodSchema;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Codec for the newline-delimited JSON protocol spoken between the gateway and an
 * extension host process.
 *
 * Every message is a single-line JSON object with a {@code type} field.
 */
public final class HostMessages {

    public static final String TYPE_REQUEST = "req";
    public static final String TYPE_RESPONSE = "res";
    public static final String TYPE_EVENT = "event";
    public static final String TYPE_CALL = "call";
    public static final String TYPE_CALL_RESPONSE = "call_res";
    public static final String TYPE_REGISTER = "register";
    public static final String TYPE_ERROR = "error";

    public static final String METHOD_HEALTH = "__health";
    public static final String METHOD_SOURCE_RESPONSE = "__sourceResponse";

    private static final Gson GSON = new Gson();

    private HostMessages() {
    }

    /**
     * Parses one line of the protocol.
     *
     * @return the message, or null if the line is not a JSON object with a type
     */
    public static JsonObject parse(String line) {
        try {
            JsonElement element = JsonParser.parseString(line);
            if (!element.isJsonObject()) {
                return null;
            }
            JsonObject message = element.getAsJsonObject();
            return getString(message, "type") != null ? message : null;
        } catch (JsonParseException e) {
            return null;
        }
    }

    public static String serialize(JsonObject message) {
        return GSON.toJson(message);
    }

    public static JsonObject request(String id, String method, JsonObject params, String connectionId,
                                     CallContext callContext, List<String> tags) {
        JsonObject message = new JsonObject();
        message.addProperty("type", TYPE_REQUEST);
        message.addProperty("id", id);
        message.addProperty("method", method);
        message.add("params", params != null ? params : new JsonObject());
        if (connectionId != null) {
            message.addProperty("connectionId", connectionId);
        }
        writeCallContext(message, callContext);
        if (tags != null && !tags.isEmpty()) {
            message.add("tags", GSON.toJsonTree(tags));
        }
        return message;
    }

    public static JsonObject call(String id, String method, JsonObject params, String connectionId,
                                  CallContext callContext) {
        JsonObject message = new JsonObject();
        message.addProperty("type", TYPE_CALL);
        message.addProperty("id", id);
        message.addProperty("method", method);
        message.add("params", params != null ? params : new JsonObject());
        if (connectionId != null) {
            message.addProperty("connectionId", connectionId);
        }
        writeCallContext(message, callContext);
        return message;
    }

    public static JsonObject success(String type, String id, JsonElement payload) {
        JsonObject message = new JsonObject();
        message.addProperty("type", type);
        message.addProperty("id", id);
        message.addProperty("ok", true);
        message.add("payload", payload != null ? payload : JsonNull.INSTANCE);
        return message;
    }

    public static JsonObject failure(String type, String id, GatewayException error) {
        JsonObject message = new JsonObject();
        message.addProperty("type", type);
        message.addProperty("id", id);
        message.addProperty("ok", false);
        message.addProperty("error", error.getMessage());
        message.addProperty("code", error.getCode());
        return message;
    }

    public static JsonObject error(String error) {
        JsonObject message = new JsonObject();
        message.addProperty("type", TYPE_ERROR);
        message.addProperty("error", error);
        return message;
    }

    /**
     * Builds an event message. Used in both directions.
     */
    public static JsonObject event(GatewayEvent event) {
        JsonObject message = new JsonObject();
        message.addProperty("type", TYPE_EVENT);
        message.addProperty("event", event.getType());
        message.add("payload", event.getPayload());
        message.addProperty("timestamp", event.getTimestamp());
        addIfPresent(message, "origin", event.getOrigin());
        addIfPresent(message, "source", event.getSource());
        addIfPresent(message, "sessionId", event.getSessionId());
        addIfPresent(message, "connectionId", event.getConnectionId());
        if (!event.getTags().isEmpty()) {
            message.add("tags", GSON.toJsonTree(event.getTags()));
        }
        return message;
    }

    /**
     * Reads an event message.
     *
     * @param message the message
     * @param origin overrides the origin carried in the message when not null
     */
    public static GatewayEvent readEvent(JsonObject message, String origin) {
        GatewayEvent.Builder builder = GatewayEvent.builder(getString(message, "event"))
            .payload(message.get("payload"))
            .origin(origin != null ? origin : getString(message, "origin"))
            .source(getString(message, "source"))
            .sessionId(getString(message, "sessionId"))
            .connectionId(getString(message, "connectionId"))
            .tags(getStringList(message, "tags"));
        JsonElement timestamp = message.get("timestamp");
        if (timestamp != null && timestamp.isJsonPrimitive() && timestamp.getAsJsonPrimitive().isNumber()) {
            builder.timestamp(timestamp.getAsLong());
        }
        return builder.build();
    }

    public static JsonObject register(ExtensionRegistration registration) {
        JsonObject extension = new JsonObject();
        extension.addProperty("id", registration.id());
        extension.addProperty("name", registration.name());
        JsonArray methods = new JsonArray();
        for (MethodDefinition method : registration.methods()) {
            JsonObject definition = new JsonObject();
            definition.addProperty("name", method.name());
            definition.addProperty("description", method.description());
            definition.add("inputSchema", method.inputSchema().toJson());
            methods.add(definition);
        }
        extension.add("methods", methods);
        extension.add("events", GSON.toJsonTree(registration.events()));
        extension.add("sourceRoutes", GSON.toJsonTree(registration.sourceRoutes()));

        JsonObject message = new JsonObject();
        message.addProperty("type", TYPE_REGISTER);
        message.add("extension", extension);
        return message;
    }

    /**
     * Reads the registration carried by a register message.
     *
     * @throws IllegalArgumentException if the message has no extension object
     */
    public static ExtensionRegistration readRegistration(JsonObject message) {
        JsonElement element = message.get("extension");
        if (element == null || !element.isJsonObject()) {
            throw new IllegalArgumentException("register message has no extension object");
        }
        JsonObject extension = element.getAsJsonObject();
        List<MethodDefinition> methods = new ArrayList<>();
        JsonElement methodsElement = extension.get("methods");
        if (methodsElement != null && methodsElement.isJsonArray()) {
            for (JsonElement methodElement : methodsElement.getAsJsonArray()) {
                JsonObject method = methodElement.getAsJsonObject();
                methods.add(new MethodDefinition(getString(method, "name"), getString(method, "description"),
                    MethodSchema.fromJson(method.get("inputSchema"))));
            }
        }
        return new ExtensionRegistration(getString(extension, "id"), getString(extension, "name"), methods,
            getStringList(extension, "events"), getStringList(extension, "sourceRoutes"));
    }

    /**
     * Reads trace metadata, filling in a fresh trace id and the given default deadline when absent.
     */
    public static CallContext readCallContext(JsonObject message, long defaultTimeoutMs) {
        String traceId = getString(message, "traceId");
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString();
        }
        int depth = Math.max(0, getInt(message, "depth"));
        long deadlineMs = getLong(message, "deadlineMs");
        if (deadlineMs <= 0) {
            deadlineMs = System.currentTimeMillis() + defaultTimeoutMs;
        }
        return new CallContext(traceId, depth, deadlineMs);
    }

    /**
     * Reads the error of a failed response, keeping its code when one was sent.
     */
    public static GatewayException readError(JsonObject message) {
        String error = getString(message, "error");
        String code = getString(message, "code");
        String text = error != null ? error : "Unknown error";
        if (code == null || code.equals(ExtensionCallException.CODE)) {
            return new ExtensionCallException(text);
        }
        return new GatewayException(code, text);
    }

    public static boolean isOk(JsonObject message) {
        JsonElement ok = message.get("ok");
        return ok != null && ok.isJsonPrimitive() && ok.getAsJsonPrimitive().isBoolean() && ok.getAsBoolean();
    }

    public static JsonObject getObject(JsonObject message, String field) {
        JsonElement value = message.get(field);
        return value != null && value.isJsonObject() ? value.getAsJsonObject() : new JsonObject();
    }

    public static String getString(JsonObject message, String field) {
        JsonElement value = message.get(field);
        if (value == null || !value.isJsonPrimitive()) {
            return null;
        }
        return value.getAsString();
    }

    private static int getInt(JsonObject message, String field) {
        JsonElement value = message.get(field);
        return value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber() ? value.getAsInt() : 0;
    }

    private static long getLong(JsonObject message, String field) {
        JsonElement value = message.get(field);
        return value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber() ? value.getAsLong() : 0L;
    }

    private static List<String> getStringList(JsonObject message, String field) {
        List<String> values = new ArrayList<>();
        JsonElement value = message.get(field);
        if (value != null && value.isJsonArray()) {
            value.getAsJsonArray().forEach(e -> {
                if (e.isJsonPrimitive()) {
                    values.add(e.getAsString());
                }
            });
        }
        return values;
    }

    private static void writeCallContext(JsonObject message, CallContext callContext) {
        if (callContext != null) {
            message.addProperty("traceId", callContext.traceId());
            message.addProperty("depth", callContext.depth());
            message.addProperty("deadlineMs", callContext.deadlineMs());
        }
    }

    private static void addIfPresent(JsonObject message, String field, String value) {
        if (value != null) {
            message.addProperty(field, value);
        }
    }
}
