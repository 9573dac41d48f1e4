package com.conduit.server;

import com.conduit.events.GatewayEvent;
import com.conduit.rpc.GatewayException;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

/**
 * Messages of the client WebSocket protocol.
 */
final class ProtocolMessages {

    static final String TYPE_REQUEST = "req";
    static final String TYPE_RESPONSE = "res";
    static final String TYPE_EVENT = "event";

    private static final Gson GSON = new Gson();

    private ProtocolMessages() {
    }

    static String serialize(JsonObject message) {
        return GSON.toJson(message);
    }

    static JsonObject success(String id, JsonElement payload) {
        JsonObject response = new JsonObject();
        response.addProperty("type", TYPE_RESPONSE);
        response.addProperty("id", id);
        response.addProperty("ok", true);
        response.add("payload", payload != null ? payload : JsonNull.INSTANCE);
        return response;
    }

    static JsonObject failure(String id, GatewayException error) {
        JsonObject response = new JsonObject();
        response.addProperty("type", TYPE_RESPONSE);
        response.addProperty("id", id);
        response.addProperty("ok", false);
        response.addProperty("error", error.getMessage());
        response.addProperty("code", error.getCode());
        return response;
    }

    static JsonObject event(GatewayEvent event) {
        JsonObject message = new JsonObject();
        message.addProperty("type", TYPE_EVENT);
        message.addProperty("event", event.getType());
        message.add("payload", event.getPayload());
        return message;
    }
}
