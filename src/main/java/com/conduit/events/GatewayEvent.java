package com.conduit.events;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;

import java.util.List;
import java.util.Objects;

/**
 * An event flowing through the gateway.
 *
 * Events are immutable once constructed. The {@code origin} is the extension (or
 * {@code "gateway"}) that produced it, {@code source} an external channel address such
 * as {@code "imessage/+15551234567"}, and {@code connectionId} restricts client delivery
 * to a single connection.
 */
public final class GatewayEvent {

    private final String type;
    private final JsonElement payload;
    private final long timestamp;
    private final String origin;
    private final String source;
    private final String sessionId;
    private final String connectionId;
    private final List<String> tags;

    private GatewayEvent(Builder builder) {
        this.type = Objects.requireNonNull(builder.type, "type");
        this.payload = builder.payload != null ? builder.payload.deepCopy() : JsonNull.INSTANCE;
        this.timestamp = builder.timestamp != 0 ? builder.timestamp : System.currentTimeMillis();
        this.origin = builder.origin;
        this.source = builder.source;
        this.sessionId = builder.sessionId;
        this.connectionId = builder.connectionId;
        this.tags = builder.tags != null ? List.copyOf(builder.tags) : List.of();
    }

    public static Builder builder(String type) {
        return new Builder(type);
    }

    public static GatewayEvent of(String type, JsonElement payload) {
        return builder(type).payload(payload).build();
    }

    /**
     * Gets the dot-delimited event type (e.g., "session.abc.content_block_delta").
     */
    public String getType() {
        return type;
    }

    /**
     * Gets a copy of the payload; the event itself is never mutated.
     */
    public JsonElement getPayload() {
        return payload.deepCopy();
    }

    public long getTimestamp() {
        return timestamp;
    }

    public String getOrigin() {
        return origin;
    }

    public String getSource() {
        return source;
    }

    /**
     * Gets the session id, falling back to a string {@code sessionId} field of an
     * object payload.
     */
    public String getSessionId() {
        if (sessionId != null) {
            return sessionId;
        }
        if (payload.isJsonObject()) {
            JsonElement value = payload.getAsJsonObject().get("sessionId");
            if (value != null && value.isJsonPrimitive() && value.getAsJsonPrimitive().isString()) {
                return value.getAsString();
            }
        }
        return null;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public List<String> getTags() {
        return tags;
    }

    /**
     * Returns a builder pre-populated with this event's fields.
     */
    public Builder toBuilder() {
        return new Builder(type)
            .payload(payload)
            .timestamp(timestamp)
            .origin(origin)
            .source(source)
            .sessionId(sessionId)
            .connectionId(connectionId)
            .tags(tags);
    }

    @Override
    public String toString() {
        return String.format("GatewayEvent{type='%s', origin='%s', source='%s', timestamp=%d}",
            type, origin, source, timestamp);
    }

    /**
     * Builder for gateway events.
     */
    public static final class Builder {
        private final String type;
        private JsonElement payload;
        private long timestamp;
        private String origin;
        private String source;
        private String sessionId;
        private String connectionId;
        private List<String> tags;

        private Builder(String type) {
            this.type = type;
        }

        public Builder payload(JsonElement payload) {
            this.payload = payload;
            return this;
        }

        public Builder timestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder origin(String origin) {
            this.origin = origin;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder connectionId(String connectionId) {
            this.connectionId = connectionId;
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public GatewayEvent build() {
            return new GatewayEvent(this);
        }
    }
}
