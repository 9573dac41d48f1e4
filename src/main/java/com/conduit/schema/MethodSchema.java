package com.conduit.schema;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Input schema for an extension method.
 *
 * Defines the expected params, their types and whether they are required. Validation
 * collects every problem instead of stopping at the first one.
 */
public class MethodSchema {

    private static final MethodSchema EMPTY = new MethodSchema(Map.of(), false);

    private final Map<String, FieldDefinition> fields;
    private final boolean strict;

    private MethodSchema(Map<String, FieldDefinition> fields, boolean strict) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        this.strict = strict;
    }

    /**
     * A schema accepting any params.
     */
    public static MethodSchema empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Validates params against the schema.
     *
     * @param params the params to validate, null is treated as an empty object
     * @return every problem found, in field declaration order; empty when valid
     */
    public List<String> validate(JsonObject params) {
        JsonObject actual = params != null ? params : new JsonObject();
        List<String> problems = new ArrayList<>();

        for (Map.Entry<String, FieldDefinition> entry : fields.entrySet()) {
            String fieldName = entry.getKey();
            FieldDefinition fieldDef = entry.getValue();
            JsonElement value = actual.get(fieldName);

            if (value == null || value.isJsonNull()) {
                if (fieldDef.required()) {
                    problems.add(String.format("missing required field '%s'", fieldName));
                }
                continue;
            }

            if (!fieldDef.type().isValid(value)) {
                problems.add(String.format("field '%s' expected %s, got %s",
                    fieldName, fieldDef.type().label(), describe(value)));
            }
        }

        if (strict) {
            for (String key : actual.keySet()) {
                if (!fields.containsKey(key)) {
                    problems.add(String.format("unknown field '%s'", key));
                }
            }
        }

        return problems;
    }

    /**
     * Gets all field definitions in declaration order.
     */
    public Map<String, FieldDefinition> getFields() {
        return fields;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Serializes the schema for discovery and for the host registration message.
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("type", "object");
        JsonObject properties = new JsonObject();
        com.google.gson.JsonArray required = new com.google.gson.JsonArray();
        for (Map.Entry<String, FieldDefinition> entry : fields.entrySet()) {
            JsonObject property = new JsonObject();
            property.addProperty("type", entry.getValue().type().label());
            if (entry.getValue().description() != null) {
                property.addProperty("description", entry.getValue().description());
            }
            properties.add(entry.getKey(), property);
            if (entry.getValue().required()) {
                required.add(entry.getKey());
            }
        }
        json.add("properties", properties);
        json.add("required", required);
        json.addProperty("additionalProperties", !strict);
        return json;
    }

    /**
     * Reads a schema produced by {@link #toJson()}. Unknown type names become
     * {@link FieldType#ANY}; anything unreadable yields an empty schema.
     */
    public static MethodSchema fromJson(JsonElement element) {
        if (element == null || !element.isJsonObject()) {
            return EMPTY;
        }
        JsonObject json = element.getAsJsonObject();
        JsonElement propertiesElement = json.get("properties");
        if (propertiesElement == null || !propertiesElement.isJsonObject()) {
            return EMPTY;
        }

        List<String> required = new ArrayList<>();
        JsonElement requiredElement = json.get("required");
        if (requiredElement != null && requiredElement.isJsonArray()) {
            requiredElement.getAsJsonArray().forEach(e -> required.add(e.getAsString()));
        }

        Builder builder = builder();
        for (Map.Entry<String, JsonElement> property : propertiesElement.getAsJsonObject().entrySet()) {
            FieldType type = FieldType.ANY;
            String description = null;
            if (property.getValue().isJsonObject()) {
                JsonObject definition = property.getValue().getAsJsonObject();
                if (definition.has("type")) {
                    type = FieldType.fromLabel(definition.get("type").getAsString());
                }
                if (definition.has("description")) {
                    description = definition.get("description").getAsString();
                }
            }
            builder.field(property.getKey(), new FieldDefinition(type, required.contains(property.getKey()), description));
        }

        JsonElement additional = json.get("additionalProperties");
        builder.strict(additional != null && additional.isJsonPrimitive() && !additional.getAsBoolean());
        return builder.build();
    }

    private static String describe(JsonElement value) {
        if (value.isJsonObject()) {
            return "object";
        }
        if (value.isJsonArray()) {
            return "array";
        }
        JsonPrimitive primitive = value.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return "boolean";
        }
        if (primitive.isNumber()) {
            return "number";
        }
        return "string";
    }

    /**
     * Definition of a single param.
     */
    public record FieldDefinition(FieldType type, boolean required, String description) {

        public FieldDefinition {
            if (type == null) {
                throw new IllegalArgumentException("Field type is required");
            }
        }
    }

    /**
     * Builder for method schemas.
     */
    public static class Builder {
        private final Map<String, FieldDefinition> fields = new LinkedHashMap<>();
        private boolean strict = false;

        public Builder required(String name, FieldType type) {
            return field(name, new FieldDefinition(type, true, null));
        }

        public Builder optional(String name, FieldType type) {
            return field(name, new FieldDefinition(type, false, null));
        }

        public Builder field(String name, FieldDefinition definition) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Field name cannot be null or empty");
            }
            if (fields.putIfAbsent(name, definition) != null) {
                throw new IllegalArgumentException("Duplicate field: " + name);
            }
            return this;
        }

        /**
         * Rejects params that are not declared in the schema.
         */
        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public MethodSchema build() {
            return new MethodSchema(fields, strict);
        }
    }

    /**
     * Supported param types.
     */
    public enum FieldType {
        STRING,
        NUMBER,
        BOOLEAN,
        OBJECT,
        ARRAY,
        ANY;

        public boolean isValid(JsonElement value) {
            if (value == null || value.isJsonNull()) {
                return false;
            }
            return switch (this) {
                case STRING -> value.isJsonPrimitive() && value.getAsJsonPrimitive().isString();
                case NUMBER -> value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber();
                case BOOLEAN -> value.isJsonPrimitive() && value.getAsJsonPrimitive().isBoolean();
                case OBJECT -> value.isJsonObject();
                case ARRAY -> value.isJsonArray();
                case ANY -> true;
            };
        }

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }

        static FieldType fromLabel(String label) {
            for (FieldType type : values()) {
                if (type.label().equals(label)) {
                    return type;
                }
            }
            return ANY;
        }
    }
}
