package com.conduit.extension;

import com.conduit.schema.MethodSchema;

/**
 * Declaration of a method an extension exposes.
 *
 * @param name the fully-qualified method name, e.g. {@code "voice.speak"}
 * @param description human-readable description for discovery
 * @param inputSchema the params schema; never null
 */
public record MethodDefinition(String name, String description, MethodSchema inputSchema) {

    public MethodDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Method name cannot be null or empty");
        }
        if (description == null) {
            description = "";
        }
        if (inputSchema == null) {
            inputSchema = MethodSchema.empty();
        }
    }

    public static MethodDefinition of(String name, String description) {
        return new MethodDefinition(name, description, MethodSchema.empty());
    }
}
