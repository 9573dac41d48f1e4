package com.conduit.config;

import com.google.gson.JsonObject;

import java.util.List;

/**
 * Settings for one configured extension.
 *
 * @param id the extension id (the key in the configuration file)
 * @param enabled whether the gateway loads it
 * @param className the {@link com.conduit.extension.Extension} implementation
 * @param outOfProcess whether it runs in an extension host process
 * @param command launcher for the host process, or empty for the default Java launcher
 * @param sourceRoutes routes overriding the extension's own, or null to keep them
 * @param config the extension's own configuration, passed through untouched
 */
public record ExtensionConfig(
    String id,
    boolean enabled,
    String className,
    boolean outOfProcess,
    List<String> command,
    List<String> sourceRoutes,
    JsonObject config
) {

    public ExtensionConfig {
        command = command != null ? List.copyOf(command) : List.of();
        sourceRoutes = sourceRoutes != null ? List.copyOf(sourceRoutes) : null;
        config = config != null ? config.deepCopy() : new JsonObject();
    }

    @Override
    public JsonObject config() {
        return config.deepCopy();
    }
}
