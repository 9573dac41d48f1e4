package com.conduit.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gateway configuration.
 *
 * @param host the interface the server binds to
 * @param port the server port
 * @param extensions extension settings by extension id, in file order
 */
public record GatewayConfig(String host, int port, Map<String, ExtensionConfig> extensions) {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 30086;

    public GatewayConfig {
        if (host == null || host.isBlank()) {
            host = DEFAULT_HOST;
        }
        extensions = extensions != null ? Collections.unmodifiableMap(new LinkedHashMap<>(extensions)) : Map.of();
    }

    public static GatewayConfig defaults() {
        return new GatewayConfig(DEFAULT_HOST, DEFAULT_PORT, Map.of());
    }
}
