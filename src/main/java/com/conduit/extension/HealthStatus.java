package com.conduit.extension;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of an extension health check.
 *
 * @param ok whether the extension considers itself healthy
 * @param details free-form diagnostic details
 */
public record HealthStatus(boolean ok, Map<String, Object> details) {

    public HealthStatus {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus healthy() {
        return new HealthStatus(true, Map.of());
    }

    public static HealthStatus unhealthy(String status) {
        return new HealthStatus(false, Map.of("status", status));
    }
}
