package com.conduit.server;

import com.conduit.extension.ExtensionManager;
import com.conduit.extension.HealthStatus;
import com.google.gson.Gson;
import com.google.gson.JsonObject;

import java.util.Map;

/**
 * Builds the gateway health document served at {@code /health} and by {@code gateway.health}.
 */
public class HealthReport {

    private static final Gson GSON = new Gson();

    private final ExtensionManager manager;
    private final ConnectionRegistry connections;

    public HealthReport(ExtensionManager manager, ConnectionRegistry connections) {
        this.manager = manager;
        this.connections = connections;
    }

    public JsonObject build() {
        JsonObject report = new JsonObject();
        report.addProperty("status", "ok");
        report.addProperty("clients", connections.size());

        JsonObject extensions = new JsonObject();
        for (Map.Entry<String, HealthStatus> entry : manager.getHealth().entrySet()) {
            JsonObject status = new JsonObject();
            status.addProperty("ok", entry.getValue().ok());
            status.add("details", GSON.toJsonTree(entry.getValue().details()));
            extensions.add(entry.getKey(), status);
        }
        report.add("extensions", extensions);
        report.add("sourceRoutes", GSON.toJsonTree(manager.getSourceRoutes()));
        return report;
    }
}
