package com.conduit.extension;

import com.conduit.events.GatewayEvent;
import com.conduit.schema.MethodSchema;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Configurable in-process extension for tests.
 */
public class TestExtension extends AbstractExtension {

    private final List<String> routes = new ArrayList<>();
    public final List<GatewayEvent> sourceResponses = new CopyOnWriteArrayList<>();
    public volatile Exception startFailure;
    public volatile HealthStatus healthStatus = HealthStatus.healthy();
    public volatile int startCount;
    public volatile int stopCount;
    public volatile JsonObject startConfig;

    public TestExtension(String id) {
        super(id, id + " extension");
    }

    public TestExtension withMethod(String name, MethodHandler handler) {
        return withMethod(name, MethodSchema.empty(), handler);
    }

    public TestExtension withMethod(String name, MethodSchema schema, MethodHandler handler) {
        method(name, "test method " + name, schema, handler);
        return this;
    }

    public TestExtension withRoutes(String... prefixes) {
        routes.addAll(List.of(prefixes));
        return this;
    }

    @Override
    public List<String> sourceRoutes() {
        return routes;
    }

    @Override
    protected void onStart(ExtensionContext context) throws Exception {
        startConfig = context.config();
        if (startFailure != null) {
            throw startFailure;
        }
        startCount++;
    }

    @Override
    protected void onStop() {
        stopCount++;
    }

    @Override
    public void handleSourceResponse(String source, GatewayEvent event) {
        sourceResponses.add(event);
    }

    @Override
    public HealthStatus health() {
        return healthStatus;
    }

    public ExtensionContext ctx() {
        return context();
    }
}
