package com.conduit.extension;

import com.conduit.rpc.UnknownMethodException;
import com.conduit.schema.MethodSchema;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Convenience base for extensions that register their methods as handlers.
 * 
 * Subclasses declare methods in their constructor with {@link #method}; dispatch of
 * undeclared names fails with {@link UnknownMethodException}.
 */
public abstract class AbstractExtension implements Extension {
    
    private final String id;
    private final String name;
    private final Map<String, Registered> handlers = new LinkedHashMap<>();
    private volatile ExtensionContext context;
    
    protected AbstractExtension(String id, String name) {
        this.id = id;
        this.name = name;
    }
    
    /**
     * Declares a method and its handler.
     */
    protected final void method(String methodName, String description, MethodSchema schema, MethodHandler handler) {
        MethodDefinition definition = new MethodDefinition(methodName, description, schema);
        if (handlers.putIfAbsent(methodName, new Registered(definition, handler)) != null) {
            throw new IllegalArgumentException("Method already declared: " + methodName);
        }
    }
    
    @Override
    public String id() {
        return id;
    }
    
    @Override
    public String name() {
        return name;
    }
    
    @Override
    public List<MethodDefinition> methods() {
        List<MethodDefinition> definitions = new ArrayList<>();
        handlers.values().forEach(registered -> definitions.add(registered.definition));
        return Collections.unmodifiableList(definitions);
    }
    
    @Override
    public void start(ExtensionContext context) throws Exception {
        this.context = context;
        onStart(context);
    }
    
    @Override
    public void stop() throws Exception {
        onStop();
        this.context = null;
    }
    
    @Override
    public Object handleMethod(String method, JsonObject params) throws Exception {
        Registered registered = handlers.get(method);
        if (registered == null) {
            throw new UnknownMethodException(method);
        }
        return registered.handler.handle(params);
    }
    
    /**
     * Gets the context, or null when the extension is not running.
     */
    protected ExtensionContext context() {
        return context;
    }
    
    protected void onStart(ExtensionContext context) throws Exception {
    }
    
    protected void onStop() throws Exception {
    }
    
    /**
     * Handler for a single method.
     */
    @FunctionalInterface
    public interface MethodHandler {
        Object handle(JsonObject params) throws Exception;
    }
    
    private record Registered(MethodDefinition definition, MethodHandler handler) {}
}
