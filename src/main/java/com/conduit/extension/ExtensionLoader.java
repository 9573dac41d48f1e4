package com.conduit.extension;

import com.google.gson.JsonObject;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;

/**
 * Instantiates extensions by class name.
 *
 * A public constructor taking the extension's {@link JsonObject} configuration is
 * preferred; otherwise the public no-arg constructor is used.
 */
public final class ExtensionLoader {
    
    private ExtensionLoader() {
    }
    
    /**
     * Loads and instantiates an extension.
     * 
     * @param className fully-qualified class name
     * @param config the extension's configuration
     * @param classLoader the class loader to load from
     * @return the new, not yet started, extension
     * @throws ExtensionRegistrationException if the class cannot be loaded or instantiated
     */
    public static Extension load(String className, JsonObject config, ClassLoader classLoader) {
        Class<?> type;
        try {
            type = Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException e) {
            throw new ExtensionRegistrationException("Extension class not found: " + className, e);
        }
        if (!Extension.class.isAssignableFrom(type)) {
            throw new ExtensionRegistrationException(
                String.format("Class %s does not implement %s", className, Extension.class.getName()));
        }
        
        try {
            try {
                Constructor<?> withConfig = type.getConstructor(JsonObject.class);
                return (Extension) withConfig.newInstance(config != null ? config.deepCopy() : new JsonObject());
            } catch (NoSuchMethodException e) {
                return (Extension) type.getConstructor().newInstance();
            }
        } catch (NoSuchMethodException e) {
            throw new ExtensionRegistrationException(
                String.format("Extension class %s needs a public constructor taking JsonObject or no arguments", className), e);
        } catch (InvocationTargetException e) {
            throw new ExtensionRegistrationException(
                String.format("Constructor of %s failed: %s", className, e.getCause().getMessage()), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new ExtensionRegistrationException("Cannot instantiate extension class " + className, e);
        }
    }
    
    public static Extension load(String className, JsonObject config) {
        return load(className, config, Thread.currentThread().getContextClassLoader());
    }
}
