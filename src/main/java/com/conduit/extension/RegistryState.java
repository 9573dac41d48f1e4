package com.conduit.extension;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of everything registered with the manager.
 *
 * Extensions are kept in registration order; re-registering an id moves it to the end.
 * The method table and the source-route table are derived from that order, so the most
 * recently registered claimant of a route prefix owns it.
 */
final class RegistryState {

    static final RegistryState EMPTY = new RegistryState(new LinkedHashMap<>());

    private final Map<String, ExtensionHandle> extensions;
    private final Map<String, MethodEntry> methods;
    private final Map<String, String> sourceRoutes;

    private RegistryState(LinkedHashMap<String, ExtensionHandle> extensions) {
        Map<String, MethodEntry> methodTable = new LinkedHashMap<>();
        Map<String, String> routeTable = new LinkedHashMap<>();
        for (ExtensionHandle handle : extensions.values()) {
            for (MethodDefinition method : handle.registration().methods()) {
                methodTable.put(method.name(), new MethodEntry(method, handle));
            }
            for (String prefix : handle.registration().sourceRoutes()) {
                routeTable.remove(prefix);
                routeTable.put(prefix, handle.id());
            }
        }
        this.extensions = Collections.unmodifiableMap(extensions);
        this.methods = Collections.unmodifiableMap(methodTable);
        this.sourceRoutes = Collections.unmodifiableMap(routeTable);
    }

    /**
     * Returns a new state with the handle added, superseding any handle under the same id.
     */
    RegistryState with(ExtensionHandle handle) {
        LinkedHashMap<String, ExtensionHandle> next = new LinkedHashMap<>(extensions);
        next.remove(handle.id());
        next.put(handle.id(), handle);
        return new RegistryState(next);
    }

    /**
     * Returns a new state without the given id, or this state if it is not registered.
     */
    RegistryState without(String extensionId) {
        if (!extensions.containsKey(extensionId)) {
            return this;
        }
        LinkedHashMap<String, ExtensionHandle> next = new LinkedHashMap<>(extensions);
        next.remove(extensionId);
        return new RegistryState(next);
    }

    /**
     * Finds the first method of a registration already owned by a different extension.
     *
     * @return the conflicting entry, or null when there is none
     */
    MethodEntry findConflict(ExtensionRegistration registration) {
        for (MethodDefinition method : registration.methods()) {
            MethodEntry existing = methods.get(method.name());
            if (existing != null && !existing.extensionId().equals(registration.id())) {
                return existing;
            }
        }
        return null;
    }

    ExtensionHandle extension(String extensionId) {
        return extensions.get(extensionId);
    }

    Collection<ExtensionHandle> extensions() {
        return extensions.values();
    }

    MethodEntry method(String name) {
        return methods.get(name);
    }

    Collection<MethodEntry> methods() {
        return methods.values();
    }

    String routeOwner(String prefix) {
        return sourceRoutes.get(prefix);
    }

    Map<String, String> sourceRoutes() {
        return sourceRoutes;
    }

    /**
     * A method table entry.
     */
    record MethodEntry(MethodDefinition definition, ExtensionHandle handle) {

        String extensionId() {
            return handle.id();
        }
    }
}
