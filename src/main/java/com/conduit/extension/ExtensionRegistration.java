package com.conduit.extension;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Registration data for an extension: its identity and what it provides.
 *
 * @param id unique extension id
 * @param name display name
 * @param methods the methods this extension exposes, in declaration order
 * @param events event patterns this extension may emit (documentation only)
 * @param sourceRoutes channel prefixes this extension owns
 */
public record ExtensionRegistration(
    String id,
    String name,
    List<MethodDefinition> methods,
    List<String> events,
    List<String> sourceRoutes
) {

    private static final Pattern EXTENSION_ID_PATTERN = Pattern.compile("^[a-z][a-z0-9_-]{0,63}$");

    public ExtensionRegistration {
        methods = methods != null ? List.copyOf(methods) : List.of();
        events = events != null ? List.copyOf(events) : List.of();
        sourceRoutes = sourceRoutes != null ? List.copyOf(sourceRoutes) : List.of();
        if (name == null || name.isBlank()) {
            name = id;
        }
    }

    /**
     * Builds the registration for a local extension.
     *
     * @param extension the extension
     * @param sourceRouteOverride routes from configuration, or null to use the extension's own
     */
    public static ExtensionRegistration of(Extension extension, List<String> sourceRouteOverride) {
        List<String> routes = sourceRouteOverride != null ? sourceRouteOverride : extension.sourceRoutes();
        return new ExtensionRegistration(extension.id(), extension.name(), extension.methods(),
            extension.events(), routes);
    }

    /**
     * Validates that this registration follows the required format.
     *
     * @throws ExtensionRegistrationException if the registration is invalid
     */
    public void validate() {
        if (id == null || !EXTENSION_ID_PATTERN.matcher(id).matches()) {
            throw new ExtensionRegistrationException(
                String.format("Extension ID '%s' must match pattern %s", id, EXTENSION_ID_PATTERN.pattern()));
        }

        Set<String> seen = new HashSet<>();
        for (MethodDefinition method : methods) {
            if (!seen.add(method.name())) {
                throw new ExtensionRegistrationException(
                    String.format("Extension declares method '%s' more than once", method.name()), id);
            }
        }

        for (String prefix : sourceRoutes) {
            if (prefix == null || prefix.isBlank() || prefix.contains("/")) {
                throw new ExtensionRegistrationException(
                    String.format("Invalid source route prefix '%s'", prefix), id);
            }
        }
    }

    /**
     * Gets the declared method names in declaration order.
     */
    public List<String> methodNames() {
        return methods.stream().map(MethodDefinition::name).collect(Collectors.toList());
    }
}
