package com.conduit.extension;

/**
 * Thrown when a method name is already owned by another extension.
 */
public class DuplicateMethodException extends ExtensionRegistrationException {
    
    private final String method;
    private final String ownerId;
    
    public DuplicateMethodException(String method, String ownerId, String extensionId) {
        super("Method '" + method + "' already registered by extension '" + ownerId + "'", extensionId);
        this.method = method;
        this.ownerId = ownerId;
    }
    
    public String getMethod() {
        return method;
    }
    
    /**
     * Gets the id of the extension that currently owns the method.
     */
    public String getOwnerId() {
        return ownerId;
    }
}
