package com.conduit.extension;

/**
 * Exception thrown when an extension fails to start.
 * 
 * Wraps the raw failure with the id of the extension that raised it.
 */
public class ExtensionStartException extends ExtensionRegistrationException {
    
    private final String extensionId;
    
    public ExtensionStartException(String extensionId, String message) {
        super(String.format("Extension start failed for '%s': %s", extensionId, message));
        this.extensionId = extensionId;
    }
    
    public ExtensionStartException(String extensionId, Throwable cause) {
        super(String.format("Extension start failed for '%s': %s", extensionId, cause.getMessage()), cause);
        this.extensionId = extensionId;
    }
    
    public String getExtensionId() {
        return extensionId;
    }
}
