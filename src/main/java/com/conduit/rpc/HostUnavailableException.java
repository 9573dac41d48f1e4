package com.conduit.rpc;

/**
 * Thrown when an out-of-process extension host is not running.
 */
public class HostUnavailableException extends GatewayException {
    
    public static final String CODE = "HOST_UNAVAILABLE";
    
    public HostUnavailableException(String extensionId) {
        super(CODE, String.format("Extension host %s is not running", extensionId));
    }
    
    public HostUnavailableException(String extensionId, String reason) {
        super(CODE, String.format("Extension host %s is unavailable: %s", extensionId, reason));
    }
}
