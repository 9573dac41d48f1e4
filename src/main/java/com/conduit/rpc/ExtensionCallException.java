package com.conduit.rpc;

/**
 * Wraps a failure raised by an extension while handling a method.
 */
public class ExtensionCallException extends GatewayException {
    
    public static final String CODE = "EXTENSION_ERROR";
    
    public ExtensionCallException(String message) {
        super(CODE, message);
    }
    
    public ExtensionCallException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
