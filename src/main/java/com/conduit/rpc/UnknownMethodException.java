package com.conduit.rpc;

/**
 * Thrown when no registered extension owns a method.
 */
public class UnknownMethodException extends GatewayException {
    
    public static final String CODE = "UNKNOWN_METHOD";
    
    private final String method;
    
    public UnknownMethodException(String method) {
        super(CODE, "Unknown method: " + method);
        this.method = method;
    }
    
    public String getMethod() {
        return method;
    }
}
