package com.conduit.rpc;

/**
 * Exception thrown when a call does not complete before its deadline.
 */
public class RpcTimeoutException extends GatewayException {
    
    public static final String CODE = "TIMEOUT";
    
    public RpcTimeoutException(String message) {
        super(CODE, message);
    }
}
