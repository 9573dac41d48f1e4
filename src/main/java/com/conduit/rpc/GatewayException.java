package com.conduit.rpc;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Base exception for failed gateway calls.
 *
 * Every failure carries a stable code that is reported to clients alongside the message.
 */
public class GatewayException extends Exception {
    
    private final String code;
    
    public GatewayException(String code, String message) {
        super(message);
        this.code = code;
    }
    
    public GatewayException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
    
    public String getCode() {
        return code;
    }
    
    /**
     * Converts the failure of a future into a gateway exception.
     * 
     * Completion wrappers are unwrapped; anything that is not already a gateway
     * exception is reported as an extension error.
     * 
     * @param failure the failure, possibly wrapped
     * @return the gateway exception to report
     */
    public static GatewayException from(Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
            && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof GatewayException gatewayException) {
            return gatewayException;
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ExtensionCallException(message, cause);
    }
    
    @Override
    public String toString() {
        return "GatewayException{" +
               "code='" + code + '\'' +
               ", message='" + getMessage() + '\'' +
               '}';
    }
}
