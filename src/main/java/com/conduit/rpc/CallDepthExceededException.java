package com.conduit.rpc;

/**
 * Thrown when a nested call chain goes deeper than {@link CallContext#MAX_DEPTH}.
 */
public class CallDepthExceededException extends GatewayException {
    
    public static final String CODE = "CALL_DEPTH_EXCEEDED";
    
    public CallDepthExceededException(int depth) {
        super(CODE, String.format("Call depth %d exceeds max (%d), possible cycle", depth, CallContext.MAX_DEPTH));
    }
}
