package com.conduit.rpc;

import java.util.List;

/**
 * Thrown when method params fail schema validation.
 * The message enumerates every problem field, not just the first.
 */
public class ParamValidationException extends GatewayException {
    
    public static final String CODE = "VALIDATION_ERROR";
    
    private final String method;
    private final List<String> problems;
    
    public ParamValidationException(String method, List<String> problems) {
        super(CODE, String.format("Invalid params for %s: %s", method, String.join("; ", problems)));
        this.method = method;
        this.problems = List.copyOf(problems);
    }
    
    public String getMethod() {
        return method;
    }
    
    /**
     * Gets the individual validation problems, in schema order.
     */
    public List<String> getProblems() {
        return problems;
    }
}
