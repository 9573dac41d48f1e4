package com.conduit.host;

/**
 * Lifecycle state of an extension host process.
 */
public enum HostState {
    
    /**
     * Not started yet.
     */
    NEW,
    
    /**
     * Child spawned, waiting for its registration.
     */
    STARTING,
    
    /**
     * Child registered and serving calls.
     */
    RUNNING,
    
    /**
     * Child exited unexpectedly; a restart is scheduled.
     */
    RESTARTING,
    
    /**
     * Stopped on request. Never restarted automatically.
     */
    STOPPED,
    
    /**
     * Could not be started, or exceeded its restart budget.
     */
    FAILED;
    
    /**
     * Returns true if the host accepts calls in this state.
     */
    public boolean isOperational() {
        return this == STARTING || this == RUNNING;
    }
    
    /**
     * Returns true if the host will not come back without an explicit restart.
     */
    public boolean isTerminal() {
        return this == STOPPED || this == FAILED;
    }
}
