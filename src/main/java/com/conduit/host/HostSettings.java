package com.conduit.host;

import java.time.Duration;

/**
 * Timing and capacity limits for an extension host process.
 *
 * @param requestTimeout upper bound for a call forwarded to the child
 * @param registrationTimeout how long to wait for the child's register message
 * @param restartDelay pause before restarting a child that exited unexpectedly
 * @param maxRestarts restarts allowed before the host gives up
 * @param killGracePeriod how long a graceful kill waits before forcing the child down
 * @param maxInFlightCalls nested calls from the child allowed at once
 */
public record HostSettings(
    Duration requestTimeout,
    Duration registrationTimeout,
    Duration restartDelay,
    int maxRestarts,
    Duration killGracePeriod,
    int maxInFlightCalls
) {

    public static final HostSettings DEFAULTS = new HostSettings(
        Duration.ofMinutes(5),
        Duration.ofSeconds(10),
        Duration.ofSeconds(2),
        5,
        Duration.ofSeconds(5),
        50
    );
}
