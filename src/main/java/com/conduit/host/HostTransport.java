package com.conduit.host;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Line-oriented channel to one extension host process.
 *
 * A transport is started once; restarting a host creates a new transport.
 */
public interface HostTransport {

    /**
     * Starts the child and begins delivering its output to the listener.
     *
     * @throws IOException if the child cannot be started
     */
    void start(Listener listener) throws IOException;

    /**
     * Queues one line for the child. Never blocks.
     *
     * @return false if the line was dropped because the outbound queue is full or the
     *     transport is closed
     */
    boolean send(String line);

    /**
     * Closes the child's input, asking it to shut down on its own.
     */
    void closeInput();

    /**
     * Asks the child to terminate.
     */
    void terminate();

    /**
     * Terminates the child immediately.
     */
    void destroyForcibly();

    boolean isAlive();

    /**
     * Completes with the exit code once the child has exited.
     */
    CompletableFuture<Integer> onExit();

    /**
     * Receives the child's output.
     */
    interface Listener {

        /**
         * Called for every non-blank line the child writes to its protocol stream.
         */
        void onLine(String line);

        /**
         * Called with diagnostic output from the child.
         */
        void onDiagnostic(String text);
    }

    /**
     * Creates a fresh transport for every (re)start of a host.
     */
    @FunctionalInterface
    interface Factory {
        HostTransport create();
    }
}
