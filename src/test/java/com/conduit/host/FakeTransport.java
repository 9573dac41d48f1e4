package com.conduit.host;

import com.google.gson.JsonObject;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory transport: records what the gateway sends and lets a test play the child.
 */
class FakeTransport implements HostTransport {

    final List<String> sent = new CopyOnWriteArrayList<>();
    private final CompletableFuture<Integer> exit = new CompletableFuture<>();
    private volatile Listener listener;
    private volatile boolean alive;
    volatile boolean acceptSends = true;
    volatile boolean inputClosed;
    volatile boolean terminated;
    volatile boolean destroyed;
    volatile boolean exitOnTerminate = true;
    IOException startFailure;
    private final Queue<FakeTransport> started;

    FakeTransport() {
        this(null);
    }

    /**
     * @param started receives this transport once it has been started
     */
    FakeTransport(Queue<FakeTransport> started) {
        this.started = started;
    }

    @Override
    public void start(Listener listener) throws IOException {
        if (startFailure != null) {
            throw startFailure;
        }
        this.listener = listener;
        this.alive = true;
        if (started != null) {
            started.add(this);
        }
    }

    @Override
    public boolean send(String line) {
        if (!acceptSends || !alive) {
            return false;
        }
        sent.add(line);
        return true;
    }

    @Override
    public void closeInput() {
        inputClosed = true;
    }

    @Override
    public void terminate() {
        terminated = true;
        if (exitOnTerminate) {
            exit(143);
        }
    }

    @Override
    public void destroyForcibly() {
        destroyed = true;
        exit(137);
    }

    @Override
    public boolean isAlive() {
        return alive;
    }

    @Override
    public CompletableFuture<Integer> onExit() {
        return exit;
    }

    void exit(int code) {
        alive = false;
        exit.complete(code);
    }

    void reply(JsonObject message) {
        listener.onLine(HostMessages.serialize(message));
    }

    void replyRaw(String line) {
        listener.onLine(line);
    }

    List<JsonObject> sentOfType(String type) {
        List<JsonObject> messages = new ArrayList<>();
        for (String line : sent) {
            JsonObject message = HostMessages.parse(line);
            if (message != null && type.equals(HostMessages.getString(message, "type"))) {
                messages.add(message);
            }
        }
        return messages;
    }

    /**
     * Waits until at least {@code count} messages of a type have been sent.
     */
    List<JsonObject> awaitSent(String type, int count) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2000;
        List<JsonObject> messages = sentOfType(type);
        while (messages.size() < count && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
            messages = sentOfType(type);
        }
        return messages;
    }

    JsonObject lastSent() {
        return HostMessages.parse(sent.get(sent.size() - 1));
    }
}
