package com.conduit.host;

import com.conduit.events.GatewayEvent;
import com.conduit.extension.ExtensionHost;
import com.conduit.extension.ExtensionRegistration;
import com.conduit.rpc.CallContext;
import com.conduit.rpc.CallDepthExceededException;
import com.conduit.rpc.ExtensionCallException;
import com.conduit.rpc.GatewayException;
import com.conduit.rpc.HostUnavailableException;
import com.conduit.rpc.PendingCallRegistry;
import com.conduit.rpc.RpcTimeoutException;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Gateway-side supervisor of one out-of-process extension.
 *
 * Spawns the child through a {@link HostTransport}, waits for its registration,
 * correlates forwarded calls with their responses and restarts the child when it exits
 * unexpectedly. Nested calls made by the extension are routed back through the
 * {@link HostListener} after the depth, deadline and in-flight guardrails pass; they run
 * on a worker pool so that a slow callee never holds up the child's output.
 *
 * The supervisor's threads are released once the host is killed, force-killed or has
 * given up restarting. A released host cannot be started again.
 */
public class ExtensionHostProcess implements ExtensionHost {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExtensionHostProcess.class);

    private static final int MAX_DIAGNOSTIC_LENGTH = 500;
    private static final int MAX_LOGGED_LINE_LENGTH = 100;

    private final String extensionId;
    private final HostTransport.Factory transportFactory;
    private final HostListener listener;
    private final HostSettings settings;
    private final PendingCallRegistry pendingCalls;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService callExecutor;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicInteger restartCount = new AtomicInteger();
    private final AtomicInteger inFlightCalls = new AtomicInteger();

    private volatile HostTransport transport;
    private volatile HostState state = HostState.NEW;
    private volatile ExtensionRegistration registration;
    private CompletableFuture<ExtensionRegistration> pendingRegistration;

    public ExtensionHostProcess(String extensionId, HostTransport.Factory transportFactory, HostListener listener) {
        this(extensionId, transportFactory, listener, HostSettings.DEFAULTS);
    }

    public ExtensionHostProcess(String extensionId, HostTransport.Factory transportFactory, HostListener listener,
                                HostSettings settings) {
        this.extensionId = extensionId;
        this.transportFactory = transportFactory;
        this.listener = listener;
        this.settings = settings;
        this.pendingCalls = new PendingCallRegistry(extensionId);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "host-supervisor-" + extensionId);
            thread.setDaemon(true);
            return thread;
        });
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "host-calls-" + extensionId);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public String extensionId() {
        return extensionId;
    }

    /**
     * Spawns the child and waits for it to register.
     *
     * @return the registration; fails with {@link RpcTimeoutException} if the child does not
     *     register in time, or {@link HostUnavailableException} if it cannot be started or exits first
     */
    public CompletableFuture<ExtensionRegistration> start() {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new HostUnavailableException(extensionId, "host has been released"));
        }
        HostTransport next = transportFactory.create();
        CompletableFuture<ExtensionRegistration> registered = new CompletableFuture<>();
        synchronized (this) {
            if (pendingRegistration != null) {
                pendingRegistration.completeExceptionally(
                    new HostUnavailableException(extensionId, "superseded by a new start"));
            }
            transport = next;
            pendingRegistration = registered;
            state = HostState.STARTING;
        }

        LOGGER.info("Spawning extension host '{}'", extensionId);
        try {
            next.start(new TransportListener(next));
        } catch (IOException e) {
            LOGGER.error("Failed to spawn extension host '{}'", extensionId, e);
            synchronized (this) {
                if (transport == next) {
                    transport = null;
                    state = HostState.FAILED;
                }
            }
            registered.completeExceptionally(
                new HostUnavailableException(extensionId, "failed to start: " + e.getMessage()));
            return registered;
        }

        next.onExit().whenComplete((code, error) -> handleExit(next, code));

        long timeoutMs = settings.registrationTimeout().toMillis();
        ScheduledFuture<?> timer = scheduler.schedule(() -> {
            if (registered.completeExceptionally(new RpcTimeoutException(String.format(
                    "Extension host %s failed to register within %dms", extensionId, timeoutMs)))) {
                LOGGER.error("Extension host '{}' did not register within {}ms, terminating it", extensionId, timeoutMs);
                next.destroyForcibly();
            }
        }, timeoutMs, TimeUnit.MILLISECONDS);
        registered.whenComplete((result, error) -> timer.cancel(false));
        return registered;
    }

    @Override
    public CompletableFuture<JsonElement> callMethod(String method, JsonObject params, String connectionId,
                                                     CallContext callContext, List<String> tags) {
        HostTransport current = transport;
        if (current == null || !current.isAlive()) {
            return CompletableFuture.failedFuture(new HostUnavailableException(extensionId));
        }

        CallContext context = callContext != null ? callContext : CallContext.root(settings.requestTimeout());
        long timeoutMs = Math.min(context.remainingMillis(), settings.requestTimeout().toMillis());
        String id = UUID.randomUUID().toString();
        CompletableFuture<JsonElement> result = pendingCalls.register(id, method, timeoutMs);
        if (result.isDone()) {
            return result;
        }

        JsonObject request = HostMessages.request(id, method, params, connectionId, context, tags);
        if (!current.send(HostMessages.serialize(request))) {
            pendingCalls.reject(id, new HostUnavailableException(extensionId, "outbound queue full"));
        }
        return result;
    }

    @Override
    public void sendEvent(GatewayEvent event) {
        HostTransport current = transport;
        if (current == null) {
            LOGGER.debug("Extension host '{}' not running, dropping event {}", extensionId, event.getType());
            return;
        }
        current.send(HostMessages.serialize(HostMessages.event(event)));
    }

    @Override
    public CompletableFuture<Boolean> routeToSource(String source, GatewayEvent event) {
        JsonObject params = new JsonObject();
        params.addProperty("source", source);
        params.add("event", HostMessages.event(event));
        return callMethod(HostMessages.METHOD_SOURCE_RESPONSE, params, event.getConnectionId(), null, List.of())
            .thenApply(result -> true)
            .exceptionally(e -> {
                LOGGER.error("Failed to route to source {} via extension host '{}': {}", source, extensionId,
                    GatewayException.from(e).getMessage());
                return false;
            });
    }

    @Override
    public boolean isRunning() {
        HostTransport current = transport;
        return current != null && current.isAlive();
    }

    @Override
    public CompletableFuture<Void> kill() {
        return terminate("killed").whenComplete((ignored, error) -> close());
    }

    private CompletableFuture<Void> terminate(String reason) {
        HostTransport current = detach(reason);
        if (current == null) {
            return CompletableFuture.completedFuture(null);
        }
        if (closed.get()) {
            current.destroyForcibly();
            return CompletableFuture.completedFuture(null);
        }

        LOGGER.info("Stopping extension host '{}'", extensionId);
        current.closeInput();
        current.terminate();

        CompletableFuture<Void> done = new CompletableFuture<>();
        ScheduledFuture<?> force = scheduler.schedule(() -> {
            if (current.isAlive()) {
                LOGGER.warn("Extension host '{}' did not exit within {}ms, forcing", extensionId,
                    settings.killGracePeriod().toMillis());
                current.destroyForcibly();
            }
            done.complete(null);
        }, settings.killGracePeriod().toMillis(), TimeUnit.MILLISECONDS);
        current.onExit().whenComplete((code, error) -> {
            force.cancel(false);
            done.complete(null);
        });
        return done;
    }

    @Override
    public void forceKill() {
        HostTransport current = detach("force-killed");
        if (current != null) {
            current.destroyForcibly();
        }
        close();
    }

    @Override
    public CompletableFuture<ExtensionRegistration> restart() {
        LOGGER.info("Restarting extension host '{}'", extensionId);
        restartCount.set(0);
        return terminate("restarting").thenCompose(ignored -> start());
    }

    /**
     * Releases the supervisor's threads. Called automatically once the host is killed,
     * force-killed or gives up; idempotent.
     */
    public void close() {
        if (closed.compareAndSet(false, true)) {
            scheduler.shutdown();
            callExecutor.shutdown();
            pendingCalls.close();
            LOGGER.debug("Released extension host '{}'", extensionId);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    public HostState getState() {
        return state;
    }

    /**
     * Gets the most recent registration, or null before the first one.
     */
    public ExtensionRegistration getRegistration() {
        return registration;
    }

    public int getRestartCount() {
        return restartCount.get();
    }

    public int getInFlightCalls() {
        return inFlightCalls.get();
    }

    public int getPendingCallCount() {
        return pendingCalls.getPendingCount();
    }

    private void handleLine(String line) {
        JsonObject message = HostMessages.parse(line);
        if (message == null) {
            LOGGER.warn("Invalid JSON from extension host '{}': {}", extensionId, truncate(line, MAX_LOGGED_LINE_LENGTH));
            return;
        }

        String type = HostMessages.getString(message, "type");
        if (type == null) {
            LOGGER.warn("Message without type from extension host '{}'", extensionId);
            return;
        }
        switch (type) {
            case HostMessages.TYPE_REGISTER -> handleRegister(message);
            case HostMessages.TYPE_RESPONSE -> handleResponse(message);
            case HostMessages.TYPE_CALL -> handleCall(message);
            case HostMessages.TYPE_EVENT -> handleEvent(message);
            case HostMessages.TYPE_ERROR -> LOGGER.error("Extension host '{}' reported error: {}", extensionId,
                HostMessages.getString(message, "error"));
            default -> LOGGER.warn("Unknown message type '{}' from extension host '{}'", type, extensionId);
        }
    }

    private void handleRegister(JsonObject message) {
        ExtensionRegistration received;
        try {
            received = HostMessages.readRegistration(message);
        } catch (RuntimeException e) {
            LOGGER.error("Invalid registration from extension host '{}': {}", extensionId, e.getMessage());
            failRegistration(new ExtensionCallException("Invalid registration: " + e.getMessage(), e));
            return;
        }
        if (!extensionId.equals(received.id())) {
            LOGGER.error("Extension host '{}' registered as '{}'", extensionId, received.id());
            failRegistration(new ExtensionCallException(String.format(
                "Extension host %s registered under a different id: %s", extensionId, received.id())));
            return;
        }

        registration = received;
        state = HostState.RUNNING;
        LOGGER.info("Extension host '{}' registered ({}) with methods {}", extensionId, received.name(),
            received.methodNames());

        try {
            listener.onRegister(this, received);
        } catch (RuntimeException e) {
            LOGGER.error("Gateway rejected registration of extension '{}': {}", extensionId, e.getMessage());
            failRegistration(e);
            return;
        }

        CompletableFuture<ExtensionRegistration> waiting;
        synchronized (this) {
            waiting = pendingRegistration;
            pendingRegistration = null;
        }
        if (waiting != null) {
            waiting.complete(received);
        }
    }

    private void handleResponse(JsonObject message) {
        String id = HostMessages.getString(message, "id");
        if (id == null) {
            LOGGER.warn("Response without id from extension host '{}'", extensionId);
            return;
        }
        if (HostMessages.isOk(message)) {
            pendingCalls.resolve(id, message.get("payload"));
        } else {
            pendingCalls.reject(id, HostMessages.readError(message));
        }
    }

    private void handleEvent(JsonObject message) {
        if (HostMessages.getString(message, "event") == null) {
            LOGGER.warn("Event without type from extension host '{}'", extensionId);
            return;
        }
        GatewayEvent event = HostMessages.readEvent(message, extensionId);
        try {
            listener.onEvent(this, event);
        } catch (RuntimeException e) {
            LOGGER.error("Failed to publish event {} from extension host '{}'", event.getType(), extensionId, e);
        }
    }

    private void handleCall(JsonObject message) {
        String callId = HostMessages.getString(message, "id");
        String method = HostMessages.getString(message, "method");
        if (callId == null || method == null) {
            LOGGER.warn("Malformed call from extension host '{}'", extensionId);
            return;
        }
        CallContext context = HostMessages.readCallContext(message, settings.requestTimeout().toMillis());

        if (context.exceedsMaxDepth()) {
            sendCallResponse(callId, null, new CallDepthExceededException(context.depth()));
            return;
        }
        if (context.isExpired()) {
            sendCallResponse(callId, null, new RpcTimeoutException("Call deadline exceeded for " + method));
            return;
        }
        if (inFlightCalls.incrementAndGet() > settings.maxInFlightCalls()) {
            int busy = inFlightCalls.decrementAndGet();
            sendCallResponse(callId, null, new HostUnavailableException(extensionId,
                String.format("busy, %d calls in flight", busy)));
            return;
        }

        try {
            callExecutor.execute(() -> dispatchCall(callId, method, message, context));
        } catch (RejectedExecutionException e) {
            inFlightCalls.decrementAndGet();
            sendCallResponse(callId, null, new HostUnavailableException(extensionId, "shutting down"));
        }
    }

    private void dispatchCall(String callId, String method, JsonObject message, CallContext context) {
        long startTime = System.currentTimeMillis();
        CompletableFuture<JsonElement> result;
        try {
            result = listener.onCall(extensionId, method, HostMessages.getObject(message, "params"),
                HostMessages.getString(message, "connectionId"), context);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }

        result.whenComplete((payload, error) -> {
            inFlightCalls.decrementAndGet();
            sendCallResponse(callId, payload, error != null ? GatewayException.from(error) : null);
            LOGGER.info("ctx.call completed: trace={} caller={} method={} depth={} durationMs={}",
                context.traceId(), extensionId, method, context.depth(), System.currentTimeMillis() - startTime);
        });
    }

    private void sendCallResponse(String callId, JsonElement payload, GatewayException error) {
        HostTransport current = transport;
        if (current == null) {
            LOGGER.debug("Extension host '{}' gone, dropping call response {}", extensionId, callId);
            return;
        }
        JsonObject response = error == null
            ? HostMessages.success(HostMessages.TYPE_CALL_RESPONSE, callId, payload)
            : HostMessages.failure(HostMessages.TYPE_CALL_RESPONSE, callId, error);
        current.send(HostMessages.serialize(response));
    }

    private void handleExit(HostTransport source, Integer exitCode) {
        synchronized (this) {
            if (source != transport) {
                return;
            }
            transport = null;
        }

        LOGGER.info("Extension host '{}' exited with code {}", extensionId, exitCode);
        failRegistration(new HostUnavailableException(extensionId, "exited with code " + exitCode));
        pendingCalls.rejectAll(method -> new HostUnavailableException(extensionId, "exited with code " + exitCode));

        int attempt = restartCount.incrementAndGet();
        if (attempt <= settings.maxRestarts()) {
            state = HostState.RESTARTING;
            LOGGER.info("Auto-restarting extension host '{}' (attempt {}/{}) in {}ms", extensionId, attempt,
                settings.maxRestarts(), settings.restartDelay().toMillis());
            scheduler.schedule(this::restartAfterExit, settings.restartDelay().toMillis(), TimeUnit.MILLISECONDS);
        } else {
            state = HostState.FAILED;
            LOGGER.error("Extension host '{}' exceeded max restarts ({})", extensionId, settings.maxRestarts());
            try {
                listener.onGiveUp(this);
            } catch (RuntimeException e) {
                LOGGER.error("Give-up handler failed for extension host '{}'", extensionId, e);
            }
            close();
        }
    }

    private void restartAfterExit() {
        if (state != HostState.RESTARTING) {
            return;
        }
        start().exceptionally(e -> {
            LOGGER.error("Failed to restart extension host '{}': {}", extensionId, GatewayException.from(e).getMessage());
            return null;
        });
    }

    private HostTransport detach(String reason) {
        HostTransport current;
        synchronized (this) {
            current = transport;
            transport = null;
            state = HostState.STOPPED;
        }
        failRegistration(new HostUnavailableException(extensionId, reason));
        pendingCalls.rejectAll(method -> new HostUnavailableException(extensionId, reason));
        return current;
    }

    private void failRegistration(Throwable error) {
        CompletableFuture<ExtensionRegistration> waiting;
        synchronized (this) {
            waiting = pendingRegistration;
            pendingRegistration = null;
        }
        if (waiting != null) {
            waiting.completeExceptionally(error);
        }
    }

    private static String truncate(String text, int max) {
        return text.length() > max ? text.substring(0, max) : text;
    }

    /**
     * Routes a transport's output to this host, ignoring output from superseded transports.
     */
    private final class TransportListener implements HostTransport.Listener {

        private final HostTransport source;

        TransportListener(HostTransport source) {
            this.source = source;
        }

        @Override
        public void onLine(String line) {
            if (source != transport) {
                return;
            }
            try {
                handleLine(line);
            } catch (RuntimeException e) {
                LOGGER.error("Failed to handle message from extension host '{}'", extensionId, e);
            }
        }

        @Override
        public void onDiagnostic(String text) {
            if (!text.isBlank()) {
                LOGGER.warn("[{}] stderr: {}", extensionId, truncate(text.trim(), MAX_DIAGNOSTIC_LENGTH));
            }
        }
    }
}
