package com.conduit.host;

import com.conduit.events.EventSubscriptions;
import com.conduit.events.GatewayEvent;
import com.conduit.extension.Extension;
import com.conduit.extension.ExtensionLoader;
import com.conduit.extension.ExtensionRegistration;
import com.conduit.extension.HealthStatus;
import com.conduit.extension.MethodDefinition;
import com.conduit.rpc.CallContext;
import com.conduit.rpc.CallDepthExceededException;
import com.conduit.rpc.ExtensionCallException;
import com.conduit.rpc.GatewayException;
import com.conduit.rpc.ParamValidationException;
import com.conduit.rpc.PendingCallRegistry;
import com.conduit.rpc.UnknownMethodException;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs one extension inside an extension host process.
 *
 * Launched by the gateway as {@code ExtensionHostRunner <extension-class> [config-json]}.
 * Standard output carries the NDJSON protocol only; everything else, logging included,
 * goes to standard error. Requests are handled on a worker pool so that an extension
 * waiting on a nested call never blocks the reader.
 */
public class ExtensionHostRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExtensionHostRunner.class);
    private static final Gson GSON = new Gson();

    static final String SUBSCRIPTION_OWNER = "hosted";
    static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofMinutes(5);
    private static final long PARENT_CHECK_INTERVAL_MS = 2000;

    private final Extension extension;
    private final JsonObject config;
    private final Consumer<String> output;
    private final ExecutorService workers;
    private final EventSubscriptions subscriptions = new EventSubscriptions();
    private final PendingCallRegistry gatewayCalls = new PendingCallRegistry("gateway");
    private final ThreadLocal<RequestScope> currentRequest = new ThreadLocal<>();

    private volatile boolean started;

    /**
     * @param extension the extension to run
     * @param config the extension's configuration
     * @param output receives every protocol line written to the gateway
     * @param workers runs requests and event handlers
     */
    public ExtensionHostRunner(Extension extension, JsonObject config, Consumer<String> output,
                               ExecutorService workers) {
        this.extension = extension;
        this.config = config != null ? config : new JsonObject();
        this.output = output;
        this.workers = workers;
    }

    public static void main(String[] args) {
        PrintStream protocol = System.out;
        System.setOut(System.err);

        if (args.length < 1) {
            System.err.println("Usage: ExtensionHostRunner <extension-class> [config-json]");
            System.exit(1);
            return;
        }

        Consumer<String> output = line -> {
            synchronized (protocol) {
                protocol.print(line);
                protocol.print('\n');
                protocol.flush();
            }
        };

        ExtensionHostRunner runner;
        try {
            JsonObject config = args.length > 1 ? JsonParser.parseString(args[1]).getAsJsonObject() : new JsonObject();
            Extension extension = ExtensionLoader.load(args[0], config);
            runner = new ExtensionHostRunner(extension, config, output, Executors.newCachedThreadPool(r -> {
                Thread thread = new Thread(r, "extension-worker");
                thread.setDaemon(true);
                return thread;
            }));
            runner.start();
        } catch (Exception e) {
            LOGGER.error("Failed to start extension {}", args[0], e);
            output.accept(HostMessages.serialize(HostMessages.error(String.valueOf(e.getMessage()))));
            System.exit(1);
            return;
        }

        watchParent();
        try {
            runner.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        } catch (IOException e) {
            LOGGER.error("Failed to read from gateway", e);
            runner.stop();
        }
        System.exit(0);
    }

    /**
     * Starts the extension and announces its registration to the gateway.
     */
    public void start() throws Exception {
        LOGGER.info("Starting extension '{}' ({})", extension.id(), extension.getClass().getName());
        extension.start(new HostedExtensionContext(this, extension.id(), config));
        started = true;
        write(HostMessages.register(ExtensionRegistration.of(extension, null)));
        LOGGER.info("Extension '{}' started", extension.id());
    }

    /**
     * Reads protocol lines until the gateway closes the stream, then stops the extension.
     */
    public void run(BufferedReader input) throws IOException {
        String line;
        while ((line = input.readLine()) != null) {
            if (!line.isBlank()) {
                handleLine(line.trim());
            }
        }
        LOGGER.info("Input closed, shutting down");
        stop();
    }

    /**
     * Handles one protocol line from the gateway.
     */
    public void handleLine(String line) {
        JsonObject message = HostMessages.parse(line);
        if (message == null) {
            LOGGER.warn("Invalid JSON on input: {}", line.length() > 100 ? line.substring(0, 100) : line);
            return;
        }

        String type = HostMessages.getString(message, "type");
        if (type == null) {
            LOGGER.warn("Message without type on input");
            return;
        }
        switch (type) {
            case HostMessages.TYPE_REQUEST -> submit(() -> handleRequest(message));
            case HostMessages.TYPE_EVENT -> dispatchEvent(HostMessages.readEvent(message, null));
            case HostMessages.TYPE_CALL_RESPONSE -> handleCallResponse(message);
            default -> LOGGER.warn("Unknown message type '{}'", type);
        }
    }

    /**
     * Stops the extension and releases the worker pool.
     */
    public void stop() {
        if (started) {
            started = false;
            try {
                extension.stop();
            } catch (Exception e) {
                LOGGER.error("Error stopping extension '{}'", extension.id(), e);
            }
        }
        gatewayCalls.rejectAll(method -> new ExtensionCallException("Extension host shutting down"));
        gatewayCalls.close();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(2, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    EventSubscriptions.Subscription subscribe(String pattern, EventSubscriptions.EventHandler handler) {
        return subscriptions.subscribe(SUBSCRIPTION_OWNER, pattern, handler);
    }

    void emit(GatewayEvent event) {
        write(HostMessages.event(event));
    }

    /**
     * Calls a method through the gateway. Made from inside a request, the call inherits that
     * request's trace, deadline and connection one level deeper; otherwise it starts a new chain.
     */
    CompletableFuture<JsonElement> call(String method, JsonObject params) {
        RequestScope scope = currentRequest.get();
        CallContext context = scope != null ? scope.callContext().nested() : CallContext.root(DEFAULT_CALL_TIMEOUT);
        if (context.exceedsMaxDepth()) {
            return CompletableFuture.failedFuture(new CallDepthExceededException(context.depth()));
        }

        String id = UUID.randomUUID().toString();
        CompletableFuture<JsonElement> result = gatewayCalls.register(id, method, context.remainingMillis());
        if (!result.isDone()) {
            write(HostMessages.call(id, method, params, scope != null ? scope.connectionId() : null, context));
        }
        return result;
    }

    private void handleRequest(JsonObject message) {
        String id = HostMessages.getString(message, "id");
        String method = HostMessages.getString(message, "method");
        if (id == null || method == null) {
            LOGGER.warn("Malformed request from gateway");
            return;
        }
        JsonObject params = HostMessages.getObject(message, "params");
        CallContext context = HostMessages.readCallContext(message, DEFAULT_CALL_TIMEOUT.toMillis());

        currentRequest.set(new RequestScope(context, HostMessages.getString(message, "connectionId")));
        try {
            JsonElement result = switch (method) {
                case HostMessages.METHOD_HEALTH -> healthJson();
                case HostMessages.METHOD_SOURCE_RESPONSE -> handleSourceResponse(params);
                default -> invoke(method, params);
            };
            write(HostMessages.success(HostMessages.TYPE_RESPONSE, id, result));
        } catch (Exception e) {
            GatewayException error = GatewayException.from(e);
            LOGGER.debug("Request {} failed: {}", method, error.getMessage());
            write(HostMessages.failure(HostMessages.TYPE_RESPONSE, id, error));
        } finally {
            currentRequest.remove();
        }
    }

    private JsonElement invoke(String method, JsonObject params) throws Exception {
        Optional<MethodDefinition> definition = extension.methods().stream()
            .filter(m -> m.name().equals(method))
            .findFirst();
        if (definition.isEmpty()) {
            throw new UnknownMethodException(method);
        }
        List<String> problems = definition.get().inputSchema().validate(params);
        if (!problems.isEmpty()) {
            throw new ParamValidationException(method, problems);
        }
        return toJson(extension.handleMethod(method, params));
    }

    private JsonElement handleSourceResponse(JsonObject params) throws Exception {
        String source = HostMessages.getString(params, "source");
        GatewayEvent event = HostMessages.readEvent(HostMessages.getObject(params, "event"), null);
        extension.handleSourceResponse(source, event);
        JsonObject result = new JsonObject();
        result.addProperty("status", "ok");
        return result;
    }

    private JsonElement healthJson() {
        HealthStatus status;
        try {
            status = extension.health();
        } catch (RuntimeException e) {
            LOGGER.warn("Health check failed: {}", e.getMessage());
            status = HealthStatus.unhealthy("health_check_failed");
        }
        JsonObject health = new JsonObject();
        health.addProperty("ok", status.ok());
        health.add("details", GSON.toJsonTree(status.details()));
        return health;
    }

    private void handleCallResponse(JsonObject message) {
        String id = HostMessages.getString(message, "id");
        if (id == null) {
            return;
        }
        if (HostMessages.isOk(message)) {
            gatewayCalls.resolve(id, message.get("payload"));
        } else {
            gatewayCalls.reject(id, HostMessages.readError(message));
        }
    }

    private void dispatchEvent(GatewayEvent event) {
        for (EventSubscriptions.Delivery delivery : subscriptions.match(SUBSCRIPTION_OWNER, event.getType())) {
            submit(() -> {
                try {
                    delivery.handler().handle(event);
                } catch (Exception e) {
                    LOGGER.error("Event handler for '{}' failed on {}", delivery.pattern(), event.getType(), e);
                }
            });
        }
    }

    private void submit(Runnable task) {
        try {
            workers.execute(task);
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Worker pool rejected task, host is shutting down");
        }
    }

    private void write(JsonObject message) {
        output.accept(HostMessages.serialize(message));
    }

    private static JsonElement toJson(Object result) {
        if (result == null) {
            return JsonNull.INSTANCE;
        }
        if (result instanceof JsonElement element) {
            return element;
        }
        return GSON.toJsonTree(result);
    }

    /**
     * Exits once the process that launched this host is gone.
     */
    private static void watchParent() {
        Optional<ProcessHandle> parent = ProcessHandle.current().parent();
        if (parent.isEmpty()) {
            return;
        }
        ProcessHandle handle = parent.get();
        Thread watcher = new Thread(() -> {
            while (true) {
                try {
                    Thread.sleep(PARENT_CHECK_INTERVAL_MS);
                } catch (InterruptedException e) {
                    return;
                }
                if (!handle.isAlive()) {
                    LOGGER.info("Parent process {} is gone, shutting down", handle.pid());
                    System.exit(0);
                }
            }
        }, "parent-watch");
        watcher.setDaemon(true);
        watcher.start();
    }

    private record RequestScope(CallContext callContext, String connectionId) {}
}
