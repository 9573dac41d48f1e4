package com.conduit.extension;

import com.conduit.events.EventSubscriptions;
import com.conduit.events.GatewayEvent;
import com.conduit.rpc.CallContext;
import com.conduit.rpc.GatewayException;
import com.conduit.rpc.HostUnavailableException;
import com.conduit.rpc.UnknownMethodException;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Registry and router for all extensions, in-process and out-of-process.
 *
 * Owns the method table, the source-route table and one {@link ExtensionHandle} per
 * registered id. Readers dispatch against an immutable {@link RegistryState} snapshot;
 * writers build a new snapshot and publish it under a lock, so a dispatch never observes
 * a half-applied registration.
 */
public class ExtensionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExtensionManager.class);

    /**
     * Deadline applied to calls that arrive without one.
     */
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofMinutes(5);

    private final Object writeLock = new Object();
    private final EventSubscriptions subscriptions = new EventSubscriptions();
    private final List<Consumer<GatewayEvent>> clientSinks = new CopyOnWriteArrayList<>();
    private final AtomicLong instanceCounter = new AtomicLong();
    private final Executor deliveryExecutor;
    private final ExecutorService ownedExecutor;

    private volatile RegistryState state = RegistryState.EMPTY;

    public ExtensionManager() {
        this.ownedExecutor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "event-delivery");
            thread.setDaemon(true);
            return thread;
        });
        this.deliveryExecutor = ownedExecutor;
    }

    /**
     * Creates a manager that delivers events to in-process handlers on the given executor.
     */
    public ExtensionManager(Executor deliveryExecutor) {
        this.deliveryExecutor = deliveryExecutor;
        this.ownedExecutor = null;
    }

    /**
     * Starts and registers an in-process extension with an empty configuration.
     */
    public void register(Extension extension) {
        register(extension, new JsonObject(), null);
    }

    /**
     * Starts and registers an in-process extension.
     *
     * The extension is started before it becomes visible; if {@code start} fails nothing
     * is published. Registering an id that is already registered replaces the previous
     * extension atomically, including its source routes.
     *
     * @param extension the extension
     * @param config the extension's configuration
     * @param sourceRouteOverride routes from configuration, or null to use the extension's own
     * @throws DuplicateMethodException if a method is owned by a different extension
     * @throws ExtensionStartException if the extension fails to start
     */
    public void register(Extension extension, JsonObject config, List<String> sourceRouteOverride) {
        ExtensionRegistration registration = ExtensionRegistration.of(extension, sourceRouteOverride);
        registration.validate();
        checkConflicts(state, registration);

        String ownerKey = registration.id() + "#" + instanceCounter.incrementAndGet();
        LocalExtensionContext context = new LocalExtensionContext(registration.id(), ownerKey,
            config != null ? config : new JsonObject(), this);

        try {
            extension.start(context);
        } catch (Exception e) {
            subscriptions.removeOwner(ownerKey);
            throw new ExtensionStartException(registration.id(), e);
        }

        LocalHandle handle = new LocalHandle(registration, extension, ownerKey, subscriptions, deliveryExecutor);
        ExtensionHandle previous;
        try {
            previous = publish(handle);
        } catch (DuplicateMethodException e) {
            handle.destroy();
            throw e;
        }

        LOGGER.info("Registered extension '{}' ({}) with methods {}", registration.id(), registration.name(),
            registration.methodNames());
        if (previous != null) {
            retire(previous);
        }
    }

    /**
     * Registers an out-of-process extension. Called whenever its host reports a registration,
     * including after a restart.
     *
     * @throws DuplicateMethodException if a method is owned by a different extension
     */
    public void registerRemote(ExtensionRegistration registration, ExtensionHost host) {
        registration.validate();
        ExtensionHandle previous = publish(new RemoteHandle(registration, host));

        if (previous != null) {
            LOGGER.info("Re-registered remote extension '{}' with methods {}", registration.id(),
                registration.methodNames());
            if (!(previous instanceof RemoteHandle remote && remote.host() == host)) {
                retire(previous);
            }
        } else {
            LOGGER.info("Registered remote extension '{}' with methods {}", registration.id(),
                registration.methodNames());
        }
    }

    /**
     * Unregisters an extension of either kind and releases it. Unknown ids are ignored.
     */
    public void unregister(String extensionId) {
        ExtensionHandle removed = remove(extensionId, false);
        if (removed != null) {
            LOGGER.info("Unregistered extension '{}'", extensionId);
            retire(removed);
        }
    }

    /**
     * Unregisters an out-of-process extension and terminates its host. Idempotent; local
     * extensions are left alone.
     */
    public void unregisterRemote(String extensionId) {
        ExtensionHandle removed = remove(extensionId, true);
        if (removed != null) {
            LOGGER.info("Unregistered remote extension '{}'", extensionId);
            retire(removed);
        }
    }

    public boolean hasMethod(String method) {
        return state.method(method) != null;
    }

    /**
     * Gets every registered method with its owner, for discovery.
     */
    public List<MethodInfo> getMethodDefinitions() {
        List<MethodInfo> methods = new ArrayList<>();
        for (RegistryState.MethodEntry entry : state.methods()) {
            ExtensionRegistration owner = entry.handle().registration();
            methods.add(new MethodInfo(owner.id(), owner.name(), entry.definition()));
        }
        return methods;
    }

    /**
     * Gets every registered extension, in registration order.
     */
    public List<ExtensionInfo> getExtensionList() {
        List<ExtensionInfo> list = new ArrayList<>();
        for (ExtensionHandle handle : state.extensions()) {
            ExtensionRegistration registration = handle.registration();
            list.add(new ExtensionInfo(registration.id(), registration.name(), registration.methodNames(),
                registration.sourceRoutes(), handle.isRemote()));
        }
        return list;
    }

    public boolean isRegistered(String extensionId) {
        return state.extension(extensionId) != null;
    }

    /**
     * Gets the host of an out-of-process extension.
     *
     * @return the host, or null when the id is unknown or runs in-process
     */
    public ExtensionHost getHost(String extensionId) {
        ExtensionHandle handle = state.extension(extensionId);
        return handle instanceof RemoteHandle remote ? remote.host() : null;
    }

    /**
     * Dispatches a method call and waits for its result.
     *
     * @see #handleMethodAsync
     */
    public JsonElement handleMethod(String method, JsonObject params, String connectionId,
                                    CallContext callContext, List<String> tags) throws GatewayException {
        try {
            return handleMethodAsync(method, params, connectionId, callContext, tags).join();
        } catch (RuntimeException e) {
            throw GatewayException.from(e);
        }
    }

    /**
     * Dispatches a method call to its owning extension.
     *
     * In-process methods have their params validated against the declared schema first;
     * every problem is reported. Out-of-process methods are forwarded unchanged.
     *
     * @param method the method name
     * @param params the params, may be null
     * @param connectionId the originating client connection, may be null
     * @param callContext trace metadata, or null to start a new chain
     * @param tags request tags, may be null
     * @return the result; fails with {@link UnknownMethodException} when nothing owns the method
     */
    public CompletableFuture<JsonElement> handleMethodAsync(String method, JsonObject params, String connectionId,
                                                            CallContext callContext, List<String> tags) {
        CallContext context = callContext != null ? callContext : CallContext.root(DEFAULT_CALL_TIMEOUT);
        try {
            context.check(method);
        } catch (GatewayException e) {
            return CompletableFuture.failedFuture(e);
        }

        RegistryState.MethodEntry entry = state.method(method);
        if (entry == null) {
            return CompletableFuture.failedFuture(new UnknownMethodException(method));
        }

        LOGGER.debug("Dispatching {} to extension '{}' (trace {}, depth {})", method, entry.extensionId(),
            context.traceId(), context.depth());
        return entry.handle().invoke(entry.definition(), params, connectionId, context,
            tags != null ? List.copyOf(tags) : List.of());
    }

    /**
     * Delivers an event to every registered extension except the one skipped.
     * A failing target never prevents delivery to the others.
     *
     * @param event the event
     * @param skipExtensionId extension to skip, usually the emitter; may be null
     */
    public void broadcast(GatewayEvent event, String skipExtensionId) {
        for (ExtensionHandle handle : state.extensions()) {
            if (handle.id().equals(skipExtensionId)) {
                continue;
            }
            try {
                handle.deliver(event);
            } catch (RuntimeException e) {
                LOGGER.error("Failed to deliver {} to extension '{}'", event.getType(), handle.id(), e);
            }
        }
    }

    /**
     * Publishes an event emitted by an extension or the gateway: every other extension
     * receives it, then every client sink.
     */
    public void publish(GatewayEvent event) {
        broadcast(event, event.getOrigin());
        for (Consumer<GatewayEvent> sink : clientSinks) {
            try {
                sink.accept(event);
            } catch (RuntimeException e) {
                LOGGER.error("Client sink failed for {}", event.getType(), e);
            }
        }
    }

    /**
     * Adds a sink that receives every published event, e.g. the client connection registry.
     */
    public void addClientSink(Consumer<GatewayEvent> sink) {
        clientSinks.add(sink);
    }

    EventSubscriptions.Subscription subscribe(String ownerKey, String pattern, EventSubscriptions.EventHandler handler) {
        return subscriptions.subscribe(ownerKey, pattern, handler);
    }

    /**
     * Routes a response event to the extension owning the source's prefix and waits for
     * the outcome.
     *
     * @return false when no route exists or delivery failed; never throws
     */
    public boolean routeToSource(String source, GatewayEvent event) {
        return routeToSourceAsync(source, event).join();
    }

    /**
     * Routes a response event to the extension owning the source's prefix.
     *
     * @param source the full source address, e.g. {@code "imessage/+15551234567"}
     * @param event the event to deliver
     * @return a future completing with false on a routing miss or a delivery failure
     */
    public CompletableFuture<Boolean> routeToSourceAsync(String source, GatewayEvent event) {
        if (source == null) {
            return CompletableFuture.completedFuture(false);
        }
        RegistryState snapshot = state;
        String owner = snapshot.routeOwner(prefixOf(source));
        ExtensionHandle handle = owner != null ? snapshot.extension(owner) : null;
        if (handle == null) {
            LOGGER.debug("No source route for {}", source);
            return CompletableFuture.completedFuture(false);
        }
        return handle.routeToSource(source, event)
            .exceptionally(e -> {
                LOGGER.error("Failed to route to source {} via extension '{}'", source, owner, e);
                return false;
            });
    }

    public boolean hasSourceRoute(String source) {
        return source != null && state.routeOwner(prefixOf(source)) != null;
    }

    /**
     * Gets the id of the extension owning a source's prefix.
     *
     * @return the owner id, or null when there is no route
     */
    public String getSourceHandler(String source) {
        return source != null ? state.routeOwner(prefixOf(source)) : null;
    }

    /**
     * Gets the source-route table: prefix to owning extension id.
     */
    public Map<String, String> getSourceRoutes() {
        return new LinkedHashMap<>(state.sourceRoutes());
    }

    /**
     * Gets the health of every registered extension. Out-of-process extensions report
     * whether their host is running.
     */
    public Map<String, HealthStatus> getHealth() {
        Map<String, HealthStatus> health = new LinkedHashMap<>();
        for (ExtensionHandle handle : state.extensions()) {
            health.put(handle.id(), handle.health());
        }
        return health;
    }

    /**
     * Restarts an out-of-process extension. The host re-registers on its own once the
     * new child reports in.
     *
     * @return the new registration
     */
    public CompletableFuture<ExtensionRegistration> restartExtension(String extensionId) {
        ExtensionHost host = getHost(extensionId);
        if (host == null) {
            return CompletableFuture.failedFuture(
                new HostUnavailableException(extensionId, "no out-of-process extension with this id"));
        }
        LOGGER.info("Restarting extension '{}'", extensionId);
        return host.restart();
    }

    /**
     * Gracefully terminates every out-of-process host and clears their registrations.
     *
     * Hosts whose termination could not be initiated stay registered, so that
     * {@link #forceKillRemoteHosts()} still reaches them.
     *
     * @return a future completing when every host has exited or its grace period has passed
     */
    public CompletableFuture<Void> killRemoteHosts() {
        List<CompletableFuture<Void>> kills = new ArrayList<>();
        for (ExtensionHandle handle : state.extensions()) {
            if (!(handle instanceof RemoteHandle remote)) {
                continue;
            }
            LOGGER.info("Killing remote extension host '{}'", handle.id());
            CompletableFuture<Void> kill;
            try {
                kill = remote.host().kill();
            } catch (RuntimeException e) {
                LOGGER.error("Failed to kill remote extension host '{}'", handle.id(), e);
                continue;
            }
            kills.add(kill.exceptionally(e -> {
                LOGGER.warn("Remote extension host '{}' did not exit cleanly: {}", remote.id(), e.getMessage());
                return null;
            }));
            remove(handle.id(), true);
        }
        return CompletableFuture.allOf(kills.toArray(new CompletableFuture[0]));
    }

    /**
     * Immediately terminates every out-of-process host and clears their registrations.
     */
    public void forceKillRemoteHosts() {
        for (ExtensionHandle handle : state.extensions()) {
            if (handle instanceof RemoteHandle remote) {
                try {
                    remote.host().forceKill();
                } catch (RuntimeException e) {
                    LOGGER.error("Failed to force-kill remote extension host '{}'", handle.id(), e);
                }
                remove(handle.id(), true);
            }
        }
    }

    /**
     * Stops every in-process extension in registration order and releases the delivery
     * executor if the manager created it. Out-of-process hosts are left to
     * {@link #killRemoteHosts()}.
     */
    public void shutdown() {
        for (ExtensionHandle handle : state.extensions()) {
            if (!handle.isRemote()) {
                remove(handle.id(), false);
                handle.destroy();
            }
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        LOGGER.info("Extension manager shut down");
    }

    private ExtensionHandle publish(ExtensionHandle handle) {
        synchronized (writeLock) {
            RegistryState current = state;
            checkConflicts(current, handle.registration());
            ExtensionHandle previous = current.extension(handle.id());
            state = current.with(handle);
            return previous;
        }
    }

    private ExtensionHandle remove(String extensionId, boolean remoteOnly) {
        synchronized (writeLock) {
            RegistryState current = state;
            ExtensionHandle handle = current.extension(extensionId);
            if (handle == null || (remoteOnly && !handle.isRemote())) {
                return null;
            }
            state = current.without(extensionId);
            return handle;
        }
    }

    private void retire(ExtensionHandle handle) {
        try {
            handle.destroy().exceptionally(e -> {
                LOGGER.warn("Extension '{}' did not shut down cleanly: {}", handle.id(), e.getMessage());
                return null;
            });
        } catch (RuntimeException e) {
            LOGGER.error("Failed to release extension '{}'", handle.id(), e);
        }
    }

    private static void checkConflicts(RegistryState snapshot, ExtensionRegistration registration) {
        RegistryState.MethodEntry conflict = snapshot.findConflict(registration);
        if (conflict != null) {
            throw new DuplicateMethodException(conflict.definition().name(), conflict.extensionId(),
                registration.id());
        }
    }

    private static String prefixOf(String source) {
        int slash = source.indexOf('/');
        return slash >= 0 ? source.substring(0, slash) : source;
    }

    /**
     * A registered method with its owner, for discovery.
     */
    public record MethodInfo(String extensionId, String extensionName, MethodDefinition method) {}

    /**
     * Summary of a registered extension, for discovery.
     */
    public record ExtensionInfo(String id, String name, List<String> methods, List<String> sourceRoutes,
                                boolean remote) {}
}
