package com.conduit;

import com.conduit.config.ConfigLoadException;
import com.conduit.config.ConfigService;
import com.conduit.config.ExtensionConfig;
import com.conduit.config.GatewayConfig;
import com.conduit.extension.Extension;
import com.conduit.extension.ExtensionLoader;
import com.conduit.extension.ExtensionManager;
import com.conduit.extension.ExtensionRegistrationException;
import com.conduit.host.ExtensionHostProcess;
import com.conduit.host.ExtensionHostRunner;
import com.conduit.host.HostListener;
import com.conduit.host.HostSettings;
import com.conduit.host.ManagerHostListener;
import com.conduit.host.ProcessHostTransport;
import com.conduit.server.ConnectionRegistry;
import com.conduit.server.GatewayServer;
import com.google.gson.Gson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Gateway entry point: loads the configuration, registers the enabled extensions, starts
 * the server and tears everything down on shutdown.
 */
public class GatewayMain {

    private static final Logger LOGGER = LoggerFactory.getLogger(GatewayMain.class);
    private static final Gson GSON = new Gson();

    private static final long REMOTE_KILL_TIMEOUT_SECONDS = 10;

    private final GatewayConfig config;
    private final ExtensionManager manager;
    private final ConnectionRegistry connections;
    private final HostListener hostListener;
    private final GatewayServer server;

    public GatewayMain(GatewayConfig config) {
        this.config = config;
        this.manager = new ExtensionManager();
        this.connections = new ConnectionRegistry();
        this.manager.addClientSink(connections);
        this.hostListener = new ManagerHostListener(manager);
        this.server = new GatewayServer(config.host(), config.port(), manager, connections);
    }

    public static void main(String[] args) {
        GatewayConfig config;
        try {
            config = new ConfigService().locateAndLoad(args);
        } catch (ConfigLoadException e) {
            LOGGER.error("Failed to load configuration: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        GatewayMain gateway = new GatewayMain(config);
        Runtime.getRuntime().addShutdownHook(new Thread(gateway::shutdown, "gateway-shutdown"));
        try {
            gateway.loadExtensions();
            gateway.server.start();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.error("Interrupted while starting the gateway");
            System.exit(1);
        } catch (RuntimeException e) {
            LOGGER.error("Failed to start the gateway", e);
            System.exit(1);
        }
    }

    /**
     * Registers every enabled extension. A failing extension is logged and skipped.
     */
    public void loadExtensions() throws InterruptedException {
        for (ExtensionConfig extension : config.extensions().values()) {
            if (!extension.enabled()) {
                LOGGER.info("Extension '{}' is disabled", extension.id());
                continue;
            }
            try {
                if (extension.outOfProcess()) {
                    startRemote(extension);
                } else {
                    startLocal(extension);
                }
            } catch (ExtensionRegistrationException e) {
                LOGGER.error("Failed to load extension '{}': {}", extension.id(), e.getMessage(), e);
            }
        }
        LOGGER.info("Loaded {} extensions", manager.getExtensionList().size());
    }

    private void startLocal(ExtensionConfig settings) {
        Extension extension = ExtensionLoader.load(settings.className(), settings.config());
        if (!settings.id().equals(extension.id())) {
            throw new ExtensionRegistrationException(String.format(
                "Extension configured as '%s' reports id '%s'", settings.id(), extension.id()));
        }
        manager.register(extension, settings.config(), settings.sourceRoutes());
    }

    private void startRemote(ExtensionConfig settings) throws InterruptedException {
        List<String> command = new ArrayList<>(settings.command().isEmpty() ? defaultLauncher() : settings.command());
        command.add(settings.className());
        command.add(GSON.toJson(settings.config()));

        ExtensionHostProcess host = new ExtensionHostProcess(settings.id(),
            () -> new ProcessHostTransport(settings.id(), command, Path.of("").toAbsolutePath()),
            hostListener);
        try {
            host.start().get(HostSettings.DEFAULTS.registrationTimeout().toSeconds() + 1, TimeUnit.SECONDS);
        } catch (ExecutionException | TimeoutException e) {
            host.forceKill();
            Throwable cause = e instanceof ExecutionException ? e.getCause() : e;
            throw new ExtensionRegistrationException("Extension host failed to start: " + cause.getMessage(), cause);
        }
    }

    private static List<String> defaultLauncher() {
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        return List.of(java, "-cp", System.getProperty("java.class.path"), ExtensionHostRunner.class.getName());
    }

    /**
     * Stops the server, terminates extension hosts (gracefully, then forcibly) and stops
     * in-process extensions.
     */
    public void shutdown() {
        LOGGER.info("Shutting down gateway");
        try {
            server.stop();
        } catch (RuntimeException e) {
            LOGGER.error("Error stopping server", e);
        }

        try {
            manager.killRemoteHosts().get(REMOTE_KILL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.warn("Remote extension hosts did not stop in time: {}", e.getMessage());
        }
        manager.forceKillRemoteHosts();
        manager.shutdown();
    }

    public ExtensionManager getManager() {
        return manager;
    }

    public GatewayServer getServer() {
        return server;
    }
}
