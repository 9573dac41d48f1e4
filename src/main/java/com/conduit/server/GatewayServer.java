package com.conduit.server;

import com.conduit.extension.ExtensionManager;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * HTTP and WebSocket front end of the gateway.
 *
 * Clients speak the request/response/event protocol over a WebSocket at {@code /ws};
 * {@code GET /health} returns the health document.
 */
public class GatewayServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(GatewayServer.class);

    public static final String WEBSOCKET_PATH = "/ws";
    private static final int MAX_MESSAGE_SIZE = 16 * 1024 * 1024;

    private final String host;
    private final int port;
    private final ConnectionRegistry connections;
    private final GatewayProtocolHandler protocolHandler;
    private final HealthReport healthReport;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private ExecutorService requestExecutor;
    private Channel serverChannel;

    public GatewayServer(String host, int port, ExtensionManager manager, ConnectionRegistry connections) {
        this.host = host;
        this.port = port;
        this.connections = connections;
        this.protocolHandler = new GatewayProtocolHandler(manager, connections);
        this.healthReport = new HealthReport(manager, connections);
    }

    /**
     * Binds the server and starts accepting connections.
     *
     * @throws InterruptedException if interrupted while binding
     */
    public void start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        requestExecutor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "gateway-request");
            thread.setDaemon(true);
            return thread;
        });

        ServerBootstrap bootstrap = new ServerBootstrap()
            .group(bossGroup, workerGroup)
            .channel(NioServerSocketChannel.class)
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel channel) {
                    ChannelPipeline pipeline = channel.pipeline();
                    pipeline.addLast("http-codec", new HttpServerCodec());
                    pipeline.addLast("http-aggregator", new HttpObjectAggregator(MAX_MESSAGE_SIZE));
                    pipeline.addLast("websocket", new WebSocketServerProtocolHandler(WEBSOCKET_PATH, null, true,
                        MAX_MESSAGE_SIZE));
                    pipeline.addLast("http", new HttpRequestHandler(healthReport));
                    pipeline.addLast("frames", new WebSocketFrameHandler(protocolHandler, connections, requestExecutor));
                }
            });

        serverChannel = bootstrap.bind(new InetSocketAddress(host, port)).sync().channel();
        LOGGER.info("Gateway listening on http://{}:{} (WebSocket {})", host, getPort(), WEBSOCKET_PATH);
    }

    /**
     * Gets the bound port, which differs from the configured one when that was 0.
     */
    public int getPort() {
        if (serverChannel != null && serverChannel.localAddress() instanceof InetSocketAddress address) {
            return address.getPort();
        }
        return port;
    }

    public boolean isRunning() {
        return serverChannel != null && serverChannel.isActive();
    }

    /**
     * Closes the listening socket and every client connection.
     */
    public void stop() {
        if (serverChannel != null) {
            serverChannel.close().awaitUninterruptibly();
            serverChannel = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        }
        if (requestExecutor != null) {
            requestExecutor.shutdownNow();
        }
        LOGGER.info("Gateway server stopped");
    }
}
