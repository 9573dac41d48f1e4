package com.conduit.server;

import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.util.AttributeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Bridges WebSocket channels to {@link ClientConnection}s.
 */
class WebSocketFrameHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebSocketFrameHandler.class);

    static final AttributeKey<ClientConnection> CONNECTION = AttributeKey.valueOf("conduit.connection");

    private final GatewayProtocolHandler protocolHandler;
    private final ConnectionRegistry connections;
    private final Executor requestExecutor;

    WebSocketFrameHandler(GatewayProtocolHandler protocolHandler, ConnectionRegistry connections,
                          Executor requestExecutor) {
        this.protocolHandler = protocolHandler;
        this.connections = connections;
        this.requestExecutor = requestExecutor;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            Channel channel = ctx.channel();
            ClientConnection connection = new ClientConnection(UUID.randomUUID().toString(),
                text -> channel.writeAndFlush(new TextWebSocketFrame(text)), requestExecutor);
            channel.attr(CONNECTION).set(connection);
            connections.add(connection);
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        ClientConnection connection = ctx.channel().attr(CONNECTION).get();
        if (connection == null) {
            LOGGER.warn("Frame received before handshake completed on {}", ctx.channel().remoteAddress());
            return;
        }
        protocolHandler.handleMessage(connection, frame.text());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        ClientConnection connection = ctx.channel().attr(CONNECTION).getAndSet(null);
        if (connection != null) {
            connections.remove(connection.getId());
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.warn("WebSocket error on {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }
}
