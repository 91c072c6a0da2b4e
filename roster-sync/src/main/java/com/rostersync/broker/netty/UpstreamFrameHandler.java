package com.rostersync.broker.netty;

import com.rostersync.broker.ConnectionException;
import com.rostersync.protocol.Frame;
import com.rostersync.protocol.FrameCodec;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last handler of the upstream pipeline: turns channel events into
 * {@link NettyUpstreamConnection} callbacks.
 *
 * - Handshake complete: connection opened
 * - Text frame: passed up as-is, decoding is the broker's job
 * - Reader idle: heartbeat timeout, treated as a transport failure
 * - Writer idle: send a HEARTBEAT frame
 */
final class UpstreamFrameHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger logger = LoggerFactory.getLogger(UpstreamFrameHandler.class);

    private final NettyUpstreamConnection connection;
    private final FrameCodec codec;

    UpstreamFrameHandler(NettyUpstreamConnection connection, FrameCodec codec) {
        this.connection = connection;
        this.codec = codec;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (!(frame instanceof TextWebSocketFrame)) {
            logger.warn("Unsupported frame type from upstream: {}", frame.getClass().getSimpleName());
            return;
        }
        connection.received(((TextWebSocketFrame) frame).text());
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
            logger.debug("Upstream handshake complete: {}", ctx.channel().id());
            connection.opened();
        } else if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
            connection.recordFailure(new ConnectionException("WebSocket handshake timed out"));
        } else if (evt instanceof IdleStateEvent) {
            IdleStateEvent e = (IdleStateEvent) evt;
            if (e.state() == IdleState.READER_IDLE) {
                logger.warn("No traffic from upstream within heartbeat timeout, closing: {}", ctx.channel().id());
                connection.recordFailure(new ConnectionException("Heartbeat timeout"));
                ctx.close();
            } else if (e.state() == IdleState.WRITER_IDLE && connection.isOpen()) {
                ctx.writeAndFlush(new TextWebSocketFrame(codec.encode(Frame.heartbeat())));
            }
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        connection.notifyClosed();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.warn("Upstream channel error: {}", cause.toString());
        connection.recordFailure(cause);
        ctx.close();
    }
}
