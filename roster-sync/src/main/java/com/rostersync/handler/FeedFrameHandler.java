package com.rostersync.handler;

import com.rostersync.protocol.Frame;
import com.rostersync.protocol.FrameCodec;
import com.rostersync.protocol.ProtocolException;
import com.rostersync.server.RosterPublisher;
import com.rostersync.session.ObserverSession;
import com.rostersync.session.SessionManager;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles frames from roster observers on the feed server.
 *
 * - SUBSCRIBE: record the client id, start streaming deltas
 * - RESYNC_REQUEST: start streaming and send the full roster
 * - HEARTBEAT: answer with a heartbeat
 * - Anything else: logged and ignored
 *
 * Threading Model:
 * - Each channel is handled by a single Netty worker thread
 * - Roster state lives in the RosterPublisher, which synchronizes itself
 *
 * Important: Never block in this handler!
 */
public class FeedFrameHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private static final Logger logger = LoggerFactory.getLogger(FeedFrameHandler.class);

    private final SessionManager sessionManager;
    private final RosterPublisher publisher;
    private final FrameCodec codec;

    public FeedFrameHandler(SessionManager sessionManager, RosterPublisher publisher) {
        this.sessionManager = sessionManager;
        this.publisher = publisher;
        this.codec = new FrameCodec();
    }

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        ObserverSession session = sessionManager.createSession(ctx.channel());
        logger.info("New observer connection: {}", session.getSessionId());
    }

    @Override
    public void handlerRemoved(ChannelHandlerContext ctx) {
        ObserverSession session = sessionManager.removeSession(ctx.channel());
        if (session != null) {
            logger.info("Observer {} disconnected", session.getClientId());
        }
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (!(frame instanceof TextWebSocketFrame)) {
            logger.warn("Unsupported frame type: {}", frame.getClass().getName());
            return;
        }

        String json = ((TextWebSocketFrame) frame).text();
        ObserverSession session = sessionManager.getSessionByChannel(ctx.channel());
        if (session == null) {
            logger.error("Received frame from unknown channel");
            return;
        }

        Frame decoded;
        try {
            decoded = codec.decode(json);
        } catch (ProtocolException e) {
            logger.warn("Ignoring malformed frame from {}: {}", session.getSessionId(), e.getMessage());
            return;
        }
        handleFrame(session, decoded);
    }

    private void handleFrame(ObserverSession session, Frame frame) {
        logger.debug("Received {} from {}", frame.getType(), session.getSessionId());

        switch (frame.getType()) {
            case SUBSCRIBE -> {
                session.setClientId(frame.getClientId());
                session.setSubscribed(true);
                logger.info("Observer {} subscribed", frame.getClientId());
            }
            case RESYNC_REQUEST -> {
                logger.info("Resync requested by {} (last known version {})",
                        session.getClientId(), frame.getLastKnownVersion());
                publisher.sendFullSnapshot(session);
            }
            case HEARTBEAT -> session.send(codec.encode(Frame.heartbeat()));
            default -> logger.warn("Ignoring {} frame from observer {}", frame.getType(), session.getSessionId());
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            IdleStateEvent e = (IdleStateEvent) evt;
            if (e.state() == IdleState.READER_IDLE) {
                logger.warn("Observer idle timeout, closing: {}", ctx.channel().id());
                ctx.close();
            } else if (e.state() == IdleState.WRITER_IDLE) {
                ctx.writeAndFlush(new TextWebSocketFrame(codec.encode(Frame.heartbeat())));
            }
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        logger.error("WebSocket error", cause);
        ctx.close();
    }
}
