package com.rostersync.broker.netty;

import com.rostersync.broker.BrokerConfig;
import com.rostersync.broker.ConnectionException;
import com.rostersync.broker.UpstreamConnection;
import com.rostersync.broker.UpstreamConnector;
import com.rostersync.broker.UpstreamListener;
import com.rostersync.protocol.FrameCodec;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.timeout.IdleStateHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.concurrent.TimeUnit;

/**
 * Opens WebSocket connections to the upstream roster feed on a caller-owned
 * Netty event loop group.
 *
 * Pipeline (per connection):
 * - SslHandler (wss only)
 * - HttpClientCodec + HttpObjectAggregator for the handshake
 * - IdleStateHandler: reader idle = heartbeat timeout, writer idle = heartbeat interval
 * - WebSocketClientProtocolHandler (handshake, ping/pong, close frames)
 * - WebSocketFrameAggregator (continuation frames)
 * - UpstreamFrameHandler
 *
 * Listener callbacks run on the channel's event loop and never from inside
 * {@link #connect(UpstreamListener)} itself.
 */
public class NettyUpstreamConnector implements UpstreamConnector {

    private static final Logger logger = LoggerFactory.getLogger(NettyUpstreamConnector.class);
    private static final int CONNECT_TIMEOUT_MS = 10_000;

    private final EventLoopGroup group;
    private final BrokerConfig config;
    private final FrameCodec codec;
    private final SslContext sslContext;

    public NettyUpstreamConnector(EventLoopGroup group, BrokerConfig config, FrameCodec codec) {
        this.group = group;
        this.config = config;
        this.codec = codec;
        this.sslContext = "wss".equalsIgnoreCase(config.getUpstreamUri().getScheme()) ? clientSslContext() : null;
    }

    @Override
    public UpstreamConnection connect(UpstreamListener listener) {
        URI uri = config.getUpstreamUri();
        String host = uri.getHost();
        int port = portOf(uri);

        NettyUpstreamConnection connection = new NettyUpstreamConnection(listener);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MS)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();

                        if (sslContext != null) {
                            pipeline.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }

                        pipeline.addLast(new HttpClientCodec());
                        pipeline.addLast(new HttpObjectAggregator(65536));

                        pipeline.addLast(new IdleStateHandler(
                                config.getHeartbeatTimeout().toMillis(),
                                config.getHeartbeatInterval().toMillis(),
                                0,
                                TimeUnit.MILLISECONDS));

                        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                                uri, WebSocketVersion.V13, null, false,
                                new DefaultHttpHeaders(), config.getMaxFrameBytes());
                        pipeline.addLast(new WebSocketClientProtocolHandler(handshaker));
                        pipeline.addLast(new WebSocketFrameAggregator(config.getMaxFrameBytes()));

                        pipeline.addLast(new UpstreamFrameHandler(connection, codec));
                    }
                });

        logger.debug("Opening upstream channel to {}:{}", host, port);
        ChannelFuture future = bootstrap.connect(host, port);
        connection.attach(future.channel());

        future.addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                ConnectionException failure =
                        new ConnectionException("Could not connect to " + uri, f.cause());
                // Deferred so the broker has seen connect() return first
                group.next().execute(() -> connection.fail(failure));
            }
        });

        return connection;
    }

    public FrameCodec getCodec() {
        return codec;
    }

    private static int portOf(URI uri) {
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        return "wss".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }

    private static SslContext clientSslContext() {
        try {
            return SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            throw new IllegalStateException("Could not initialize TLS for upstream connection", e);
        }
    }
}
