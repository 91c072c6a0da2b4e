package com.rostersync.server;

import com.rostersync.handler.FeedFrameHandler;
import com.rostersync.session.SessionManager;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.codec.http.websocketx.extensions.compression.WebSocketServerCompressionHandler;
import io.netty.handler.timeout.IdleStateHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket server that streams the roster to observers at {@code /roster}.
 *
 * Threading Model:
 * - Boss Group: 1 thread that accepts incoming connections
 * - Worker Group: N threads (CPU cores) that handle I/O operations
 */
public class RosterFeedServer {

    private static final Logger logger = LoggerFactory.getLogger(RosterFeedServer.class);

    public static final String WEBSOCKET_PATH = "/roster";
    private static final int MAX_FRAME_BYTES = 1 << 20;

    private final int port;
    private final SessionManager sessionManager;
    private final RosterPublisher publisher;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public RosterFeedServer(int port) {
        this.port = port;
        this.sessionManager = new SessionManager();
        this.publisher = new RosterPublisher(sessionManager);
    }

    /**
     * Binds the server and returns once it accepts connections.
     */
    public synchronized void start() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("Server already started");
        }

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();

                        // Read timeout: 60s, Write timeout (heartbeat): 30s
                        pipeline.addLast(new IdleStateHandler(60, 30, 0, TimeUnit.SECONDS));

                        pipeline.addLast(new HttpServerCodec());
                        pipeline.addLast(new HttpObjectAggregator(65536));
                        pipeline.addLast(new WebSocketServerCompressionHandler());

                        pipeline.addLast(new WebSocketServerProtocolHandler(
                                WEBSOCKET_PATH,
                                null,      // subprotocols
                                true,      // allow extensions
                                MAX_FRAME_BYTES,
                                false,     // allow mask mismatch
                                true,      // check starting slash
                                10000L     // handshake timeout ms
                        ));

                        pipeline.addLast(new FeedFrameHandler(sessionManager, publisher));
                    }
                });

        try {
            serverChannel = bootstrap.bind(port).sync().channel();
        } catch (Exception e) {
            releaseGroups();
            throw e;
        }

        logger.info("Roster feed started: ws://localhost:{}{}", getPort(), WEBSOCKET_PATH);
    }

    /**
     * Blocks until the server channel is closed.
     */
    public void blockUntilShutdown() throws InterruptedException {
        Channel channel;
        synchronized (this) {
            channel = serverChannel;
        }
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }

    /**
     * Stops accepting connections, closes every observer connection and
     * releases the event loops. The port is free once this returns.
     */
    public synchronized void shutdown() {
        if (serverChannel == null) {
            return;
        }
        logger.info("Shutting down roster feed...");

        serverChannel.close().syncUninterruptibly();
        serverChannel = null;
        releaseGroups();

        logger.info("Roster feed shutdown complete.");
    }

    private void releaseGroups() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
            bossGroup = null;
        }
    }

    /**
     * The bound port (useful when constructed with port 0), or the configured
     * port before {@link #start()}.
     */
    public synchronized int getPort() {
        if (serverChannel != null) {
            return ((InetSocketAddress) serverChannel.localAddress()).getPort();
        }
        return port;
    }

    public SessionManager getSessionManager() {
        return sessionManager;
    }

    public RosterPublisher getPublisher() {
        return publisher;
    }
}
