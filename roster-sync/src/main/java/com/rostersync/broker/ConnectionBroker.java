package com.rostersync.broker;

import com.rostersync.broker.netty.NettyUpstreamConnector;
import com.rostersync.delta.ApplyResult;
import com.rostersync.delta.DeltaApplicator;
import com.rostersync.delta.DeltaMetadata;
import com.rostersync.delta.DeltaPackage;
import com.rostersync.monitor.PerformanceMonitor;
import com.rostersync.protocol.Frame;
import com.rostersync.protocol.FrameCodec;
import com.rostersync.protocol.ProtocolException;
import com.rostersync.state.Snapshot;
import com.rostersync.state.SnapshotStore;

import io.netty.channel.EventLoop;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.EventExecutor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the one upstream roster connection of the process and fans its
 * frames out to any number of local subscribers.
 *
 * Construct one broker per process and hand it to whatever needs roster
 * events; its lifecycle ({@link #connect()} / {@link #stop()}) belongs to the
 * host process, not to any single consumer.
 *
 * Frame handling:
 * - FULL_SNAPSHOT: replace the store, emit RESET
 * - DELTA: apply on top of the store; on success commit and emit UPDATE,
 *   on a desync drop the package and request a resync
 * - Malformed frames: log, resync; too many within the window force a reconnect
 *
 * Threading Model:
 * - All state changes, frame handling and subscriber callbacks run on a
 *   single dispatch loop (a Netty event loop), so deltas are applied and
 *   delivered strictly in order and callbacks never overlap
 * - Public methods may be called from any thread; they hop onto the loop
 *
 * Important: subscriber callbacks run on the dispatch loop. A slow callback
 * stalls every other subscriber and the connection itself.
 */
public class ConnectionBroker implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionBroker.class);

    private final BrokerConfig config;
    private final UpstreamConnector connector;
    private final EventExecutor executor;
    private final ReconnectTimer reconnectTimer;
    private final BackoffPolicy backoff;
    private final Clock clock;
    private final Runnable releaseResources;

    private final FrameCodec codec;
    private final DeltaApplicator applicator;
    private final PerformanceMonitor monitor;
    private final SnapshotStore store;
    private final ProtocolErrorWindow protocolErrors;
    private final UpstreamListener upstreamEvents;

    private final Map<String, Subscriber> subscribers;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile boolean stopped;

    // Confined to the dispatch loop
    private UpstreamConnection connection;
    private int retryAttempt;
    private long resyncRequestedAt = -1;

    private final AtomicLong framesReceived = new AtomicLong();
    private final AtomicLong fullSnapshots = new AtomicLong();
    private final AtomicLong deltasApplied = new AtomicLong();
    private final AtomicLong deltasRejected = new AtomicLong();
    private final AtomicLong protocolErrorCount = new AtomicLong();
    private final AtomicLong resyncRequests = new AtomicLong();

    public ConnectionBroker(BrokerConfig config, UpstreamConnector connector, EventExecutor executor,
                            ReconnectTimer reconnectTimer, BackoffPolicy backoff,
                            PerformanceMonitor monitor, Clock clock) {
        this(config, connector, executor, reconnectTimer, backoff, monitor, clock, new FrameCodec(), () -> { });
    }

    private ConnectionBroker(BrokerConfig config, UpstreamConnector connector, EventExecutor executor,
                             ReconnectTimer reconnectTimer, BackoffPolicy backoff,
                             PerformanceMonitor monitor, Clock clock, FrameCodec codec,
                             Runnable releaseResources) {
        this.config = Objects.requireNonNull(config, "config");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.reconnectTimer = Objects.requireNonNull(reconnectTimer, "reconnectTimer");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.releaseResources = releaseResources;

        this.codec = Objects.requireNonNull(codec, "codec");
        this.applicator = new DeltaApplicator();
        this.store = new SnapshotStore(monitor);
        this.protocolErrors = new ProtocolErrorWindow(config.getProtocolErrorWindow());
        this.upstreamEvents = new UpstreamEvents();
        this.subscribers = new ConcurrentHashMap<>();
    }

    /**
     * Creates a broker that talks WebSocket to {@link BrokerConfig#getUpstreamUri()}.
     * The broker owns a single-threaded Netty event loop that carries both the
     * upstream I/O and all dispatch work; {@link #stop()} releases it.
     */
    public static ConnectionBroker create(BrokerConfig config) {
        EventLoopGroup group = new NioEventLoopGroup(1);
        EventLoop loop = group.next();
        FrameCodec codec = new FrameCodec();
        NettyUpstreamConnector connector = new NettyUpstreamConnector(group, config, codec);

        return new ConnectionBroker(config, connector, loop,
                new EventLoopReconnectTimer(loop),
                BackoffPolicy.from(config),
                new PerformanceMonitor(config.getMonitorCapacity()),
                Clock.systemUTC(),
                codec,
                () -> group.shutdownGracefully(0, 2, TimeUnit.SECONDS));
    }

    // === Public API ===

    /**
     * Opens the upstream connection. Leaves DISCONNECTED or DEGRADED, and cuts
     * a pending backoff short when RECONNECTING; a no-op when already
     * connecting or connected.
     */
    public void connect() {
        runOnLoop(this::doConnect);
    }

    /**
     * Closes the upstream connection without automatic reconnect.
     * Subscribers stay registered.
     */
    public void disconnect() {
        runOnLoopAndWait(this::doDisconnect);
    }

    /**
     * Tears the broker down: closes the connection, removes every subscriber
     * and releases the event loop. Idempotent; a stopped broker cannot be
     * restarted.
     */
    public void stop() {
        if (stopped) {
            return;
        }
        runOnLoopAndWait(() -> {
            doDisconnect();
            stopped = true;
            for (Subscriber subscriber : subscribers.values()) {
                subscriber.deactivate();
            }
            subscribers.clear();
        });
        connector.shutdown();
        releaseResources.run();
        logger.info("Connection broker stopped");
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Registers a callback for the given event types.
     *
     * @return the id to pass to {@link #unsubscribe(String)}
     */
    public String subscribe(Set<RosterEventType> eventTypes, RosterListener listener) {
        Objects.requireNonNull(listener, "listener");
        if (eventTypes == null || eventTypes.isEmpty()) {
            throw new IllegalArgumentException("At least one event type is required");
        }
        if (stopped) {
            throw new IllegalStateException("Broker is stopped");
        }

        String subscriberId = "sub-" + UUID.randomUUID();
        subscribers.put(subscriberId, new Subscriber(subscriberId, EnumSet.copyOf(eventTypes), listener));

        logger.debug("New subscriber {} for {} (total: {})", subscriberId, eventTypes, subscribers.size());
        return subscriberId;
    }

    /**
     * Registers a callback for every event type.
     */
    public String subscribe(RosterListener listener) {
        return subscribe(EnumSet.allOf(RosterEventType.class), listener);
    }

    /**
     * Removes a subscriber. Idempotent. Once this returns, the callback is
     * never invoked again: when called off the dispatch loop it waits for any
     * dispatch in flight to finish.
     */
    public void unsubscribe(String subscriberId) {
        Subscriber subscriber = subscriberId != null ? subscribers.get(subscriberId) : null;
        if (subscriber == null) {
            logger.debug("Unsubscribe of unknown subscriber {}", subscriberId);
            return;
        }

        subscriber.deactivate();
        subscribers.remove(subscriberId, subscriber);
        logger.debug("Unsubscribed {} (remaining: {})", subscriberId, subscribers.size());

        if (!executor.inEventLoop() && !executor.isShuttingDown()) {
            executor.submit(() -> { }).syncUninterruptibly();
        }
    }

    /**
     * Asks upstream for a full snapshot. Deferred (dropped) while not
     * connected, since every new connection starts with a resync anyway.
     */
    public void requestResync() {
        runOnLoop(this::sendResyncRequest);
    }

    public ConnectionState getState() {
        return state;
    }

    public Snapshot currentSnapshot() {
        return store.current();
    }

    public SnapshotStore getSnapshotStore() {
        return store;
    }

    public PerformanceMonitor getPerformanceMonitor() {
        return monitor;
    }

    public BrokerConfig getConfig() {
        return config;
    }

    /**
     * The codec shared by the broker and its transport.
     */
    public FrameCodec getCodec() {
        return codec;
    }

    UpstreamConnector getConnector() {
        return connector;
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    public BrokerStats getStats() {
        return new BrokerStats(state, subscribers.size(), framesReceived.get(), fullSnapshots.get(),
                deltasApplied.get(), deltasRejected.get(), protocolErrorCount.get(),
                resyncRequests.get(), store.current().getVersion());
    }

    // === Connection lifecycle (dispatch loop) ===

    private void doConnect() {
        if (stopped) {
            logger.warn("connect() called on a stopped broker, ignoring");
            return;
        }

        switch (state.getKind()) {
            case CONNECTING, CONNECTED -> {
                logger.debug("connect() while {}, nothing to do", state);
                return;
            }
            case RECONNECTING -> reconnectTimer.cancel();
            default -> {
                // DISCONNECTED or DEGRADED
            }
        }

        retryAttempt = 0;
        openConnection();
    }

    private void openConnection() {
        transition(ConnectionState.CONNECTING);
        logger.info("Connecting to {}", config.getUpstreamUri());

        try {
            connection = connector.connect(upstreamEvents);
        } catch (RuntimeException e) {
            logger.warn("Could not start connection attempt to {}", config.getUpstreamUri(), e);
            connection = null;
            scheduleReconnect();
        }
    }

    private void doDisconnect() {
        reconnectTimer.cancel();
        retryAttempt = 0;

        UpstreamConnection open = connection;
        connection = null;
        if (open != null) {
            open.close();
        }

        if (!state.is(ConnectionState.Kind.DISCONNECTED)) {
            transition(ConnectionState.DISCONNECTED);
        }
    }

    private void handleOpen(UpstreamConnection opened) {
        if (opened != connection) {
            logger.debug("Ignoring open of a stale connection");
            opened.close();
            return;
        }

        retryAttempt = 0;
        protocolErrors.clear();
        resyncRequestedAt = -1;
        transition(ConnectionState.CONNECTED);

        // A CONNECTED subscriber may have disconnected or stopped the broker
        if (opened != connection || !state.is(ConnectionState.Kind.CONNECTED)) {
            return;
        }

        // Server-side stream state is unknown after any (re)connect
        send(Frame.subscribe(config.getClientId()));
        sendResyncRequest();
    }

    private void handleClosed(UpstreamConnection closed, Throwable cause) {
        if (closed != connection) {
            logger.debug("Ignoring close of a stale connection");
            return;
        }
        connection = null;

        if (stopped || state.is(ConnectionState.Kind.DISCONNECTED)) {
            return;
        }

        if (cause != null) {
            logger.warn("Upstream connection lost: {}", cause.toString());
        } else {
            logger.warn("Upstream connection closed");
        }
        scheduleReconnect();
    }

    private void forceReconnect() {
        UpstreamConnection stale = connection;
        connection = null;
        if (stale != null) {
            stale.close();
        }
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (retryAttempt >= config.getMaxRetryAttempts()) {
            reconnectTimer.cancel();
            logger.error("Giving up after {} reconnect attempts; roster is stale until connect() is called",
                    retryAttempt);
            transition(ConnectionState.DEGRADED);
            return;
        }

        retryAttempt++;
        int attempt = retryAttempt;
        Duration delay = backoff.delayFor(attempt);

        reconnectTimer.schedule(delay, () -> runOnLoop(() -> retry(attempt)));
        logger.info("Reconnect attempt {}/{} in {}ms", attempt, config.getMaxRetryAttempts(), delay.toMillis());
        transition(ConnectionState.reconnecting(attempt, clock.millis() + delay.toMillis()));
    }

    private void retry(int attempt) {
        if (stopped || !state.is(ConnectionState.Kind.RECONNECTING) || state.getAttempt() != attempt) {
            return;
        }
        openConnection();
    }

    private void transition(ConnectionState next) {
        ConnectionState previous = state;
        state = next;
        logger.info("Upstream connection {} -> {}", previous, next);
        deliver(RosterEvent.connectionState(next));
    }

    // === Frame handling (dispatch loop) ===

    private void handleText(UpstreamConnection source, String text) {
        if (source != connection || !state.is(ConnectionState.Kind.CONNECTED)) {
            logger.debug("Dropping frame from a stale connection");
            return;
        }
        framesReceived.incrementAndGet();

        Frame frame;
        try {
            frame = codec.decode(text);
        } catch (ProtocolException e) {
            handleProtocolError(e, text);
            return;
        }

        switch (frame.getType()) {
            case FULL_SNAPSHOT -> applyFullSnapshot(frame);
            case DELTA -> applyDelta(frame);
            case HEARTBEAT -> logger.trace("Heartbeat from upstream");
            case SUBSCRIBE, RESYNC_REQUEST -> handleProtocolError(
                    new ProtocolException("Unexpected " + frame.getType() + " frame from upstream"), text);
        }
    }

    private void applyFullSnapshot(Frame frame) {
        long started = System.nanoTime();
        Snapshot snapshot = frame.toSnapshot();
        store.replace(snapshot);
        double elapsed = elapsedMillis(started);

        resyncRequestedAt = -1;
        fullSnapshots.incrementAndGet();
        monitor.recordFull(codec.measure(snapshot.sortedEntities()), elapsed);

        logger.info("Roster reset to version {} ({} entities)", snapshot.getVersion(), snapshot.size());
        deliver(RosterEvent.reset(snapshot));
    }

    private void applyDelta(Frame frame) {
        DeltaPackage pkg = frame.toDeltaPackage();

        long started = System.nanoTime();
        ApplyResult result = applicator.apply(store.current(), pkg);

        if (!result.isSuccess()) {
            deltasRejected.incrementAndGet();
            if (resyncPending()) {
                logger.debug("Dropping delta {} -> {} while a resync is pending",
                        pkg.getBaseVersion(), pkg.getTargetVersion());
                return;
            }
            logger.warn("Rejected delta {} -> {} at version {}: {}", pkg.getBaseVersion(),
                    pkg.getTargetVersion(), store.current().getVersion(), result.getError());
            sendResyncRequest();
            return;
        }

        Snapshot next = result.getSnapshot();
        store.replace(next);
        double elapsed = elapsedMillis(started);

        deltasApplied.incrementAndGet();
        monitor.recordDelta(remeasured(pkg, next), elapsed);

        logger.debug("Applied delta {} -> {} ({} changes)", pkg.getBaseVersion(),
                pkg.getTargetVersion(), pkg.getChanges().size());
        deliver(RosterEvent.update(pkg.getChanges(), next));
    }

    /**
     * The package with its size accounting measured locally, so the monitor
     * never reports statistics the producer merely claims.
     */
    private DeltaPackage remeasured(DeltaPackage pkg, Snapshot next) {
        DeltaMetadata claimed = pkg.getMetadata();
        DeltaMetadata measured = DeltaMetadata.of(pkg.getChanges().size(),
                codec.measure(next.sortedEntities()),
                codec.measure(pkg.getChanges()),
                claimed.getProducedAt());
        if (measured.getFullSizeBytes() != claimed.getFullSizeBytes()
                || measured.getDeltaSizeBytes() != claimed.getDeltaSizeBytes()) {
            logger.debug("Delta {} -> {} claimed {} bytes of {}, measured {} of {}",
                    pkg.getBaseVersion(), pkg.getTargetVersion(),
                    claimed.getDeltaSizeBytes(), claimed.getFullSizeBytes(),
                    measured.getDeltaSizeBytes(), measured.getFullSizeBytes());
        }
        return new DeltaPackage(pkg.getBaseVersion(), pkg.getTargetVersion(), pkg.getChanges(), measured);
    }

    private void handleProtocolError(ProtocolException e, String text) {
        protocolErrorCount.incrementAndGet();
        int recent = protocolErrors.record(clock.millis());
        logger.warn("Protocol error from upstream ({} within window): {}", recent, e.getMessage());
        logger.debug("Offending frame: {}", text);

        if (recent >= config.getProtocolErrorThreshold()) {
            logger.error("{} protocol errors within {}ms, forcing reconnect",
                    recent, config.getProtocolErrorWindow().toMillis());
            protocolErrors.clear();
            forceReconnect();
            return;
        }

        if (!resyncPending()) {
            sendResyncRequest();
        }
    }

    private boolean resyncPending() {
        return resyncRequestedAt >= 0
                && clock.millis() - resyncRequestedAt < config.getResyncRetryInterval().toMillis();
    }

    private void sendResyncRequest() {
        if (connection == null || !state.is(ConnectionState.Kind.CONNECTED)) {
            logger.debug("Resync deferred until connected");
            return;
        }

        long version = store.current().getVersion();
        if (send(Frame.resyncRequest(version))) {
            resyncRequests.incrementAndGet();
            resyncRequestedAt = clock.millis();
            logger.info("Requested resync (last known version {})", version);
        }
    }

    private boolean send(Frame frame) {
        UpstreamConnection open = connection;
        if (open == null) {
            logger.debug("Not sending {}: no upstream connection", frame.getType());
            return false;
        }
        boolean sent = open.send(codec.encode(frame));
        if (!sent) {
            logger.warn("Could not send {}: connection not writable", frame.getType());
        }
        return sent;
    }

    // === Fan-out ===

    private void deliver(RosterEvent event) {
        for (Subscriber subscriber : subscribers.values()) {
            if (!subscriber.accepts(event.getType())) {
                continue;
            }
            try {
                subscriber.getListener().onEvent(event);
            } catch (RuntimeException e) {
                logger.error("Subscriber {} failed handling {}", subscriber.getSubscriberId(), event, e);
            }
        }
    }

    // === Loop plumbing ===

    private void runOnLoop(Runnable task) {
        if (executor.inEventLoop()) {
            task.run();
        } else if (executor.isShuttingDown()) {
            logger.debug("Dispatch loop is shutting down, dropping task");
        } else {
            executor.execute(task);
        }
    }

    private void runOnLoopAndWait(Runnable task) {
        if (executor.inEventLoop()) {
            task.run();
        } else if (!executor.isShuttingDown()) {
            executor.submit(task).syncUninterruptibly();
        }
    }

    private static double elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000.0;
    }

    /**
     * Hops every transport callback onto the dispatch loop.
     */
    private final class UpstreamEvents implements UpstreamListener {

        @Override
        public void onOpen(UpstreamConnection opened) {
            runOnLoop(() -> handleOpen(opened));
        }

        @Override
        public void onText(UpstreamConnection source, String text) {
            runOnLoop(() -> handleText(source, text));
        }

        @Override
        public void onClosed(UpstreamConnection closed, Throwable cause) {
            runOnLoop(() -> handleClosed(closed, cause));
        }
    }
}
