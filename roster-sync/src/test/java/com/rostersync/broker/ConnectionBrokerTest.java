package com.rostersync.broker;

import com.rostersync.broker.netty.NettyUpstreamConnector;
import com.rostersync.delta.DeltaCalculator;
import com.rostersync.delta.DeltaMetadata;
import com.rostersync.delta.DeltaPackage;
import com.rostersync.delta.EntityChange;
import com.rostersync.monitor.PerformanceMonitor;
import com.rostersync.monitor.PerformanceSample;
import com.rostersync.monitor.PerformanceSummary;
import com.rostersync.monitor.UpdateMode;
import com.rostersync.protocol.Frame;
import com.rostersync.protocol.FrameCodec;
import com.rostersync.protocol.FrameType;
import com.rostersync.state.Entity;
import com.rostersync.state.EntityStatus;
import com.rostersync.state.Snapshot;
import io.netty.util.concurrent.ImmediateEventExecutor;
import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the connection broker state machine:
 * - Handshake and frame handling
 * - Desync detection and resync
 * - Reconnect backoff and degradation
 * - Subscriber fan-out and isolation
 *
 * Runs on an immediate executor with a scripted transport and a manual
 * timer, so every step is deterministic.
 */
@DisplayName("Connection Broker Tests")
class ConnectionBrokerTest {

    private final FrameCodec codec = new FrameCodec();
    private final DeltaCalculator calculator = new DeltaCalculator(codec);

    private ScriptedConnector connector;
    private ManualTimer timer;
    private MutableClock clock;
    private ConnectionBroker broker;
    private List<RosterEvent> events;

    @BeforeEach
    void setUp() {
        setUpBroker(BrokerConfig.builder()
                .clientId("observer-test")
                .backoffBase(Duration.ofSeconds(1))
                .backoffMultiplier(2.0)
                .backoffMax(Duration.ofSeconds(8))
                .backoffJitter(0.0)
                .maxRetryAttempts(3)
                .protocolErrorThreshold(3)
                .resyncRetryInterval(Duration.ofSeconds(5))
                .build());
    }

    private void setUpBroker(BrokerConfig config) {
        connector = new ScriptedConnector();
        timer = new ManualTimer();
        clock = new MutableClock(1_000_000L);
        broker = new ConnectionBroker(config, connector, ImmediateEventExecutor.INSTANCE, timer,
                BackoffPolicy.from(config), new PerformanceMonitor(100), clock);
        events = new ArrayList<>();
        broker.subscribe(events::add);
    }

    @AfterEach
    void tearDown() {
        broker.stop();
    }

    private static Entity entity(String id, EntityStatus status) {
        return Entity.builder().id(id).displayName("Student " + id).status(status).build();
    }

    private static Snapshot roster(long version, Entity... entities) {
        return Snapshot.of(version, version * 1000, List.of(entities));
    }

    private String fullSnapshot(Snapshot snapshot) {
        return codec.encode(Frame.fullSnapshot(snapshot));
    }

    private String delta(Snapshot previous, Snapshot next) {
        return codec.encode(Frame.delta(calculator.calculate(previous, next)));
    }

    private ScriptedConnection connectAndOpen() {
        broker.connect();
        ScriptedConnection connection = connector.latest();
        connection.open();
        return connection;
    }

    private List<RosterEvent> eventsOf(RosterEventType type) {
        List<RosterEvent> matching = new ArrayList<>();
        for (RosterEvent event : events) {
            if (event.getType() == type) {
                matching.add(event);
            }
        }
        return matching;
    }

    // ==========================================
    // Test: Handshake and Frame Handling
    // ==========================================

    @Test
    @DisplayName("Should subscribe and request a resync on every new connection")
    void testHandshake() {
        broker.connect();
        assertEquals(ConnectionState.Kind.CONNECTING, broker.getState().getKind());

        ScriptedConnection connection = connector.latest();
        connection.open();

        assertEquals(ConnectionState.Kind.CONNECTED, broker.getState().getKind());
        List<Frame> sent = connection.sentFrames();
        assertEquals(2, sent.size());
        assertEquals(FrameType.SUBSCRIBE, sent.get(0).getType());
        assertEquals("observer-test", sent.get(0).getClientId());
        assertEquals(FrameType.RESYNC_REQUEST, sent.get(1).getType());
        assertEquals(0L, sent.get(1).getLastKnownVersion());
    }

    @Test
    @DisplayName("Connect while connecting or connected is a no-op")
    void testConnectIdempotent() {
        broker.connect();
        broker.connect();
        assertEquals(1, connector.connections.size());

        connector.latest().open();
        broker.connect();
        assertEquals(1, connector.connections.size());
    }

    @Test
    @DisplayName("Full snapshot replaces the roster and emits RESET")
    void testFullSnapshot() {
        ScriptedConnection connection = connectAndOpen();
        Snapshot snapshot = roster(4, entity("s1", EntityStatus.ACTIVE), entity("s2", EntityStatus.IDLE));

        connection.receive(fullSnapshot(snapshot));

        assertEquals(snapshot, broker.currentSnapshot());
        List<RosterEvent> resets = eventsOf(RosterEventType.RESET);
        assertEquals(1, resets.size());
        assertEquals(snapshot, resets.get(0).getSnapshot());
        assertEquals(1, broker.getPerformanceMonitor().summary().getModeStats(UpdateMode.FULL).getCount());
        assertEquals(2, broker.getPerformanceMonitor().summary().getLastRosterSize());
    }

    @Test
    @DisplayName("Applied delta commits and emits UPDATE with the changes")
    void testDeltaApplied() {
        ScriptedConnection connection = connectAndOpen();
        Snapshot v1 = roster(1, entity("s1", EntityStatus.ACTIVE), entity("s2", EntityStatus.IDLE));
        Snapshot v2 = roster(2, entity("s1", EntityStatus.ERROR), entity("s2", EntityStatus.IDLE),
                entity("s3", EntityStatus.ACTIVE));
        connection.receive(fullSnapshot(v1));

        connection.receive(delta(v1, v2));

        assertEquals(v2, broker.currentSnapshot());
        List<RosterEvent> updates = eventsOf(RosterEventType.UPDATE);
        assertEquals(1, updates.size());
        assertEquals(2, updates.get(0).getChanges().size());
        assertTrue(updates.get(0).getChanges().get(1) instanceof EntityChange.Created);
        assertEquals(2, updates.get(0).getResultingVersion());
        assertEquals(1, broker.getStats().getDeltasApplied());
        assertEquals(1, broker.getPerformanceMonitor().summary().getModeStats(UpdateMode.DELTA).getCount());
    }

    // ==========================================
    // Test: Desync and Resync
    // ==========================================

    @Test
    @DisplayName("Delta with a stale base is dropped and triggers a resync")
    void testVersionMismatchTriggersResync() {
        ScriptedConnection connection = connectAndOpen();
        Snapshot v5 = roster(5, entity("s1", EntityStatus.ACTIVE));
        connection.receive(fullSnapshot(v5));

        // The frame for 4 -> 5 arrives after a dropped one
        Snapshot v4 = roster(4, entity("s1", EntityStatus.IDLE));
        connection.receive(delta(v4, v5));

        assertEquals(v5, broker.currentSnapshot());
        assertTrue(eventsOf(RosterEventType.UPDATE).isEmpty(), "Rejected delta must not reach subscribers");
        List<Frame> sent = connection.sentFrames();
        assertEquals(3, sent.size());
        assertEquals(FrameType.RESYNC_REQUEST, sent.get(2).getType());
        assertEquals(5L, sent.get(2).getLastKnownVersion());
        assertEquals(1, broker.getStats().getDeltasRejected());
    }

    @Test
    @DisplayName("Repeated desyncs send one resync per retry interval")
    void testResyncDeduplication() {
        ScriptedConnection connection = connectAndOpen();
        Snapshot v5 = roster(5, entity("s1", EntityStatus.ACTIVE));
        connection.receive(fullSnapshot(v5));
        String stale = delta(roster(8, entity("s1", EntityStatus.IDLE)), roster(9, entity("s1", EntityStatus.ACTIVE)));

        connection.receive(stale);
        connection.receive(stale);
        connection.receive(stale);
        assertEquals(2, connection.countSent(FrameType.RESYNC_REQUEST), "Initial resync plus one for the desync");

        clock.advance(Duration.ofSeconds(6));
        connection.receive(stale);
        assertEquals(3, connection.countSent(FrameType.RESYNC_REQUEST));
        assertEquals(4, broker.getStats().getDeltasRejected());
    }

    @Test
    @DisplayName("Explicit resync requests always go out")
    void testExplicitResync() {
        ScriptedConnection connection = connectAndOpen();

        broker.requestResync();
        broker.requestResync();

        assertEquals(3, connection.countSent(FrameType.RESYNC_REQUEST));
        assertEquals(3, broker.getStats().getResyncRequests());
    }

    @Test
    @DisplayName("Unknown entity in an update is a desync")
    void testUnknownEntityDesync() {
        ScriptedConnection connection = connectAndOpen();
        Snapshot v1 = roster(1, entity("s1", EntityStatus.ACTIVE));
        connection.receive(fullSnapshot(v1));

        // Producer believes s9 exists
        String bad = delta(roster(1, entity("s9", EntityStatus.ACTIVE)), roster(2, entity("s9", EntityStatus.ERROR)));
        connection.receive(bad);

        assertEquals(v1, broker.currentSnapshot());
        assertTrue(eventsOf(RosterEventType.UPDATE).isEmpty());
        assertEquals(1, broker.getStats().getDeltasRejected());
    }

    @Test
    @DisplayName("Monitor records sizes measured locally, not the sizes a producer claims")
    void testDeltaStatisticsMeasuredLocally() {
        ScriptedConnection connection = connectAndOpen();
        Snapshot v1 = roster(1, entity("s1", EntityStatus.ACTIVE), entity("s2", EntityStatus.IDLE));
        Snapshot v2 = roster(2, entity("s1", EntityStatus.ERROR), entity("s2", EntityStatus.IDLE));
        connection.receive(fullSnapshot(v1));
        DeltaPackage actual = calculator.calculate(v1, v2);

        // Consistent on its face, but the roster size is inflated a thousandfold
        DeltaMetadata inflated = DeltaMetadata.of(actual.getChanges().size(),
                actual.getMetadata().getFullSizeBytes() * 1000, actual.getMetadata().getDeltaSizeBytes(),
                actual.getMetadata().getProducedAt());
        connection.receive(codec.encode(Frame.delta(
                new DeltaPackage(1, 2, actual.getChanges(), inflated))));

        assertEquals(v2, broker.currentSnapshot());
        PerformanceSummary summary = broker.getPerformanceMonitor().summary();
        assertEquals(actual.getMetadata().getCompressionRatio(), summary.getAverageCompressionRatio(), 1e-9);
        assertEquals(actual.getMetadata().getFullSizeBytes() - actual.getMetadata().getDeltaSizeBytes(),
                summary.getTotalBytesSaved());
        List<PerformanceSample> history = broker.getPerformanceMonitor().history();
        PerformanceSample sample = history.get(history.size() - 1);
        assertEquals(UpdateMode.DELTA, sample.getMode());
        assertEquals(codec.measure(v2.sortedEntities()), sample.getFullSizeBytes());
    }

    @Test
    @DisplayName("Delta whose metadata contradicts its changes is a protocol error")
    void testContradictoryMetadataRejected() {
        ScriptedConnection connection = connectAndOpen();
        Snapshot v1 = roster(1, entity("s1", EntityStatus.ACTIVE));
        Snapshot v2 = roster(2, entity("s1", EntityStatus.IDLE));
        connection.receive(fullSnapshot(v1));
        DeltaPackage actual = calculator.calculate(v1, v2);

        DeltaMetadata bogus = new DeltaMetadata(99, actual.getMetadata().getFullSizeBytes(), -500, 5.0,
                actual.getMetadata().getProducedAt());
        connection.receive(codec.encode(Frame.delta(new DeltaPackage(1, 2, actual.getChanges(), bogus))));

        assertEquals(v1, broker.currentSnapshot());
        assertTrue(eventsOf(RosterEventType.UPDATE).isEmpty());
        assertEquals(1, broker.getStats().getProtocolErrors());
        assertEquals(2, connection.countSent(FrameType.RESYNC_REQUEST));
        PerformanceSummary summary = broker.getPerformanceMonitor().summary();
        assertEquals(0, summary.getModeStats(UpdateMode.DELTA).getCount());
        assertEquals(0, summary.getTotalBytesSaved());
    }

    // ==========================================
    // Test: Protocol Errors
    // ==========================================

    @Test
    @DisplayName("Malformed frames resync; too many force a reconnect")
    void testProtocolErrorThreshold() {
        ScriptedConnection connection = connectAndOpen();

        connection.receive("{not json");
        assertEquals(ConnectionState.Kind.CONNECTED, broker.getState().getKind());
        connection.receive("{\"type\":\"DELTA\"}");
        assertEquals(ConnectionState.Kind.CONNECTED, broker.getState().getKind());
        assertFalse(connection.closed);

        connection.receive(codec.encode(Frame.subscribe("someone")));

        assertTrue(connection.closed);
        assertEquals(ConnectionState.Kind.RECONNECTING, broker.getState().getKind());
        assertEquals(3, broker.getStats().getProtocolErrors());
        assertEquals(Duration.ofSeconds(1), timer.lastDelay);
    }

    @Test
    @DisplayName("Protocol errors outside the window do not accumulate")
    void testProtocolErrorWindow() {
        ScriptedConnection connection = connectAndOpen();

        for (int i = 0; i < 10; i++) {
            connection.receive("garbage");
            clock.advance(Duration.ofSeconds(61));
        }

        assertEquals(ConnectionState.Kind.CONNECTED, broker.getState().getKind());
        assertEquals(10, broker.getStats().getProtocolErrors());
    }

    @Test
    @DisplayName("Heartbeats are accepted silently")
    void testHeartbeat() {
        ScriptedConnection connection = connectAndOpen();

        connection.receive(codec.encode(Frame.heartbeat()));

        assertEquals(0, broker.getStats().getProtocolErrors());
        assertEquals(1, broker.getStats().getFramesReceived());
    }

    // ==========================================
    // Test: Reconnect and Degradation
    // ==========================================

    @Test
    @DisplayName("Consecutive failures back off 1s, 2s, 4s then degrade")
    void testBackoffThenDegraded() {
        ScriptedConnection first = connectAndOpen();

        first.drop(new ConnectionException("reset by peer"));
        assertEquals(ConnectionState.reconnecting(1, clock.millis() + 1000), broker.getState());

        List<Duration> delays = new ArrayList<>();
        delays.add(timer.lastDelay);
        for (int i = 0; i < 2; i++) {
            timer.fire();
            assertEquals(ConnectionState.Kind.CONNECTING, broker.getState().getKind());
            connector.latest().drop(new ConnectionException("refused"));
            delays.add(timer.lastDelay);
        }
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)), delays);

        timer.fire();
        connector.latest().drop(new ConnectionException("refused"));

        assertEquals(ConnectionState.DEGRADED, broker.getState());
        assertFalse(timer.isPending());
        assertEquals(4, connector.connections.size());

        // Stays degraded until asked
        clock.advance(Duration.ofMinutes(10));
        assertEquals(4, connector.connections.size());

        broker.connect();
        assertEquals(ConnectionState.Kind.CONNECTING, broker.getState().getKind());
        connector.latest().open();
        assertEquals(ConnectionState.Kind.CONNECTED, broker.getState().getKind());
    }

    @Test
    @DisplayName("A successful reconnect resets the attempt counter and resyncs")
    void testReconnectResets() {
        Snapshot v3 = roster(3, entity("s1", EntityStatus.ACTIVE));
        ScriptedConnection first = connectAndOpen();
        first.receive(fullSnapshot(v3));

        first.drop(null);
        timer.fire();
        connector.latest().drop(null);
        assertEquals(Duration.ofSeconds(2), timer.lastDelay);
        timer.fire();

        ScriptedConnection third = connector.latest();
        third.open();

        assertEquals(ConnectionState.Kind.CONNECTED, broker.getState().getKind());
        assertEquals(FrameType.SUBSCRIBE, third.sentFrames().get(0).getType());
        assertEquals(3L, third.sentFrames().get(1).getLastKnownVersion());

        third.drop(null);
        assertEquals(Duration.ofSeconds(1), timer.lastDelay);
    }

    @Test
    @DisplayName("Connect during backoff cancels the timer and retries now")
    void testConnectDuringBackoff() {
        connectAndOpen().drop(null);
        assertTrue(timer.isPending());

        broker.connect();

        assertFalse(timer.isPending());
        assertEquals(2, connector.connections.size());
        assertEquals(ConnectionState.Kind.CONNECTING, broker.getState().getKind());
    }

    @Test
    @DisplayName("Callbacks from a replaced connection are ignored")
    void testStaleConnectionIgnored() {
        ScriptedConnection first = connectAndOpen();
        first.receive(fullSnapshot(roster(1, entity("s1", EntityStatus.ACTIVE))));
        first.drop(null);
        timer.fire();
        ScriptedConnection second = connector.latest();
        second.open();
        int eventCount = events.size();

        first.receive(fullSnapshot(roster(99, entity("zombie", EntityStatus.ACTIVE))));
        first.drop(new ConnectionException("late close"));

        assertEquals(1, broker.currentSnapshot().getVersion());
        assertEquals(ConnectionState.Kind.CONNECTED, broker.getState().getKind());
        assertEquals(eventCount, events.size());
    }

    @Test
    @DisplayName("Frames before the handshake completes are dropped")
    void testFramesBeforeOpen() {
        broker.connect();
        ScriptedConnection connection = connector.latest();

        connection.receive(fullSnapshot(roster(2, entity("s1", EntityStatus.ACTIVE))));

        assertEquals(Snapshot.empty(), broker.currentSnapshot());
        assertEquals(0, broker.getStats().getFramesReceived());
    }

    @Test
    @DisplayName("Connection state changes reach CONNECTION_STATE subscribers")
    void testConnectionStateEvents() {
        connectAndOpen().drop(null);

        List<ConnectionState.Kind> kinds = new ArrayList<>();
        for (RosterEvent event : eventsOf(RosterEventType.CONNECTION_STATE)) {
            kinds.add(event.getConnectionState().getKind());
        }
        assertEquals(List.of(ConnectionState.Kind.CONNECTING, ConnectionState.Kind.CONNECTED,
                ConnectionState.Kind.RECONNECTING), kinds);
    }

    // ==========================================
    // Test: Disconnect and Stop
    // ==========================================

    @Test
    @DisplayName("Disconnect closes without reconnecting and keeps subscribers")
    void testDisconnect() {
        ScriptedConnection connection = connectAndOpen();

        broker.disconnect();

        assertTrue(connection.closed);
        assertEquals(ConnectionState.DISCONNECTED, broker.getState());
        assertFalse(timer.isPending());
        assertEquals(1, broker.getSubscriberCount());
        assertEquals(1, connector.connections.size());
    }

    @Test
    @DisplayName("Stop removes subscribers and refuses new ones")
    void testStop() {
        ScriptedConnection connection = connectAndOpen();

        broker.stop();
        broker.stop();

        assertTrue(connection.closed);
        assertEquals(ConnectionState.DISCONNECTED, broker.getState());
        assertEquals(0, broker.getSubscriberCount());
        assertThrows(IllegalStateException.class, () -> broker.subscribe(e -> { }));

        broker.connect();
        assertEquals(1, connector.connections.size());
    }

    @Test
    @DisplayName("Disconnecting from a CONNECTED callback does not break the handshake")
    void testDisconnectFromConnectedCallback() {
        broker.subscribe(EnumSet.of(RosterEventType.CONNECTION_STATE), e -> {
            if (e.getConnectionState().is(ConnectionState.Kind.CONNECTED)) {
                broker.disconnect();
            }
        });
        broker.connect();
        ScriptedConnection connection = connector.latest();

        assertDoesNotThrow(connection::open);

        assertEquals(ConnectionState.DISCONNECTED, broker.getState());
        assertTrue(connection.closed);
        assertTrue(connection.sentFrames().isEmpty(), "Nothing is sent on a connection closed mid-handshake");
        assertFalse(timer.isPending());
    }

    @Test
    @DisplayName("Stopping from a CONNECTED callback leaves the broker stopped")
    void testStopFromConnectedCallback() {
        broker.subscribe(EnumSet.of(RosterEventType.CONNECTION_STATE), e -> {
            if (e.getConnectionState().is(ConnectionState.Kind.CONNECTED)) {
                broker.stop();
            }
        });
        broker.connect();
        ScriptedConnection connection = connector.latest();

        assertDoesNotThrow(connection::open);

        assertEquals(ConnectionState.DISCONNECTED, broker.getState());
        assertTrue(connection.closed);
        assertTrue(connection.sentFrames().isEmpty());
        assertEquals(0, broker.getSubscriberCount());
    }

    @Test
    @DisplayName("Network broker shares one codec with its transport")
    void testCreateSharesCodec() {
        ConnectionBroker networked = ConnectionBroker.create(BrokerConfig.builder()
                .upstreamUri("ws://localhost:1/roster")
                .build());
        try {
            assertTrue(networked.getConnector() instanceof NettyUpstreamConnector);
            assertSame(networked.getCodec(), ((NettyUpstreamConnector) networked.getConnector()).getCodec());
        } finally {
            networked.stop();
        }
    }

    // ==========================================
    // Test: Subscribers
    // ==========================================

    @Test
    @DisplayName("A failing subscriber does not affect the others")
    void testSubscriberIsolation() {
        broker.subscribe(EnumSet.of(RosterEventType.RESET), e -> {
            throw new IllegalStateException("widget crashed");
        });
        ScriptedConnection connection = connectAndOpen();

        connection.receive(fullSnapshot(roster(1, entity("s1", EntityStatus.ACTIVE))));

        assertEquals(1, eventsOf(RosterEventType.RESET).size());
        assertEquals(1, broker.currentSnapshot().getVersion());
        assertEquals(ConnectionState.Kind.CONNECTED, broker.getState().getKind());
    }

    @Test
    @DisplayName("Subscribers only receive the event types they asked for")
    void testEventTypeFilter() {
        List<RosterEvent> updatesOnly = new ArrayList<>();
        broker.subscribe(EnumSet.of(RosterEventType.UPDATE), updatesOnly::add);
        ScriptedConnection connection = connectAndOpen();
        Snapshot v1 = roster(1, entity("s1", EntityStatus.ACTIVE));
        Snapshot v2 = roster(2, entity("s1", EntityStatus.IDLE));

        connection.receive(fullSnapshot(v1));
        connection.receive(delta(v1, v2));

        assertEquals(1, updatesOnly.size());
        assertEquals(RosterEventType.UPDATE, updatesOnly.get(0).getType());
        assertThrows(IllegalArgumentException.class,
                () -> broker.subscribe(EnumSet.noneOf(RosterEventType.class), e -> { }));
    }

    @Test
    @DisplayName("Unsubscribe is idempotent and takes effect from inside a callback")
    void testUnsubscribe() {
        List<RosterEvent> received = new ArrayList<>();
        AtomicReference<String> self = new AtomicReference<>();
        self.set(broker.subscribe(EnumSet.of(RosterEventType.RESET), e -> {
            received.add(e);
            broker.unsubscribe(self.get());
        }));
        ScriptedConnection connection = connectAndOpen();

        connection.receive(fullSnapshot(roster(1, entity("s1", EntityStatus.ACTIVE))));
        connection.receive(fullSnapshot(roster(2, entity("s1", EntityStatus.IDLE))));

        assertEquals(1, received.size());
        assertEquals(1, broker.getSubscriberCount());

        broker.unsubscribe(self.get());
        broker.unsubscribe("sub-does-not-exist");
        broker.unsubscribe(null);
        assertEquals(1, broker.getSubscriberCount());
    }

    // ==========================================
    // Test Transport
    // ==========================================

    private final class ScriptedConnector implements UpstreamConnector {

        final List<ScriptedConnection> connections = new ArrayList<>();

        @Override
        public UpstreamConnection connect(UpstreamListener listener) {
            ScriptedConnection connection = new ScriptedConnection(listener);
            connections.add(connection);
            return connection;
        }

        ScriptedConnection latest() {
            return connections.get(connections.size() - 1);
        }
    }

    private final class ScriptedConnection implements UpstreamConnection {

        private final UpstreamListener listener;
        private final List<String> sent = new ArrayList<>();
        private boolean open;
        private boolean closed;

        ScriptedConnection(UpstreamListener listener) {
            this.listener = listener;
        }

        void open() {
            open = true;
            listener.onOpen(this);
        }

        void receive(String text) {
            listener.onText(this, text);
        }

        void drop(Throwable cause) {
            open = false;
            closed = true;
            listener.onClosed(this, cause);
        }

        List<Frame> sentFrames() {
            List<Frame> frames = new ArrayList<>();
            for (String text : sent) {
                frames.add(codec.decode(text));
            }
            return frames;
        }

        long countSent(FrameType type) {
            return sentFrames().stream().filter(f -> f.getType() == type).count();
        }

        @Override
        public boolean send(String text) {
            if (!open) {
                return false;
            }
            sent.add(text);
            return true;
        }

        @Override
        public void close() {
            if (!closed) {
                open = false;
                closed = true;
                listener.onClosed(this, null);
            }
        }
    }

    private static final class ManualTimer implements ReconnectTimer {

        private Runnable pending;
        private Duration lastDelay;

        @Override
        public void schedule(Duration delay, Runnable task) {
            lastDelay = delay;
            pending = task;
        }

        @Override
        public void cancel() {
            pending = null;
        }

        @Override
        public boolean isPending() {
            return pending != null;
        }

        void fire() {
            Runnable task = pending;
            pending = null;
            assertNotNull(task, "No reconnect scheduled");
            task.run();
        }
    }

    private static final class MutableClock extends Clock {

        private long millis;

        MutableClock(long millis) {
            this.millis = millis;
        }

        void advance(Duration duration) {
            millis += duration.toMillis();
        }

        @Override
        public long millis() {
            return millis;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }
}
