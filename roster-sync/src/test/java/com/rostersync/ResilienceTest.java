package com.rostersync;

import com.rostersync.broker.BrokerConfig;
import com.rostersync.broker.ConnectionBroker;
import com.rostersync.broker.ConnectionState;
import com.rostersync.broker.RosterEvent;
import com.rostersync.broker.RosterEventType;
import com.rostersync.server.RosterFeedServer;
import com.rostersync.state.Entity;
import com.rostersync.state.EntityStatus;
import org.junit.jupiter.api.*;

import java.net.URI;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the real broker against the real roster feed:
 * - Initial sync and live deltas
 * - Recovery from a feed restart
 * - Degradation when the feed stays down
 */
@DisplayName("Resilience Tests")
class ResilienceTest {

    private RosterFeedServer server;
    private ConnectionBroker broker;

    @BeforeEach
    void startServer() throws Exception {
        server = new RosterFeedServer(0);
        server.start();
    }

    @AfterEach
    void tearDown() {
        if (broker != null) {
            broker.stop();
        }
        if (server != null) {
            server.shutdown();
        }
    }

    private BrokerConfig config(int port, int maxRetryAttempts) {
        return BrokerConfig.builder()
                .upstreamUri(URI.create("ws://localhost:" + port + RosterFeedServer.WEBSOCKET_PATH))
                .clientId("resilience-observer")
                .backoffBase(Duration.ofMillis(100))
                .backoffMax(Duration.ofMillis(400))
                .backoffJitter(0.0)
                .maxRetryAttempts(maxRetryAttempts)
                .build();
    }

    private static void await(BooleanSupplier condition, String description) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for: " + description);
            }
            Thread.sleep(20);
        }
    }

    private static Entity student(String id, EntityStatus status) {
        return Entity.builder().id(id).displayName("Student " + id).teamName("team-a").status(status).build();
    }

    @Test
    @DisplayName("Broker mirrors the feed through snapshot and deltas")
    void testLiveSync() throws Exception {
        server.getPublisher().publish(List.of(student("s1", EntityStatus.ACTIVE), student("s2", EntityStatus.IDLE)));

        broker = ConnectionBroker.create(config(server.getPort(), 5));
        List<RosterEvent> events = new CopyOnWriteArrayList<>();
        broker.subscribe(EnumSet.of(RosterEventType.RESET, RosterEventType.UPDATE), events::add);
        broker.connect();

        await(() -> broker.currentSnapshot().getVersion() == 1, "initial snapshot");
        assertEquals(RosterEventType.RESET, events.get(0).getType());

        server.getPublisher().upsert(student("s1", EntityStatus.ERROR));
        server.getPublisher().upsert(student("s3", EntityStatus.ACTIVE));
        server.getPublisher().remove("s2");

        await(() -> broker.currentSnapshot().getVersion() == 4, "three deltas");
        assertEquals(server.getPublisher().current(), broker.currentSnapshot());
        assertEquals(3, events.stream().filter(e -> e.getType() == RosterEventType.UPDATE).count());
        assertEquals(3, broker.getStats().getDeltasApplied());
        assertEquals(0, broker.getStats().getDeltasRejected());

        System.out.println("✓ Broker in sync at version 4: " + broker.getPerformanceMonitor().summary());
    }

    @Test
    @DisplayName("Broker reconnects and resyncs after the feed restarts")
    void testFeedRestart() throws Exception {
        int port = server.getPort();
        server.getPublisher().upsert(student("s1", EntityStatus.ACTIVE));

        broker = ConnectionBroker.create(config(port, 50));
        List<ConnectionState.Kind> states = new CopyOnWriteArrayList<>();
        broker.subscribe(EnumSet.of(RosterEventType.CONNECTION_STATE),
                e -> states.add(e.getConnectionState().getKind()));
        broker.connect();
        await(() -> broker.currentSnapshot().getVersion() == 1, "initial snapshot");

        server.shutdown();
        await(() -> broker.getState().is(ConnectionState.Kind.RECONNECTING), "reconnecting");

        // The new feed starts over with a different roster
        server = new RosterFeedServer(port);
        server.start();
        server.getPublisher().publish(List.of(student("s7", EntityStatus.HELP_REQUESTING)));

        await(() -> broker.currentSnapshot().contains("s7"), "resync from the new feed");
        assertEquals(ConnectionState.Kind.CONNECTED, broker.getState().getKind());
        assertFalse(broker.currentSnapshot().contains("s1"));

        server.getPublisher().upsert(student("s8", EntityStatus.ACTIVE));
        await(() -> broker.currentSnapshot().contains("s8"), "delta after restart");
        assertEquals(server.getPublisher().current(), broker.currentSnapshot());
        assertTrue(states.contains(ConnectionState.Kind.RECONNECTING));
        assertTrue(broker.getStats().getFullSnapshots() >= 2);
    }

    @Test
    @DisplayName("Broker degrades when the feed stays down")
    void testDegradesWhenFeedGone() throws Exception {
        int port = server.getPort();
        broker = ConnectionBroker.create(config(port, 2));
        broker.connect();
        await(() -> broker.getState().is(ConnectionState.Kind.CONNECTED), "connected");

        server.shutdown();
        server = null;

        await(() -> broker.getState().is(ConnectionState.Kind.DEGRADED), "degraded");
        // Last known roster stays readable
        assertNotNull(broker.currentSnapshot());
    }

    @Test
    @DisplayName("Unsubscribe from another thread stops delivery")
    void testUnsubscribeAcrossThreads() throws Exception {
        broker = ConnectionBroker.create(config(server.getPort(), 5));
        List<RosterEvent> events = new CopyOnWriteArrayList<>();
        String id = broker.subscribe(EnumSet.of(RosterEventType.UPDATE), events::add);
        broker.connect();
        await(() -> broker.getStats().getFullSnapshots() >= 1, "initial snapshot");

        server.getPublisher().upsert(student("u1", EntityStatus.ACTIVE));
        await(() -> events.size() == 1, "first update");

        broker.unsubscribe(id);
        server.getPublisher().upsert(student("u2", EntityStatus.ACTIVE));
        await(() -> broker.currentSnapshot().contains("u2"), "second delta applied");

        assertEquals(1, events.size());
        assertEquals(0, broker.getSubscriberCount());
    }
}
