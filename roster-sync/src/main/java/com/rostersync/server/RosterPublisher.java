package com.rostersync.server;

import com.rostersync.delta.DeltaCalculator;
import com.rostersync.delta.DeltaPackage;
import com.rostersync.protocol.Frame;
import com.rostersync.protocol.FrameCodec;
import com.rostersync.session.ObserverSession;
import com.rostersync.session.SessionManager;
import com.rostersync.state.Entity;
import com.rostersync.state.Snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Owns the authoritative roster and streams it to subscribed observers.
 *
 * Every published roster is diffed against the current one; a roster that
 * changes anything becomes the next version and goes out as a DELTA frame,
 * a roster that changes nothing is dropped without a version bump.
 *
 * Thread Safety:
 * - All methods are synchronized, so versions advance one at a time and a
 *   FULL_SNAPSHOT sent to one observer is ordered against the deltas that
 *   follow it on the same channel
 */
public class RosterPublisher {

    private static final Logger logger = LoggerFactory.getLogger(RosterPublisher.class);

    private final SessionManager sessionManager;
    private final DeltaCalculator calculator;
    private final FrameCodec codec;
    private final Clock clock;

    private Snapshot current = Snapshot.empty();

    public RosterPublisher(SessionManager sessionManager) {
        this(sessionManager, Clock.systemUTC());
    }

    public RosterPublisher(SessionManager sessionManager, Clock clock) {
        this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.codec = new FrameCodec();
        this.calculator = new DeltaCalculator(codec);
    }

    /**
     * Publishes a complete roster.
     *
     * @return the broadcast package, or null if the roster changed nothing
     * @throws IllegalArgumentException if two entities share an id
     */
    public synchronized DeltaPackage publish(Collection<Entity> roster) {
        Snapshot next = Snapshot.of(current.getVersion() + 1, clock.millis(), roster);
        DeltaPackage pkg = calculator.calculate(current, next);

        if (!pkg.hasChanges()) {
            logger.debug("Roster unchanged at version {}", current.getVersion());
            return null;
        }

        current = next;
        broadcast(codec.encode(Frame.delta(pkg)));

        logger.info("Published roster version {} ({} changes, ratio {})",
                pkg.getTargetVersion(), pkg.getChanges().size(),
                String.format("%.3f", pkg.getMetadata().getCompressionRatio()));
        return pkg;
    }

    /**
     * Adds or replaces one entity.
     */
    public synchronized DeltaPackage upsert(Entity entity) {
        Objects.requireNonNull(entity, "entity");
        Map<String, Entity> roster = new HashMap<>(current.getEntities());
        roster.put(entity.getId(), entity);
        return publish(roster.values());
    }

    /**
     * Removes one entity; null if it was not on the roster.
     */
    public synchronized DeltaPackage remove(String entityId) {
        if (!current.contains(entityId)) {
            return null;
        }
        Map<String, Entity> roster = new HashMap<>(current.getEntities());
        roster.remove(entityId);
        return publish(roster.values());
    }

    /**
     * Subscribes the session and sends it the whole current roster.
     */
    public synchronized void sendFullSnapshot(ObserverSession session) {
        session.setSubscribed(true);
        session.send(codec.encode(Frame.fullSnapshot(current)));
        logger.debug("Sent full snapshot version {} to {}", current.getVersion(), session.getSessionId());
    }

    public synchronized Snapshot current() {
        return current;
    }

    private void broadcast(String json) {
        List<ObserverSession> sessions = sessionManager.getSubscribedSessions();
        for (ObserverSession session : sessions) {
            session.send(json);
        }
        logger.debug("Broadcast to {} observers", sessions.size());
    }
}
