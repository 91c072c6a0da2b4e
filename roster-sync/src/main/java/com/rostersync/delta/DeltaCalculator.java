package com.rostersync.delta;

import com.rostersync.protocol.FrameCodec;
import com.rostersync.state.Entity;
import com.rostersync.state.EntityPatch;
import com.rostersync.state.Snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Computes the minimal change-set between two rosters.
 *
 * Delta compression is what keeps a dashboard of several hundred participants
 * cheap to keep current:
 * - An entity with no field differences contributes nothing
 * - A changed entity contributes only its changed fields
 *
 * Changes are emitted in ascending id order, so two calculators given the
 * same inputs produce byte-identical encodings.
 *
 * Sizes are measured by {@link FrameCodec#measure}: the UTF-8 length of the
 * compact JSON encoding. fullSizeBytes covers next's entities alone and
 * deltaSizeBytes covers the change records alone.
 *
 * The calculator is stateless and thread-safe.
 */
public class DeltaCalculator {

    private static final Logger logger = LoggerFactory.getLogger(DeltaCalculator.class);

    private final FrameCodec codec;

    public DeltaCalculator() {
        this(new FrameCodec());
    }

    public DeltaCalculator(FrameCodec codec) {
        this.codec = codec;
    }

    /**
     * Produces the package that turns {@code previous} into {@code next}.
     * Total over any two well-formed snapshots; an empty previous yields
     * only creations.
     */
    public DeltaPackage calculate(Snapshot previous, Snapshot next) {
        TreeSet<String> ids = new TreeSet<>(previous.ids());
        ids.addAll(next.ids());

        List<EntityChange> changes = new ArrayList<>();
        for (String id : ids) {
            Entity before = previous.get(id);
            Entity after = next.get(id);

            if (before == null) {
                changes.add(new EntityChange.Created(after));
            } else if (after == null) {
                changes.add(new EntityChange.Removed(id));
            } else {
                EntityPatch patch = EntityPatch.between(before, after);
                if (!patch.isEmpty()) {
                    changes.add(new EntityChange.Updated(id, patch));
                }
            }
        }

        long fullSize = codec.measure(next.sortedEntities());
        long deltaSize = codec.measure(changes);
        DeltaMetadata metadata = DeltaMetadata.of(changes.size(), fullSize, deltaSize, next.getCapturedAt());

        long baseVersion = previous.getVersion();
        if (next.getVersion() != baseVersion + 1) {
            logger.debug("Next roster carries version {} but delta targets {}",
                    next.getVersion(), baseVersion + 1);
        }

        return new DeltaPackage(baseVersion, baseVersion + 1, changes, metadata);
    }
}
