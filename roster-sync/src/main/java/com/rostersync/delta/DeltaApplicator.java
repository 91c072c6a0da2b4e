package com.rostersync.delta;

import com.rostersync.state.Entity;
import com.rostersync.state.Snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies a received delta to the local replica.
 *
 * Rules:
 * - The package must start at the replica's version, otherwise VERSION_MISMATCH.
 *   Mismatched packages are never merged best-effort; a silent merge would
 *   hide the missed update.
 * - Created inserts (DUPLICATE_ENTITY if the id exists)
 * - Updated merges only the listed fields (UNKNOWN_ENTITY if the id is absent)
 * - Removed deletes; removing an absent id is only a warning, so replays stay idempotent
 *
 * The input snapshot is never touched; work happens on a private copy and a
 * new Snapshot is returned. Committing it is the caller's job.
 */
public class DeltaApplicator {

    private static final Logger logger = LoggerFactory.getLogger(DeltaApplicator.class);

    public ApplyResult apply(Snapshot current, DeltaPackage pkg) {
        if (pkg.getBaseVersion() != current.getVersion()) {
            return ApplyResult.failure(DesyncError.versionMismatch(current.getVersion(), pkg.getBaseVersion()));
        }

        Map<String, Entity> working = new HashMap<>(current.getEntities());
        List<String> warnings = new ArrayList<>();

        for (EntityChange change : pkg.getChanges()) {
            DesyncError error = change.accept(new EntityChange.Visitor<DesyncError>() {
                @Override
                public DesyncError created(EntityChange.Created created) {
                    Entity entity = created.getEntity();
                    if (working.putIfAbsent(entity.getId(), entity) != null) {
                        return DesyncError.duplicateEntity(entity.getId());
                    }
                    return null;
                }

                @Override
                public DesyncError updated(EntityChange.Updated updated) {
                    Entity existing = working.get(updated.getId());
                    if (existing == null) {
                        return DesyncError.unknownEntity(updated.getId());
                    }
                    working.put(updated.getId(), updated.getFields().applyTo(existing));
                    return null;
                }

                @Override
                public DesyncError removed(EntityChange.Removed removed) {
                    if (working.remove(removed.getId()) == null) {
                        warnings.add("Removal of absent entity " + removed.getId());
                        logger.warn("Delta {} -> {} removes absent entity {}",
                                pkg.getBaseVersion(), pkg.getTargetVersion(), removed.getId());
                    }
                    return null;
                }
            });

            if (error != null) {
                return ApplyResult.failure(error);
            }
        }

        Snapshot next = Snapshot.fromMap(pkg.getTargetVersion(), pkg.getMetadata().getProducedAt(), working);
        return ApplyResult.success(next, warnings);
    }
}
