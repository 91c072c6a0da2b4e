package com.rostersync.delta;

import com.rostersync.state.Snapshot;

import java.util.List;

/**
 * Outcome of {@link DeltaApplicator#apply}: either the next snapshot or the
 * desync that prevented it.
 *
 * Warnings are non-fatal oddities met on the way (a removal of an id that was
 * already gone); they never turn a success into a failure.
 */
public final class ApplyResult {

    private final Snapshot snapshot;
    private final DesyncError error;
    private final List<String> warnings;

    private ApplyResult(Snapshot snapshot, DesyncError error, List<String> warnings) {
        this.snapshot = snapshot;
        this.error = error;
        this.warnings = List.copyOf(warnings);
    }

    public static ApplyResult success(Snapshot snapshot, List<String> warnings) {
        return new ApplyResult(snapshot, null, warnings);
    }

    public static ApplyResult failure(DesyncError error) {
        return new ApplyResult(null, error, List.of());
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * The applied snapshot.
     *
     * @throws IllegalStateException if the package was rejected
     */
    public Snapshot getSnapshot() {
        if (error != null) {
            throw new IllegalStateException("Delta was rejected: " + error);
        }
        return snapshot;
    }

    /**
     * The rejection reason, or null on success.
     */
    public DesyncError getError() {
        return error;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "ApplyResult{success=" + snapshot + ", warnings=" + warnings.size() + "}"
                : "ApplyResult{failure=" + error + "}";
    }
}
