package com.rostersync.delta;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Size accounting that travels with every delta.
 *
 * compressionRatio = 1 - deltaSizeBytes / fullSizeBytes, clamped to [0, 1].
 * A delta with no changes has ratio 1 (nothing needs sending); otherwise a
 * zero fullSizeBytes defines the ratio as 0.
 *
 * producedAt is the capture time of the roster the delta leads to, so a
 * replica can stamp the snapshot it builds with the producer's time.
 */
@JsonPropertyOrder({"changeCount", "fullSizeBytes", "deltaSizeBytes", "compressionRatio", "producedAt"})
public final class DeltaMetadata {

    private final int changeCount;
    private final long fullSizeBytes;
    private final long deltaSizeBytes;
    private final double compressionRatio;
    private final long producedAt;

    @JsonCreator
    public DeltaMetadata(@JsonProperty("changeCount") int changeCount,
                         @JsonProperty("fullSizeBytes") long fullSizeBytes,
                         @JsonProperty("deltaSizeBytes") long deltaSizeBytes,
                         @JsonProperty("compressionRatio") double compressionRatio,
                         @JsonProperty("producedAt") long producedAt) {
        this.changeCount = changeCount;
        this.fullSizeBytes = fullSizeBytes;
        this.deltaSizeBytes = deltaSizeBytes;
        this.compressionRatio = compressionRatio;
        this.producedAt = producedAt;
    }

    /**
     * Builds metadata, deriving the compression ratio from the two sizes.
     */
    public static DeltaMetadata of(int changeCount, long fullSizeBytes, long deltaSizeBytes, long producedAt) {
        return new DeltaMetadata(changeCount, fullSizeBytes, deltaSizeBytes,
                compressionRatio(changeCount, fullSizeBytes, deltaSizeBytes), producedAt);
    }

    static double compressionRatio(int changeCount, long fullSizeBytes, long deltaSizeBytes) {
        if (changeCount == 0) {
            return 1.0;
        }
        if (fullSizeBytes <= 0) {
            return 0.0;
        }
        double ratio = 1.0 - (double) deltaSizeBytes / fullSizeBytes;
        return Math.max(0.0, Math.min(1.0, ratio));
    }

    public int getChangeCount() {
        return changeCount;
    }

    public long getFullSizeBytes() {
        return fullSizeBytes;
    }

    public long getDeltaSizeBytes() {
        return deltaSizeBytes;
    }

    public double getCompressionRatio() {
        return compressionRatio;
    }

    public long getProducedAt() {
        return producedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DeltaMetadata)) {
            return false;
        }
        DeltaMetadata other = (DeltaMetadata) o;
        return changeCount == other.changeCount
                && fullSizeBytes == other.fullSizeBytes
                && deltaSizeBytes == other.deltaSizeBytes
                && Double.compare(compressionRatio, other.compressionRatio) == 0
                && producedAt == other.producedAt;
    }

    @Override
    public int hashCode() {
        return Objects.hash(changeCount, fullSizeBytes, deltaSizeBytes, compressionRatio, producedAt);
    }

    @Override
    public String toString() {
        return "DeltaMetadata{" +
                "changeCount=" + changeCount +
                ", fullSizeBytes=" + fullSizeBytes +
                ", deltaSizeBytes=" + deltaSizeBytes +
                ", compressionRatio=" + String.format("%.3f", compressionRatio) +
                '}';
    }
}
