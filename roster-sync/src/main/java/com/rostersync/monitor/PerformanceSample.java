package com.rostersync.monitor;

/**
 * One recorded update.
 *
 * sizeBytes is what was actually transferred for the update; fullSizeBytes is
 * what a full replace would have cost. For FULL samples the two are equal and
 * the compression ratio is 0.
 */
public final class PerformanceSample {

    private final long timestamp;
    private final UpdateMode mode;
    private final long sizeBytes;
    private final long fullSizeBytes;
    private final double compressionRatio;
    private final double processingTimeMs;
    private final int changeCount;

    public PerformanceSample(long timestamp, UpdateMode mode, long sizeBytes, long fullSizeBytes,
                             double compressionRatio, double processingTimeMs, int changeCount) {
        this.timestamp = timestamp;
        this.mode = mode;
        this.sizeBytes = sizeBytes;
        this.fullSizeBytes = fullSizeBytes;
        this.compressionRatio = compressionRatio;
        this.processingTimeMs = processingTimeMs;
        this.changeCount = changeCount;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public UpdateMode getMode() {
        return mode;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public long getFullSizeBytes() {
        return fullSizeBytes;
    }

    public double getCompressionRatio() {
        return compressionRatio;
    }

    public double getProcessingTimeMs() {
        return processingTimeMs;
    }

    public int getChangeCount() {
        return changeCount;
    }

    /**
     * Bytes this update avoided sending; always 0 for full updates.
     */
    public long getBytesSaved() {
        return mode == UpdateMode.DELTA ? fullSizeBytes - sizeBytes : 0;
    }

    @Override
    public String toString() {
        return "PerformanceSample{" +
                "mode=" + mode +
                ", sizeBytes=" + sizeBytes +
                ", fullSizeBytes=" + fullSizeBytes +
                ", processingTimeMs=" + String.format("%.3f", processingTimeMs) +
                '}';
    }
}
