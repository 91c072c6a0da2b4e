package com.rostersync.monitor;

/**
 * Aggregates over the buffered samples of one update mode.
 */
public final class ModeStats {

    static final ModeStats NONE = new ModeStats(0, 0, 0, 0);

    private final int count;
    private final long totalSizeBytes;
    private final double averageSizeBytes;
    private final double averageProcessingTimeMs;

    public ModeStats(int count, long totalSizeBytes, double averageSizeBytes, double averageProcessingTimeMs) {
        this.count = count;
        this.totalSizeBytes = totalSizeBytes;
        this.averageSizeBytes = averageSizeBytes;
        this.averageProcessingTimeMs = averageProcessingTimeMs;
    }

    public int getCount() {
        return count;
    }

    public long getTotalSizeBytes() {
        return totalSizeBytes;
    }

    public double getAverageSizeBytes() {
        return averageSizeBytes;
    }

    public double getAverageProcessingTimeMs() {
        return averageProcessingTimeMs;
    }

    @Override
    public String toString() {
        return "ModeStats{" +
                "count=" + count +
                ", averageSizeBytes=" + String.format("%.1f", averageSizeBytes) +
                ", averageProcessingTimeMs=" + String.format("%.3f", averageProcessingTimeMs) +
                '}';
    }
}
