package com.rostersync.monitor;

import java.util.Map;

/**
 * Point-in-time statistics from the {@link PerformanceMonitor}.
 *
 * averageCompressionRatio and modeBreakdown cover the buffered window only;
 * totalBytesSaved and totalRecorded cover the whole session.
 */
public final class PerformanceSummary {

    private final double averageCompressionRatio;
    private final long totalBytesSaved;
    private final int sampleCount;
    private final long totalRecorded;
    private final Map<UpdateMode, ModeStats> modeBreakdown;
    private final int lastRosterSize;
    private final long lastRosterVersion;

    public PerformanceSummary(double averageCompressionRatio, long totalBytesSaved, int sampleCount,
                              long totalRecorded, Map<UpdateMode, ModeStats> modeBreakdown,
                              int lastRosterSize, long lastRosterVersion) {
        this.averageCompressionRatio = averageCompressionRatio;
        this.totalBytesSaved = totalBytesSaved;
        this.sampleCount = sampleCount;
        this.totalRecorded = totalRecorded;
        this.modeBreakdown = Map.copyOf(modeBreakdown);
        this.lastRosterSize = lastRosterSize;
        this.lastRosterVersion = lastRosterVersion;
    }

    /**
     * Mean compression ratio of the buffered delta samples, 0 when there are none.
     */
    public double getAverageCompressionRatio() {
        return averageCompressionRatio;
    }

    public long getTotalBytesSaved() {
        return totalBytesSaved;
    }

    /**
     * Number of samples currently buffered.
     */
    public int getSampleCount() {
        return sampleCount;
    }

    public long getTotalRecorded() {
        return totalRecorded;
    }

    public Map<UpdateMode, ModeStats> getModeBreakdown() {
        return modeBreakdown;
    }

    public ModeStats getModeStats(UpdateMode mode) {
        return modeBreakdown.getOrDefault(mode, ModeStats.NONE);
    }

    public int getLastRosterSize() {
        return lastRosterSize;
    }

    public long getLastRosterVersion() {
        return lastRosterVersion;
    }

    @Override
    public String toString() {
        return "PerformanceSummary{" +
                "averageCompressionRatio=" + String.format("%.3f", averageCompressionRatio) +
                ", totalBytesSaved=" + totalBytesSaved +
                ", sampleCount=" + sampleCount +
                ", modeBreakdown=" + modeBreakdown +
                '}';
    }
}
