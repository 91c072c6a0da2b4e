package com.rostersync.monitor;

/**
 * Full-replace versus delta cost over the buffered window.
 * Reductions are percentages, floored at 0.
 */
public final class LoadComparison {

    private final ModeStats full;
    private final ModeStats delta;
    private final double dataSizeReductionPercent;
    private final double processingSpeedupPercent;

    public LoadComparison(ModeStats full, ModeStats delta) {
        this.full = full;
        this.delta = delta;
        this.dataSizeReductionPercent = reduction(full.getAverageSizeBytes(), delta.getAverageSizeBytes());
        this.processingSpeedupPercent = reduction(full.getAverageProcessingTimeMs(), delta.getAverageProcessingTimeMs());
    }

    private static double reduction(double before, double after) {
        if (before <= 0) {
            return 0;
        }
        return Math.max(0, (before - after) / before * 100.0);
    }

    public ModeStats getFull() {
        return full;
    }

    public ModeStats getDelta() {
        return delta;
    }

    public double getDataSizeReductionPercent() {
        return dataSizeReductionPercent;
    }

    public double getProcessingSpeedupPercent() {
        return processingSpeedupPercent;
    }

    @Override
    public String toString() {
        return "LoadComparison{" +
                "dataSizeReduction=" + String.format("%.1f%%", dataSizeReductionPercent) +
                ", processingSpeedup=" + String.format("%.1f%%", processingSpeedupPercent) +
                '}';
    }
}
