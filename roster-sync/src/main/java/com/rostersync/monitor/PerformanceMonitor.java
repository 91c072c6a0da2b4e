package com.rostersync.monitor;

import com.rostersync.delta.DeltaMetadata;
import com.rostersync.delta.DeltaPackage;
import com.rostersync.state.Snapshot;
import com.rostersync.state.SnapshotObserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Records the size and processing time of every roster update and compares
 * delta mode against full-replace mode.
 *
 * Memory is bounded: samples live in a fixed-capacity ring buffer and the
 * oldest sample is evicted once it is full. Session totals (bytes saved,
 * samples recorded) are plain counters and survive eviction.
 *
 * This sits on the hot path of every update, so recording never throws:
 * bad input is logged and dropped.
 *
 * Thread Safety:
 * - Recording happens on the broker's dispatch loop, reads come from anywhere
 * - All buffer access is synchronized on the monitor
 */
public class PerformanceMonitor implements SnapshotObserver {

    private static final Logger logger = LoggerFactory.getLogger(PerformanceMonitor.class);

    public static final int DEFAULT_CAPACITY = 1000;

    private final PerformanceSample[] buffer;
    private final Clock clock;

    // Ring buffer cursor: next write position and number of live samples
    private int head;
    private int size;

    private long totalBytesSaved;
    private long totalRecorded;

    private volatile int lastRosterSize;
    private volatile long lastRosterVersion;

    public PerformanceMonitor() {
        this(DEFAULT_CAPACITY);
    }

    public PerformanceMonitor(int capacity) {
        this(capacity, Clock.systemUTC());
    }

    public PerformanceMonitor(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.buffer = new PerformanceSample[capacity];
        this.clock = clock;
    }

    /**
     * Records a full-replace update.
     */
    public void recordFull(long sizeBytes, double processingTimeMs) {
        long size = Math.max(0, sizeBytes);
        append(new PerformanceSample(clock.millis(), UpdateMode.FULL, size, size, 0.0,
                sanitize(processingTimeMs), 0));
    }

    /**
     * Records an applied delta. Savings are fullSizeBytes - deltaSizeBytes of
     * the package's metadata.
     */
    public void recordDelta(DeltaPackage pkg, double processingTimeMs) {
        if (pkg == null) {
            logger.warn("Ignoring null delta package");
            return;
        }
        DeltaMetadata metadata = pkg.getMetadata();
        PerformanceSample sample = new PerformanceSample(clock.millis(), UpdateMode.DELTA,
                Math.max(0, metadata.getDeltaSizeBytes()),
                Math.max(0, metadata.getFullSizeBytes()),
                metadata.getCompressionRatio(),
                sanitize(processingTimeMs),
                pkg.getChanges().size());
        append(sample);
    }

    private synchronized void append(PerformanceSample sample) {
        buffer[head] = sample;
        head = (head + 1) % buffer.length;
        if (size < buffer.length) {
            size++;
        }
        totalRecorded++;
        totalBytesSaved += sample.getBytesSaved();
    }

    private static double sanitize(double processingTimeMs) {
        return Double.isFinite(processingTimeMs) && processingTimeMs > 0 ? processingTimeMs : 0.0;
    }

    /**
     * Tracks the roster size after each store replace.
     */
    @Override
    public void onSnapshotReplaced(Snapshot snapshot) {
        lastRosterSize = snapshot.size();
        lastRosterVersion = snapshot.getVersion();
    }

    public synchronized PerformanceSummary summary() {
        double ratioSum = 0;
        int deltaCount = 0;
        for (PerformanceSample sample : history()) {
            if (sample.getMode() == UpdateMode.DELTA) {
                ratioSum += sample.getCompressionRatio();
                deltaCount++;
            }
        }
        double averageRatio = deltaCount > 0 ? ratioSum / deltaCount : 0.0;

        return new PerformanceSummary(averageRatio, totalBytesSaved, size, totalRecorded,
                breakdown(), lastRosterSize, lastRosterVersion);
    }

    /**
     * Compares the buffered full and delta samples.
     *
     * @return the comparison, or null if either mode has no buffered samples
     */
    public synchronized LoadComparison compare() {
        Map<UpdateMode, ModeStats> stats = breakdown();
        ModeStats full = stats.get(UpdateMode.FULL);
        ModeStats delta = stats.get(UpdateMode.DELTA);
        if (full == null || delta == null) {
            return null;
        }
        return new LoadComparison(full, delta);
    }

    private Map<UpdateMode, ModeStats> breakdown() {
        Map<UpdateMode, long[]> sizes = new EnumMap<>(UpdateMode.class);
        Map<UpdateMode, double[]> times = new EnumMap<>(UpdateMode.class);
        for (PerformanceSample sample : history()) {
            // [count, totalSize]
            long[] s = sizes.computeIfAbsent(sample.getMode(), m -> new long[2]);
            s[0]++;
            s[1] += sample.getSizeBytes();
            times.computeIfAbsent(sample.getMode(), m -> new double[1])[0] += sample.getProcessingTimeMs();
        }

        Map<UpdateMode, ModeStats> result = new EnumMap<>(UpdateMode.class);
        for (Map.Entry<UpdateMode, long[]> entry : sizes.entrySet()) {
            long count = entry.getValue()[0];
            long totalSize = entry.getValue()[1];
            double totalTime = times.get(entry.getKey())[0];
            result.put(entry.getKey(), new ModeStats((int) count, totalSize,
                    (double) totalSize / count, totalTime / count));
        }
        return result;
    }

    /**
     * Buffered samples, oldest first.
     */
    public synchronized List<PerformanceSample> history() {
        List<PerformanceSample> samples = new ArrayList<>(size);
        int start = (head - size + buffer.length) % buffer.length;
        for (int i = 0; i < size; i++) {
            samples.add(buffer[(start + i) % buffer.length]);
        }
        return samples;
    }

    public synchronized int bufferedSampleCount() {
        return size;
    }

    public int capacity() {
        return buffer.length;
    }

    /**
     * Drops all buffered samples and session totals.
     */
    public synchronized void clear() {
        for (int i = 0; i < buffer.length; i++) {
            buffer[i] = null;
        }
        head = 0;
        size = 0;
        totalBytesSaved = 0;
        totalRecorded = 0;
    }

    /**
     * The buffered samples as CSV, one row per sample, oldest first.
     */
    public String exportCsv() {
        StringBuilder csv = new StringBuilder(
                "timestamp,mode,sizeBytes,fullSizeBytes,compressionRatio,processingTimeMs,changeCount\n");
        for (PerformanceSample sample : history()) {
            csv.append(Instant.ofEpochMilli(sample.getTimestamp())).append(',')
                    .append(sample.getMode().name().toLowerCase()).append(',')
                    .append(sample.getSizeBytes()).append(',')
                    .append(sample.getFullSizeBytes()).append(',')
                    .append(String.format(Locale.ROOT, "%.3f", sample.getCompressionRatio())).append(',')
                    .append(String.format(Locale.ROOT, "%.2f", sample.getProcessingTimeMs())).append(',')
                    .append(sample.getChangeCount()).append('\n');
        }
        return csv.toString();
    }
}
