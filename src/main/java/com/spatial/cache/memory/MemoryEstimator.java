package com.spatial.cache.memory;

import com.spatial.cache.config.CacheConfig;

/**
 * Converts a record count into an approximate resident footprint.
 *
 * Observability only: eviction is driven by counts against capacities, never
 * by this estimate, because real heap usage cannot be measured reliably on
 * the client.
 */
public class MemoryEstimator {
    private static final double KB_PER_MB = 1024.0;

    private final double perRecordKB;
    private final double warningThresholdMB;
    private final double criticalThresholdMB;

    public MemoryEstimator(CacheConfig config) {
        this(config.getPerRecordKB(), config.getMemoryWarningMB(), config.getMemoryCriticalMB());
    }

    public MemoryEstimator(double perRecordKB, double warningThresholdMB, double criticalThresholdMB) {
        this.perRecordKB = perRecordKB;
        this.warningThresholdMB = warningThresholdMB;
        this.criticalThresholdMB = criticalThresholdMB;
    }

    /**
     * @param count number of cached records
     * @return estimated megabytes, rounded to 2 decimal places
     */
    public double estimateMemoryUsage(int count) {
        return estimateMemoryUsage(count, perRecordKB);
    }

    public static double estimateMemoryUsage(int count, double perRecordKB) {
        if (count <= 0) {
            return 0.0;
        }
        return roundToHundredths(count * perRecordKB / KB_PER_MB);
    }

    private static double roundToHundredths(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    public MemoryPressure pressure(int count) {
        double memoryMB = estimateMemoryUsage(count);
        if (memoryMB >= criticalThresholdMB) {
            return MemoryPressure.CRITICAL;
        }
        if (memoryMB >= warningThresholdMB) {
            return MemoryPressure.WARNING;
        }
        return MemoryPressure.NORMAL;
    }

    public boolean isMemoryWarning(int count) {
        return pressure(count) != MemoryPressure.NORMAL;
    }

    public boolean isMemoryCritical(int count) {
        return pressure(count) == MemoryPressure.CRITICAL;
    }

    public double getPerRecordKB() {
        return perRecordKB;
    }
}
