package com.spatial.cache.eviction;

import java.util.Map;

/**
 * Summary of one eviction pass. Recomputed every pass, never persisted.
 */
public final class CacheStats {
    private final int initialCount;
    private final int keptCount;
    private final int evictedCount;
    private final double memoryFreedMB;

    public CacheStats(int initialCount, int keptCount, int evictedCount, double memoryFreedMB) {
        this.initialCount = initialCount;
        this.keptCount = keptCount;
        this.evictedCount = evictedCount;
        this.memoryFreedMB = memoryFreedMB;
    }

    public int getInitialCount() {
        return initialCount;
    }

    public int getKeptCount() {
        return keptCount;
    }

    public int getEvictedCount() {
        return evictedCount;
    }

    public double getMemoryFreedMB() {
        return memoryFreedMB;
    }

    /**
     * Convert to a JSON-friendly map for telemetry.
     */
    public Map<String, Object> toMap() {
        return Map.of(
                "initialCount", initialCount,
                "keptCount", keptCount,
                "evictedCount", evictedCount,
                "memoryFreedMB", memoryFreedMB
        );
    }

    @Override
    public String toString() {
        return String.format("CacheStats{initial=%d, kept=%d, evicted=%d, freed=%.2fMB}",
                initialCount, keptCount, evictedCount, memoryFreedMB);
    }
}
