package com.spatial.cache.store;

import java.util.Map;

/**
 * Cumulative cache statistics kept by the host across cleanup passes.
 */
public final class StoreStats {
    private static final StoreStats INITIAL = new StoreStats(0, 0, 0, 0, 0.0);

    private final int totalCached;
    private final long totalEvicted;
    private final long lastCleanupTime;
    private final int cleanupCount;
    private final double memoryEstimateMB;

    public StoreStats(int totalCached, long totalEvicted, long lastCleanupTime,
                      int cleanupCount, double memoryEstimateMB) {
        this.totalCached = totalCached;
        this.totalEvicted = totalEvicted;
        this.lastCleanupTime = lastCleanupTime;
        this.cleanupCount = cleanupCount;
        this.memoryEstimateMB = memoryEstimateMB;
    }

    public static StoreStats initial() {
        return INITIAL;
    }

    /**
     * @return stats after one more pass that kept {@code kept} and evicted {@code evicted} records
     */
    StoreStats afterCleanup(int kept, int evicted, long cleanupTime, double memoryEstimateMB) {
        return new StoreStats(kept, totalEvicted + evicted, cleanupTime, cleanupCount + 1, memoryEstimateMB);
    }

    public int getTotalCached() {
        return totalCached;
    }

    public long getTotalEvicted() {
        return totalEvicted;
    }

    public long getLastCleanupTime() {
        return lastCleanupTime;
    }

    public int getCleanupCount() {
        return cleanupCount;
    }

    public double getMemoryEstimateMB() {
        return memoryEstimateMB;
    }

    public Map<String, Object> toMap() {
        return Map.of(
                "totalCached", totalCached,
                "totalEvicted", totalEvicted,
                "lastCleanupTime", lastCleanupTime,
                "cleanupCount", cleanupCount,
                "memoryEstimateMB", memoryEstimateMB
        );
    }

    @Override
    public String toString() {
        return String.format("StoreStats{cached=%d, totalEvicted=%d, cleanups=%d, memory=%.2fMB, last=%d}",
                totalCached, totalEvicted, cleanupCount, memoryEstimateMB, lastCleanupTime);
    }
}
