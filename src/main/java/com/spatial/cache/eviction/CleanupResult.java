package com.spatial.cache.eviction;

import java.util.Collections;
import java.util.List;

/**
 * Keep/evict partition recommended by one eviction pass.
 *
 * The two lists are disjoint and together hold every input id exactly once.
 * Applying the partition (deleting the evicted ids) is the caller's job.
 */
public final class CleanupResult {
    private final List<String> keep;
    private final List<String> evict;
    private final CacheStats stats;
    private final boolean forcedTrim;

    CleanupResult(List<String> keep, List<String> evict, CacheStats stats, boolean forcedTrim) {
        this.keep = Collections.unmodifiableList(keep);
        this.evict = Collections.unmodifiableList(evict);
        this.stats = stats;
        this.forcedTrim = forcedTrim;
    }

    public List<String> getKeep() {
        return keep;
    }

    public List<String> getEvict() {
        return evict;
    }

    public CacheStats getStats() {
        return stats;
    }

    /**
     * @return true if the eligible set exceeded the hard capacity and was ranked down
     */
    public boolean isForcedTrim() {
        return forcedTrim;
    }

    @Override
    public String toString() {
        return "CleanupResult{keep=" + keep.size() + ", evict=" + evict.size()
                + ", forcedTrim=" + forcedTrim + ", stats=" + stats + '}';
    }
}
