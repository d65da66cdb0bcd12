package com.spatial.cache.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Read-only snapshot of record id to last-touch wall-clock time (ms).
 *
 * The live table belongs to the host; the eviction engine only ever sees a
 * snapshot. A missing entry means "never accessed".
 */
public final class AccessTimestamps {

    /** Returned for ids with no entry. */
    public static final long NEVER_ACCESSED = Long.MIN_VALUE;

    private static final AccessTimestamps EMPTY = new AccessTimestamps(Collections.emptyMap());

    private final Map<String, Long> timestamps;

    private AccessTimestamps(Map<String, Long> timestamps) {
        this.timestamps = timestamps;
    }

    /**
     * Copy the given table. Null keys or values are dropped.
     */
    public static AccessTimestamps of(Map<String, Long> timestamps) {
        if (timestamps == null || timestamps.isEmpty()) {
            return EMPTY;
        }
        Map<String, Long> copy = new HashMap<>(timestamps.size() * 2);
        for (Map.Entry<String, Long> entry : timestamps.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                copy.put(entry.getKey(), entry.getValue());
            }
        }
        return new AccessTimestamps(Collections.unmodifiableMap(copy));
    }

    public static AccessTimestamps empty() {
        return EMPTY;
    }

    /**
     * @return last access in epoch ms, or {@link #NEVER_ACCESSED}
     */
    public long lastAccess(String id) {
        Long timestamp = timestamps.get(id);
        return timestamp != null ? timestamp : NEVER_ACCESSED;
    }

    /**
     * @return true if the id was touched within {@code windowMs} of {@code nowMs}
     */
    public boolean accessedWithin(String id, long windowMs, long nowMs) {
        Long timestamp = timestamps.get(id);
        if (timestamp == null || timestamp == NEVER_ACCESSED) {
            return false;
        }
        if (timestamp >= nowMs) {
            return true;
        }
        // wraps negative when the gap does not fit in a long
        long gap = nowMs - timestamp;
        return gap >= 0 && gap <= windowMs;
    }

    public Set<String> ids() {
        return timestamps.keySet();
    }

    public int size() {
        return timestamps.size();
    }

    public Map<String, Long> asMap() {
        return timestamps;
    }
}
