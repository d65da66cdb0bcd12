package com.spatial.cache.store;

import com.spatial.cache.model.AccessTimestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * AccessTracker records the last time each record was rendered, selected or
 * otherwise touched by the user.
 *
 * Owned and mutated by the host; the eviction engine only reads the
 * {@link #snapshot()}. Thread-safe.
 */
public class AccessTracker {
    private static final Logger logger = LoggerFactory.getLogger(AccessTracker.class);

    private final ConcurrentHashMap<String, Long> lastAccess;
    private final LongSupplier clock;

    public AccessTracker() {
        this(System::currentTimeMillis);
    }

    public AccessTracker(LongSupplier clock) {
        this.lastAccess = new ConcurrentHashMap<>();
        this.clock = clock;
    }

    /**
     * Record an access to a record at the current time.
     *
     * @param id The record id that was touched
     */
    public void recordAccess(String id) {
        recordAccess(id, clock.getAsLong());
    }

    /**
     * Record an access at an explicit time. Later touches win; an older
     * timestamp never overwrites a newer one.
     */
    public void recordAccess(String id, long timestampMs) {
        lastAccess.merge(id, timestampMs, Math::max);
        logger.trace("Recorded access for id: {}, timestamp: {}", id, timestampMs);
    }

    /**
     * Touch several records with one shared timestamp.
     */
    public void recordAccess(Collection<String> ids) {
        long now = clock.getAsLong();
        for (String id : ids) {
            recordAccess(id, now);
        }
    }

    /**
     * @return last access in epoch ms, or {@link AccessTimestamps#NEVER_ACCESSED}
     */
    public long getLastAccess(String id) {
        Long timestamp = lastAccess.get(id);
        return timestamp != null ? timestamp : AccessTimestamps.NEVER_ACCESSED;
    }

    /**
     * @return an independent read-only copy for one eviction pass
     */
    public AccessTimestamps snapshot() {
        return AccessTimestamps.of(lastAccess);
    }

    /**
     * Stop tracking a record (e.g., when evicted from the cache).
     */
    public void removeKey(String id) {
        lastAccess.remove(id);
    }

    public int getTrackedKeyCount() {
        return lastAccess.size();
    }

    public void clear() {
        lastAccess.clear();
        logger.info("Cleared all access tracking data");
    }
}
