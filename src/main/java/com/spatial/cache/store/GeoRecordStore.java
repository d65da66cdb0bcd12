package com.spatial.cache.store;

import com.spatial.cache.config.CacheConfig;
import com.spatial.cache.eviction.CleanupResult;
import com.spatial.cache.eviction.EvictionEngine;
import com.spatial.cache.memory.MemoryEstimator;
import com.spatial.cache.memory.MemoryPressure;
import com.spatial.cache.model.GeoRecord;
import com.spatial.cache.model.SpatialKeySet;
import com.spatial.cache.model.Viewport;
import com.spatial.cache.priority.RecordRanker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Authoritative record table of the map client.
 *
 * Ingests fetched batches, tracks user touches and applies the partitions
 * recommended by the {@link EvictionEngine}. Cleanup passes are serialized;
 * ingestion and touches may run concurrently with them.
 */
public class GeoRecordStore {
    private static final Logger logger = LoggerFactory.getLogger(GeoRecordStore.class);

    private final CacheConfig config;
    private final EvictionEngine engine;
    private final MemoryEstimator memoryEstimator;
    private final AccessTracker accessTracker;
    private final LongSupplier clock;

    private final Map<String, GeoRecord> records;

    private volatile Viewport viewport;
    private volatile SpatialKeySet trackedSpatialKeys;
    private volatile boolean loading;
    private volatile StoreStats stats;
    private volatile List<String> keptIds;

    public GeoRecordStore(CacheConfig config) {
        this(config, System::currentTimeMillis);
    }

    public GeoRecordStore(CacheConfig config, LongSupplier clock) {
        this(config, new EvictionEngine(config), clock);
    }

    public GeoRecordStore(CacheConfig config, EvictionEngine engine, LongSupplier clock) {
        this.config = config;
        this.engine = engine;
        this.memoryEstimator = new MemoryEstimator(config);
        this.clock = clock;
        this.accessTracker = new AccessTracker(clock);
        this.records = new ConcurrentHashMap<>();
        this.trackedSpatialKeys = SpatialKeySet.empty();
        this.stats = StoreStats.initial();
        this.keptIds = List.of();
        logger.info("GeoRecordStore initialized with {}", config);
    }

    /**
     * Insert or refresh a batch of fetched records. Ingested records count as
     * touched, so they survive a fly-to animation that outruns the viewport.
     *
     * @return number of records ingested
     */
    public int putAll(Collection<GeoRecord> batch) {
        long now = clock.getAsLong();
        int count = 0;
        for (GeoRecord record : batch) {
            if (record == null) {
                continue;
            }
            records.put(record.getId(), record);
            accessTracker.recordAccess(record.getId(), now);
            count++;
        }
        logger.debug("Ingested {} records, table size {}", count, records.size());
        return count;
    }

    public void put(GeoRecord record) {
        putAll(List.of(record));
    }

    /**
     * Look up a record and mark it as touched.
     */
    public GeoRecord get(String id) {
        GeoRecord record = records.get(id);
        if (record != null) {
            accessTracker.recordAccess(id);
        }
        return record;
    }

    /**
     * Look up a record without touching it.
     */
    public GeoRecord peek(String id) {
        return records.get(id);
    }

    /**
     * Touch records that are rendered or selected. Unknown ids are ignored.
     */
    public void touch(Collection<String> ids) {
        long now = clock.getAsLong();
        for (String id : ids) {
            if (records.containsKey(id)) {
                accessTracker.recordAccess(id, now);
            }
        }
    }

    public void updateViewport(Viewport viewport) {
        this.viewport = viewport;
        logger.trace("Viewport updated: {}", viewport);
    }

    public Viewport getViewport() {
        return viewport;
    }

    public void updateTrackedSpatialKeys(SpatialKeySet trackedSpatialKeys) {
        this.trackedSpatialKeys = trackedSpatialKeys != null ? trackedSpatialKeys : SpatialKeySet.empty();
    }

    public SpatialKeySet getTrackedSpatialKeys() {
        return trackedSpatialKeys;
    }

    /**
     * Mark a fetch as in flight; cleanup is skipped meanwhile.
     */
    public void setLoading(boolean loading) {
        this.loading = loading;
    }

    public boolean isLoading() {
        return loading;
    }

    /**
     * Run the eviction engine on a snapshot and apply its partition.
     *
     * Skipped while a fetch is loading or when the previous pass finished less
     * than the debounce interval ago.
     *
     * @return the applied result, or empty if the pass was skipped
     */
    public synchronized Optional<CleanupResult> cleanup() {
        if (loading) {
            logger.debug("Cleanup skipped: fetch in progress");
            return Optional.empty();
        }

        long now = clock.getAsLong();
        long lastCleanup = stats.getLastCleanupTime();
        if (stats.getCleanupCount() > 0 && now - lastCleanup < config.getCleanupDebounceMs()) {
            logger.debug("Cleanup skipped: {}ms since last cleanup", now - lastCleanup);
            return Optional.empty();
        }

        Map<String, GeoRecord> snapshot = new HashMap<>(records);
        CleanupResult result = engine.cleanup(snapshot, accessTracker.snapshot(),
                viewport, trackedSpatialKeys, now);

        for (String id : result.getEvict()) {
            // a record refreshed after the snapshot is newer than the decision, leave it
            if (records.remove(id, snapshot.get(id))) {
                accessTracker.removeKey(id);
            }
        }

        int kept = result.getStats().getKeptCount();
        keptIds = result.getKeep();
        stats = stats.afterCleanup(kept, result.getStats().getEvictedCount(), now,
                memoryEstimator.estimateMemoryUsage(kept));

        logger.info("Cleanup completed: {} ({})", result.getStats(), stats);

        MemoryPressure pressure = memoryEstimator.pressure(kept);
        if (pressure == MemoryPressure.CRITICAL) {
            logger.error("Memory usage is critical: ~{}MB for {} records", stats.getMemoryEstimateMB(), kept);
        } else if (pressure == MemoryPressure.WARNING) {
            logger.warn("Memory usage is approaching limit: ~{}MB for {} records", stats.getMemoryEstimateMB(), kept);
        }
        return Optional.of(result);
    }

    /**
     * Records to draw as markers, at most the configured marker budget.
     */
    public List<GeoRecord> visibleMarkers() {
        List<GeoRecord> candidates = new ArrayList<>();
        Viewport current = viewport;
        for (GeoRecord record : records.values()) {
            if (current == null || current.getBounds().contains(record.getPosition())) {
                candidates.add(record);
            }
        }
        return RecordRanker.limitMarkers(candidates, config.getMaxVisibleMarkers(), clock.getAsLong());
    }

    /**
     * @return ids kept by the last cleanup pass, for out-of-band persistence
     */
    public List<String> keptIds() {
        return keptIds;
    }

    public Set<String> ids() {
        return Set.copyOf(records.keySet());
    }

    public int size() {
        return records.size();
    }

    public double estimatedMemoryMB() {
        return memoryEstimator.estimateMemoryUsage(records.size());
    }

    public StoreStats getStats() {
        return stats;
    }

    public AccessTracker getAccessTracker() {
        return accessTracker;
    }

    public CacheConfig getConfig() {
        return config;
    }

    public synchronized void clear() {
        records.clear();
        accessTracker.clear();
        keptIds = List.of();
        logger.info("Record store cleared");
    }
}
