package com.spatial.cache.eviction;

import com.spatial.cache.config.CacheConfig;
import com.spatial.cache.config.SpatialCriterion;
import com.spatial.cache.memory.MemoryEstimator;
import com.spatial.cache.model.AccessTimestamps;
import com.spatial.cache.model.BoundingBox;
import com.spatial.cache.model.GeoRecord;
import com.spatial.cache.model.SpatialKeySet;
import com.spatial.cache.model.Viewport;
import com.spatial.cache.priority.RankingFunction;
import com.spatial.cache.priority.RetentionPriorityScorer;
import com.spatial.cache.priority.ScoredRecord;
import com.spatial.cache.zone.CacheZoneCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * EvictionEngine partitions a record table into ids to keep and ids to evict.
 *
 * Two stages:
 * <ol>
 *   <li>Eligibility: a record is eligible if it lies in the cache zone (or,
 *       in spatial-key mode, shares a tracked cell) or was touched within the
 *       recency window. Everything else is evicted, whatever its priority.</li>
 *   <li>Capacity: if more than {@code hardCapacity} records are eligible, they
 *       are ranked by the retention ranking and only the top
 *       {@code softCapacity} survive.</li>
 * </ol>
 *
 * Without a viewport (or with a zero-area one) there is no basis for spatial
 * judgement and every record is kept.
 *
 * The engine holds no mutable state: inputs are read once, the result is a
 * fresh object, and concurrent calls do not interfere.
 */
public class EvictionEngine {
    private static final Logger logger = LoggerFactory.getLogger(EvictionEngine.class);

    private final CacheConfig config;
    private final RankingFunction retentionRanking;
    private final MemoryEstimator memoryEstimator;

    public EvictionEngine(CacheConfig config) {
        this(config, new RetentionPriorityScorer(config.getPriorityWeights()));
    }

    public EvictionEngine(CacheConfig config, RankingFunction retentionRanking) {
        this.config = Objects.requireNonNull(config, "config");
        this.retentionRanking = Objects.requireNonNull(retentionRanking, "retentionRanking");
        this.memoryEstimator = new MemoryEstimator(config);

        if (config.getHardCapacity() <= 0 || config.getSoftCapacity() <= 0) {
            throw new IllegalArgumentException("Capacities must be positive, got hard="
                    + config.getHardCapacity() + ", soft=" + config.getSoftCapacity());
        }
    }

    /**
     * Run one eviction pass with the current wall-clock time.
     *
     * @see #cleanup(Map, AccessTimestamps, Viewport, SpatialKeySet, long)
     */
    public CleanupResult cleanup(Map<String, GeoRecord> records, AccessTimestamps accessTimestamps,
                                 Viewport viewport, SpatialKeySet trackedSpatialKeys) {
        return cleanup(records, accessTimestamps, viewport, trackedSpatialKeys, System.currentTimeMillis());
    }

    /**
     * Run one eviction pass.
     *
     * @param records            record table keyed by id; the keys are the id set partitioned
     * @param accessTimestamps   last-touch snapshot; null means nothing was touched
     * @param viewport           current view state; null keeps everything
     * @param trackedSpatialKeys cells tracked by the host, used in spatial-key mode only
     * @param nowMs              reference time, fixed for the whole pass
     * @return the keep/evict partition with statistics
     */
    public CleanupResult cleanup(Map<String, GeoRecord> records, AccessTimestamps accessTimestamps,
                                 Viewport viewport, SpatialKeySet trackedSpatialKeys, long nowMs) {
        Map<String, GeoRecord> table = records != null ? records : Collections.emptyMap();
        AccessTimestamps access = accessTimestamps != null ? accessTimestamps : AccessTimestamps.empty();
        List<String> ids = new ArrayList<>(table.keySet());

        if (viewport == null) {
            logger.debug("No viewport yet, keeping all {} records", ids.size());
            return keepAll(ids);
        }

        SpatialTest spatialTest = spatialTest(viewport, trackedSpatialKeys);
        if (spatialTest == null) {
            return keepAll(ids);
        }

        // Step 1: eligibility
        List<String> eligible = new ArrayList<>();
        int keptBySpatial = 0;
        int keptByRecency = 0;
        for (String id : ids) {
            GeoRecord record = table.get(id);
            if (record != null && spatialTest.matches(record)) {
                eligible.add(id);
                keptBySpatial++;
            } else if (access.accessedWithin(id, config.getRecencyWindowMs(), nowMs)) {
                eligible.add(id);
                keptByRecency++;
            }
        }

        // Step 2: capacity
        List<String> keep = eligible;
        boolean forcedTrim = false;
        if (eligible.size() > config.getHardCapacity()) {
            logger.warn("Force cleanup triggered: {} eligible records > hard capacity {}, trimming to {}",
                    eligible.size(), config.getHardCapacity(), config.getSoftCapacity());
            keep = trimByPriority(eligible, table, access, nowMs);
            forcedTrim = true;
        }

        Set<String> keptIds = new HashSet<>(keep);
        List<String> evict = new ArrayList<>(ids.size() - keep.size());
        for (String id : ids) {
            if (!keptIds.contains(id)) {
                evict.add(id);
            }
        }

        logger.debug("Eviction pass ({}): total={}, keptBySpatial={}, keptByRecency={}, kept={}, evicted={}",
                config.getSpatialCriterion(), ids.size(), keptBySpatial, keptByRecency,
                keep.size(), evict.size());

        return result(ids.size(), keep, evict, forcedTrim);
    }

    private List<String> trimByPriority(List<String> eligible, Map<String, GeoRecord> table,
                                        AccessTimestamps access, long nowMs) {
        List<ScoredRecord> scored = new ArrayList<>(eligible.size());
        for (String id : eligible) {
            double score = retentionRanking.score(table.get(id), access.lastAccess(id), nowMs);
            scored.add(new ScoredRecord(id, score));
        }
        scored.sort(ScoredRecord.HIGHEST_FIRST);

        int limit = Math.min(config.getSoftCapacity(), scored.size());
        List<String> kept = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            kept.add(scored.get(i).getId());
        }
        return kept;
    }

    /**
     * @return the spatial half of the eligibility rule, or null when there is
     *         no basis to judge spatial relevance
     */
    private SpatialTest spatialTest(Viewport viewport, SpatialKeySet trackedSpatialKeys) {
        if (config.getSpatialCriterion() == SpatialCriterion.SPATIAL_KEYS) {
            if (trackedSpatialKeys == null || trackedSpatialKeys.isEmpty()) {
                logger.debug("No tracked spatial keys, keeping all records");
                return null;
            }
            return record -> trackedSpatialKeys.overlaps(record.getSpatialKeys());
        }

        BoundingBox zone = CacheZoneCalculator.computeCacheZone(viewport, config.getExpansionFactor());
        if (zone.isDegenerate()) {
            logger.debug("Degenerate viewport {}, keeping all records", viewport);
            return null;
        }
        return record -> zone.contains(record.getPosition());
    }

    private CleanupResult keepAll(List<String> ids) {
        return result(ids.size(), ids, new ArrayList<>(), false);
    }

    private CleanupResult result(int initialCount, List<String> keep, List<String> evict, boolean forcedTrim) {
        CacheStats stats = new CacheStats(
                initialCount,
                keep.size(),
                evict.size(),
                memoryEstimator.estimateMemoryUsage(evict.size()));
        return new CleanupResult(keep, evict, stats, forcedTrim);
    }

    public CacheConfig getConfig() {
        return config;
    }

    public RankingFunction getRetentionRanking() {
        return retentionRanking;
    }

    @FunctionalInterface
    private interface SpatialTest {
        boolean matches(GeoRecord record);
    }
}
