package com.spatial.cache.priority;

import com.spatial.cache.model.AccessTimestamps;
import com.spatial.cache.model.GeoRecord;

/**
 * RankingFunction scores a record; higher means more worth keeping (or drawing).
 *
 * Two strategies exist and must not be conflated: a retention ranking that
 * decides what stays cached and a discovery ranking that decides which of
 * the cached records get a marker.
 */
public interface RankingFunction {

    /**
     * Score one record. Must be pure and deterministic for identical inputs.
     *
     * @param record       the record to score
     * @param lastAccessMs last touch in epoch ms, or {@link AccessTimestamps#NEVER_ACCESSED}
     * @param nowMs        the reference time, fixed for a whole ranking pass
     * @return the score
     */
    double score(GeoRecord record, long lastAccessMs, long nowMs);

    /**
     * @return the ranking name (e.g., "RETENTION", "DISCOVERY")
     */
    String getName();
}
