package com.spatial.cache.priority;

import com.spatial.cache.model.AccessTimestamps;
import com.spatial.cache.model.GeoRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders records by a {@link RankingFunction} with a deterministic tie-break.
 */
public final class RecordRanker {
    private static final Logger logger = LoggerFactory.getLogger(RecordRanker.class);

    private static final DiscoveryScorer DISCOVERY = new DiscoveryScorer();

    private RecordRanker() {
    }

    /**
     * Score every record and sort highest first (ties by id).
     *
     * @param records      records to rank; null entries are skipped
     * @param access       access snapshot, may be null
     * @param ranking      scoring strategy
     * @param nowMs        reference time, fixed for the whole pass
     * @return scored ids, highest first
     */
    public static List<ScoredRecord> rank(Collection<GeoRecord> records, AccessTimestamps access,
                                          RankingFunction ranking, long nowMs) {
        AccessTimestamps timestamps = access != null ? access : AccessTimestamps.empty();
        List<ScoredRecord> scored = new ArrayList<>(records.size());
        for (GeoRecord record : records) {
            if (record == null) {
                continue;
            }
            double score = ranking.score(record, timestamps.lastAccess(record.getId()), nowMs);
            scored.add(new ScoredRecord(record.getId(), score));
        }
        scored.sort(ScoredRecord.HIGHEST_FIRST);
        return scored;
    }

    /**
     * Keep the {@code limit} highest-ranked records. Input that already fits
     * is returned as-is, in its own order.
     */
    public static List<GeoRecord> top(Collection<GeoRecord> records, AccessTimestamps access,
                                      RankingFunction ranking, int limit, long nowMs) {
        if (limit < 0) {
            throw new IllegalArgumentException("Limit must not be negative, got: " + limit);
        }
        if (records.size() <= limit) {
            return new ArrayList<>(records);
        }

        Map<String, GeoRecord> byId = new HashMap<>(records.size() * 2);
        for (GeoRecord record : records) {
            if (record != null) {
                byId.put(record.getId(), record);
            }
        }

        List<ScoredRecord> ranked = rank(byId.values(), access, ranking, nowMs);
        List<GeoRecord> result = new ArrayList<>(Math.min(limit, ranked.size()));
        for (int i = 0; i < Math.min(limit, ranked.size()); i++) {
            result.add(byId.get(ranked.get(i).getId()));
        }

        logger.debug("{} ranking kept {} of {} records", ranking.getName(), result.size(), records.size());
        return result;
    }

    /**
     * Choose which cached records get a map marker, favouring older and
     * unreferenced records.
     *
     * @param records    the kept set
     * @param maxMarkers marker budget
     * @param nowMs      reference time
     */
    public static List<GeoRecord> limitMarkers(Collection<GeoRecord> records, int maxMarkers, long nowMs) {
        return top(records, AccessTimestamps.empty(), DISCOVERY, maxMarkers, nowMs);
    }
}
