package com.spatial.cache.priority;

import com.spatial.cache.model.GeoRecord;

/**
 * Display ranking: older, unreferenced records become more discoverable,
 * the way a smoke signal grows with time.
 *
 * <ul>
 *   <li>age boost: log1p(ageDays) / log1p(30), saturating around a month</li>
 *   <li>isolation bonus: 0.3 when nothing references the record</li>
 *   <li>generation: 0.1 + 0.05 per generation</li>
 * </ul>
 * Access history is ignored.
 */
public class DiscoveryScorer implements RankingFunction {
    private static final double MS_PER_DAY = 24.0 * 60 * 60 * 1000;
    private static final double AGE_SATURATION_DAYS = 30;
    private static final double ISOLATION_BONUS = 0.3;
    private static final double GENERATION_BASE = 0.1;
    private static final double GENERATION_STEP = 0.05;

    @Override
    public double score(GeoRecord record, long lastAccessMs, long nowMs) {
        if (record == null) {
            return Double.NEGATIVE_INFINITY;
        }
        double ageDays = (nowMs - record.getCreatedAt() * 1000L) / MS_PER_DAY;
        double ageBoost = Math.log1p(Math.max(0.0, ageDays)) / Math.log1p(AGE_SATURATION_DAYS);
        double isolationBonus = record.getReferenceCount() == 0 ? ISOLATION_BONUS : 0.0;
        double generationScore = GENERATION_BASE + Math.max(0, record.getGeneration()) * GENERATION_STEP;
        return ageBoost + isolationBonus + generationScore;
    }

    @Override
    public String getName() {
        return "DISCOVERY";
    }
}
