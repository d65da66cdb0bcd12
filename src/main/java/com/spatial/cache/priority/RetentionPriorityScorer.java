package com.spatial.cache.priority;

import com.spatial.cache.config.PriorityWeights;
import com.spatial.cache.model.AccessTimestamps;
import com.spatial.cache.model.GeoRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Retention priority used by forced trimming.
 *
 * Balances established records (generation, references), engagement
 * (content, recent access) and newly created records (freshness, a flat
 * exploration bonus during the first days). Each term is non-decreasing in
 * generation, reference count and content presence and strictly decreasing
 * in the access gap.
 */
public class RetentionPriorityScorer implements RankingFunction {
    private static final Logger logger = LoggerFactory.getLogger(RetentionPriorityScorer.class);

    static final double MS_PER_DAY = 24.0 * 60 * 60 * 1000;

    private final PriorityWeights weights;

    public RetentionPriorityScorer() {
        this(PriorityWeights.defaults());
    }

    public RetentionPriorityScorer(PriorityWeights weights) {
        this.weights = Objects.requireNonNull(weights, "weights").validated();
    }

    @Override
    public double score(GeoRecord record, long lastAccessMs, long nowMs) {
        double recencyScore = recencyScore(lastAccessMs, nowMs);
        if (record == null) {
            return recencyScore;
        }

        int generation = Math.max(0, record.getGeneration());
        int referenceCount = Math.max(0, record.getReferenceCount());

        double generationScore = Math.min(generation, weights.getGenerationCap()) * weights.getGeneration();
        double referenceScore = Math.min(referenceCount, weights.getRefCountCap()) * weights.getRefCount();
        double contentScore = record.hasContent() ? weights.getHasContent() : 0.0;

        // createdAt is in seconds; a record without one counts as brand new
        long createdAtMs = record.getCreatedAt() > 0 ? record.getCreatedAt() * 1000L : nowMs;
        double recordAgeDays = Math.max(0L, nowMs - createdAtMs) / MS_PER_DAY;

        double freshnessScore = weights.getFreshness()
                * Math.exp(-recordAgeDays / weights.getFreshnessHalfLifeDays());
        double explorationBonus = recordAgeDays < weights.getExplorationBonusDays()
                ? weights.getExplorationBonus()
                : 0.0;

        double total = generationScore + referenceScore + contentScore
                + recencyScore + freshnessScore + explorationBonus;

        if (explorationBonus > 0 && logger.isTraceEnabled()) {
            logger.trace("New record bonus: {} ({}d old, score {}, G={}, R={}, C={})",
                    record.getId(), String.format("%.1f", recordAgeDays), String.format("%.2f", total),
                    generation, referenceCount, record.hasContent() ? "Y" : "N");
        }
        return total;
    }

    private double recencyScore(long lastAccessMs, long nowMs) {
        if (lastAccessMs == AccessTimestamps.NEVER_ACCESSED) {
            return 0.0;
        }
        // a timestamp in the future counts as "just now"
        long gapMs = Math.max(0L, nowMs - lastAccessMs);
        return weights.getRecency() * Math.exp(-(double) gapMs / weights.getRecencyDecayMs());
    }

    public PriorityWeights getWeights() {
        return weights;
    }

    @Override
    public String getName() {
        return "RETENTION";
    }
}
