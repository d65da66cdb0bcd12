package com.spatial.cache.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * PriorityWeights holds the tunable constants of the retention priority score.
 *
 * Only the monotonic direction of each term is a contract; the magnitudes
 * below reproduce the behaviour the map client shipped with. Any key missing
 * from the YAML falls back to its default.
 *
 * <pre>
 * priority_weights:
 *   generation: 0.25
 *   ref_count: 0.20
 *   has_content: 0.15
 *   recency: 0.15
 *   freshness: 0.25
 *   generation_cap: 8
 *   ref_count_cap: 8
 *   exploration_bonus: 0.4
 *   exploration_bonus_days: 7
 *   freshness_half_life_days: 30
 *   recency_decay_ms: 86400000
 * </pre>
 */
public final class PriorityWeights {
    public static final double DEFAULT_GENERATION = 0.25;
    public static final double DEFAULT_REF_COUNT = 0.20;
    public static final double DEFAULT_HAS_CONTENT = 0.15;
    public static final double DEFAULT_RECENCY = 0.15;
    public static final double DEFAULT_FRESHNESS = 0.25;
    public static final int DEFAULT_GENERATION_CAP = 8;
    public static final int DEFAULT_REF_COUNT_CAP = 8;
    public static final double DEFAULT_EXPLORATION_BONUS = 0.4;
    public static final double DEFAULT_EXPLORATION_BONUS_DAYS = 7;
    public static final double DEFAULT_FRESHNESS_HALF_LIFE_DAYS = 30;
    public static final long DEFAULT_RECENCY_DECAY_MS = 24L * 60 * 60 * 1000;

    private final double generation;
    private final double refCount;
    private final double hasContent;
    private final double recency;
    private final double freshness;
    private final int generationCap;
    private final int refCountCap;
    private final double explorationBonus;
    private final double explorationBonusDays;
    private final double freshnessHalfLifeDays;
    private final long recencyDecayMs;

    @JsonCreator
    public PriorityWeights(
            @JsonProperty("generation") Double generation,
            @JsonProperty("ref_count") Double refCount,
            @JsonProperty("has_content") Double hasContent,
            @JsonProperty("recency") Double recency,
            @JsonProperty("freshness") Double freshness,
            @JsonProperty("generation_cap") Integer generationCap,
            @JsonProperty("ref_count_cap") Integer refCountCap,
            @JsonProperty("exploration_bonus") Double explorationBonus,
            @JsonProperty("exploration_bonus_days") Double explorationBonusDays,
            @JsonProperty("freshness_half_life_days") Double freshnessHalfLifeDays,
            @JsonProperty("recency_decay_ms") Long recencyDecayMs) {

        this.generation = generation != null ? generation : DEFAULT_GENERATION;
        this.refCount = refCount != null ? refCount : DEFAULT_REF_COUNT;
        this.hasContent = hasContent != null ? hasContent : DEFAULT_HAS_CONTENT;
        this.recency = recency != null ? recency : DEFAULT_RECENCY;
        this.freshness = freshness != null ? freshness : DEFAULT_FRESHNESS;
        this.generationCap = generationCap != null ? generationCap : DEFAULT_GENERATION_CAP;
        this.refCountCap = refCountCap != null ? refCountCap : DEFAULT_REF_COUNT_CAP;
        this.explorationBonus = explorationBonus != null ? explorationBonus : DEFAULT_EXPLORATION_BONUS;
        this.explorationBonusDays = explorationBonusDays != null
                ? explorationBonusDays : DEFAULT_EXPLORATION_BONUS_DAYS;
        this.freshnessHalfLifeDays = freshnessHalfLifeDays != null
                ? freshnessHalfLifeDays : DEFAULT_FRESHNESS_HALF_LIFE_DAYS;
        this.recencyDecayMs = recencyDecayMs != null ? recencyDecayMs : DEFAULT_RECENCY_DECAY_MS;
    }

    public static PriorityWeights defaults() {
        return new PriorityWeights(null, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * Collect validation problems into the given list (empty if the weights are usable).
     */
    void validateInto(List<String> errors) {
        checkNonNegative(errors, "generation", generation);
        checkNonNegative(errors, "ref_count", refCount);
        checkNonNegative(errors, "has_content", hasContent);
        checkNonNegative(errors, "recency", recency);
        checkNonNegative(errors, "freshness", freshness);
        checkNonNegative(errors, "exploration_bonus", explorationBonus);
        checkNonNegative(errors, "exploration_bonus_days", explorationBonusDays);
        if (generationCap < 0) {
            errors.add("priority_weights.generation_cap must not be negative, got: " + generationCap);
        }
        if (refCountCap < 0) {
            errors.add("priority_weights.ref_count_cap must not be negative, got: " + refCountCap);
        }
        if (!(freshnessHalfLifeDays > 0)) {
            errors.add("priority_weights.freshness_half_life_days must be positive, got: " + freshnessHalfLifeDays);
        }
        if (recencyDecayMs <= 0) {
            errors.add("priority_weights.recency_decay_ms must be positive, got: " + recencyDecayMs);
        }
    }

    private static void checkNonNegative(List<String> errors, String name, double value) {
        if (!(value >= 0)) {
            errors.add("priority_weights." + name + " must not be negative, got: " + value);
        }
    }

    /**
     * @throws IllegalArgumentException if any weight is unusable
     */
    public PriorityWeights validated() {
        List<String> errors = new ArrayList<>();
        validateInto(errors);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Priority weights validation failed: " + String.join("; ", errors));
        }
        return this;
    }

    public double getGeneration() {
        return generation;
    }

    public double getRefCount() {
        return refCount;
    }

    public double getHasContent() {
        return hasContent;
    }

    public double getRecency() {
        return recency;
    }

    public double getFreshness() {
        return freshness;
    }

    public int getGenerationCap() {
        return generationCap;
    }

    public int getRefCountCap() {
        return refCountCap;
    }

    public double getExplorationBonus() {
        return explorationBonus;
    }

    public double getExplorationBonusDays() {
        return explorationBonusDays;
    }

    public double getFreshnessHalfLifeDays() {
        return freshnessHalfLifeDays;
    }

    public long getRecencyDecayMs() {
        return recencyDecayMs;
    }

    @Override
    public String toString() {
        return "PriorityWeights{" +
                "generation=" + generation +
                ", refCount=" + refCount +
                ", hasContent=" + hasContent +
                ", recency=" + recency +
                ", freshness=" + freshness +
                ", caps=" + generationCap + "/" + refCountCap +
                ", explorationBonus=" + explorationBonus + " for " + explorationBonusDays + "d" +
                ", freshnessHalfLife=" + freshnessHalfLifeDays + "d" +
                '}';
    }
}
