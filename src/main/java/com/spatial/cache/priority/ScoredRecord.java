package com.spatial.cache.priority;

import java.util.Comparator;

/**
 * A record id with the score a ranking function gave it.
 */
public class ScoredRecord {

    /** Highest score first, ties broken by ascending id. */
    public static final Comparator<ScoredRecord> HIGHEST_FIRST =
            Comparator.comparingDouble(ScoredRecord::getScore).reversed()
                    .thenComparing(ScoredRecord::getId);

    private final String id;
    private final double score;

    public ScoredRecord(String id, double score) {
        this.id = id;
        this.score = score;
    }

    public String getId() {
        return id;
    }

    public double getScore() {
        return score;
    }

    @Override
    public String toString() {
        return String.format("ScoredRecord{id='%s', score=%.4f}", id, score);
    }
}
