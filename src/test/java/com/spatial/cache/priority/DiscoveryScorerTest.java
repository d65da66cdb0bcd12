package com.spatial.cache.priority;

import com.spatial.cache.model.AccessTimestamps;
import com.spatial.cache.model.GeoRecord;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiscoveryScorerTest {

    private static final long NOW = 1_750_000_000_000L;
    private static final long DAY_SECONDS = 24L * 60 * 60;

    private final DiscoveryScorer scorer = new DiscoveryScorer();

    private GeoRecord record(long ageDays, int refs, int generation) {
        return GeoRecord.builder("d")
                .createdAt(NOW / 1000 - ageDays * DAY_SECONDS)
                .referenceCount(refs)
                .generation(generation)
                .build();
    }

    @Test
    void testOlderRecordsScoreHigher() {
        assertTrue(scorer.score(record(20, 1, 0), 0, NOW) > scorer.score(record(2, 1, 0), 0, NOW));
    }

    @Test
    void testAgeBoostSaturatesAtThirtyDays() {
        double score = scorer.score(record(30, 1, 0), 0, NOW);
        // ageBoost 1.0 + generation base 0.1
        assertEquals(1.1, score, 1e-9);
    }

    @Test
    void testUnreferencedRecordsGetIsolationBonus() {
        double isolated = scorer.score(record(10, 0, 0), 0, NOW);
        double referenced = scorer.score(record(10, 3, 0), 0, NOW);

        assertEquals(0.3, isolated - referenced, 1e-9);
    }

    @Test
    void testGenerationStep() {
        double difference = scorer.score(record(10, 1, 4), 0, NOW) - scorer.score(record(10, 1, 0), 0, NOW);
        assertEquals(0.2, difference, 1e-9);
    }

    @Test
    void testAccessHistoryIgnored() {
        GeoRecord record = record(5, 0, 1);
        assertEquals(scorer.score(record, NOW, NOW), scorer.score(record, AccessTimestamps.NEVER_ACCESSED, NOW));
    }

    @Test
    void testFutureCreationClampedToZeroAge() {
        GeoRecord future = GeoRecord.builder("f").createdAt(NOW / 1000 + DAY_SECONDS).referenceCount(1).build();
        assertEquals(0.1, scorer.score(future, 0, NOW), 1e-9);
    }
}
