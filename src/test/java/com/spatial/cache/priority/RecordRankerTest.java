package com.spatial.cache.priority;

import com.spatial.cache.model.AccessTimestamps;
import com.spatial.cache.model.GeoRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class RecordRankerTest {

    private static final long NOW = 1_750_000_000_000L;
    private static final long DAY_SECONDS = 24L * 60 * 60;

    private final RetentionPriorityScorer retention = new RetentionPriorityScorer();

    @Test
    void testRankHighestFirst() {
        List<GeoRecord> records = List.of(
                GeoRecord.builder("low").build(),
                GeoRecord.builder("high").generation(5).referenceCount(5).build(),
                GeoRecord.builder("mid").generation(2).build());

        List<String> order = RecordRanker.rank(records, AccessTimestamps.empty(), retention, NOW).stream()
                .map(ScoredRecord::getId)
                .collect(Collectors.toList());

        assertEquals(List.of("high", "mid", "low"), order);
    }

    @Test
    void testTiesBrokenById() {
        List<GeoRecord> records = List.of(
                GeoRecord.builder("c").build(),
                GeoRecord.builder("a").build(),
                GeoRecord.builder("b").build());

        List<GeoRecord> top = RecordRanker.top(records, null, retention, 2, NOW);

        assertEquals(List.of("a", "b"), top.stream().map(GeoRecord::getId).collect(Collectors.toList()));
    }

    @Test
    void testTopUsesAccessTimestamps() {
        List<GeoRecord> records = List.of(GeoRecord.builder("a").build(), GeoRecord.builder("b").build());
        AccessTimestamps access = AccessTimestamps.of(Map.of("b", NOW - 1000));

        List<GeoRecord> top = RecordRanker.top(records, access, retention, 1, NOW);

        assertEquals("b", top.get(0).getId());
    }

    @Test
    void testTopReturnsInputWhenWithinLimit() {
        List<GeoRecord> records = List.of(GeoRecord.builder("z").build(), GeoRecord.builder("a").build());

        List<GeoRecord> top = RecordRanker.top(records, null, retention, 5, NOW);

        assertEquals(records, top);
    }

    @Test
    void testNegativeLimitRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> RecordRanker.top(List.of(), null, retention, -1, NOW));
    }

    @Test
    void testLimitMarkersPrefersOldUnreferencedRecords() {
        List<GeoRecord> records = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            records.add(GeoRecord.builder("new-" + i)
                    .createdAt(NOW / 1000 - DAY_SECONDS)
                    .referenceCount(3)
                    .build());
        }
        for (int i = 0; i < 5; i++) {
            records.add(GeoRecord.builder("old-" + i)
                    .createdAt(NOW / 1000 - 60 * DAY_SECONDS)
                    .build());
        }

        List<GeoRecord> markers = RecordRanker.limitMarkers(records, 5, NOW);

        assertEquals(5, markers.size());
        assertTrue(markers.stream().allMatch(r -> r.getId().startsWith("old-")));
    }
}
