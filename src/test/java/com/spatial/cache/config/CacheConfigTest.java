package com.spatial.cache.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CacheConfig.
 *
 * Tests cover:
 * - Loading from classpath and file system
 * - Defaults for omitted keys
 * - Fail-fast validation of capacities and other constants
 */
class CacheConfigTest {

    @Test
    void testDefaults() {
        CacheConfig config = CacheConfig.defaults();

        assertEquals(1.75, config.getExpansionFactor());
        assertEquals(60_000, config.getRecencyWindowMs());
        assertEquals(4000, config.getHardCapacity());
        assertEquals(3000, config.getSoftCapacity());
        assertEquals(1.8, config.getPerRecordKB());
        assertEquals(100, config.getMaxVisibleMarkers());
        assertEquals(SpatialCriterion.BOUNDS, config.getSpatialCriterion());
        assertEquals(0.25, config.getPriorityWeights().getGeneration());
    }

    @Test
    void testBundledConfigMatchesDefaults() throws IOException {
        CacheConfig bundled = CacheConfig.loadFromClasspath("spatial-cache.yaml");
        CacheConfig defaults = CacheConfig.defaults();

        assertEquals(defaults.getExpansionFactor(), bundled.getExpansionFactor());
        assertEquals(defaults.getRecencyWindowMs(), bundled.getRecencyWindowMs());
        assertEquals(defaults.getHardCapacity(), bundled.getHardCapacity());
        assertEquals(defaults.getSoftCapacity(), bundled.getSoftCapacity());
        assertEquals(defaults.getPerRecordKB(), bundled.getPerRecordKB());
        assertEquals(defaults.getPriorityWeights().getRecencyDecayMs(),
                bundled.getPriorityWeights().getRecencyDecayMs());
    }

    @Test
    void testLoadFromClasspath() throws IOException {
        CacheConfig config = CacheConfig.loadFromClasspath("test-spatial-cache.yaml");

        assertEquals(2.0, config.getExpansionFactor());
        assertEquals(30_000, config.getRecencyWindowMs());
        assertEquals(400, config.getHardCapacity());
        assertEquals(300, config.getSoftCapacity());
        assertEquals(2.0, config.getPerRecordKB());
        assertEquals(4, config.getMemoryWarningMB());
        assertEquals(6, config.getMemoryCriticalMB());
        assertEquals(50, config.getMaxVisibleMarkers());
        assertEquals(500, config.getCleanupDebounceMs());
        assertEquals(10_000, config.getPeriodicCleanupIntervalMs());
        assertEquals(SpatialCriterion.SPATIAL_KEYS, config.getSpatialCriterion());

        PriorityWeights weights = config.getPriorityWeights();
        assertEquals(0.5, weights.getGeneration());
        assertEquals(0.3, weights.getHasContent());
        assertEquals(10, weights.getGenerationCap());
        // omitted weights keep their defaults
        assertEquals(PriorityWeights.DEFAULT_REF_COUNT, weights.getRefCount());
        assertEquals(PriorityWeights.DEFAULT_FRESHNESS_HALF_LIFE_DAYS, weights.getFreshnessHalfLifeDays());
    }

    @Test
    void testLoadFromFile(@TempDir Path tempDir) throws IOException {
        Path configPath = tempDir.resolve("cache.yaml");
        String yamlContent = """
                cache:
                  hard_capacity: 200
                  soft_capacity: 150
                  recency_window_ms: 45000
                """;
        Files.writeString(configPath, yamlContent);

        CacheConfig config = CacheConfig.load(configPath.toString());

        assertEquals(200, config.getHardCapacity());
        assertEquals(150, config.getSoftCapacity());
        assertEquals(45_000, config.getRecencyWindowMs());
        assertEquals(CacheConfig.DEFAULT_EXPANSION_FACTOR, config.getExpansionFactor());
    }

    @Test
    void testEmptyCacheSectionUsesDefaults(@TempDir Path tempDir) throws IOException {
        Path configPath = tempDir.resolve("cache.yaml");
        Files.writeString(configPath, "cache:\n");

        CacheConfig config = CacheConfig.load(configPath.toString());

        assertEquals(CacheConfig.DEFAULT_HARD_CAPACITY, config.getHardCapacity());
    }

    @Test
    void testMissingFile() {
        assertThrows(IOException.class, () -> CacheConfig.load("/nonexistent/cache.yaml"));
    }

    @Test
    void testMissingClasspathResource() {
        assertThrows(IOException.class, () -> CacheConfig.loadFromClasspath("missing-cache.yaml"));
    }

    @Test
    void testMissingRootElement(@TempDir Path tempDir) throws IOException {
        Path configPath = tempDir.resolve("cache.yaml");
        Files.writeString(configPath, "cluster:\n  hard_capacity: 10\n");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CacheConfig.load(configPath.toString()));
        assertTrue(e.getMessage().contains("'cache' root element"));
    }

    @Test
    void testInvalidCapacityInFile(@TempDir Path tempDir) throws IOException {
        Path configPath = tempDir.resolve("cache.yaml");
        Files.writeString(configPath, "cache:\n  hard_capacity: 0\n  soft_capacity: 0\n");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CacheConfig.load(configPath.toString()));
        assertTrue(e.getMessage().contains("Hard capacity must be positive"));
    }

    @Test
    void testNonPositiveCapacitiesRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CacheConfig.builder().hardCapacity(0).softCapacity(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> CacheConfig.builder().hardCapacity(100).softCapacity(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> CacheConfig.builder().hardCapacity(-5).softCapacity(-10).build());
    }

    @Test
    void testSoftCapacityAboveHardCapacityRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CacheConfig.builder().hardCapacity(100).softCapacity(200).build());
        assertTrue(e.getMessage().contains("must not exceed hard capacity"));
    }

    @Test
    void testSoftEqualToHardAllowed() {
        CacheConfig config = CacheConfig.builder().hardCapacity(100).softCapacity(100).build();
        assertEquals(100, config.getSoftCapacity());
    }

    @Test
    void testAllErrorsReportedTogether() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CacheConfig.builder()
                        .expansionFactor(0)
                        .recencyWindowMs(-1)
                        .memoryThresholdsMB(12, 10)
                        .build());

        assertTrue(e.getMessage().contains("Expansion factor"));
        assertTrue(e.getMessage().contains("Recency window"));
        assertTrue(e.getMessage().contains("warning threshold"));
    }

    @Test
    void testNegativeWeightRejected() {
        PriorityWeights weights = new PriorityWeights(-1.0, null, null, null, null,
                null, null, null, null, null, null);

        assertThrows(IllegalArgumentException.class,
                () -> CacheConfig.builder().priorityWeights(weights).build());
        assertThrows(IllegalArgumentException.class, weights::validated);
    }
}
