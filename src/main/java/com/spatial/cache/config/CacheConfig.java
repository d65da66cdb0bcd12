package com.spatial.cache.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * CacheConfig loads and validates the spatial cache configuration from YAML.
 *
 * Configuration format (every key optional, defaults shown):
 * <pre>
 * cache:
 *   expansion_factor: 1.75
 *   recency_window_ms: 60000
 *   hard_capacity: 4000
 *   soft_capacity: 3000
 *   per_record_kb: 1.8
 *   memory_warning_mb: 8
 *   memory_critical_mb: 10
 *   max_visible_markers: 100
 *   cleanup_debounce_ms: 1000
 *   periodic_cleanup_interval_ms: 30000
 *   spatial_criterion: bounds
 *   priority_weights:
 *     generation: 0.25
 * </pre>
 *
 * The object is immutable and validated on construction. A bad value is a
 * host mis-configuration, so construction fails with every problem listed
 * instead of letting the engine produce a nonsensical partition.
 */
public final class CacheConfig {
    private static final Logger logger = LoggerFactory.getLogger(CacheConfig.class);

    public static final double DEFAULT_EXPANSION_FACTOR = 1.75;
    public static final long DEFAULT_RECENCY_WINDOW_MS = 60_000;
    public static final int DEFAULT_HARD_CAPACITY = 4000;
    public static final int DEFAULT_SOFT_CAPACITY = 3000;
    public static final double DEFAULT_PER_RECORD_KB = 1.8;
    public static final double DEFAULT_MEMORY_WARNING_MB = 8;
    public static final double DEFAULT_MEMORY_CRITICAL_MB = 10;
    public static final int DEFAULT_MAX_VISIBLE_MARKERS = 100;
    public static final long DEFAULT_CLEANUP_DEBOUNCE_MS = 1000;
    public static final long DEFAULT_PERIODIC_CLEANUP_INTERVAL_MS = 30_000;

    private static final String ROOT_ELEMENT = "cache";

    private final double expansionFactor;
    private final long recencyWindowMs;
    private final int hardCapacity;
    private final int softCapacity;
    private final double perRecordKB;
    private final double memoryWarningMB;
    private final double memoryCriticalMB;
    private final int maxVisibleMarkers;
    private final long cleanupDebounceMs;
    private final long periodicCleanupIntervalMs;
    private final SpatialCriterion spatialCriterion;
    private final PriorityWeights priorityWeights;

    @JsonCreator
    public CacheConfig(
            @JsonProperty("expansion_factor") Double expansionFactor,
            @JsonProperty("recency_window_ms") Long recencyWindowMs,
            @JsonProperty("hard_capacity") Integer hardCapacity,
            @JsonProperty("soft_capacity") Integer softCapacity,
            @JsonProperty("per_record_kb") Double perRecordKB,
            @JsonProperty("memory_warning_mb") Double memoryWarningMB,
            @JsonProperty("memory_critical_mb") Double memoryCriticalMB,
            @JsonProperty("max_visible_markers") Integer maxVisibleMarkers,
            @JsonProperty("cleanup_debounce_ms") Long cleanupDebounceMs,
            @JsonProperty("periodic_cleanup_interval_ms") Long periodicCleanupIntervalMs,
            @JsonProperty("spatial_criterion") SpatialCriterion spatialCriterion,
            @JsonProperty("priority_weights") PriorityWeights priorityWeights) {

        this.expansionFactor = expansionFactor != null ? expansionFactor : DEFAULT_EXPANSION_FACTOR;
        this.recencyWindowMs = recencyWindowMs != null ? recencyWindowMs : DEFAULT_RECENCY_WINDOW_MS;
        this.hardCapacity = hardCapacity != null ? hardCapacity : DEFAULT_HARD_CAPACITY;
        this.softCapacity = softCapacity != null ? softCapacity : DEFAULT_SOFT_CAPACITY;
        this.perRecordKB = perRecordKB != null ? perRecordKB : DEFAULT_PER_RECORD_KB;
        this.memoryWarningMB = memoryWarningMB != null ? memoryWarningMB : DEFAULT_MEMORY_WARNING_MB;
        this.memoryCriticalMB = memoryCriticalMB != null ? memoryCriticalMB : DEFAULT_MEMORY_CRITICAL_MB;
        this.maxVisibleMarkers = maxVisibleMarkers != null ? maxVisibleMarkers : DEFAULT_MAX_VISIBLE_MARKERS;
        this.cleanupDebounceMs = cleanupDebounceMs != null ? cleanupDebounceMs : DEFAULT_CLEANUP_DEBOUNCE_MS;
        this.periodicCleanupIntervalMs = periodicCleanupIntervalMs != null
                ? periodicCleanupIntervalMs : DEFAULT_PERIODIC_CLEANUP_INTERVAL_MS;
        this.spatialCriterion = spatialCriterion != null ? spatialCriterion : SpatialCriterion.BOUNDS;
        this.priorityWeights = priorityWeights != null ? priorityWeights : PriorityWeights.defaults();

        validate();
    }

    /**
     * @return configuration with every value at its default
     */
    public static CacheConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Load configuration from a YAML file on the file system.
     *
     * @param configPath Path to YAML configuration file
     * @return Loaded and validated CacheConfig
     * @throws IOException              if file cannot be read
     * @throws IllegalArgumentException if configuration is invalid
     */
    public static CacheConfig load(String configPath) throws IOException {
        logger.info("Loading cache configuration from file: {}", configPath);

        File configFile = new File(configPath);
        if (!configFile.exists()) {
            throw new IOException("Configuration file not found: " + configPath);
        }
        if (!configFile.canRead()) {
            throw new IOException("Cannot read configuration file: " + configPath);
        }

        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        Map<String, Object> wrapper = mapper.readValue(configFile, Map.class);
        CacheConfig config = fromWrapper(mapper, wrapper);

        logger.info("Successfully loaded configuration from {}", configPath);
        return config;
    }

    /**
     * Load configuration from a classpath resource.
     *
     * @param resourcePath Path to resource (e.g., "spatial-cache.yaml")
     * @return Loaded and validated CacheConfig
     * @throws IOException              if resource cannot be read
     * @throws IllegalArgumentException if configuration is invalid
     */
    public static CacheConfig loadFromClasspath(String resourcePath) throws IOException {
        logger.info("Loading cache configuration from classpath: {}", resourcePath);

        try (InputStream inputStream = CacheConfig.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Configuration resource not found in classpath: " + resourcePath);
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            Map<String, Object> wrapper = mapper.readValue(inputStream, Map.class);
            CacheConfig config = fromWrapper(mapper, wrapper);

            logger.info("Successfully loaded configuration from classpath resource");
            return config;
        }
    }

    private static CacheConfig fromWrapper(ObjectMapper mapper, Map<String, Object> wrapper) {
        if (wrapper == null || !wrapper.containsKey(ROOT_ELEMENT)) {
            throw new IllegalArgumentException("Configuration must contain '" + ROOT_ELEMENT + "' root element");
        }
        Object cacheData = wrapper.get(ROOT_ELEMENT);
        if (cacheData == null) {
            return defaults();
        }
        try {
            return mapper.convertValue(cacheData, CacheConfig.class);
        } catch (IllegalArgumentException e) {
            // convertValue wraps constructor failures; surface our own message when there is one
            Throwable cause = e;
            while (cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof IllegalArgumentException && cause != e) {
                throw (IllegalArgumentException) cause;
            }
            throw e;
        }
    }

    /**
     * Checks:
     * - capacities positive, soft not above hard
     * - expansion factor positive, recency window not negative
     * - memory constants not negative, warning not above critical
     * - scheduling intervals and marker budget positive
     * - priority weights usable
     *
     * @throws IllegalArgumentException if validation fails
     */
    private void validate() {
        List<String> errors = new ArrayList<>();

        if (hardCapacity <= 0) {
            errors.add("Hard capacity must be positive, got: " + hardCapacity);
        }
        if (softCapacity <= 0) {
            errors.add("Soft capacity must be positive, got: " + softCapacity);
        }
        if (softCapacity > hardCapacity) {
            errors.add("Soft capacity (" + softCapacity + ") must not exceed hard capacity (" + hardCapacity + ")");
        }

        if (!(expansionFactor > 0)) {
            errors.add("Expansion factor must be positive, got: " + expansionFactor);
        } else if (expansionFactor < 1.0) {
            logger.warn("Expansion factor {} shrinks the cache zone below the visible viewport", expansionFactor);
        }
        if (recencyWindowMs < 0) {
            errors.add("Recency window must not be negative, got: " + recencyWindowMs);
        }

        if (!(perRecordKB >= 0)) {
            errors.add("Per-record KB must not be negative, got: " + perRecordKB);
        }
        if (!(memoryWarningMB >= 0) || !(memoryCriticalMB >= 0)) {
            errors.add("Memory thresholds must not be negative, got warning=" + memoryWarningMB
                    + ", critical=" + memoryCriticalMB);
        } else if (memoryWarningMB > memoryCriticalMB) {
            errors.add("Memory warning threshold (" + memoryWarningMB
                    + "MB) must not exceed critical threshold (" + memoryCriticalMB + "MB)");
        }

        if (maxVisibleMarkers <= 0) {
            errors.add("Max visible markers must be positive, got: " + maxVisibleMarkers);
        }
        if (cleanupDebounceMs <= 0) {
            errors.add("Cleanup debounce must be positive, got: " + cleanupDebounceMs);
        }
        if (periodicCleanupIntervalMs <= 0) {
            errors.add("Periodic cleanup interval must be positive, got: " + periodicCleanupIntervalMs);
        }

        priorityWeights.validateInto(errors);

        if (!errors.isEmpty()) {
            String errorMessage = "Cache configuration validation failed:\n" +
                    errors.stream()
                            .map(e -> "  - " + e)
                            .collect(Collectors.joining("\n"));
            throw new IllegalArgumentException(errorMessage);
        }

        logger.debug("Cache configuration validation passed");
    }

    public double getExpansionFactor() {
        return expansionFactor;
    }

    public long getRecencyWindowMs() {
        return recencyWindowMs;
    }

    public int getHardCapacity() {
        return hardCapacity;
    }

    public int getSoftCapacity() {
        return softCapacity;
    }

    public double getPerRecordKB() {
        return perRecordKB;
    }

    public double getMemoryWarningMB() {
        return memoryWarningMB;
    }

    public double getMemoryCriticalMB() {
        return memoryCriticalMB;
    }

    public int getMaxVisibleMarkers() {
        return maxVisibleMarkers;
    }

    public long getCleanupDebounceMs() {
        return cleanupDebounceMs;
    }

    public long getPeriodicCleanupIntervalMs() {
        return periodicCleanupIntervalMs;
    }

    public SpatialCriterion getSpatialCriterion() {
        return spatialCriterion;
    }

    public PriorityWeights getPriorityWeights() {
        return priorityWeights;
    }

    @Override
    public String toString() {
        return "CacheConfig{" +
                "expansionFactor=" + expansionFactor +
                ", recencyWindowMs=" + recencyWindowMs +
                ", hardCapacity=" + hardCapacity +
                ", softCapacity=" + softCapacity +
                ", perRecordKB=" + perRecordKB +
                ", memory=" + memoryWarningMB + "/" + memoryCriticalMB + "MB" +
                ", maxVisibleMarkers=" + maxVisibleMarkers +
                ", spatialCriterion=" + spatialCriterion +
                '}';
    }

    /**
     * Programmatic construction; unset values take their defaults.
     */
    public static final class Builder {
        private Double expansionFactor;
        private Long recencyWindowMs;
        private Integer hardCapacity;
        private Integer softCapacity;
        private Double perRecordKB;
        private Double memoryWarningMB;
        private Double memoryCriticalMB;
        private Integer maxVisibleMarkers;
        private Long cleanupDebounceMs;
        private Long periodicCleanupIntervalMs;
        private SpatialCriterion spatialCriterion;
        private PriorityWeights priorityWeights;

        private Builder() {
        }

        public Builder expansionFactor(double expansionFactor) {
            this.expansionFactor = expansionFactor;
            return this;
        }

        public Builder recencyWindowMs(long recencyWindowMs) {
            this.recencyWindowMs = recencyWindowMs;
            return this;
        }

        public Builder hardCapacity(int hardCapacity) {
            this.hardCapacity = hardCapacity;
            return this;
        }

        public Builder softCapacity(int softCapacity) {
            this.softCapacity = softCapacity;
            return this;
        }

        public Builder perRecordKB(double perRecordKB) {
            this.perRecordKB = perRecordKB;
            return this;
        }

        public Builder memoryThresholdsMB(double warning, double critical) {
            this.memoryWarningMB = warning;
            this.memoryCriticalMB = critical;
            return this;
        }

        public Builder maxVisibleMarkers(int maxVisibleMarkers) {
            this.maxVisibleMarkers = maxVisibleMarkers;
            return this;
        }

        public Builder cleanupDebounceMs(long cleanupDebounceMs) {
            this.cleanupDebounceMs = cleanupDebounceMs;
            return this;
        }

        public Builder periodicCleanupIntervalMs(long periodicCleanupIntervalMs) {
            this.periodicCleanupIntervalMs = periodicCleanupIntervalMs;
            return this;
        }

        public Builder spatialCriterion(SpatialCriterion spatialCriterion) {
            this.spatialCriterion = spatialCriterion;
            return this;
        }

        public Builder priorityWeights(PriorityWeights priorityWeights) {
            this.priorityWeights = priorityWeights;
            return this;
        }

        public CacheConfig build() {
            return new CacheConfig(expansionFactor, recencyWindowMs, hardCapacity, softCapacity,
                    perRecordKB, memoryWarningMB, memoryCriticalMB, maxVisibleMarkers,
                    cleanupDebounceMs, periodicCleanupIntervalMs, spatialCriterion, priorityWeights);
        }
    }
}
