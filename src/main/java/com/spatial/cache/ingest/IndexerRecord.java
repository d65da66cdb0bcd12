package com.spatial.cache.ingest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.spatial.cache.model.GeoPosition;
import com.spatial.cache.model.GeoRecord;
import com.spatial.cache.model.SpatialKeys;

/**
 * One record as returned by the indexer.
 *
 * The indexer reports decimal degrees and counters either as JSON numbers or
 * as numeric strings; both bind here. Fields the cache has no use for
 * (owner, tree, transaction data, ...) are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IndexerRecord {
    private final String id;
    private final Double latitude;
    private final Double longitude;
    private final Double elevation;
    private final String h3r6;
    private final String h3r8;
    private final String h3r10;
    private final String h3r12;
    private final Integer generation;
    private final Integer refCount;
    private final String message;
    private final Long createdAt;

    @JsonCreator
    public IndexerRecord(
            @JsonProperty("id") String id,
            @JsonProperty("latitude") Double latitude,
            @JsonProperty("longitude") Double longitude,
            @JsonProperty("elevation") Double elevation,
            @JsonProperty("h3r6") String h3r6,
            @JsonProperty("h3r8") String h3r8,
            @JsonProperty("h3r10") String h3r10,
            @JsonProperty("h3r12") String h3r12,
            @JsonProperty("generation") Integer generation,
            @JsonProperty("refCount") Integer refCount,
            @JsonProperty("message") String message,
            @JsonProperty("createdAt") Long createdAt) {
        this.id = id;
        this.latitude = latitude;
        this.longitude = longitude;
        this.elevation = elevation;
        this.h3r6 = h3r6;
        this.h3r8 = h3r8;
        this.h3r10 = h3r10;
        this.h3r12 = h3r12;
        this.generation = generation;
        this.refCount = refCount;
        this.message = message;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    /**
     * Convert to the cached form. Missing counters become 0; a record without
     * both coordinates gets no position and so never matches a cache zone.
     *
     * @throws IllegalArgumentException if the id is missing
     */
    public GeoRecord toGeoRecord() {
        GeoRecord.Builder builder = GeoRecord.builder(id)
                .generation(generation != null ? generation : 0)
                .referenceCount(refCount != null ? refCount : 0)
                .content(message)
                .createdAt(createdAt != null ? createdAt : 0L);

        if (latitude != null && longitude != null) {
            builder.position(GeoPosition.ofDegrees(latitude, longitude, elevation != null ? elevation : 0.0));
        }
        if (h3r6 != null || h3r8 != null || h3r10 != null || h3r12 != null) {
            builder.spatialKeys(new SpatialKeys(h3r6, h3r8, h3r10, h3r12));
        }
        return builder.build();
    }
}
