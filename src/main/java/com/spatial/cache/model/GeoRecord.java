package com.spatial.cache.model;

import java.util.Objects;

/**
 * GeoRecord is an immutable snapshot of one spatial entity as cached client-side.
 *
 * A later snapshot with the same id replaces an earlier one in the host's table.
 * Only {@code id} is required; every other attribute is tolerated missing
 * (null position, null keys, null content).
 */
public final class GeoRecord {
    private final String id;
    private final GeoPosition position;
    private final SpatialKeys spatialKeys;
    private final int generation;
    private final int referenceCount;
    private final String content;
    private final long createdAt;

    private GeoRecord(Builder builder) {
        if (builder.id == null || builder.id.isEmpty()) {
            throw new IllegalArgumentException("Record id cannot be null or empty");
        }
        this.id = builder.id;
        this.position = builder.position;
        this.spatialKeys = builder.spatialKeys;
        this.generation = builder.generation;
        this.referenceCount = builder.referenceCount;
        this.content = builder.content;
        this.createdAt = builder.createdAt;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public GeoPosition getPosition() {
        return position;
    }

    public SpatialKeys getSpatialKeys() {
        return spatialKeys;
    }

    public int getGeneration() {
        return generation;
    }

    public int getReferenceCount() {
        return referenceCount;
    }

    public String getContent() {
        return content;
    }

    /**
     * @return true if the record carries a non-empty text payload
     */
    public boolean hasContent() {
        return content != null && !content.isEmpty();
    }

    /**
     * @return creation time in seconds since epoch
     */
    public long getCreatedAt() {
        return createdAt;
    }

    /**
     * @return a builder pre-filled with this record's attributes
     */
    public Builder toBuilder() {
        return new Builder(id)
                .position(position)
                .spatialKeys(spatialKeys)
                .generation(generation)
                .referenceCount(referenceCount)
                .content(content)
                .createdAt(createdAt);
    }

    /**
     * Records are equal when every attribute matches; two snapshots of the
     * same id with different attributes are different records.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GeoRecord that = (GeoRecord) o;
        return generation == that.generation
                && referenceCount == that.referenceCount
                && createdAt == that.createdAt
                && id.equals(that.id)
                && Objects.equals(position, that.position)
                && Objects.equals(spatialKeys, that.spatialKeys)
                && Objects.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, position, spatialKeys, generation, referenceCount, content, createdAt);
    }

    @Override
    public String toString() {
        return "GeoRecord{" +
                "id='" + id + '\'' +
                ", position=" + position +
                ", generation=" + generation +
                ", referenceCount=" + referenceCount +
                ", hasContent=" + hasContent() +
                ", createdAt=" + createdAt +
                '}';
    }

    public static final class Builder {
        private final String id;
        private GeoPosition position;
        private SpatialKeys spatialKeys;
        private int generation;
        private int referenceCount;
        private String content;
        private long createdAt;

        private Builder(String id) {
            this.id = id;
        }

        public Builder position(GeoPosition position) {
            this.position = position;
            return this;
        }

        public Builder position(double latitude, double longitude) {
            this.position = GeoPosition.ofDegrees(latitude, longitude);
            return this;
        }

        public Builder spatialKeys(SpatialKeys spatialKeys) {
            this.spatialKeys = spatialKeys;
            return this;
        }

        public Builder generation(int generation) {
            this.generation = generation;
            return this;
        }

        public Builder referenceCount(int referenceCount) {
            this.referenceCount = referenceCount;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder createdAt(long createdAtSeconds) {
            this.createdAt = createdAtSeconds;
            return this;
        }

        public GeoRecord build() {
            return new GeoRecord(this);
        }
    }
}
