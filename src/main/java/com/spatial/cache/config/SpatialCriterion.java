package com.spatial.cache.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Which spatial test decides the first eligibility condition.
 */
public enum SpatialCriterion {
    /** Record position inside the padded cache zone. */
    @JsonProperty("bounds")
    BOUNDS,

    /** Any of the record's spatial keys tracked by the caller at the same resolution. */
    @JsonProperty("spatial_keys")
    SPATIAL_KEYS
}
