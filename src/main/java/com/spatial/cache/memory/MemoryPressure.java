package com.spatial.cache.memory;

/**
 * Coarse classification of the estimated cache footprint.
 */
public enum MemoryPressure {
    NORMAL,
    WARNING,
    CRITICAL
}
