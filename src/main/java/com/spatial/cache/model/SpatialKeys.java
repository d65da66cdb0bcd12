package com.spatial.cache.model;

import java.util.Objects;

/**
 * Identifiers of the cells containing a record at four nested resolutions,
 * coarse (r6) to fine (r12). Any of them may be null when the indexer did not
 * supply it.
 */
public final class SpatialKeys {
    private final String r6;
    private final String r8;
    private final String r10;
    private final String r12;

    public SpatialKeys(String r6, String r8, String r10, String r12) {
        this.r6 = r6;
        this.r8 = r8;
        this.r10 = r10;
        this.r12 = r12;
    }

    public String getR6() {
        return r6;
    }

    public String getR8() {
        return r8;
    }

    public String getR10() {
        return r10;
    }

    public String getR12() {
        return r12;
    }

    /**
     * @return true if no resolution carries a key
     */
    public boolean isEmpty() {
        return r6 == null && r8 == null && r10 == null && r12 == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SpatialKeys that = (SpatialKeys) o;
        return Objects.equals(r6, that.r6)
                && Objects.equals(r8, that.r8)
                && Objects.equals(r10, that.r10)
                && Objects.equals(r12, that.r12);
    }

    @Override
    public int hashCode() {
        return Objects.hash(r6, r8, r10, r12);
    }

    @Override
    public String toString() {
        return "SpatialKeys{r6=" + r6 + ", r8=" + r8 + ", r10=" + r10 + ", r12=" + r12 + '}';
    }
}
