package com.spatial.cache.model;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * The cells currently tracked by the host at each of the four resolutions
 * (usually the cells covering the viewport).
 */
public final class SpatialKeySet {
    private static final SpatialKeySet EMPTY = new SpatialKeySet(
            Collections.emptySet(), Collections.emptySet(), Collections.emptySet(), Collections.emptySet());

    private final Set<String> r6;
    private final Set<String> r8;
    private final Set<String> r10;
    private final Set<String> r12;

    private SpatialKeySet(Set<String> r6, Set<String> r8, Set<String> r10, Set<String> r12) {
        this.r6 = r6;
        this.r8 = r8;
        this.r10 = r10;
        this.r12 = r12;
    }

    public static SpatialKeySet of(Collection<String> r6, Collection<String> r8,
                                   Collection<String> r10, Collection<String> r12) {
        return new SpatialKeySet(copy(r6), copy(r8), copy(r10), copy(r12));
    }

    public static SpatialKeySet empty() {
        return EMPTY;
    }

    private static Set<String> copy(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> set = new HashSet<>(keys);
        set.remove(null);
        return Collections.unmodifiableSet(set);
    }

    public Set<String> getR6() {
        return r6;
    }

    public Set<String> getR8() {
        return r8;
    }

    public Set<String> getR10() {
        return r10;
    }

    public Set<String> getR12() {
        return r12;
    }

    public boolean isEmpty() {
        return r6.isEmpty() && r8.isEmpty() && r10.isEmpty() && r12.isEmpty();
    }

    /**
     * @return true if any of the record's keys is tracked at the same resolution
     */
    public boolean overlaps(SpatialKeys keys) {
        if (keys == null) {
            return false;
        }
        return contains(r6, keys.getR6())
                || contains(r8, keys.getR8())
                || contains(r10, keys.getR10())
                || contains(r12, keys.getR12());
    }

    private static boolean contains(Set<String> set, String key) {
        return key != null && set.contains(key);
    }

    /**
     * Average Jaccard overlap across the four resolutions, in [0, 1].
     * A resolution where both sides are empty contributes 0.
     */
    public double overlapRatio(SpatialKeySet other) {
        if (other == null) {
            return 0.0;
        }
        return (jaccard(r6, other.r6) + jaccard(r8, other.r8)
                + jaccard(r10, other.r10) + jaccard(r12, other.r12)) / 4.0;
    }

    private static double jaccard(Set<String> a, Set<String> b) {
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        for (String key : a) {
            if (b.contains(key)) {
                intersection++;
            }
        }
        return (double) intersection / union.size();
    }

    @Override
    public String toString() {
        return "SpatialKeySet{r6=" + r6.size() + ", r8=" + r8.size()
                + ", r10=" + r10.size() + ", r12=" + r12.size() + '}';
    }
}
