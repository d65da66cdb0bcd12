package com.spatial.cache.zone;

import com.spatial.cache.model.BoundingBox;
import com.spatial.cache.model.Viewport;

/**
 * Derives the retention region (cache zone) from the current viewport.
 *
 * The zone keeps the viewport's center and scales its width and height by
 * the expansion factor, so a short pan does not evict records that are about
 * to come into view. Degrees are treated as planar; no projection correction.
 */
public final class CacheZoneCalculator {

    private CacheZoneCalculator() {
    }

    /**
     * Compute the padded cache zone.
     *
     * @param viewport        current view state; null yields null
     * @param expansionFactor multiplier applied to width and height
     * @return the zone, a zero-area box at the center for a degenerate viewport
     */
    public static BoundingBox computeCacheZone(Viewport viewport, double expansionFactor) {
        if (viewport == null) {
            return null;
        }
        return expand(viewport.getBounds(), expansionFactor);
    }

    /**
     * Scale a box around its own midpoint.
     */
    public static BoundingBox expand(BoundingBox bounds, double expansionFactor) {
        double centerLon = bounds.getCenterLongitude();
        double centerLat = bounds.getCenterLatitude();

        if (bounds.isDegenerate() || !(expansionFactor > 0)) {
            return BoundingBox.point(centerLon, centerLat);
        }

        double deltaLon = bounds.getWidth() * expansionFactor / 2.0;
        double deltaLat = bounds.getHeight() * expansionFactor / 2.0;

        return new BoundingBox(
                centerLon - deltaLon,
                centerLat - deltaLat,
                centerLon + deltaLon,
                centerLat + deltaLat);
    }
}
