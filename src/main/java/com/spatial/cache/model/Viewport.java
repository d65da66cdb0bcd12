package com.spatial.cache.model;

import java.util.Objects;

/**
 * The caller's current view state. Read-only to the cache.
 *
 * The cache zone is centred on the midpoint of {@code bounds}; {@code center}
 * is carried as reported by the view controller.
 */
public final class Viewport {
    private final double centerLongitude;
    private final double centerLatitude;
    private final double zoom;
    private final BoundingBox bounds;

    public Viewport(double centerLongitude, double centerLatitude, double zoom, BoundingBox bounds) {
        this.centerLongitude = centerLongitude;
        this.centerLatitude = centerLatitude;
        this.zoom = zoom;
        this.bounds = Objects.requireNonNull(bounds, "bounds");
    }

    /**
     * Viewport whose center is the midpoint of the given bounds.
     */
    public static Viewport ofBounds(double west, double south, double east, double north, double zoom) {
        BoundingBox bounds = new BoundingBox(west, south, east, north);
        return new Viewport(bounds.getCenterLongitude(), bounds.getCenterLatitude(), zoom, bounds);
    }

    public double getCenterLongitude() {
        return centerLongitude;
    }

    public double getCenterLatitude() {
        return centerLatitude;
    }

    public double getZoom() {
        return zoom;
    }

    public BoundingBox getBounds() {
        return bounds;
    }

    @Override
    public String toString() {
        return String.format("Viewport{center=(%.5f, %.5f), zoom=%.2f, bounds=%s}",
                centerLongitude, centerLatitude, zoom, bounds);
    }
}
