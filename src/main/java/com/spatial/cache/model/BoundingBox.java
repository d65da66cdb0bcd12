package com.spatial.cache.model;

import java.util.Objects;

/**
 * Axis-aligned box in degrees: (west, south, east, north).
 *
 * No projection correction and no antimeridian wrapping; a box whose east
 * edge is west of its west edge simply contains nothing.
 */
public final class BoundingBox {
    private final double west;
    private final double south;
    private final double east;
    private final double north;

    public BoundingBox(double west, double south, double east, double north) {
        this.west = west;
        this.south = south;
        this.east = east;
        this.north = north;
    }

    /**
     * Zero-area box located at a single point.
     */
    public static BoundingBox point(double longitude, double latitude) {
        return new BoundingBox(longitude, latitude, longitude, latitude);
    }

    public double getWest() {
        return west;
    }

    public double getSouth() {
        return south;
    }

    public double getEast() {
        return east;
    }

    public double getNorth() {
        return north;
    }

    public double getWidth() {
        return east - west;
    }

    public double getHeight() {
        return north - south;
    }

    public double getCenterLongitude() {
        return (west + east) / 2.0;
    }

    public double getCenterLatitude() {
        return (south + north) / 2.0;
    }

    /**
     * A box is degenerate when it has no positive width or height (or carries NaN).
     */
    public boolean isDegenerate() {
        return !(getWidth() > 0.0) || !(getHeight() > 0.0);
    }

    /**
     * Inclusive containment test. Degenerate boxes contain nothing.
     */
    public boolean contains(double latitude, double longitude) {
        if (isDegenerate()) {
            return false;
        }
        return longitude >= west && longitude <= east
                && latitude >= south && latitude <= north;
    }

    public boolean contains(GeoPosition position) {
        return position != null && contains(position.getLatitude(), position.getLongitude());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BoundingBox that = (BoundingBox) o;
        return Double.compare(west, that.west) == 0
                && Double.compare(south, that.south) == 0
                && Double.compare(east, that.east) == 0
                && Double.compare(north, that.north) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(west, south, east, north);
    }

    @Override
    public String toString() {
        return "BoundingBox{" + west + ", " + south + ", " + east + ", " + north + '}';
    }
}
