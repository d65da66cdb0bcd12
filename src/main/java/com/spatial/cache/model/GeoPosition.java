package com.spatial.cache.model;

import java.util.Objects;

/**
 * GeoPosition is a fixed-point latitude/longitude/elevation triple.
 *
 * Coordinates are stored as integers scaled by 10^6 (degrees) and elevation
 * by 10^4 (metres), so repeated conversions never drift at country scale.
 * Ranges are not validated here: out-of-range values simply fall outside
 * any cache zone. Values too large for the fixed-point range (and NaN)
 * saturate to {@link Integer#MAX_VALUE} or {@link Integer#MIN_VALUE}
 * rather than wrapping back onto the globe.
 */
public final class GeoPosition {
    public static final int COORDINATE_SCALE = 1_000_000;
    public static final int ELEVATION_SCALE = 10_000;

    private final int latitudeE6;
    private final int longitudeE6;
    private final int elevationE4;

    public GeoPosition(int latitudeE6, int longitudeE6, int elevationE4) {
        this.latitudeE6 = latitudeE6;
        this.longitudeE6 = longitudeE6;
        this.elevationE4 = elevationE4;
    }

    /**
     * Build a position from decimal degrees and metres, rounding to the nearest fixed-point unit.
     */
    public static GeoPosition ofDegrees(double latitude, double longitude, double elevationMeters) {
        return new GeoPosition(
                toFixed(latitude, COORDINATE_SCALE),
                toFixed(longitude, COORDINATE_SCALE),
                toFixed(elevationMeters, ELEVATION_SCALE));
    }

    private static int toFixed(double value, int scale) {
        if (Double.isNaN(value)) {
            return Integer.MAX_VALUE;
        }
        long scaled = Math.round(value * scale);
        if (scaled > Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        if (scaled < Integer.MIN_VALUE) {
            return Integer.MIN_VALUE;
        }
        return (int) scaled;
    }

    public static GeoPosition ofDegrees(double latitude, double longitude) {
        return ofDegrees(latitude, longitude, 0.0);
    }

    public int getLatitudeE6() {
        return latitudeE6;
    }

    public int getLongitudeE6() {
        return longitudeE6;
    }

    public int getElevationE4() {
        return elevationE4;
    }

    public double getLatitude() {
        return (double) latitudeE6 / COORDINATE_SCALE;
    }

    public double getLongitude() {
        return (double) longitudeE6 / COORDINATE_SCALE;
    }

    public double getElevationMeters() {
        return (double) elevationE4 / ELEVATION_SCALE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GeoPosition that = (GeoPosition) o;
        return latitudeE6 == that.latitudeE6
                && longitudeE6 == that.longitudeE6
                && elevationE4 == that.elevationE4;
    }

    @Override
    public int hashCode() {
        return Objects.hash(latitudeE6, longitudeE6, elevationE4);
    }

    @Override
    public String toString() {
        return String.format("GeoPosition{lat=%.6f, lon=%.6f, elev=%.4fm}",
                getLatitude(), getLongitude(), getElevationMeters());
    }
}
