package com.spatial.cache.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BoundingBoxTest {

    private final BoundingBox box = new BoundingBox(139.0, 35.0, 140.0, 36.0);

    @Test
    void testContainsIsInclusive() {
        assertTrue(box.contains(35.5, 139.5));
        assertTrue(box.contains(35.0, 139.0));
        assertTrue(box.contains(36.0, 140.0));
        assertFalse(box.contains(36.000001, 139.5));
        assertFalse(box.contains(35.5, 138.999999));
    }

    @Test
    void testContainsPosition() {
        assertTrue(box.contains(GeoPosition.ofDegrees(35.25, 139.75)));
        assertFalse(box.contains((GeoPosition) null));
    }

    @Test
    void testOversizedDegreesSaturateInsteadOfWrapping() {
        GeoPosition far = GeoPosition.ofDegrees(4329.967296, -4434.467296);

        assertEquals(Integer.MAX_VALUE, far.getLatitudeE6());
        assertEquals(Integer.MIN_VALUE, far.getLongitudeE6());
        assertEquals(Integer.MAX_VALUE, GeoPosition.ofDegrees(Double.NaN, 0.0).getLatitudeE6());
        assertFalse(box.contains(GeoPosition.ofDegrees(4329.967296, 4434.467296)));
    }

    @Test
    void testOutOfRangeCoordinatesSimplyFail() {
        assertFalse(box.contains(GeoPosition.ofDegrees(135.5, 339.5)));
        assertFalse(box.contains(Double.NaN, 139.5));
    }

    @Test
    void testInvertedBoxContainsNothing() {
        BoundingBox inverted = new BoundingBox(140.0, 35.0, 139.0, 36.0);

        assertTrue(inverted.isDegenerate());
        assertFalse(inverted.contains(35.5, 139.5));
    }

    @Test
    void testFixedPointPositionRoundTrip() {
        GeoPosition position = GeoPosition.ofDegrees(35.681236, 139.767125, 40.5);

        assertEquals(35_681_236, position.getLatitudeE6());
        assertEquals(139_767_125, position.getLongitudeE6());
        assertEquals(405_000, position.getElevationE4());
        assertEquals(35.681236, position.getLatitude(), 1e-9);
        assertEquals(40.5, position.getElevationMeters(), 1e-9);
    }
}
