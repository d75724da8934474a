package org.Aayush.facility.geo;

import org.Aayush.facility.testutil.FacilityFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Great-Circle Distance Tests")
class GreatCircleDistanceTest {
    private static final double ONE_DEGREE_ARC_METERS =
            GreatCircleDistance.EARTH_MEAN_RADIUS_METERS * Math.PI / 180.0d;

    @Test
    @DisplayName("Known distances: one degree of arc on meridian and equator")
    void testKnownDistances() {
        assertEquals(ONE_DEGREE_ARC_METERS, GreatCircleDistance.meters(0.0, 0.0, 1.0, 0.0), 1e-6);
        assertEquals(ONE_DEGREE_ARC_METERS, GreatCircleDistance.meters(0.0, 0.0, 0.0, 1.0), 1e-6);
        assertEquals(180.0 * ONE_DEGREE_ARC_METERS, GreatCircleDistance.meters(90.0, 0.0, -90.0, 0.0), 1e-3);
    }

    @Test
    @DisplayName("Vienna fixture distances match reference values")
    void testViennaDistances() {
        GeoPosition center = FacilityFixtures.VIENNA_CENTER;
        assertEquals(1_296.2, center.distanceTo(FacilityFixtures.AKH), 0.5);
        assertEquals(1_863.2, center.distanceTo(FacilityFixtures.OTTAKRING), 0.5);
        assertEquals(9_702.9, center.distanceTo(FacilityFixtures.SMZ_OST), 0.5);
    }

    @Test
    @DisplayName("Identity: distance to self is exactly zero")
    void testZeroForSamePoint() {
        Random random = new Random(7);
        for (int i = 0; i < 1_000; i++) {
            GeoPosition p = randomPosition(random);
            assertEquals(0.0d, GreatCircleDistance.meters(p, p));
        }
    }

    @Test
    @DisplayName("Symmetry: swapping arguments yields the identical value")
    void testSymmetry() {
        Random random = new Random(11);
        for (int i = 0; i < 10_000; i++) {
            GeoPosition a = randomPosition(random);
            GeoPosition b = randomPosition(random);
            assertEquals(GreatCircleDistance.meters(a, b), GreatCircleDistance.meters(b, a));
        }
    }

    @Test
    @DisplayName("Triangle inequality holds within floating-point tolerance")
    void testTriangleInequality() {
        Random random = new Random(13);
        for (int i = 0; i < 10_000; i++) {
            GeoPosition a = randomPosition(random);
            GeoPosition b = randomPosition(random);
            GeoPosition c = randomPosition(random);
            double ab = a.distanceTo(b);
            double bc = b.distanceTo(c);
            double ac = a.distanceTo(c);
            assertTrue(ac <= ab + bc + 0.5, "d(a,c) exceeded d(a,b)+d(b,c) for " + a + " " + b + " " + c);
        }
    }

    @Test
    @DisplayName("Antimeridian: short way around is used")
    void testAntimeridianShortestPath() {
        double across = GreatCircleDistance.meters(0.0, 179.9, 0.0, -179.9);
        assertEquals(0.2 * ONE_DEGREE_ARC_METERS, across, 1e-3);
        assertEquals(0.0d, GreatCircleDistance.meters(10.0, 180.0, 10.0, -180.0), 1e-6);
    }

    @Test
    @DisplayName("Range helpers accept domain edges and reject NaN")
    void testRangeHelpers() {
        assertTrue(GeoPosition.of(90.0, 180.0).isWithinRange());
        assertTrue(GeoPosition.of(-90.0, -180.0).isWithinRange());
        assertFalse(GeoPosition.of(90.0001, 0.0).isWithinRange());
        assertFalse(GeoPosition.of(0.0, -180.0001).isWithinRange());
        assertFalse(GeoPosition.of(Double.NaN, 0.0).isLatitudeInRange());
        assertFalse(GeoPosition.of(0.0, Double.POSITIVE_INFINITY).isLongitudeInRange());
        assertEquals(GeoPosition.of(1.5, 2.5), GeoPosition.of(1.5, 2.5));
    }

    @Test
    @DisplayName("Positions with zero distance between them are equal")
    void testCanonicalPositions() {
        GeoPosition east = GeoPosition.of(0.0, 180.0);
        GeoPosition west = GeoPosition.of(0.0, -180.0);
        assertEquals(0.0d, east.distanceTo(west));
        assertEquals(east, west);
        assertEquals(east.hashCode(), west.hashCode());
        assertEquals(180.0, west.longitude());

        GeoPosition pole = GeoPosition.of(90.0, 37.0);
        assertEquals(0.0d, pole.distanceTo(GeoPosition.of(90.0, -122.0)));
        assertEquals(pole, GeoPosition.of(90.0, -122.0));
        assertEquals(GeoPosition.of(-90.0, 0.0), GeoPosition.of(-90.0, 179.0));
        assertEquals(0.0, pole.longitude());

        assertEquals(GeoPosition.of(0.0, 0.0), GeoPosition.of(-0.0, -0.0));
        assertNotEquals(GeoPosition.of(0.0, 179.999), GeoPosition.of(0.0, -179.999));
    }

    @Test
    @DisplayName("Out-of-range positions are kept verbatim for the index to reject")
    void testOutOfRangeNotNormalized() {
        assertEquals(-180.5, GeoPosition.of(0.0, -180.5).longitude());
        assertEquals(45.0, GeoPosition.of(91.0, 45.0).longitude());
        assertTrue(Double.isNaN(GeoPosition.of(Double.NaN, -180.0).latitude()));
        assertEquals(-180.0, GeoPosition.of(Double.NaN, -180.0).longitude());
    }

    private static GeoPosition randomPosition(Random random) {
        return GeoPosition.of(-90.0 + random.nextDouble() * 180.0, -180.0 + random.nextDouble() * 360.0);
    }
}
