package org.Aayush.facility.index;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.Aayush.facility.geo.GeoBounds;
import org.Aayush.facility.geo.GeoPosition;
import org.Aayush.facility.testutil.FacilityFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Grid Cell Scheme Tests")
class GridCellSchemeTest {

    @Test
    @DisplayName("Cell size outside the supported range is rejected")
    void testCellSizeValidation() {
        assertThrows(IllegalArgumentException.class, () -> new GridCellScheme(0.0));
        assertThrows(IllegalArgumentException.class, () -> new GridCellScheme(0.0001));
        assertThrows(IllegalArgumentException.class, () -> new GridCellScheme(91.0));
        assertThrows(IllegalArgumentException.class, () -> new GridCellScheme(Double.NaN));
        assertDoesNotThrow(() -> new GridCellScheme(90.0));
    }

    @Test
    @DisplayName("Longitude columns shrink toward the poles")
    void testColumnsShrinkWithLatitude() {
        GridCellScheme scheme = new GridCellScheme(1.0);
        assertEquals(180, scheme.bandCount());
        int equator = scheme.columnCount(scheme.bandOf(0.5));
        int vienna = scheme.columnCount(scheme.bandOf(48.2));
        int polar = scheme.columnCount(scheme.bandOf(89.5));
        assertEquals(360, equator);
        assertTrue(vienna < equator && vienna > 200, "columns at 48N: " + vienna);
        assertTrue(polar >= 1 && polar < vienna);
    }

    @Test
    @DisplayName("Domain edges map to valid cells")
    void testDomainEdges() {
        GridCellScheme scheme = new GridCellScheme(0.01);
        long north = scheme.cellOf(GeoPosition.of(89.999999, 180.0));
        assertEquals(scheme.bandCount() - 1, GridCellScheme.bandOfKey(north));
        assertEquals(scheme.columnCount(scheme.bandCount() - 1) - 1, GridCellScheme.columnOfKey(north));
        assertEquals(scheme.bandCount() - 1, GridCellScheme.bandOfKey(scheme.cellOf(GeoPosition.of(90.0, 0.0))));

        long south = scheme.cellOf(GeoPosition.of(-89.999999, -179.999999));
        assertEquals(0, GridCellScheme.bandOfKey(south));
        assertEquals(0, GridCellScheme.columnOfKey(south));

        assertEquals(scheme.cellOf(GeoPosition.of(0.0, 180.0)), scheme.cellOf(GeoPosition.of(0.0, -180.0)));
        assertEquals(scheme.cellOf(GeoPosition.of(-90.0, 12.0)), scheme.cellOf(GeoPosition.of(-90.0, -150.0)));
    }

    @Test
    @DisplayName("Key packing round-trips band and column")
    void testKeyPacking() {
        long key = GridCellScheme.key(17_999, 35_999);
        assertEquals(17_999, GridCellScheme.bandOfKey(key));
        assertEquals(35_999, GridCellScheme.columnOfKey(key));
    }

    @Test
    @DisplayName("Covering cells include the cell of every point inside the window")
    void testCoveringCellsAreComplete() {
        GridCellScheme scheme = new GridCellScheme(0.05);
        Random random = new Random(99);
        for (int i = 0; i < 500; i++) {
            GeoPosition center = GeoPosition.of(-89.0 + random.nextDouble() * 178.0, -180.0 + random.nextDouble() * 360.0);
            double radius = 10.0 + random.nextDouble() * 40_000.0;
            GeoBounds bounds = GeoBounds.around(center, radius);

            LongArrayList covering = new LongArrayList();
            scheme.collectCoveringCells(bounds, covering);
            assertEquals(covering.size(), scheme.coveringCellCount(bounds));
            LongOpenHashSet coveringSet = new LongOpenHashSet(covering);

            for (int k = 0; k < 20; k++) {
                GeoPosition p = FacilityFixtures.destination(center, random.nextDouble() * 360.0, radius * random.nextDouble());
                if (center.distanceTo(p) <= radius) {
                    assertTrue(coveringSet.contains(scheme.cellOf(p)),
                            "cell of " + p + " missing for window " + bounds);
                }
            }
        }
    }

    @Test
    @DisplayName("Antimeridian window covers both edge columns of a band")
    void testAntimeridianCovering() {
        GridCellScheme scheme = new GridCellScheme(0.1);
        GeoBounds bounds = GeoBounds.around(GeoPosition.of(10.0, -179.99), 5_000.0);
        assertTrue(bounds.wrapsAntimeridian());

        LongArrayList covering = new LongArrayList();
        scheme.collectCoveringCells(bounds, covering);
        LongOpenHashSet coveringSet = new LongOpenHashSet(covering);
        assertTrue(coveringSet.contains(scheme.cellOf(GeoPosition.of(10.0, 179.99))));
        assertTrue(coveringSet.contains(scheme.cellOf(GeoPosition.of(10.0, -179.99))));
        assertTrue(covering.size() < 20, "wrap should not expand to the whole band: " + covering.size());
    }
}
