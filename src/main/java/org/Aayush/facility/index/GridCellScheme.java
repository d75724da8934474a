package org.Aayush.facility.index;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.facility.geo.GeoBounds;
import org.Aayush.facility.geo.GeoPosition;

/**
 * Two-level cell layout over the WGS-84 degree domain.
 * <p>
 * Level one splits latitude into fixed bands of {@code cellSizeDegrees}. Level two splits
 * each band into longitude cells whose count shrinks with {@code cos(latitude)}, so cells
 * keep a roughly constant ground width from the equator to the poles.
 * </p>
 * <p>
 * Cell keys pack {@code band} into the high 32 bits and {@code column} into the low 32 bits.
 * Immutable and safe for concurrent readers.
 * </p>
 */
final class GridCellScheme {
    static final double MIN_CELL_SIZE_DEGREES = 0.001d;
    static final double MAX_CELL_SIZE_DEGREES = 90.0d;

    @Getter
    @Accessors(fluent = true)
    private final double cellSizeDegrees;
    private final int bandCount;
    private final int[] columnsPerBand;

    GridCellScheme(double cellSizeDegrees) {
        if (!Double.isFinite(cellSizeDegrees)
                || cellSizeDegrees < MIN_CELL_SIZE_DEGREES
                || cellSizeDegrees > MAX_CELL_SIZE_DEGREES) {
            throw new IllegalArgumentException(
                    "cellSizeDegrees must be in [" + MIN_CELL_SIZE_DEGREES + ", " + MAX_CELL_SIZE_DEGREES +
                            "], got " + cellSizeDegrees);
        }
        this.cellSizeDegrees = cellSizeDegrees;
        this.bandCount = (int) Math.ceil(180.0d / cellSizeDegrees);
        this.columnsPerBand = new int[bandCount];
        for (int band = 0; band < bandCount; band++) {
            double southEdge = GeoPosition.MIN_LATITUDE + band * cellSizeDegrees;
            double northEdge = Math.min(GeoPosition.MAX_LATITUDE, southEdge + cellSizeDegrees);
            // widest parallel of the band
            double widestLat = (southEdge <= 0.0d && northEdge >= 0.0d)
                    ? 0.0d
                    : Math.min(Math.abs(southEdge), Math.abs(northEdge));
            int columns = (int) Math.floor(360.0d * Math.cos(Math.toRadians(widestLat)) / cellSizeDegrees);
            columnsPerBand[band] = Math.max(1, columns);
        }
    }

    int bandCount() {
        return bandCount;
    }

    int columnCount(int band) {
        return columnsPerBand[band];
    }

    int bandOf(double latitude) {
        int band = (int) Math.floor((latitude - GeoPosition.MIN_LATITUDE) / cellSizeDegrees);
        if (band < 0) {
            return 0;
        }
        return Math.min(band, bandCount - 1);
    }

    int columnOf(int band, double longitude) {
        int columns = columnsPerBand[band];
        int column = (int) Math.floor((longitude - GeoPosition.MIN_LONGITUDE) * columns / 360.0d);
        if (column < 0) {
            return 0;
        }
        return Math.min(column, columns - 1);
    }

    long cellOf(GeoPosition position) {
        int band = bandOf(position.latitude());
        return key(band, columnOf(band, position.longitude()));
    }

    static long key(int band, int column) {
        return ((long) band << 32) | (column & 0xFFFF_FFFFL);
    }

    static int bandOfKey(long key) {
        return (int) (key >>> 32);
    }

    static int columnOfKey(long key) {
        return (int) key;
    }

    /**
     * Counts cells intersecting a window without materializing them.
     */
    long coveringCellCount(GeoBounds bounds) {
        long count = 0L;
        int firstBand = bandOf(bounds.minLatitude());
        int lastBand = bandOf(bounds.maxLatitude());
        for (int band = firstBand; band <= lastBand; band++) {
            count += columnSpan(band, bounds);
        }
        return count;
    }

    /**
     * Appends the keys of every cell intersecting the window.
     */
    void collectCoveringCells(GeoBounds bounds, LongArrayList out) {
        int firstBand = bandOf(bounds.minLatitude());
        int lastBand = bandOf(bounds.maxLatitude());
        for (int band = firstBand; band <= lastBand; band++) {
            int columns = columnsPerBand[band];
            if (bounds.allLongitudes()) {
                addColumns(band, 0, columns - 1, out);
                continue;
            }
            int west = columnOf(band, bounds.minLongitude());
            int east = columnOf(band, bounds.maxLongitude());
            if (!bounds.wrapsAntimeridian()) {
                addColumns(band, west, east, out);
            } else if (west <= east) {
                // both halves land in overlapping columns of a coarse band
                addColumns(band, 0, columns - 1, out);
            } else {
                addColumns(band, west, columns - 1, out);
                addColumns(band, 0, east, out);
            }
        }
    }

    private int columnSpan(int band, GeoBounds bounds) {
        int columns = columnsPerBand[band];
        if (bounds.allLongitudes()) {
            return columns;
        }
        int west = columnOf(band, bounds.minLongitude());
        int east = columnOf(band, bounds.maxLongitude());
        if (!bounds.wrapsAntimeridian()) {
            return east - west + 1;
        }
        if (west <= east) {
            return columns;
        }
        return (columns - west) + (east + 1);
    }

    private static void addColumns(int band, int fromColumn, int toColumn, LongArrayList out) {
        for (int column = fromColumn; column <= toColumn; column++) {
            out.add(key(band, column));
        }
    }

    @Override
    public String toString() {
        return "GridCellScheme[cellSizeDegrees=" + cellSizeDegrees + ", bands=" + bandCount + "]";
    }
}
