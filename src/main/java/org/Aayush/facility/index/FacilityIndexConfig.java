package org.Aayush.facility.index;

import lombok.Builder;
import lombok.Value;

/**
 * Construction-time configuration for {@link SpatialFacilityIndex}.
 *
 * <p>Bound once when the index is created; it cannot be changed per request.</p>
 */
@Value
@Builder
public class FacilityIndexConfig {
    /** Default grid cell edge in degrees of latitude (about 1.1 km). */
    public static final double DEFAULT_CELL_SIZE_DEGREES = 0.01d;

    /**
     * Candidate selection strategy.
     */
    @Builder.Default
    IndexStrategy strategy = IndexStrategy.GRID;

    /**
     * Latitude band height of the grid, in degrees; must be in {@code [0.001, 90]}.
     * Ignored by {@link IndexStrategy#LINEAR_SCAN}.
     */
    @Builder.Default
    double cellSizeDegrees = DEFAULT_CELL_SIZE_DEGREES;

    /**
     * Returns the default grid configuration.
     */
    public static FacilityIndexConfig defaults() {
        return FacilityIndexConfig.builder().build();
    }

    /**
     * Returns a configuration for the exhaustive scan strategy.
     */
    public static FacilityIndexConfig linearScan() {
        return FacilityIndexConfig.builder()
                .strategy(IndexStrategy.LINEAR_SCAN)
                .build();
    }
}
