package org.Aayush.facility.index;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Creates empty stores for a configured strategy.
 */
@UtilityClass
class FacilityStoreFactory {

    /**
     * Validates config-level constraints and returns the shared cell scheme, or null for
     * strategies without cells.
     */
    static GridCellScheme schemeFor(FacilityIndexConfig config) {
        Objects.requireNonNull(config, "config");
        IndexStrategy strategy = Objects.requireNonNull(config.getStrategy(), "config.strategy");
        return switch (strategy) {
            case GRID -> new GridCellScheme(config.getCellSizeDegrees());
            case LINEAR_SCAN -> null;
        };
    }

    static FacilityStore create(IndexStrategy strategy, GridCellScheme scheme, int expectedSize) {
        return switch (strategy) {
            case GRID -> new GridFacilityStore(Objects.requireNonNull(scheme, "scheme"), expectedSize);
            case LINEAR_SCAN -> new LinearScanFacilityStore(expectedSize);
        };
    }
}
