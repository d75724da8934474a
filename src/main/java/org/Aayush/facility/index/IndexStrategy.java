package org.Aayush.facility.index;

/**
 * Candidate selection strategy behind {@link SpatialFacilityIndex}.
 *
 * <p>{@code GRID} prunes radius queries with a two-level latitude/longitude cell grid.</p>
 * <p>{@code LINEAR_SCAN} examines every record; it is the baseline correctness reference.</p>
 */
public enum IndexStrategy {
    GRID,
    LINEAR_SCAN
}
