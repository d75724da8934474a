package org.Aayush.facility.index;

import lombok.Builder;
import lombok.Value;
import org.Aayush.facility.geo.GeoPosition;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Radius query payload.
 *
 * <p>Matches every record within {@code radiusMeters} of {@code center} (inclusive)
 * whose raw type tag is in {@code typeFilter}, when one is given.</p>
 */
@Value
@Builder
public class RadiusQuery {
    /** Radius applied by callers that do not choose one, in meters. */
    public static final double DEFAULT_RADIUS_METERS = 2_000.0d;

    /** Query center. */
    GeoPosition center;
    /** Inclusive radius in meters; must be finite and {@code > 0}. */
    double radiusMeters;
    /**
     * Raw type tags to keep, as an unmodifiable copy taken when the query is built.
     * Null means no type filtering; an empty set is rejected.
     */
    Set<String> typeFilter;
    /** Maximum number of matches to return, nearest first; null means unlimited. */
    Integer limit;

    public static RadiusQuery of(GeoPosition center, double radiusMeters) {
        return RadiusQuery.builder()
                .center(center)
                .radiusMeters(radiusMeters)
                .build();
    }

    public static class RadiusQueryBuilder {
        /**
         * Copies the tags so later changes to the caller's set cannot affect the query.
         * Null elements are kept and rejected by the index.
         */
        public RadiusQueryBuilder typeFilter(Set<String> typeFilter) {
            this.typeFilter = typeFilter == null
                    ? null
                    : Collections.unmodifiableSet(new LinkedHashSet<>(typeFilter));
            return this;
        }
    }
}
