package org.Aayush.facility.model;

import lombok.Builder;
import lombok.Value;
import org.Aayush.facility.geo.GeoPosition;

/**
 * One point-located facility as held by the index.
 *
 * <p>Records are immutable values. Attribute changes are applied by upserting a new
 * record under the same {@code id}. Range and presence checks are performed by the
 * index on ingest, not by the builder.</p>
 */
@Value
@Builder(toBuilder = true)
public class FacilityRecord {
    /** Stable unique key assigned at ingestion. */
    long id;
    /** WGS-84 location. */
    GeoPosition position;
    /** Raw facility type tag, used verbatim as the filter key. */
    String facilityType;
    /** Descriptive attributes carried opaquely. */
    @Builder.Default
    FacilityAttributes attributes = FacilityAttributes.EMPTY;

    /**
     * Display category derived from the raw type tag.
     */
    public FacilityType displayType() {
        return FacilityType.fromTag(facilityType);
    }

    public FacilityRecord withPosition(GeoPosition newPosition) {
        return toBuilder().position(newPosition).build();
    }

    public FacilityRecord withAttributes(FacilityAttributes newAttributes) {
        return toBuilder().attributes(newAttributes).build();
    }
}
