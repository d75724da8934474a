package org.Aayush.facility.index;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.Aayush.facility.model.FacilityRecord;

import java.util.Comparator;

/**
 * Immutable radius-query hit: the stored record plus its distance to the query center.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@ToString
@RequiredArgsConstructor
public final class FacilityMatch {
    /**
     * Result order: ascending distance, then ascending id.
     */
    public static final Comparator<FacilityMatch> BY_DISTANCE_THEN_ID =
            Comparator.comparingDouble(FacilityMatch::distanceMeters)
                    .thenComparingLong(FacilityMatch::id);

    private final FacilityRecord record;
    private final double distanceMeters;

    public long id() {
        return record.getId();
    }
}
