package org.Aayush.facility.index;

import org.Aayush.facility.geo.GeoPosition;
import org.Aayush.facility.model.FacilityRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * In-process spatial index of point-located facilities.
 *
 * <p>Implementations are safe for concurrent use: reads run in parallel with each
 * other, writes are serialized, and every read observes a state produced by a
 * complete sequence of writes.</p>
 */
public interface FacilityIndex {

    /**
     * Replaces the entire content with the given records, atomically.
     *
     * @param records replacement records; ids must be unique within the batch.
     * @throws ValidationException when any record is malformed; the index is unchanged.
     */
    void load(Collection<FacilityRecord> records);

    /**
     * Inserts a record or replaces the record with the same id.
     *
     * @throws ValidationException when the record is malformed; the index is unchanged.
     */
    void upsert(FacilityRecord record);

    /**
     * Removes a record.
     *
     * @return true when a record was removed.
     */
    boolean delete(long id);

    /**
     * Returns every live record in insertion order. The list is an immutable copy.
     */
    List<FacilityRecord> listAll();

    /**
     * Looks up one record by id.
     */
    Optional<FacilityRecord> get(long id);

    /**
     * @return number of live records.
     */
    int size();

    /**
     * Returns every matching record ordered by ascending distance, then ascending id.
     *
     * @throws InvalidArgumentException when query arguments are malformed.
     */
    List<FacilityMatch> queryRadius(RadiusQuery query);

    /**
     * Convenience form of {@link #queryRadius(RadiusQuery)} without a result limit.
     *
     * @param center query center.
     * @param radiusMeters inclusive radius; must be {@code > 0}.
     * @param typeFilter raw type tags to keep, or null for all types.
     */
    default List<FacilityMatch> queryRadius(GeoPosition center, double radiusMeters, Set<String> typeFilter) {
        return queryRadius(RadiusQuery.builder()
                .center(center)
                .radiusMeters(radiusMeters)
                .typeFilter(typeFilter)
                .build());
    }
}
