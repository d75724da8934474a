package org.Aayush.facility.index;

import org.Aayush.facility.geo.GeoBounds;
import org.Aayush.facility.model.FacilityRecord;

import java.util.List;
import java.util.function.Consumer;

/**
 * Mutable record storage behind {@link SpatialFacilityIndex}.
 * <p>
 * Implementations are not thread-safe; the owning index serializes writers and
 * excludes them from readers.
 * </p>
 */
interface FacilityStore {

    IndexStrategy strategy();

    int size();

    /**
     * @return the record with this id, or null when absent.
     */
    FacilityRecord get(long id);

    /**
     * Inserts or replaces by id. A replaced record keeps its insertion position.
     *
     * @return the previous record, or null for a new id.
     */
    FacilityRecord put(FacilityRecord record);

    /**
     * @return the removed record, or null when the id was absent.
     */
    FacilityRecord remove(long id);

    /**
     * @return all records in insertion order, as a fresh list.
     */
    List<FacilityRecord> records();

    /**
     * Feeds every record that may lie inside the window to the consumer. The consumer
     * applies the exact predicate; false positives are allowed, false negatives are not.
     *
     * @return number of grid cells visited; {@code 0} for stores without cells.
     */
    int forEachCandidate(GeoBounds bounds, Consumer<FacilityRecord> consumer);
}
