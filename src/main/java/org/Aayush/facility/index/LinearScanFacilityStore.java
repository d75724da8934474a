package org.Aayush.facility.index;

import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;
import org.Aayush.facility.geo.GeoBounds;
import org.Aayush.facility.model.FacilityRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Exhaustive store: every query examines every record.
 */
final class LinearScanFacilityStore implements FacilityStore {
    private final Long2ObjectLinkedOpenHashMap<FacilityRecord> records;

    LinearScanFacilityStore(int expectedSize) {
        this.records = new Long2ObjectLinkedOpenHashMap<>(Math.max(expectedSize, 16));
    }

    @Override
    public IndexStrategy strategy() {
        return IndexStrategy.LINEAR_SCAN;
    }

    @Override
    public int size() {
        return records.size();
    }

    @Override
    public FacilityRecord get(long id) {
        return records.get(id);
    }

    @Override
    public FacilityRecord put(FacilityRecord record) {
        return records.put(record.getId(), record);
    }

    @Override
    public FacilityRecord remove(long id) {
        return records.remove(id);
    }

    @Override
    public List<FacilityRecord> records() {
        return new ArrayList<>(records.values());
    }

    @Override
    public int forEachCandidate(GeoBounds bounds, Consumer<FacilityRecord> consumer) {
        for (FacilityRecord record : records.values()) {
            consumer.accept(record);
        }
        return 0;
    }
}
