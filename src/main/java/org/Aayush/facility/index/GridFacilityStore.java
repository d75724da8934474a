package org.Aayush.facility.index;

import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import org.Aayush.facility.geo.GeoBounds;
import org.Aayush.facility.model.FacilityRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Grid-backed store: records are bucketed by {@link GridCellScheme} cell and radius
 * queries visit only the cells intersecting the query window.
 * <p>
 * Cell membership is a coarse prefilter. Callers still apply the exact distance
 * predicate to every candidate.
 * </p>
 * <p>
 * Invariants:
 * </p>
 * <ul>
 * <li>Each live record id appears in exactly one cell list: the cell of its position.</li>
 * <li>Cells with no records are removed from {@link #cells}.</li>
 * </ul>
 */
final class GridFacilityStore implements FacilityStore {
    private final GridCellScheme scheme;
    private final Long2ObjectLinkedOpenHashMap<FacilityRecord> records;
    private final Long2ObjectOpenHashMap<LongArrayList> cells;

    GridFacilityStore(GridCellScheme scheme, int expectedSize) {
        this.scheme = Objects.requireNonNull(scheme, "scheme");
        this.records = new Long2ObjectLinkedOpenHashMap<>(Math.max(expectedSize, 16));
        this.cells = new Long2ObjectOpenHashMap<>();
    }

    @Override
    public IndexStrategy strategy() {
        return IndexStrategy.GRID;
    }

    @Override
    public int size() {
        return records.size();
    }

    /**
     * Number of non-empty cells.
     */
    int occupiedCellCount() {
        return cells.size();
    }

    @Override
    public FacilityRecord get(long id) {
        return records.get(id);
    }

    @Override
    public FacilityRecord put(FacilityRecord record) {
        long id = record.getId();
        long newCell = scheme.cellOf(record.getPosition());
        FacilityRecord previous = records.put(id, record);
        if (previous != null) {
            long oldCell = scheme.cellOf(previous.getPosition());
            if (oldCell == newCell) {
                return previous;
            }
            detach(oldCell, id);
        }
        LongArrayList ids = cells.get(newCell);
        if (ids == null) {
            ids = new LongArrayList(4);
            cells.put(newCell, ids);
        }
        ids.add(id);
        return previous;
    }

    @Override
    public FacilityRecord remove(long id) {
        FacilityRecord removed = records.remove(id);
        if (removed != null) {
            detach(scheme.cellOf(removed.getPosition()), id);
        }
        return removed;
    }

    @Override
    public List<FacilityRecord> records() {
        return new ArrayList<>(records.values());
    }

    @Override
    public int forEachCandidate(GeoBounds bounds, Consumer<FacilityRecord> consumer) {
        if (records.isEmpty()) {
            return 0;
        }

        if (scheme.coveringCellCount(bounds) > cells.size()) {
            // Window spans more cells than are occupied: walk occupied cells instead.
            for (LongArrayList ids : cells.values()) {
                emit(ids, consumer);
            }
            return cells.size();
        }

        LongArrayList covering = new LongArrayList();
        scheme.collectCoveringCells(bounds, covering);
        for (int i = 0; i < covering.size(); i++) {
            LongArrayList ids = cells.get(covering.getLong(i));
            if (ids != null) {
                emit(ids, consumer);
            }
        }
        return covering.size();
    }

    private void emit(LongArrayList ids, Consumer<FacilityRecord> consumer) {
        for (int i = 0; i < ids.size(); i++) {
            consumer.accept(records.get(ids.getLong(i)));
        }
    }

    private void detach(long cell, long id) {
        LongArrayList ids = cells.get(cell);
        if (ids == null || !ids.rem(id)) {
            throw new IllegalStateException("grid cell " + cell + " does not hold record " + id);
        }
        if (ids.isEmpty()) {
            cells.remove(cell);
        }
    }
}
