package org.Aayush.facility.index;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.facility.geo.GeoBounds;
import org.Aayush.facility.geo.GeoPosition;
import org.Aayush.facility.geo.GreatCircleDistance;
import org.Aayush.facility.model.FacilityAttributes;
import org.Aayush.facility.model.FacilityRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Default {@link FacilityIndex}: validated ingest over a pluggable {@link FacilityStore}.
 *
 * <p>Concurrency discipline:</p>
 * <ul>
 * <li>Readers ({@code listAll}, {@code get}, {@code size}, {@code queryRadius}) share the
 * read lock and never block each other.</li>
 * <li>{@code upsert} and {@code delete} mutate the live store under the write lock.</li>
 * <li>{@code load} validates and builds a complete replacement store without holding any
 * lock, then publishes it with a reference swap under the write lock. Readers see the
 * old set or the new set, never a mix, and are not blocked during the rebuild.</li>
 * <li>A failed validation leaves the live store untouched.</li>
 * </ul>
 * <p>Query telemetry is recorded per thread; see {@link #lastQueryStats()}.</p>
 */
@Slf4j
public final class SpatialFacilityIndex implements FacilityIndex {
    public static final String REASON_RECORD_BATCH_REQUIRED = "RECORD_BATCH_REQUIRED";
    public static final String REASON_RECORD_REQUIRED = "RECORD_REQUIRED";
    public static final String REASON_POSITION_REQUIRED = "POSITION_REQUIRED";
    public static final String REASON_LATITUDE_OUT_OF_RANGE = "LATITUDE_OUT_OF_RANGE";
    public static final String REASON_LONGITUDE_OUT_OF_RANGE = "LONGITUDE_OUT_OF_RANGE";
    public static final String REASON_FACILITY_TYPE_REQUIRED = "FACILITY_TYPE_REQUIRED";
    public static final String REASON_DUPLICATE_ID_IN_BATCH = "DUPLICATE_ID_IN_BATCH";

    public static final String REASON_QUERY_REQUIRED = "QUERY_REQUIRED";
    public static final String REASON_CENTER_REQUIRED = "CENTER_REQUIRED";
    public static final String REASON_CENTER_OUT_OF_RANGE = "CENTER_OUT_OF_RANGE";
    public static final String REASON_RADIUS_NOT_FINITE = "RADIUS_NOT_FINITE";
    public static final String REASON_RADIUS_NOT_POSITIVE = "RADIUS_NOT_POSITIVE";
    public static final String REASON_TYPE_FILTER_MALFORMED = "TYPE_FILTER_MALFORMED";
    public static final String REASON_LIMIT_NOT_POSITIVE = "LIMIT_NOT_POSITIVE";

    private final IndexStrategy strategy;
    private final GridCellScheme scheme;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ThreadLocal<QueryStats> lastQueryStats = ThreadLocal.withInitial(QueryStats::empty);

    /** Live store; replaced wholesale by {@link #load}. Guarded by {@link #lock}. */
    private FacilityStore store;

    /**
     * Creates an empty grid index with default configuration.
     */
    public SpatialFacilityIndex() {
        this(FacilityIndexConfig.defaults());
    }

    /**
     * Creates an empty index.
     *
     * @param config strategy and grid configuration.
     * @throws IllegalArgumentException when the configuration is invalid.
     */
    public SpatialFacilityIndex(FacilityIndexConfig config) {
        this.scheme = FacilityStoreFactory.schemeFor(config);
        this.strategy = config.getStrategy();
        this.store = FacilityStoreFactory.create(strategy, scheme, 0);
    }

    public IndexStrategy strategy() {
        return strategy;
    }

    @Override
    public void load(Collection<FacilityRecord> records) {
        if (records == null) {
            throw new ValidationException(REASON_RECORD_BATCH_REQUIRED, "records must be non-null");
        }

        long startNanos = System.nanoTime();
        FacilityStore replacement = FacilityStoreFactory.create(strategy, scheme, records.size());
        LongOpenHashSet seenIds = new LongOpenHashSet(records.size());
        try {
            int position = 0;
            for (FacilityRecord record : records) {
                FacilityRecord accepted = validateRecord(record, "records[" + position + "]");
                if (!seenIds.add(accepted.getId())) {
                    throw new ValidationException(
                            REASON_DUPLICATE_ID_IN_BATCH,
                            "records[" + position + "] repeats id " + accepted.getId());
                }
                replacement.put(accepted);
                position++;
            }
        } catch (ValidationException ex) {
            log.warn("Rejected load of {} facility records: {}", records.size(), ex.getMessage());
            throw ex;
        }

        lock.writeLock().lock();
        try {
            store = replacement;
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Loaded {} facility records into {} index in {} ms",
                replacement.size(), strategy, (System.nanoTime() - startNanos) / 1_000_000L);
    }

    @Override
    public void upsert(FacilityRecord record) {
        FacilityRecord accepted = validateRecord(record, "record");
        FacilityRecord previous;
        lock.writeLock().lock();
        try {
            previous = store.put(accepted);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("{} facility record {}", previous == null ? "Inserted" : "Replaced", accepted.getId());
    }

    @Override
    public boolean delete(long id) {
        boolean removed;
        lock.writeLock().lock();
        try {
            removed = store.remove(id) != null;
        } finally {
            lock.writeLock().unlock();
        }
        if (removed) {
            log.debug("Deleted facility record {}", id);
        }
        return removed;
    }

    @Override
    public List<FacilityRecord> listAll() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(store.records());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<FacilityRecord> get(long id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(store.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return store.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<FacilityMatch> queryRadius(RadiusQuery query) {
        validateQuery(query);
        long startNanos = System.nanoTime();

        GeoPosition center = query.getCenter();
        double radiusMeters = query.getRadiusMeters();
        GeoBounds bounds = GeoBounds.around(center, radiusMeters);
        MatchCollector collector = new MatchCollector(center, radiusMeters, query.getTypeFilter());

        int cellsVisited;
        lock.readLock().lock();
        try {
            cellsVisited = store.forEachCandidate(bounds, collector);
        } finally {
            lock.readLock().unlock();
        }

        List<FacilityMatch> matches = collector.matches;
        matches.sort(FacilityMatch.BY_DISTANCE_THEN_ID);
        Integer limit = query.getLimit();
        if (limit != null && matches.size() > limit) {
            matches = new ArrayList<>(matches.subList(0, limit));
        }

        lastQueryStats.set(new QueryStats(
                cellsVisited,
                collector.examined,
                matches.size(),
                System.nanoTime() - startNanos
        ));
        return Collections.unmodifiableList(matches);
    }

    /**
     * Returns telemetry of the most recent {@code queryRadius} call on the current thread.
     */
    public QueryStats lastQueryStats() {
        return lastQueryStats.get();
    }

    @Override
    public String toString() {
        return "SpatialFacilityIndex[strategy=" + strategy + ", size=" + size() + "]";
    }

    /**
     * Checks one record and returns the form that is stored (absent attributes become empty).
     */
    private static FacilityRecord validateRecord(FacilityRecord record, String label) {
        if (record == null) {
            throw new ValidationException(REASON_RECORD_REQUIRED, label + " must be non-null");
        }
        GeoPosition position = record.getPosition();
        if (position == null) {
            throw new ValidationException(
                    REASON_POSITION_REQUIRED, label + " (id " + record.getId() + ") has no position");
        }
        if (!position.isLatitudeInRange()) {
            throw new ValidationException(
                    REASON_LATITUDE_OUT_OF_RANGE,
                    label + " (id " + record.getId() + ") latitude must be in [-90, 90], got " +
                            position.latitude());
        }
        if (!position.isLongitudeInRange()) {
            throw new ValidationException(
                    REASON_LONGITUDE_OUT_OF_RANGE,
                    label + " (id " + record.getId() + ") longitude must be in [-180, 180], got " +
                            position.longitude());
        }
        String type = record.getFacilityType();
        if (type == null || type.isBlank()) {
            throw new ValidationException(
                    REASON_FACILITY_TYPE_REQUIRED, label + " (id " + record.getId() + ") has no facility type");
        }
        if (record.getAttributes() == null) {
            return record.withAttributes(FacilityAttributes.EMPTY);
        }
        return record;
    }

    private static void validateQuery(RadiusQuery query) {
        if (query == null) {
            throw new InvalidArgumentException(REASON_QUERY_REQUIRED, "query must be non-null");
        }
        GeoPosition center = query.getCenter();
        if (center == null) {
            throw new InvalidArgumentException(REASON_CENTER_REQUIRED, "center must be non-null");
        }
        if (!center.isWithinRange()) {
            throw new InvalidArgumentException(
                    REASON_CENTER_OUT_OF_RANGE, "center must be a valid WGS-84 position, got " + center);
        }
        double radius = query.getRadiusMeters();
        if (!Double.isFinite(radius)) {
            throw new InvalidArgumentException(REASON_RADIUS_NOT_FINITE, "radiusMeters must be finite");
        }
        if (radius <= 0.0d) {
            throw new InvalidArgumentException(
                    REASON_RADIUS_NOT_POSITIVE, "radiusMeters must be > 0, got " + radius);
        }
        Set<String> typeFilter = query.getTypeFilter();
        if (typeFilter != null) {
            if (typeFilter.isEmpty()) {
                throw new InvalidArgumentException(
                        REASON_TYPE_FILTER_MALFORMED, "typeFilter must be null or non-empty");
            }
            for (String type : typeFilter) {
                if (type == null || type.isBlank()) {
                    throw new InvalidArgumentException(
                            REASON_TYPE_FILTER_MALFORMED, "typeFilter must not contain null or blank tags");
                }
            }
        }
        Integer limit = query.getLimit();
        if (limit != null && limit <= 0) {
            throw new InvalidArgumentException(REASON_LIMIT_NOT_POSITIVE, "limit must be > 0, got " + limit);
        }
    }

    /**
     * Applies the exact predicate (type filter, then great-circle distance) to candidates.
     */
    private static final class MatchCollector implements Consumer<FacilityRecord> {
        private final GeoPosition center;
        private final double radiusMeters;
        private final Set<String> typeFilter;
        private final List<FacilityMatch> matches = new ArrayList<>();
        private int examined;

        private MatchCollector(GeoPosition center, double radiusMeters, Set<String> typeFilter) {
            this.center = center;
            this.radiusMeters = radiusMeters;
            this.typeFilter = typeFilter;
        }

        @Override
        public void accept(FacilityRecord record) {
            examined++;
            if (typeFilter != null && !typeFilter.contains(record.getFacilityType())) {
                return;
            }
            double distance = GreatCircleDistance.meters(center, record.getPosition());
            if (distance <= radiusMeters) {
                matches.add(new FacilityMatch(record, distance));
            }
        }
    }
}
