package org.Aayush.facility.index;

/**
 * Telemetry of one radius query.
 *
 * @param cellsVisited grid cells inspected; {@code 0} for the linear scan strategy.
 * @param candidatesExamined records fed to the exact predicate.
 * @param matches records returned, after any limit.
 * @param elapsedNanos wall time of the query.
 */
public record QueryStats(
        int cellsVisited,
        int candidatesExamined,
        int matches,
        long elapsedNanos
) {
    /**
     * Returns a zeroed telemetry payload.
     */
    public static QueryStats empty() {
        return new QueryStats(0, 0, 0, 0L);
    }
}
