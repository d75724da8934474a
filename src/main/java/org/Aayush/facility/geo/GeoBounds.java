package org.Aayush.facility.geo;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Latitude/longitude window enclosing a spherical cap (query disc).
 * <p>
 * The window is a conservative prefilter: every point within the cap lies inside it,
 * but corner points of the window may be farther than the radius.
 * </p>
 * <ul>
 * <li>When the cap reaches a pole, the window spans every longitude.</li>
 * <li>When the cap crosses the antimeridian, {@link #minLongitude()} is greater than
 * {@link #maxLongitude()} and the window wraps through {@code ±180}.</li>
 * </ul>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class GeoBounds {
    /**
     * Outward padding in degrees (about 0.1 mm) absorbing rounding in the window math.
     */
    static final double PADDING_DEGREES = 1e-9d;

    private static final GeoBounds WORLD = new GeoBounds(
            GeoPosition.MIN_LATITUDE,
            GeoPosition.MAX_LATITUDE,
            GeoPosition.MIN_LONGITUDE,
            GeoPosition.MAX_LONGITUDE,
            true
    );

    private final double minLatitude;
    private final double maxLatitude;
    private final double minLongitude;
    private final double maxLongitude;
    private final boolean allLongitudes;

    /**
     * Computes the window around a cap of the given surface radius.
     *
     * @param center cap center; must be within range.
     * @param radiusMeters cap radius in meters; must be finite and {@code >= 0}.
     * @return enclosing window.
     */
    public static GeoBounds around(GeoPosition center, double radiusMeters) {
        Objects.requireNonNull(center, "center");
        if (!Double.isFinite(radiusMeters) || radiusMeters < 0.0d) {
            throw new IllegalArgumentException("radiusMeters must be finite and >= 0");
        }

        double angular = GreatCircleDistance.centralAngleRadians(radiusMeters);
        if (angular >= Math.PI) {
            return WORLD;
        }

        double latRad = Math.toRadians(center.latitude());
        double minLatRad = latRad - angular;
        double maxLatRad = latRad + angular;
        double minLat = Math.max(GeoPosition.MIN_LATITUDE, Math.toDegrees(minLatRad) - PADDING_DEGREES);
        double maxLat = Math.min(GeoPosition.MAX_LATITUDE, Math.toDegrees(maxLatRad) + PADDING_DEGREES);

        if (minLatRad <= -Math.PI / 2.0d || maxLatRad >= Math.PI / 2.0d) {
            return new GeoBounds(minLat, maxLat, GeoPosition.MIN_LONGITUDE, GeoPosition.MAX_LONGITUDE, true);
        }

        double ratio = Math.sin(angular) / Math.cos(latRad);
        if (ratio >= 1.0d) {
            return new GeoBounds(minLat, maxLat, GeoPosition.MIN_LONGITUDE, GeoPosition.MAX_LONGITUDE, true);
        }
        double deltaLon = Math.toDegrees(Math.asin(ratio)) + PADDING_DEGREES;
        if (deltaLon >= 180.0d) {
            return new GeoBounds(minLat, maxLat, GeoPosition.MIN_LONGITUDE, GeoPosition.MAX_LONGITUDE, true);
        }

        double minLon = center.longitude() - deltaLon;
        double maxLon = center.longitude() + deltaLon;
        if (minLon < GeoPosition.MIN_LONGITUDE) {
            minLon += 360.0d;
        }
        if (maxLon > GeoPosition.MAX_LONGITUDE) {
            maxLon -= 360.0d;
        }
        return new GeoBounds(minLat, maxLat, minLon, maxLon, false);
    }

    /**
     * @return true when the longitude range passes through the antimeridian.
     */
    public boolean wrapsAntimeridian() {
        return !allLongitudes && minLongitude > maxLongitude;
    }

    /**
     * Tests window membership, honoring antimeridian wrap.
     */
    public boolean contains(GeoPosition position) {
        double lat = position.latitude();
        if (lat < minLatitude || lat > maxLatitude) {
            return false;
        }
        if (allLongitudes) {
            return true;
        }
        double lon = position.longitude();
        if (wrapsAntimeridian()) {
            return lon >= minLongitude || lon <= maxLongitude;
        }
        return lon >= minLongitude && lon <= maxLongitude;
    }

    @Override
    public String toString() {
        return "GeoBounds[lat=" + minLatitude + ".." + maxLatitude +
                ", lon=" + (allLongitudes ? "all" : minLongitude + ".." + maxLongitude) + "]";
    }
}
