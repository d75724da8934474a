package org.Aayush.facility.geo;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Immutable WGS-84 point in degrees.
 * <p>
 * Construction does not reject out-of-range values: range checks belong to the index,
 * which reports them with its own reason codes. Use {@link #isWithinRange()} to test.
 * </p>
 * <p>
 * In-range positions are stored in one canonical form per physical point, so equality
 * agrees with zero distance:
 * </p>
 * <ul>
 * <li>longitude {@code -180} is stored as {@code 180};</li>
 * <li>at either pole the longitude is stored as {@code 0};</li>
 * <li>negative zero is stored as positive zero.</li>
 * </ul>
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class GeoPosition {
    public static final double MIN_LATITUDE = -90.0d;
    public static final double MAX_LATITUDE = 90.0d;
    public static final double MIN_LONGITUDE = -180.0d;
    public static final double MAX_LONGITUDE = 180.0d;

    private final double latitude;
    private final double longitude;

    /**
     * Creates a position from latitude and longitude, in that order.
     */
    public static GeoPosition of(double latitude, double longitude) {
        if (!isLatitudeInRange(latitude) || !isLongitudeInRange(longitude)) {
            return new GeoPosition(latitude, longitude);
        }
        double lon = longitude;
        if (Math.abs(latitude) == MAX_LATITUDE) {
            lon = 0.0d;
        } else if (lon == MIN_LONGITUDE) {
            lon = MAX_LONGITUDE;
        }
        // + 0.0 turns -0.0 into 0.0
        return new GeoPosition(latitude + 0.0d, lon + 0.0d);
    }

    public boolean isLatitudeInRange() {
        return isLatitudeInRange(latitude);
    }

    public boolean isLongitudeInRange() {
        return isLongitudeInRange(longitude);
    }

    /**
     * @return true when both coordinates are finite and inside the WGS-84 degree domain.
     */
    public boolean isWithinRange() {
        return isLatitudeInRange() && isLongitudeInRange();
    }

    /**
     * Great-circle distance to another position in meters.
     */
    public double distanceTo(GeoPosition other) {
        return GreatCircleDistance.meters(this, other);
    }

    public static boolean isLatitudeInRange(double latitude) {
        // NaN fails both comparisons
        return latitude >= MIN_LATITUDE && latitude <= MAX_LATITUDE;
    }

    public static boolean isLongitudeInRange(double longitude) {
        return longitude >= MIN_LONGITUDE && longitude <= MAX_LONGITUDE;
    }

    @Override
    public String toString() {
        return "(" + latitude + ", " + longitude + ")";
    }
}
