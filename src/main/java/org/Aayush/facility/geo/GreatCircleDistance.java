package org.Aayush.facility.geo;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Great-circle distance model over a spherical Earth.
 * <p>
 * The sphere radius is the IUGG mean Earth radius, the same approximation used by
 * web-mercator map clients, so distances shown on a map and distances returned by
 * the index agree.
 * </p>
 */
@UtilityClass
public final class GreatCircleDistance {
    public static final double EARTH_MEAN_RADIUS_METERS = 6_371_008.8d;

    /**
     * Computes the distance in meters between two positions.
     * <p>
     * Symmetric in its arguments and exactly {@code 0.0} for identical positions.
     * Inputs are assumed to be range-checked by the caller.
     * </p>
     */
    public static double meters(GeoPosition a, GeoPosition b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        return meters(a.latitude(), a.longitude(), b.latitude(), b.longitude());
    }

    /**
     * Computes great-circle distance in meters using the haversine formulation.
     */
    public static double meters(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        // absolute deltas keep the result bit-identical when the arguments are swapped
        double deltaLatRad = Math.toRadians(Math.abs(lat2Deg - lat1Deg));
        double deltaLonRad = Math.toRadians(absoluteDeltaLongitudeDegrees(lon1Deg, lon2Deg));

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double c = 2.0d * Math.asin(Math.sqrt(clamp(a, 0.0d, 1.0d)));
        return EARTH_MEAN_RADIUS_METERS * c;
    }

    /**
     * Converts a surface distance in meters into the central angle in radians.
     */
    public static double centralAngleRadians(double meters) {
        return meters / EARTH_MEAN_RADIUS_METERS;
    }

    /**
     * Shortest longitude separation in degrees, in {@code [0, 180]}.
     */
    static double absoluteDeltaLongitudeDegrees(double lon1Deg, double lon2Deg) {
        double delta = Math.abs(lon2Deg - lon1Deg);
        if (delta > 180.0d) {
            delta = 360.0d - delta;
        }
        return delta;
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
