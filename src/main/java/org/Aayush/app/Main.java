package org.Aayush.app;

import org.Aayush.facility.geo.GeoPosition;
import org.Aayush.facility.index.FacilityIndex;
import org.Aayush.facility.index.FacilityIndexException;
import org.Aayush.facility.index.FacilityMatch;
import org.Aayush.facility.index.RadiusQuery;
import org.Aayush.facility.index.SpatialFacilityIndex;
import org.Aayush.facility.model.FacilityAttributes;
import org.Aayush.facility.model.FacilityRecord;

import java.util.List;
import java.util.Locale;

/**
 * Minimal application entry point used for local smoke runs.
 * <p>
 * Usage: {@code Main [lat lon [radiusMeters]]}. Loads three Vienna hospitals and prints
 * the ones within the radius, nearest first.
 * </p>
 */
public class Main {
    static final GeoPosition DEFAULT_CENTER = GeoPosition.of(48.215, 16.330);

    /**
     * Launches the sample radius query.
     *
     * @param args optional latitude, longitude and radius in meters.
     */
    public static void main(String[] args) {
        FacilityIndex index = new SpatialFacilityIndex();
        index.load(seedFacilities());

        GeoPosition center = DEFAULT_CENTER;
        double radius = RadiusQuery.DEFAULT_RADIUS_METERS;
        try {
            if (args.length >= 2) {
                center = GeoPosition.of(Double.parseDouble(args[0]), Double.parseDouble(args[1]));
            }
            if (args.length >= 3) {
                radius = Double.parseDouble(args[2]);
            }
        } catch (NumberFormatException ex) {
            System.out.println("Invalid number: " + ex.getMessage());
            return;
        }

        List<FacilityMatch> matches;
        try {
            matches = index.queryRadius(RadiusQuery.of(center, radius));
        } catch (FacilityIndexException ex) {
            System.out.println(ex.getMessage());
            return;
        }

        System.out.printf(Locale.ROOT, "%d of %d facilities within %.0f m of %s%n",
                matches.size(), index.size(), radius, center);
        for (FacilityMatch match : matches) {
            System.out.printf(Locale.ROOT, "%s  %.1f m%n",
                    match.record().getAttributes().getName(), match.distanceMeters());
        }
    }

    static List<FacilityRecord> seedFacilities() {
        return List.of(
                seed(1L, "AKH Hospital", 48.221, 16.345),
                seed(2L, "Ottakring Hospital", 48.210, 16.306),
                seed(3L, "SMZ Ost Hospital", 48.250, 16.450)
        );
    }

    private static FacilityRecord seed(long id, String name, double lat, double lon) {
        return FacilityRecord.builder()
                .id(id)
                .position(GeoPosition.of(lat, lon))
                .facilityType("hospital")
                .attributes(FacilityAttributes.builder()
                        .name(name)
                        .city("Wien")
                        .source("seed")
                        .build())
                .build();
    }
}
