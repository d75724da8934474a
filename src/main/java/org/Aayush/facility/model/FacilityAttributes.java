package org.Aayush.facility.model;

import lombok.Builder;
import lombok.Value;

/**
 * Optional descriptive fields of a facility.
 *
 * <p>The index stores and returns these values without interpreting them. Every field
 * is nullable; {@code null} means the source did not provide it.</p>
 */
@Value
@Builder(toBuilder = true)
public class FacilityAttributes {
    /** Attribute set with every field absent. */
    public static final FacilityAttributes EMPTY = FacilityAttributes.builder().build();

    /** Display name. */
    String name;
    /** Street address line (street and house number). */
    String address;
    String city;
    String postcode;
    /** Operating organisation. */
    String operator;
    /** Bed or seat capacity. */
    Integer capacity;
    /** Whether the facility runs an emergency department. */
    Boolean emergency;
    String phone;
    String website;
    /** Provenance tag of the upstream dataset, for example {@code OSM}. */
    String source;
}
