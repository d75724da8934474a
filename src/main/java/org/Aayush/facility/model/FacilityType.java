package org.Aayush.facility.model;

import java.util.Locale;

/**
 * Display category of a facility.
 *
 * <p>The index never interprets facility types: records carry the raw tag string and
 * type filters match that string exactly. This enum only groups tags for rendering.</p>
 */
public enum FacilityType {
    HOSPITAL("hospital"),
    CLINIC("clinic"),
    PHARMACY("pharmacy"),
    DOCTOR("doctor"),
    DENTIST("dentist"),
    LABORATORY("laboratory"),
    OTHER("other");

    private final String tag;

    FacilityType(String tag) {
        this.tag = tag;
    }

    /**
     * Canonical lower-case tag for this category.
     */
    public String tag() {
        return tag;
    }

    /**
     * Maps a raw tag to its display category.
     * <p>
     * Matching is case-insensitive and ignores surrounding whitespace. The OpenStreetMap
     * amenity spelling {@code doctors} maps to {@link #DOCTOR}. Unknown, blank and null
     * tags map to {@link #OTHER}.
     * </p>
     *
     * @param rawTag tag as stored on the record.
     * @return display category, never null.
     */
    public static FacilityType fromTag(String rawTag) {
        if (rawTag == null) {
            return OTHER;
        }
        String normalized = rawTag.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("doctors")) {
            return DOCTOR;
        }
        for (FacilityType type : values()) {
            if (type.tag.equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }
}
