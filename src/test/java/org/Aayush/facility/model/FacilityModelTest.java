package org.Aayush.facility.model;

import org.Aayush.facility.geo.GeoPosition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Facility Model Tests")
class FacilityModelTest {

    @Test
    @DisplayName("Known tags map to their display category regardless of case")
    void testKnownTags() {
        assertEquals(FacilityType.HOSPITAL, FacilityType.fromTag("hospital"));
        assertEquals(FacilityType.CLINIC, FacilityType.fromTag("Clinic"));
        assertEquals(FacilityType.PHARMACY, FacilityType.fromTag(" PHARMACY "));
        assertEquals(FacilityType.DENTIST, FacilityType.fromTag("dentist"));
        assertEquals(FacilityType.LABORATORY, FacilityType.fromTag("laboratory"));
        assertEquals(FacilityType.DOCTOR, FacilityType.fromTag("doctor"));
        assertEquals(FacilityType.DOCTOR, FacilityType.fromTag("doctors"));
    }

    @Test
    @DisplayName("Unknown, blank and null tags map to OTHER")
    void testUnknownTags() {
        assertEquals(FacilityType.OTHER, FacilityType.fromTag("veterinary"));
        assertEquals(FacilityType.OTHER, FacilityType.fromTag(""));
        assertEquals(FacilityType.OTHER, FacilityType.fromTag(null));
        assertEquals("other", FacilityType.OTHER.tag());
    }

    @Test
    @DisplayName("Record builder defaults attributes and keeps the raw type tag")
    void testRecordDefaults() {
        FacilityRecord record = FacilityRecord.builder()
                .id(42L)
                .position(GeoPosition.of(47.07, 15.44))
                .facilityType("doctors")
                .build();

        assertSame(FacilityAttributes.EMPTY, record.getAttributes());
        assertEquals("doctors", record.getFacilityType());
        assertEquals(FacilityType.DOCTOR, record.displayType());
        assertNull(record.getAttributes().getName());
    }

    @Test
    @DisplayName("Copy helpers replace one component and keep identity")
    void testCopyHelpers() {
        FacilityRecord original = FacilityRecord.builder()
                .id(7L)
                .position(GeoPosition.of(48.0, 16.0))
                .facilityType("clinic")
                .attributes(FacilityAttributes.builder().name("Old").capacity(12).emergency(Boolean.TRUE).build())
                .build();

        FacilityRecord moved = original.withPosition(GeoPosition.of(48.5, 16.5));
        assertEquals(7L, moved.getId());
        assertEquals(GeoPosition.of(48.5, 16.5), moved.getPosition());
        assertEquals(original.getAttributes(), moved.getAttributes());

        FacilityRecord renamed = original.withAttributes(
                original.getAttributes().toBuilder().name("New").build());
        assertEquals("New", renamed.getAttributes().getName());
        assertEquals(Integer.valueOf(12), renamed.getAttributes().getCapacity());
        assertEquals(original.getPosition(), renamed.getPosition());
        assertNotEquals(original, renamed);
    }
}
