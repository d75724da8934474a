package org.Aayush.facility.index;

/**
 * Thrown when a record or record batch is malformed. The index is left unchanged.
 */
public final class ValidationException extends FacilityIndexException {

    public ValidationException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
