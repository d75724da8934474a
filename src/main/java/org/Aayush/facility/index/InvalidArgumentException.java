package org.Aayush.facility.index;

/**
 * Thrown when query arguments are malformed (non-positive radius, bad filter, bad center).
 */
public final class InvalidArgumentException extends FacilityIndexException {

    public InvalidArgumentException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
