package org.Aayush.facility.index;

import lombok.Getter;

import java.util.Objects;

/**
 * Caller-error contract of the facility index with deterministic reason codes.
 *
 * <p>Messages are prefixed with the reason code, for example
 * {@code [RADIUS_NOT_POSITIVE] radiusMeters must be > 0}.</p>
 */
@Getter
public abstract class FacilityIndexException extends RuntimeException {
    private final String reasonCode;

    protected FacilityIndexException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
