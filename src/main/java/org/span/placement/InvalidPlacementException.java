package org.span.placement;

import lombok.Getter;

import java.util.Objects;

/**
 * Placement contract violation with a deterministic reason code.
 */
@Getter
public final class InvalidPlacementException extends RuntimeException {
    public static final String REASON_NOT_TOTAL = "PLACEMENT_NOT_TOTAL";
    public static final String REASON_UNKNOWN_VERTEX = "PLACEMENT_UNKNOWN_VERTEX";
    public static final String REASON_UNKNOWN_SERVER = "PLACEMENT_UNKNOWN_SERVER";
    public static final String REASON_CAPACITY_EXCEEDED = "PLACEMENT_CAPACITY_EXCEEDED";

    private final String reasonCode;

    public InvalidPlacementException(String reasonCode, String message) {
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
