package org.span.optimizer;

import lombok.Getter;

import java.util.Objects;

/**
 * Raised when a placement run cannot start or continue: the network lacks
 * capacity, the placement is locked or malformed, a hyperedge is committed, or
 * an initial partitioner gives up. The {@code SPAN_*} reason code names the failure.
 */
@Getter
public final class OptimizerException extends RuntimeException {
    public static final String REASON_INFEASIBLE_NETWORK = "SPAN_INFEASIBLE_NETWORK";
    public static final String REASON_NO_VALID_PLACEMENT = "SPAN_NO_VALID_PLACEMENT";
    public static final String REASON_PLACEMENT_LOCKED = "SPAN_PLACEMENT_LOCKED";
    public static final String REASON_HYPEREDGE_COMMITTED = "SPAN_HYPEREDGE_COMMITTED";
    public static final String REASON_INVALID_PLACEMENT = "SPAN_INVALID_PLACEMENT";
    public static final String REASON_PARTITIONER_FAILED = "SPAN_PARTITIONER_FAILED";
    public static final String REASON_SEARCH_BUDGET_EXCEEDED = "SPAN_SEARCH_BUDGET_EXCEEDED";

    private final String reasonCode;

    /**
     * Creates a reason-coded optimizer failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public OptimizerException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded optimizer failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public OptimizerException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
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
