package org.citylink.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Failure raised by {@link ReachabilityService} operations.
 *
 * <p>The message is prefixed with the reason code in brackets, e.g.
 * {@code [CL_NODE_OUT_OF_BOUNDS] target node 7 outside [0, 3)}, so the CLI can
 * print it as-is. Codes raised by {@link ReachabilityCore}:</p>
 * <ul>
 * <li>{@link ReachabilityCore#REASON_MATRIX_REQUIRED}: no adjacency matrix was given.</li>
 * <li>{@link ReachabilityCore#REASON_CLOSURE_REQUIRED}: a path query was made without a closure.</li>
 * <li>{@link ReachabilityCore#REASON_NODE_OUT_OF_BOUNDS}: a query node is outside the closure's node range.</li>
 * <li>{@link ReachabilityCore#REASON_CLOSURE_CAPACITY_EXCEEDED}: the closure would exceed the edge budget;
 * the cause is the {@link org.citylink.closure.ClosureBudget.BudgetExceededException}.</li>
 * <li>{@link ReachabilityCore#REASON_CLOSURE_PASS_LIMIT_EXCEEDED}: the closure needed more passes than allowed.</li>
 * </ul>
 */
@Getter
public final class ReachabilityException extends RuntimeException {
    private final String reasonCode;

    /**
     * Creates a reason-coded reachability failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    public ReachabilityException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Creates a reason-coded reachability failure with a cause.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     * @param cause underlying cause.
     */
    public ReachabilityException(String reasonCode, String message, Throwable cause) {
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
