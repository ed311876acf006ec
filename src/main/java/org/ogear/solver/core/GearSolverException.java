package org.ogear.solver.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Base solver failure with a deterministic reason code.
 *
 * <p>Failures are terminal: the caller receives either a complete path or one
 * of the subclasses, never a partial result.</p>
 */
@Getter
@Accessors(fluent = true)
public abstract class GearSolverException extends RuntimeException {
    public static final String REASON_INVALID_POSITION = "INVALID_POSITION";
    public static final String REASON_NO_SOLUTION = "NO_SOLUTION";
    public static final String REASON_SEARCH_BUDGET_EXCEEDED = "SEARCH_BUDGET_EXCEEDED";

    private final String reasonCode;

    /**
     * Creates a reason-coded solver failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive error message.
     */
    protected GearSolverException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Formats exception message with the reason-code prefix.
     */
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
