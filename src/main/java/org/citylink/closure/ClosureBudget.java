package org.citylink.closure;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Deterministic bounds on closure growth.
 * <p>
 * The fixed-point loop can grow the edge list up to N^2 pairs; this budget lets
 * callers fail fast instead of exhausting memory on inputs larger than intended.
 * </p>
 */
public final class ClosureBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final String REASON_EDGES_EXCEEDED = "CL_BUDGET_EDGES_EXCEEDED";
    public static final String REASON_PASSES_EXCEEDED = "CL_BUDGET_PASSES_EXCEEDED";

    static final String PROP_MAX_EDGES = "citylink.closure.maxEdges";
    static final String PROP_MAX_PASSES = "citylink.closure.maxPasses";

    @Getter
    @Accessors(fluent = true)
    private final int maxEdges;
    @Getter
    @Accessors(fluent = true)
    private final int maxPasses;

    private ClosureBudget(int maxEdges, int maxPasses) {
        this.maxEdges = normalizeBound(maxEdges);
        this.maxPasses = normalizeBound(maxPasses);
    }

    /**
     * Creates a budget with explicit bounds. Non-positive values mean unbounded.
     */
    public static ClosureBudget of(int maxEdges, int maxPasses) {
        return new ClosureBudget(maxEdges, maxPasses);
    }

    public static ClosureBudget unbounded() {
        return new ClosureBudget(UNBOUNDED, UNBOUNDED);
    }

    /**
     * Loads budget values from system properties.
     */
    public static ClosureBudget defaults() {
        return ClosureBudget.of(readBound(PROP_MAX_EDGES), readBound(PROP_MAX_PASSES));
    }

    /**
     * Validates the edge count the list would reach after one more append.
     */
    void checkEdgeCount(int edgeCount) {
        if (edgeCount > maxEdges) {
            throw new BudgetExceededException(
                    REASON_EDGES_EXCEEDED,
                    "closure edge budget exceeded: " + edgeCount + " > " + maxEdges
            );
        }
    }

    /**
     * Validates the number of the pass about to start.
     */
    void checkPassCount(int passNumber) {
        if (passNumber > maxPasses) {
            throw new BudgetExceededException(
                    REASON_PASSES_EXCEEDED,
                    "closure pass budget exceeded: " + passNumber + " > " + maxPasses
            );
        }
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }

    @Override
    public String toString() {
        return "ClosureBudget{maxEdges=" + describe(maxEdges) + ", maxPasses=" + describe(maxPasses) + "}";
    }

    private static String describe(int bound) {
        return bound == UNBOUNDED ? "unbounded" : String.valueOf(bound);
    }

    /**
     * Fail-fast signal for an exhausted closure budget. The closure under
     * construction is abandoned; no partial result is defined.
     */
    public static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }

        public String reasonCode() {
            return reasonCode;
        }
    }
}
