package org.citylink.core;

import lombok.Builder;
import lombok.extern.log4j.Log4j2;
import org.citylink.closure.ClosureBudget;
import org.citylink.closure.ClosureEngine;
import org.citylink.closure.TransitiveClosure;
import org.citylink.graph.AdjacencyMatrix;
import org.citylink.graph.EdgeList;
import org.citylink.graph.PairListBuilder;
import org.citylink.search.PathFinder;
import org.citylink.search.PathResult;
import org.citylink.search.PathStrategy;

/**
 * Main reachability orchestration entry point.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Convert the adjacency matrix into its base edge list.</li>
 * <li>Grow the edge list into the transitive closure under the configured budget.</li>
 * <li>Validate query nodes against the closure's node range.</li>
 * <li>Delegate path reconstruction to the configured {@link PathStrategy}.</li>
 * <li>Wrap budget failures into {@link ReachabilityException} with stable reason codes.</li>
 * </ul>
 */
@Log4j2
public final class ReachabilityCore implements ReachabilityService {
    public static final String REASON_MATRIX_REQUIRED = "CL_MATRIX_REQUIRED";
    public static final String REASON_CLOSURE_REQUIRED = "CL_CLOSURE_REQUIRED";
    public static final String REASON_NODE_OUT_OF_BOUNDS = "CL_NODE_OUT_OF_BOUNDS";
    public static final String REASON_CLOSURE_CAPACITY_EXCEEDED = "CL_CLOSURE_CAPACITY_EXCEEDED";
    public static final String REASON_CLOSURE_PASS_LIMIT_EXCEEDED = "CL_CLOSURE_PASS_LIMIT_EXCEEDED";

    private final ClosureEngine closureEngine;
    private final PathFinder pathFinder;

    /**
     * Creates the facade.
     *
     * @param pathStrategy path reconstruction strategy (defaults to GREEDY).
     * @param closureBudget closure growth bounds (defaults to {@link ClosureBudget#defaults()}).
     */
    @Builder
    public ReachabilityCore(PathStrategy pathStrategy, ClosureBudget closureBudget) {
        this.closureEngine = new ClosureEngine(closureBudget == null ? ClosureBudget.defaults() : closureBudget);
        this.pathFinder = new PathFinder(pathStrategy == null ? PathStrategy.GREEDY : pathStrategy);
    }

    /**
     * Builds the base edge list and closes it.
     *
     * @throws ReachabilityException when the matrix is missing or the closure budget is exhausted.
     */
    @Override
    public TransitiveClosure computeClosure(AdjacencyMatrix matrix) {
        if (matrix == null) {
            throw new ReachabilityException(REASON_MATRIX_REQUIRED, "adjacency matrix must be provided");
        }
        EdgeList edges = PairListBuilder.build(matrix, matrix.size());
        log.debug("built {} base edges from {}x{} matrix", edges.size(), matrix.size(), matrix.size());
        try {
            return closureEngine.close(edges);
        } catch (ClosureBudget.BudgetExceededException ex) {
            String reason = ClosureBudget.REASON_PASSES_EXCEEDED.equals(ex.reasonCode())
                    ? REASON_CLOSURE_PASS_LIMIT_EXCEEDED
                    : REASON_CLOSURE_CAPACITY_EXCEEDED;
            throw new ReachabilityException(reason, "closure computation aborted: " + ex.getMessage(), ex);
        }
    }

    /**
     * Validates the query and reconstructs a path over the closure's base edges.
     *
     * @throws ReachabilityException when the closure is missing or a node is out of bounds.
     */
    @Override
    public PathResult findPath(TransitiveClosure closure, int start, int target) {
        if (closure == null) {
            throw new ReachabilityException(REASON_CLOSURE_REQUIRED, "closure must be provided");
        }
        requireNode(closure, start, "start");
        requireNode(closure, target, "target");
        return pathFinder.findPath(closure, closure.baseEdges(), start, target);
    }

    public PathStrategy pathStrategy() {
        return pathFinder.getStrategy();
    }

    private static void requireNode(TransitiveClosure closure, int node, String role) {
        if (node < 0 || node >= closure.nodeCount()) {
            throw new ReachabilityException(
                    REASON_NODE_OUT_OF_BOUNDS,
                    role + " node " + node + " outside [0, " + closure.nodeCount() + ")"
            );
        }
    }
}
