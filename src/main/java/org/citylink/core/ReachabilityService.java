package org.citylink.core;

import org.citylink.closure.TransitiveClosure;
import org.citylink.graph.AdjacencyMatrix;
import org.citylink.search.PathResult;

/**
 * Public closure and path-query contract.
 *
 * <p>Implementations are expected to perform deterministic input validation and
 * throw reason-coded runtime exceptions for contract failures.</p>
 */
public interface ReachabilityService {
    /**
     * Computes the transitive closure of the graph described by {@code matrix}.
     *
     * @param matrix adjacency matrix.
     * @return frozen closure.
     */
    TransitiveClosure computeClosure(AdjacencyMatrix matrix);

    /**
     * Answers one reachability query against a previously computed closure.
     *
     * @param closure closure from {@link #computeClosure(AdjacencyMatrix)}.
     * @param start start node.
     * @param target target node.
     * @return path result; NOT_FOUND is a normal outcome.
     */
    PathResult findPath(TransitiveClosure closure, int start, int target);
}
