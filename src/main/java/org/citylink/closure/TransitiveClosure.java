package org.citylink.closure;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.citylink.graph.Edge;
import org.citylink.graph.EdgeList;

import java.util.List;
import java.util.Objects;

/**
 * Frozen edge list closed under transitivity (the R* table).
 * <p>
 * The base edges the closure grew from occupy the first {@link #baseEdgeCount()}
 * positions; composed edges follow in the order they were discovered.
 * </p>
 */
public final class TransitiveClosure {

    private final EdgeList edges;

    @Getter
    @Accessors(fluent = true)
    private final int baseEdgeCount;

    /** Number of composition passes run, including the final pass that added nothing. */
    @Getter
    @Accessors(fluent = true)
    private final int passCount;

    TransitiveClosure(EdgeList edges, int baseEdgeCount, int passCount) {
        this.edges = Objects.requireNonNull(edges, "edges").freeze();
        if (baseEdgeCount < 0 || baseEdgeCount > edges.size()) {
            throw new IllegalArgumentException(
                    "baseEdgeCount " + baseEdgeCount + " out of bounds [0, " + edges.size() + "]"
            );
        }
        this.baseEdgeCount = baseEdgeCount;
        this.passCount = passCount;
    }

    /**
     * Reachability oracle: true when {@code source -> target} is in the closure.
     */
    public boolean contains(int source, int target) {
        return edges.contains(source, target);
    }

    public int size() {
        return edges.size();
    }

    public int nodeCount() {
        return edges.nodeCount();
    }

    public int addedEdgeCount() {
        return edges.size() - baseEdgeCount;
    }

    /**
     * Returns the frozen closure edges in closure order.
     */
    public EdgeList edges() {
        return edges;
    }

    /**
     * Returns a copy of the original pre-closure edges, in their original order.
     */
    public EdgeList baseEdges() {
        return edges.prefix(baseEdgeCount).freeze();
    }

    public List<Edge> pairs() {
        return edges.toList();
    }

    @Override
    public String toString() {
        return "TransitiveClosure{nodes=" + nodeCount() + ", edges=" + size()
                + ", base=" + baseEdgeCount + ", passes=" + passCount + "}";
    }
}
