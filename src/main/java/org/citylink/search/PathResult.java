package org.citylink.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of one reachability query.
 *
 * <p>When {@code status=NOT_FOUND}, {@code nodes} is empty. When
 * {@code status=DEAD_END}, {@code nodes} holds the partial greedy walk that
 * stalled before reaching the target.</p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PathResult {
    public static final String NODE_SEPARATOR = " => ";

    /**
     * Query outcome category.
     */
    public enum Status {
        FOUND,
        NOT_FOUND,
        DEAD_END
    }

    Status status;
    /** Requested start node. */
    int start;
    /** Requested target node. */
    int target;
    /** Walked nodes, start first. */
    IntList nodes;

    static PathResult found(int start, int target, IntArrayList nodes) {
        return new PathResult(Status.FOUND, start, target, IntLists.unmodifiable(nodes));
    }

    static PathResult notFound(int start, int target) {
        return new PathResult(Status.NOT_FOUND, start, target, IntLists.emptyList());
    }

    static PathResult deadEnd(int start, int target, IntArrayList partialWalk) {
        return new PathResult(Status.DEAD_END, start, target, IntLists.unmodifiable(partialWalk));
    }

    public boolean isFound() {
        return status == Status.FOUND;
    }

    /**
     * Node where the walk ended, or -1 when nothing was walked.
     */
    public int lastNode() {
        return nodes.isEmpty() ? -1 : nodes.getInt(nodes.size() - 1);
    }

    /**
     * Renders the walked nodes as {@code "a => b => c"}; empty for NOT_FOUND.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                sb.append(NODE_SEPARATOR);
            }
            sb.append(nodes.getInt(i));
        }
        return sb.toString();
    }
}
