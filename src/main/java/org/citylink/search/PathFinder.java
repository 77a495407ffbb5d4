package org.citylink.search;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.citylink.closure.TransitiveClosure;
import org.citylink.graph.EdgeList;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Objects;

/**
 * Reconstructs one concrete path between two nodes.
 * <p>
 * The closure is used purely as an existence oracle. The walk itself only follows
 * base (pre-closure) edges, since closure shortcuts are not real direct connections.
 * </p>
 * <p>
 * <strong>Usage Warning:</strong> NOT thread-safe; scratch state is allocated per query.
 * </p>
 */
@Log4j2
public final class PathFinder {

    @Getter
    private final PathStrategy strategy;

    public PathFinder() {
        this(PathStrategy.GREEDY);
    }

    public PathFinder(PathStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    /**
     * Answers one reachability query.
     *
     * @param closure reachability oracle.
     * @param baseEdges original edges the closure was grown from.
     * @param start start node.
     * @param target target node.
     * @return FOUND with a simple path, NOT_FOUND when the closure lacks {@code (start, target)},
     * or DEAD_END when the greedy walk stalls.
     * @throws IllegalArgumentException if a node is out of bounds or the edge sets disagree on node count.
     */
    public PathResult findPath(TransitiveClosure closure, EdgeList baseEdges, int start, int target) {
        Objects.requireNonNull(closure, "closure");
        Objects.requireNonNull(baseEdges, "baseEdges");
        int nodeCount = closure.nodeCount();
        if (baseEdges.nodeCount() != nodeCount) {
            throw new IllegalArgumentException(
                    "baseEdges node count " + baseEdges.nodeCount() + " != closure node count " + nodeCount
            );
        }
        checkNode(start, nodeCount, "start");
        checkNode(target, nodeCount, "target");

        if (!closure.contains(start, target)) {
            log.debug("no closure edge {} -> {}", start, target);
            return PathResult.notFound(start, target);
        }
        if (start == target) {
            // Only reachable through a direct self-loop; a simple path cannot repeat the node.
            IntArrayList single = new IntArrayList(1);
            single.add(start);
            return PathResult.found(start, target, single);
        }

        PathResult result = strategy == PathStrategy.BREADTH_FIRST
                ? breadthFirst(baseEdges, start, target)
                : greedyWalk(baseEdges, start, target);
        log.debug("{} path query {} -> {}: {} [{}]", strategy, start, target, result.getStatus(), result.render());
        return result;
    }

    /**
     * Forward walk taking the first base edge (in list order) that leaves the current
     * node towards a node not yet on the path. Never backtracks.
     */
    private PathResult greedyWalk(EdgeList baseEdges, int start, int target) {
        IntArrayList path = new IntArrayList();
        BitSet onPath = new BitSet(baseEdges.nodeCount());
        path.add(start);
        onPath.set(start);

        int current = start;
        while (current != target) {
            int next = -1;
            for (int i = 0; i < baseEdges.size(); i++) {
                if (baseEdges.source(i) == current && !onPath.get(baseEdges.destination(i))) {
                    next = baseEdges.destination(i);
                    break;
                }
            }
            if (next < 0) {
                return PathResult.deadEnd(start, target, path);
            }
            path.add(next);
            onPath.set(next);
            current = next;
        }
        return PathResult.found(start, target, path);
    }

    /**
     * Breadth-first search over a CSR view of the base edges. Neighbors are expanded in
     * base-list order, so ties between equal-length paths resolve deterministically.
     */
    private PathResult breadthFirst(EdgeList baseEdges, int start, int target) {
        int nodeCount = baseEdges.nodeCount();
        int edgeCount = baseEdges.size();

        // CSR: firstEdge[node] .. firstEdge[node + 1] indexes node's successors in adjacency.
        int[] firstEdge = new int[nodeCount + 1];
        for (int i = 0; i < edgeCount; i++) {
            firstEdge[baseEdges.source(i) + 1]++;
        }
        for (int node = 0; node < nodeCount; node++) {
            firstEdge[node + 1] += firstEdge[node];
        }
        int[] adjacency = new int[edgeCount];
        int[] cursor = Arrays.copyOf(firstEdge, nodeCount);
        for (int i = 0; i < edgeCount; i++) {
            adjacency[cursor[baseEdges.source(i)]++] = baseEdges.destination(i);
        }

        int[] predecessor = new int[nodeCount];
        Arrays.fill(predecessor, -1);
        BitSet visited = new BitSet(nodeCount);
        IntArrayFIFOQueue frontier = new IntArrayFIFOQueue();
        visited.set(start);
        frontier.enqueue(start);

        boolean reached = false;
        while (!frontier.isEmpty() && !reached) {
            int node = frontier.dequeueInt();
            for (int k = firstEdge[node]; k < firstEdge[node + 1]; k++) {
                int next = adjacency[k];
                if (visited.get(next)) {
                    continue;
                }
                visited.set(next);
                predecessor[next] = node;
                if (next == target) {
                    reached = true;
                    break;
                }
                frontier.enqueue(next);
            }
        }

        if (!reached) {
            log.warn("closure reports {} -> {} reachable but base edges do not connect them", start, target);
            IntArrayList stalled = new IntArrayList(1);
            stalled.add(start);
            return PathResult.deadEnd(start, target, stalled);
        }

        IntArrayList path = new IntArrayList();
        for (int node = target; node != -1; node = predecessor[node]) {
            path.add(node);
        }
        for (int lo = 0, hi = path.size() - 1; lo < hi; lo++, hi--) {
            int tmp = path.getInt(lo);
            path.set(lo, path.getInt(hi));
            path.set(hi, tmp);
        }
        return PathResult.found(start, target, path);
    }

    private static void checkNode(int node, int nodeCount, String role) {
        if (node < 0 || node >= nodeCount) {
            throw new IllegalArgumentException(role + " node " + node + " out of bounds [0, " + nodeCount + ")");
        }
    }
}
