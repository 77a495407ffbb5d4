package org.citylink.testutil;

import org.citylink.closure.ClosureEngine;
import org.citylink.closure.TransitiveClosure;
import org.citylink.graph.AdjacencyMatrix;
import org.citylink.graph.Edge;
import org.citylink.graph.EdgeList;
import org.citylink.graph.PairListBuilder;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

/**
 * Shared matrices and reference computations for reachability tests.
 */
public final class GraphFixtures {

    /** 0 -> 1 -> 2. */
    public static final int[][] CHAIN_3 = {
            {0, 1, 0},
            {0, 0, 1},
            {0, 0, 0}
    };

    public static final int[][] EMPTY_2 = {
            {0, 0},
            {0, 0}
    };

    /** 0 <-> 1, node 2 isolated. */
    public static final int[][] TWO_CYCLE_3 = {
            {0, 1, 0},
            {1, 0, 0},
            {0, 0, 0}
    };

    public static final int[][] COMPLETE_3 = {
            {0, 1, 1},
            {1, 0, 1},
            {1, 1, 0}
    };

    /** Components {0, 1, 2} (0 -> 1 -> 2) and {3, 4} (3 -> 4). */
    public static final int[][] TWO_COMPONENTS_5 = {
            {0, 1, 0, 0, 0},
            {0, 0, 1, 0, 0},
            {0, 0, 0, 0, 0},
            {0, 0, 0, 0, 1},
            {0, 0, 0, 0, 0}
    };

    /** 0 -> 1 (dead end), 0 -> 2 -> 3. The first edge out of 0 leads nowhere. */
    public static final int[][] GREEDY_TRAP_4 = {
            {0, 1, 1, 0},
            {0, 0, 0, 0},
            {0, 0, 0, 1},
            {0, 0, 0, 0}
    };

    /** 0 -> 1 -> 2 plus the shortcut 0 -> 2. */
    public static final int[][] SHORTCUT_3 = {
            {0, 1, 1},
            {0, 0, 1},
            {0, 0, 0}
    };

    private GraphFixtures() {
    }

    public static EdgeList baseEdges(int[][] rows) {
        return PairListBuilder.build(AdjacencyMatrix.of(rows));
    }

    public static TransitiveClosure closureOf(int[][] rows) {
        return new ClosureEngine().close(baseEdges(rows));
    }

    public static Set<Edge> edgeSet(EdgeList edges) {
        Set<Edge> set = new HashSet<>();
        for (Edge edge : edges) {
            set.add(edge);
        }
        return set;
    }

    /**
     * Reference closure: all (u, w) with u != w reachable through one or more edges,
     * plus direct self-loops from the diagonal.
     */
    public static Set<Edge> referenceClosure(int[][] rows) {
        int n = rows.length;
        boolean[][] reach = new boolean[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                reach[i][j] = rows[i][j] == 1;
            }
        }
        for (int k = 0; k < n; k++) {
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    if (reach[i][k] && reach[k][j]) {
                        reach[i][j] = true;
                    }
                }
            }
        }
        Set<Edge> expected = new HashSet<>();
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (i == j ? rows[i][i] == 1 : reach[i][j]) {
                    expected.add(new Edge(i, j));
                }
            }
        }
        return expected;
    }

    public static int[][] randomMatrix(Random random, int n, double density) {
        int[][] rows = new int[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                rows[i][j] = random.nextDouble() < density ? 1 : 0;
            }
        }
        return rows;
    }

    public static String toFileText(int[][] rows) {
        StringBuilder sb = new StringBuilder().append(rows.length).append('\n');
        for (int[] row : rows) {
            for (int j = 0; j < row.length; j++) {
                if (j > 0) {
                    sb.append(' ');
                }
                sb.append(row[j]);
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
