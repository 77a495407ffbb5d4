package org.citylink.graph;

import lombok.experimental.UtilityClass;

import java.util.Objects;

/**
 * Converts a dense adjacency matrix into its list of direct edges.
 */
@UtilityClass
public class PairListBuilder {

    /**
     * Scans the matrix row-major and appends one edge per 1-cell.
     *
     * @param matrix source matrix; not mutated.
     * @return mutable edge list sized to the matrix edge count.
     */
    public static EdgeList build(AdjacencyMatrix matrix) {
        Objects.requireNonNull(matrix, "matrix");
        int n = matrix.size();
        EdgeList edges = new EdgeList(n, matrix.edgeCount());
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                if (matrix.hasEdge(i, j)) {
                    edges.add(i, j);
                }
            }
        }
        return edges;
    }

    /**
     * Same as {@link #build(AdjacencyMatrix)}, with the dimension supplied by the caller.
     *
     * @throws IllegalArgumentException if {@code n} differs from the matrix dimension.
     */
    public static EdgeList build(AdjacencyMatrix matrix, int n) {
        Objects.requireNonNull(matrix, "matrix");
        if (n != matrix.size()) {
            throw new IllegalArgumentException(
                    "dimension mismatch: n=" + n + " but matrix is " + matrix.size() + "x" + matrix.size()
            );
        }
        return build(matrix);
    }
}
