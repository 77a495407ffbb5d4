package org.citylink.graph;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Dense N x N adjacency matrix of 0/1 cells.
 * <p>
 * Cell (i, j) = 1 means a direct edge i -> j. Storage is a single row-major
 * {@code byte[]} so the matrix stays one contiguous block regardless of N.
 * </p>
 * <p>
 * Instances are immutable after construction; the input array is copied.
 * </p>
 */
public final class AdjacencyMatrix {

    private final byte[] cells;

    @Getter
    @Accessors(fluent = true)
    private final int size;

    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;

    private AdjacencyMatrix(int size, byte[] cells, int edgeCount) {
        this.size = size;
        this.cells = cells;
        this.edgeCount = edgeCount;
    }

    /**
     * Builds a matrix from row arrays.
     *
     * @param rows square matrix rows; every cell must be 0 or 1.
     * @return immutable adjacency matrix.
     * @throws IllegalArgumentException if the rows are not square or hold values other than 0/1.
     */
    public static AdjacencyMatrix of(int[][] rows) {
        Objects.requireNonNull(rows, "rows");
        int n = rows.length;
        byte[] cells = new byte[Math.multiplyExact(n, n)];
        int edges = 0;
        for (int i = 0; i < n; i++) {
            int[] row = rows[i];
            if (row == null || row.length != n) {
                throw new IllegalArgumentException(
                        "row " + i + " must have exactly " + n + " cells, found "
                                + (row == null ? "null" : String.valueOf(row.length))
                );
            }
            for (int j = 0; j < n; j++) {
                int value = row[j];
                if (value != 0 && value != 1) {
                    throw new IllegalArgumentException(
                            "cell (" + i + "," + j + ") must be 0 or 1, found " + value
                    );
                }
                if (value == 1) {
                    cells[i * n + j] = 1;
                    edges++;
                }
            }
        }
        return new AdjacencyMatrix(n, cells, edges);
    }

    /**
     * Checks whether a direct edge {@code source -> destination} exists.
     *
     * @throws IndexOutOfBoundsException if either index is outside [0, size).
     */
    public boolean hasEdge(int source, int destination) {
        checkNode(source);
        checkNode(destination);
        return cells[source * size + destination] == 1;
    }

    /**
     * Returns the raw 0/1 cell value.
     */
    public int get(int row, int column) {
        return hasEdge(row, column) ? 1 : 0;
    }

    private void checkNode(int node) {
        if (node < 0 || node >= size) {
            throw new IndexOutOfBoundsException("Node " + node + " out of bounds [0, " + size + ")");
        }
    }
}
