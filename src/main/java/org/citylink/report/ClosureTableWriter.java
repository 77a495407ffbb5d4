package org.citylink.report;

import lombok.extern.log4j.Log4j2;
import org.citylink.closure.TransitiveClosure;
import org.citylink.graph.AdjacencyMatrix;
import org.citylink.graph.EdgeList;
import org.citylink.search.PathResult;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Console and file rendering of the neighbor table, the R* table and path answers.
 * <p>
 * The layouts are fixed text formats consumed by people and by scripts diffing
 * output files, so whitespace here is part of the contract.
 * </p>
 */
@Log4j2
public final class ClosureTableWriter {
    public static final String OUTPUT_FILE_PREFIX = "out-";
    static final String TABLE_HEADER = "R* Table";
    static final String PAIR_SEPARATOR = " -> ";

    private final PrintStream out;

    public ClosureTableWriter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    /**
     * Prints the matrix as read, each cell followed by a space, then a blank line.
     */
    public void printNeighborTable(AdjacencyMatrix matrix) {
        StringBuilder sb = new StringBuilder("Neighbor table\n");
        for (int i = 0; i < matrix.size(); i++) {
            for (int j = 0; j < matrix.size(); j++) {
                sb.append(matrix.get(i, j)).append(' ');
            }
            sb.append('\n');
        }
        sb.append('\n');
        out.print(sb);
    }

    /**
     * Prints the R* table to the console stream.
     */
    public void printClosure(TransitiveClosure closure) {
        out.print("\n" + TABLE_HEADER + "\n" + formatPairs(closure.edges()) + "\n");
    }

    /**
     * Prints the outcome of one path query.
     */
    public void printPath(PathResult result) {
        switch (result.getStatus()) {
            case FOUND:
                out.print("Yes path exists!\n" + result.render() + "\n");
                break;
            case DEAD_END:
                out.print("Yes path exists!\n"
                        + "Greedy walk stalled at " + result.lastNode() + ": " + result.render() + "\n");
                break;
            default:
                out.print("No Path Exists!\n");
                break;
        }
    }

    /**
     * Writes the R* table to {@code out-<input file name>} next to the input file.
     *
     * @param inputFile matrix file the closure was computed from.
     * @return path of the written file.
     * @throws IOException if the file cannot be written.
     */
    public Path writeClosure(TransitiveClosure closure, Path inputFile) throws IOException {
        Objects.requireNonNull(inputFile, "inputFile");
        Path outputFile = outputFileFor(inputFile);
        try (BufferedWriter writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
            writer.write(TABLE_HEADER + "\n" + formatPairs(closure.edges()) + "\n\n");
        }
        out.print("Saving " + outputFile.getFileName() + "...\n");
        log.info("Wrote {} closure edges to {}", closure.size(), outputFile);
        return outputFile;
    }

    /**
     * Resolves {@code out-<name>} as a sibling of the input file.
     */
    public static Path outputFileFor(Path inputFile) {
        Path fileName = inputFile.getFileName();
        if (fileName == null) {
            throw new IllegalArgumentException("input path has no file name: " + inputFile);
        }
        return inputFile.resolveSibling(OUTPUT_FILE_PREFIX + fileName);
    }

    /**
     * Formats pairs as {@code "u -> v"} lines joined by newlines, without a trailing newline.
     */
    static String formatPairs(EdgeList edges) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < edges.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(edges.source(i)).append(PAIR_SEPARATOR).append(edges.destination(i));
        }
        return sb.toString();
    }
}
