package org.citylink.io;

import lombok.extern.log4j.Log4j2;
import org.citylink.graph.AdjacencyMatrix;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Parses the neighbor-table text format.
 * <p>
 * The first token is the dimension N, followed by N rows of N whitespace-separated
 * 0/1 values. Line breaks are not significant; any whitespace separates tokens.
 * </p>
 */
@Log4j2
public final class AdjacencyMatrixReader {

    /**
     * Reads a matrix from a UTF-8 file.
     *
     * @throws IOException if the file cannot be opened or read.
     * @throws MatrixFormatException if the content is malformed.
     */
    public AdjacencyMatrix read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            AdjacencyMatrix matrix = read(reader);
            log.info("Loaded {}x{} neighbor table with {} edges from {}",
                    matrix.size(), matrix.size(), matrix.edgeCount(), file);
            return matrix;
        }
    }

    /**
     * Reads a matrix from an open character stream. The stream is not closed.
     */
    public AdjacencyMatrix read(Reader reader) throws IOException {
        Objects.requireNonNull(reader, "reader");
        String[] tokens = tokenize(reader);
        if (tokens.length == 0) {
            throw new MatrixFormatException("input is empty; expected matrix dimension");
        }

        int n = parseDimension(tokens[0]);
        long expectedCells = (long) n * n;
        long foundCells = tokens.length - 1L;
        if (foundCells < expectedCells) {
            throw new MatrixFormatException(
                    "expected " + expectedCells + " cells for a " + n + "x" + n + " matrix, found " + foundCells
            );
        }
        if (foundCells > expectedCells) {
            throw new MatrixFormatException(
                    "unexpected trailing content after " + expectedCells + " cells: '" + tokens[(int) expectedCells + 1] + "'"
            );
        }

        int[][] rows = new int[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                String token = tokens[1 + i * n + j];
                if ("0".equals(token)) {
                    rows[i][j] = 0;
                } else if ("1".equals(token)) {
                    rows[i][j] = 1;
                } else {
                    throw new MatrixFormatException(
                            "cell (" + i + "," + j + ") must be 0 or 1, found '" + token + "'"
                    );
                }
            }
        }
        return AdjacencyMatrix.of(rows);
    }

    private static String[] tokenize(Reader reader) throws IOException {
        StringBuilder content = new StringBuilder();
        char[] buffer = new char[4096];
        int read;
        while ((read = reader.read(buffer)) != -1) {
            content.append(buffer, 0, read);
        }
        String trimmed = content.toString().strip();
        if (trimmed.isEmpty()) {
            return new String[0];
        }
        return trimmed.split("\\s+");
    }

    private static int parseDimension(String token) {
        int n;
        try {
            n = Integer.parseInt(token);
        } catch (NumberFormatException ex) {
            throw new MatrixFormatException("matrix dimension must be an integer, found '" + token + "'", ex);
        }
        if (n < 0) {
            throw new MatrixFormatException("matrix dimension must be non-negative, found " + n);
        }
        return n;
    }
}
