package org.citylink.app;

import lombok.Builder;
import lombok.Value;
import org.citylink.search.PathStrategy;

import java.nio.file.Path;

/**
 * Parsed command-line configuration for one run.
 *
 * <p>Consumed by the I/O collaborators only; the reachability core never sees it.</p>
 */
@Value
@Builder
public class CliOptions {
    /** Matrix file given with {@code -i}. */
    Path inputFile;
    /** Route requested with {@code -r}, or null when no query was asked for. */
    RouteQuery route;
    /** {@code -p}: print the R* table to the console. */
    boolean printClosure;
    /** {@code -o}: write the R* table to {@code out-<input file name>}. */
    boolean writeClosure;
    /** {@code -b} selects BREADTH_FIRST; GREEDY otherwise. */
    PathStrategy pathStrategy;

    public boolean hasRoute() {
        return route != null;
    }

    /**
     * One {@code <source>,<destination>} query.
     */
    @Value
    public static class RouteQuery {
        int source;
        int destination;

        /**
         * Parses {@code "<source>,<destination>"}; both parts must be non-negative integers.
         *
         * @throws UsageException if the text does not match that shape.
         */
        public static RouteQuery parse(String text) {
            String[] parts = text == null ? new String[0] : text.split(",", -1);
            if (parts.length != 2) {
                throw new UsageException("invalid route '" + text + "': expected <source>,<destination>");
            }
            return new RouteQuery(parseNode(parts[0], text), parseNode(parts[1], text));
        }

        private static int parseNode(String part, String text) {
            String trimmed = part.trim();
            int node;
            try {
                node = Integer.parseInt(trimmed);
            } catch (NumberFormatException ex) {
                throw new UsageException("invalid route '" + text + "': '" + trimmed + "' is not a node number", ex);
            }
            if (node < 0) {
                throw new UsageException("invalid route '" + text + "': node numbers must be non-negative");
            }
            return node;
        }
    }
}
