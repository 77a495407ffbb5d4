package org.citylink.app;

import lombok.extern.log4j.Log4j2;
import org.citylink.closure.ClosureBudget;
import org.citylink.closure.TransitiveClosure;
import org.citylink.core.ReachabilityCore;
import org.citylink.core.ReachabilityException;
import org.citylink.graph.AdjacencyMatrix;
import org.citylink.io.AdjacencyMatrixReader;
import org.citylink.io.MatrixFormatException;
import org.citylink.report.ClosureTableWriter;
import org.citylink.search.PathResult;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;

/**
 * One command-line run: read the neighbor table, compute R*, answer the optional
 * route query and report.
 *
 * <p>Exit codes: {@link #EXIT_OK}, {@link #EXIT_FAILURE} for input, closure or
 * output failures, {@link #EXIT_USAGE} for a malformed command line.</p>
 */
@Log4j2
public final class CityLinkApplication {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;
    private final AdjacencyMatrixReader matrixReader;
    private final ClosureBudget closureBudget;

    public CityLinkApplication(PrintStream out, PrintStream err) {
        this(out, err, new AdjacencyMatrixReader(), ClosureBudget.defaults());
    }

    CityLinkApplication(PrintStream out, PrintStream err,
                        AdjacencyMatrixReader matrixReader, ClosureBudget closureBudget) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.matrixReader = Objects.requireNonNull(matrixReader, "matrixReader");
        this.closureBudget = Objects.requireNonNull(closureBudget, "closureBudget");
    }

    /**
     * Parses {@code args} and executes the run.
     *
     * @return process exit code.
     */
    public int run(String[] args) {
        CliOptions options;
        try {
            options = CliOptionsParser.parse(args);
        } catch (UsageException ex) {
            err.println("citylink: " + ex.getMessage());
            err.println(CliOptionsParser.USAGE);
            return EXIT_USAGE;
        }
        return run(options);
    }

    /**
     * Executes a run for already-parsed options.
     */
    public int run(CliOptions options) {
        Objects.requireNonNull(options, "options");
        ClosureTableWriter writer = new ClosureTableWriter(out);

        AdjacencyMatrix matrix;
        try {
            matrix = matrixReader.read(options.getInputFile());
        } catch (IOException ex) {
            log.warn("Cannot read {}: {}", options.getInputFile(), ex.toString());
            log.debug("Read failure for {}", options.getInputFile(), ex);
            out.print("Input file can not be read!\n");
            return EXIT_FAILURE;
        } catch (MatrixFormatException ex) {
            err.println("citylink: malformed input file " + options.getInputFile() + ": " + ex.getMessage());
            return EXIT_FAILURE;
        }
        writer.printNeighborTable(matrix);

        ReachabilityCore core = ReachabilityCore.builder()
                .pathStrategy(options.getPathStrategy())
                .closureBudget(closureBudget)
                .build();

        TransitiveClosure closure;
        try {
            closure = core.computeClosure(matrix);
        } catch (ReachabilityException ex) {
            log.debug("Closure computation failed for {}", options.getInputFile(), ex);
            err.println("citylink: " + ex.getMessage());
            return EXIT_FAILURE;
        }

        if (options.isPrintClosure()) {
            writer.printClosure(closure);
        }

        int exitCode = EXIT_OK;
        if (options.hasRoute()) {
            CliOptions.RouteQuery route = options.getRoute();
            try {
                PathResult result = core.findPath(closure, route.getSource(), route.getDestination());
                writer.printPath(result);
            } catch (ReachabilityException ex) {
                err.println("citylink: " + ex.getMessage());
                exitCode = EXIT_FAILURE;
            }
        }

        if (options.isWriteClosure()) {
            try {
                writer.writeClosure(closure, options.getInputFile());
            } catch (IOException ex) {
                log.warn("Cannot write closure for {}: {}", options.getInputFile(), ex.toString());
                log.debug("Write failure for {}", options.getInputFile(), ex);
                out.print("Error opening file\n");
                return EXIT_FAILURE;
            }
        }
        return exitCode;
    }
}
