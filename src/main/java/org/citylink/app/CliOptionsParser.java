package org.citylink.app;

import lombok.experimental.UtilityClass;
import org.citylink.search.PathStrategy;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * getopt-style parser for {@code -i <file> [-r <source>,<destination>] [-p] [-o] [-b]}.
 * <p>
 * Flags may be clustered ({@code -opr 0,1}) and option arguments may be attached
 * ({@code -icities.txt}, {@code -r0,1}). An option that takes an argument consumes
 * the next word verbatim, even when it starts with {@code -}.
 * </p>
 */
@UtilityClass
public class CliOptionsParser {
    public static final String USAGE =
            "Usage: <executable> -i <inputfile> [-r <source>,<destination> -p -o -b]";

    /**
     * Parses the command line.
     *
     * @throws UsageException on any malformed or incomplete command line.
     */
    public static CliOptions parse(String[] args) {
        if (args == null || args.length == 0) {
            throw new UsageException("No command line arguments given!");
        }

        String inputFile = null;
        String route = null;
        boolean print = false;
        boolean write = false;
        PathStrategy strategy = PathStrategy.GREEDY;

        int i = 0;
        while (i < args.length) {
            String arg = args[i];
            if ("--".equals(arg)) {
                i++;
                break;
            }
            if (arg.length() < 2 || arg.charAt(0) != '-') {
                throw new UsageException("Non-option argument " + arg);
            }
            for (int pos = 1; pos < arg.length(); pos++) {
                char option = arg.charAt(pos);
                switch (option) {
                    case 'p':
                        print = true;
                        break;
                    case 'o':
                        write = true;
                        break;
                    case 'b':
                        strategy = PathStrategy.BREADTH_FIRST;
                        break;
                    case 'i':
                    case 'r':
                        String value;
                        if (pos + 1 < arg.length()) {
                            value = arg.substring(pos + 1);
                        } else if (i + 1 < args.length) {
                            value = args[++i];
                        } else {
                            throw new UsageException("option requires an argument -- '" + option + "'");
                        }
                        if (option == 'i') {
                            inputFile = value;
                        } else {
                            route = value;
                        }
                        pos = arg.length();
                        break;
                    default:
                        throw new UsageException("invalid option -- '" + option + "'");
                }
            }
            i++;
        }
        if (i < args.length) {
            throw new UsageException("Non-option argument " + args[i]);
        }
        if (inputFile == null) {
            throw new UsageException("No input file given!");
        }

        Path input;
        try {
            input = Paths.get(inputFile);
        } catch (InvalidPathException ex) {
            throw new UsageException("invalid input file '" + inputFile + "'", ex);
        }
        return CliOptions.builder()
                .inputFile(input)
                .route(route == null ? null : CliOptions.RouteQuery.parse(route))
                .printClosure(print)
                .writeClosure(write)
                .pathStrategy(strategy)
                .build();
    }
}
