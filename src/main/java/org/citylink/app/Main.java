package org.citylink.app;

/**
 * Command-line entry point.
 *
 * <p>Example: {@code citylink -i cities1.txt -opr 0,1}</p>
 */
public class Main {
    /**
     * Runs CityLink and exits with a non-zero status on failure.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        int exitCode = new CityLinkApplication(System.out, System.err).run(args);
        if (exitCode != CityLinkApplication.EXIT_OK) {
            System.exit(exitCode);
        }
    }
}
