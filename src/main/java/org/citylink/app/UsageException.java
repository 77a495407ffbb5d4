package org.citylink.app;

import lombok.experimental.StandardException;

/**
 * Thrown when the command line cannot be turned into {@link CliOptions}.
 */
@StandardException
public class UsageException extends RuntimeException {
}
