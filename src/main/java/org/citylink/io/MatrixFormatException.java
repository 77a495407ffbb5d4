package org.citylink.io;

import lombok.experimental.StandardException;

/**
 * Thrown when matrix input text does not describe a square 0/1 matrix.
 */
@StandardException
public class MatrixFormatException extends RuntimeException {
}
