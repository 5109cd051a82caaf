/*
 *  InsufficientDataException
 */
package net.genomicbreeding.analysis.distance;

/**
 * Thrown when data are too sparse for a computation to produce any result.
 */
public class InsufficientDataException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public InsufficientDataException(String message) {
        super(message);
    }

}
