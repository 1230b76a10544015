package com.phillippitts.tsaugment.exception;

/**
 * Thrown when a length-changing operation would leave rows of different lengths, or when
 * a row is too short for the operation and the augmenter does not clamp.
 */
public class DimensionException extends TsAugmentException {

    private final int expectedLength;
    private final int actualLength;

    public DimensionException(String message) {
        super(message);
        this.expectedLength = -1;
        this.actualLength = -1;
    }

    public DimensionException(String message, int expectedLength, int actualLength) {
        super(message + " (expected length " + expectedLength + ", got " + actualLength + ")");
        this.expectedLength = expectedLength;
        this.actualLength = actualLength;
    }

    public int getExpectedLength() {
        return expectedLength;
    }

    public int getActualLength() {
        return actualLength;
    }
}
