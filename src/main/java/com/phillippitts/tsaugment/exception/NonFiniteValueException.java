package com.phillippitts.tsaugment.exception;

/**
 * Thrown when a computation that needs finite input receives NaN or an infinity.
 */
public class NonFiniteValueException extends TsAugmentException {

    private final int index;

    public NonFiniteValueException(String message, int index) {
        super(message);
        this.index = index;
    }

    /** Position of the first offending value. */
    public int getIndex() {
        return index;
    }
}
