package com.phillippitts.tsaugment.exception;

/**
 * Thrown when dynamic time warping is asked to align a zero-length sequence.
 */
public class EmptySequenceException extends TsAugmentException {

    public EmptySequenceException(String message) {
        super(message);
    }
}
