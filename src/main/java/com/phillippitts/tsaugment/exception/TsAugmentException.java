package com.phillippitts.tsaugment.exception;

/**
 * Base exception for all tsaugment engine errors.
 * All domain exceptions should extend this class so callers can handle engine failures in one place.
 */
public class TsAugmentException extends RuntimeException {

    public TsAugmentException(String message) {
        super(message);
    }

    public TsAugmentException(String message, Throwable cause) {
        super(message, cause);
    }

    public TsAugmentException(Throwable cause) {
        super(cause);
    }
}
