package com.phillippitts.tsaugment.exception;

/**
 * Thrown when an augmenter is configured with invalid or incompatible parameters.
 * Covers unknown augmenter names, unknown enumeration values, missing or malformed
 * parameters and out-of-range probabilities.
 */
public class ConfigurationException extends TsAugmentException {

    private final String augmenterName;
    private final String parameter;

    public ConfigurationException(String message) {
        super(message);
        this.augmenterName = "unknown";
        this.parameter = null;
    }

    public ConfigurationException(String message, String augmenterName) {
        super(message + " (augmenter: " + augmenterName + ")");
        this.augmenterName = augmenterName;
        this.parameter = null;
    }

    public ConfigurationException(String message, String augmenterName, String parameter) {
        super(message + " (augmenter: " + augmenterName + ", parameter: " + parameter + ")");
        this.augmenterName = augmenterName;
        this.parameter = parameter;
    }

    public ConfigurationException(String message, String augmenterName, String parameter, Throwable cause) {
        super(message + " (augmenter: " + augmenterName + ", parameter: " + parameter + ")", cause);
        this.augmenterName = augmenterName;
        this.parameter = parameter;
    }

    public ConfigurationException(String message, String augmenterName, Throwable cause) {
        super(message + " (augmenter: " + augmenterName + ")", cause);
        this.augmenterName = augmenterName;
        this.parameter = null;
    }

    public String getAugmenterName() {
        return augmenterName;
    }

    /** Name of the offending parameter, or null when the error is not tied to one. */
    public String getParameter() {
        return parameter;
    }
}
