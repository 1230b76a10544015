package com.phillippitts.tsaugment.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing ConfigurationException with contextual information.
 *
 * <p>Augmenter constructors and the factory validate many numeric parameters; this builder keeps
 * their messages uniform.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw ConfigurationExceptionBuilder.create("size must be at least 1")
 *         .augmenter("Crop")
 *         .parameter("size")
 *         .metadata("value", size)
 *         .build();
 *
 * throw ConfigurationExceptionBuilder.create("Not a number")
 *         .augmenter("Jittering")
 *         .parameter("standardDeviation")
 *         .cause(numberFormatException)
 *         .build();
 * </pre>
 */
public final class ConfigurationExceptionBuilder {

    private final String message;
    private String augmenterName;
    private String parameter;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ConfigurationExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static ConfigurationExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ConfigurationExceptionBuilder(message);
    }

    /**
     * Sets the augmenter name for the exception.
     *
     * @param augmenterName augmenter name (e.g., "Crop", "AddNoise")
     * @return this builder for chaining
     */
    public ConfigurationExceptionBuilder augmenter(String augmenterName) {
        this.augmenterName = augmenterName;
        return this;
    }

    /**
     * Sets the offending parameter name.
     *
     * @param parameter parameter name (e.g., "size")
     * @return this builder for chaining
     */
    public ConfigurationExceptionBuilder parameter(String parameter) {
        this.parameter = parameter;
        return this;
    }

    /**
     * Sets the root cause of the exception.
     *
     * @param cause underlying exception
     * @return this builder for chaining
     */
    public ConfigurationExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public ConfigurationExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the ConfigurationException with the configured properties.
     *
     * <p>The final message format is:
     * <pre>
     * {message} ({key1}={val1}, ...) (augmenter: {name}, parameter: {parameter})
     * </pre>
     *
     * @return constructed ConfigurationException
     */
    public ConfigurationException build() {
        String detailedMessage = buildDetailedMessage();
        String augmenter = augmenterName != null ? augmenterName : "unknown";

        if (parameter != null) {
            return cause != null
                    ? new ConfigurationException(detailedMessage, augmenter, parameter, cause)
                    : new ConfigurationException(detailedMessage, augmenter, parameter);
        }
        return cause != null
                ? new ConfigurationException(detailedMessage, augmenter, cause)
                : new ConfigurationException(detailedMessage, augmenter);
    }

    private String buildDetailedMessage() {
        if (metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        return sb.append(")").toString();
    }
}
