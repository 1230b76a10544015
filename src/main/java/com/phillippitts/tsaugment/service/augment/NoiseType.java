package com.phillippitts.tsaugment.service.augment;

import com.phillippitts.tsaugment.exception.ConfigurationException;

/**
 * Noise distributions supported by {@link com.phillippitts.tsaugment.service.augment.impl.AddNoise}.
 */
public enum NoiseType {
    /** Uniform noise drawn from {@code [low, high)}. */
    UNIFORM,
    /** Gaussian noise with configured mean and standard deviation. */
    GAUSSIAN,
    /** A single spike at a random position, scaled by the row's standard deviation. */
    SPIKE,
    /** Linear trend of a random slope drawn from {@code [low, high)}. */
    SLOPE;

    /**
     * Parses a configuration value such as {@code "Gaussian"} or {@code "uniform"}.
     *
     * @throws ConfigurationException if the value names no noise type
     */
    public static NoiseType fromString(String value) {
        switch (ConfigNames.normalize(value)) {
            case "uniform":
                return UNIFORM;
            case "gaussian":
            case "normal":
                return GAUSSIAN;
            case "spike":
                return SPIKE;
            case "slope":
                return SLOPE;
            default:
                throw new ConfigurationException("Unknown noise type: " + value, "AddNoise", "noiseType");
        }
    }
}
