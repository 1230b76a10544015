package com.phillippitts.tsaugment.service.augment;

import com.phillippitts.tsaugment.exception.ConfigurationException;

import java.util.Arrays;

/**
 * Smoothing kernels for {@link com.phillippitts.tsaugment.service.augment.impl.Convolve}.
 */
public enum ConvolveWindow {
    /** Moving average. */
    FLAT,
    /** Normalized Gaussian bell centered on the kernel. */
    GAUSSIAN;

    /**
     * @throws ConfigurationException if the value names no window
     */
    public static ConvolveWindow fromString(String value) {
        switch (ConfigNames.normalize(value)) {
            case "flat":
            case "box":
                return FLAT;
            case "gaussian":
                return GAUSSIAN;
            default:
                throw new ConfigurationException("Unknown convolution window: " + value, "Convolve", "window");
        }
    }

    /**
     * Builds a kernel of {@code size} taps whose weights sum to 1.
     */
    public double[] kernel(int size) {
        double[] weights = new double[size];
        if (this == FLAT) {
            Arrays.fill(weights, 1.0 / size);
            return weights;
        }
        double sigma = 0.3 * (size - 1) * 0.5 + 0.8;
        double center = (size - 1) / 2.0;
        double sum = 0.0;
        for (int i = 0; i < size; i++) {
            double d = i - center;
            weights[i] = Math.exp(-(d * d) / (2 * sigma * sigma));
            sum += weights[i];
        }
        for (int i = 0; i < size; i++) {
            weights[i] /= sum;
        }
        return weights;
    }
}
