package com.phillippitts.tsaugment.service.augment;

import com.phillippitts.tsaugment.exception.ConfigurationException;

/**
 * Reduction applied to each pooling block by {@link com.phillippitts.tsaugment.service.augment.impl.Pool}.
 */
public enum PoolingMethod {
    MAX,
    MIN,
    AVERAGE;

    /**
     * @throws ConfigurationException if the value names no pooling method
     */
    public static PoolingMethod fromString(String value) {
        switch (ConfigNames.normalize(value)) {
            case "max":
                return MAX;
            case "min":
                return MIN;
            case "average":
            case "avg":
            case "mean":
                return AVERAGE;
            default:
                throw new ConfigurationException("Unknown pooling method: " + value, "Pool", "kind");
        }
    }

    /** Reduces {@code values[from, to)} to one value. */
    public double reduce(double[] values, int from, int to) {
        double acc = values[from];
        for (int i = from + 1; i < to; i++) {
            switch (this) {
                case MAX:
                    acc = Math.max(acc, values[i]);
                    break;
                case MIN:
                    acc = Math.min(acc, values[i]);
                    break;
                default:
                    acc += values[i];
                    break;
            }
        }
        return this == AVERAGE ? acc / (to - from) : acc;
    }
}
