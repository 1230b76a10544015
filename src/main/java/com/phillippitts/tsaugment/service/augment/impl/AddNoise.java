package com.phillippitts.tsaugment.service.augment.impl;

import com.phillippitts.tsaugment.service.augment.AbstractAugmenter;
import com.phillippitts.tsaugment.service.augment.NoiseType;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.Objects;

/**
 * Adds random noise of a configurable distribution to a series.
 *
 * <ul>
 *   <li>{@link NoiseType#UNIFORM}: every point gets {@code U[low, high)}</li>
 *   <li>{@link NoiseType#GAUSSIAN}: every point gets {@code N(mean, stdDev)}</li>
 *   <li>{@link NoiseType#SPIKE}: one random point is replaced by {@code U[low, high) * std(series)}</li>
 *   <li>{@link NoiseType#SLOPE}: point {@code i} gets {@code i * U[low, high)}</li>
 * </ul>
 */
public final class AddNoise extends AbstractAugmenter {

    private final NoiseType noiseType;
    private final double low;
    private final double high;
    private final double mean;
    private final double stdDev;

    /**
     * @param noiseType distribution kind
     * @param low       lower bound (uniform, spike, slope)
     * @param high      upper bound (uniform, spike, slope)
     * @param mean      mean (gaussian)
     * @param stdDev    standard deviation (gaussian)
     */
    public AddNoise(NoiseType noiseType, double low, double high, double mean, double stdDev) {
        super("AddNoise");
        this.noiseType = Objects.requireNonNull(noiseType, "noiseType");
        if (noiseType == NoiseType.GAUSSIAN) {
            requireFinite("mean", mean);
            requireNonNegative("stdDev", stdDev);
        } else {
            requireRange("bounds", low, high);
        }
        this.low = low;
        this.high = high;
        this.mean = mean;
        this.stdDev = stdDev;
    }

    public static AddNoise uniform(double low, double high) {
        return new AddNoise(NoiseType.UNIFORM, low, high, 0.0, 0.0);
    }

    public static AddNoise gaussian(double mean, double stdDev) {
        return new AddNoise(NoiseType.GAUSSIAN, 0.0, 0.0, mean, stdDev);
    }

    public static AddNoise spike(double low, double high) {
        return new AddNoise(NoiseType.SPIKE, low, high, 0.0, 0.0);
    }

    public static AddNoise slope(double low, double high) {
        return new AddNoise(NoiseType.SLOPE, low, high, 0.0, 0.0);
    }

    public NoiseType getNoiseType() {
        return noiseType;
    }

    @Override
    protected double[] transform(double[] sample, RandomGenerator random) {
        double[] out = sample.clone();
        if (out.length == 0) {
            return out;
        }
        switch (noiseType) {
            case UNIFORM:
                for (int i = 0; i < out.length; i++) {
                    out[i] += between(random);
                }
                break;
            case GAUSSIAN:
                for (int i = 0; i < out.length; i++) {
                    out[i] += mean + stdDev * random.nextGaussian();
                }
                break;
            case SPIKE:
                int index = random.nextInt(out.length);
                out[index] = between(random) * populationStd(sample);
                break;
            case SLOPE:
                double slope = between(random);
                for (int i = 0; i < out.length; i++) {
                    out[i] += i * slope;
                }
                break;
            default:
                throw new IllegalStateException("Unhandled noise type: " + noiseType);
        }
        return out;
    }

    private double between(RandomGenerator random) {
        return low + (high - low) * random.nextDouble();
    }

    private static double populationStd(double[] x) {
        double mean = 0.0;
        for (double v : x) {
            mean += v;
        }
        mean /= x.length;
        double sq = 0.0;
        for (double v : x) {
            sq += (v - mean) * (v - mean);
        }
        return Math.sqrt(sq / x.length);
    }
}
