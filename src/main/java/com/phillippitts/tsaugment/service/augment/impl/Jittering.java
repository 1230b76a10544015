package com.phillippitts.tsaugment.service.augment.impl;

import com.phillippitts.tsaugment.service.augment.AbstractAugmenter;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Adds zero-mean Gaussian noise to every point.
 */
public final class Jittering extends AbstractAugmenter {

    private final double standardDeviation;

    public Jittering(double standardDeviation) {
        super("Jittering");
        requireNonNegative("standardDeviation", standardDeviation);
        this.standardDeviation = standardDeviation;
    }

    @Override
    protected double[] transform(double[] sample, RandomGenerator random) {
        double[] out = new double[sample.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = sample[i] + standardDeviation * random.nextGaussian();
        }
        return out;
    }
}
