package com.phillippitts.tsaugment.service.augment.impl;

import com.phillippitts.tsaugment.service.augment.AbstractAugmenter;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Reverses the time axis.
 */
public final class Reverse extends AbstractAugmenter {

    public Reverse() {
        super("Reverse");
    }

    @Override
    protected double[] transform(double[] sample, RandomGenerator random) {
        int n = sample.length;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = sample[n - 1 - i];
        }
        return out;
    }
}
