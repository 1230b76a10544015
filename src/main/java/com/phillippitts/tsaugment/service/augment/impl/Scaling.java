package com.phillippitts.tsaugment.service.augment.impl;

import com.phillippitts.tsaugment.service.augment.AbstractAugmenter;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Multiplies a series by one factor drawn from {@code U[min, max)}; {@code min == max} scales by
 * exactly that factor.
 */
public final class Scaling extends AbstractAugmenter {

    private final double min;
    private final double max;

    public Scaling(double min, double max) {
        super("Scaling");
        requireRange("factor", min, max);
        this.min = min;
        this.max = max;
    }

    @Override
    protected double[] transform(double[] sample, RandomGenerator random) {
        double factor = min + (max - min) * random.nextDouble();
        double[] out = new double[sample.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = sample[i] * factor;
        }
        return out;
    }
}
