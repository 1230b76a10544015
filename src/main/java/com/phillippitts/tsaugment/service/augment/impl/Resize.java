package com.phillippitts.tsaugment.service.augment.impl;

import com.phillippitts.tsaugment.service.augment.AbstractAugmenter;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Resamples a series to {@code size} points by nearest-lower index, without interpolation:
 * {@code out[i] = x[floor(i * length / size)]}.
 */
public final class Resize extends AbstractAugmenter {

    private final int size;

    public Resize(int size) {
        super("Resize");
        requireAtLeast("size", size, 1);
        this.size = size;
    }

    @Override
    protected double[] transform(double[] sample, RandomGenerator random) {
        if (sample.length == 0) {
            return new double[0];
        }
        double ratio = sample.length / (double) size;
        double[] out = new double[size];
        for (int i = 0; i < size; i++) {
            out[i] = sample[Math.min((int) (i * ratio), sample.length - 1)];
        }
        return out;
    }
}
