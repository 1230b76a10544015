package com.phillippitts.tsaugment.service.augment.impl;

import com.phillippitts.tsaugment.service.augment.AbstractAugmenter;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Snaps each value to the nearest of {@code levels} evenly spaced levels
 * {@code min + l * (max - min) / levels}, {@code l = 0 .. levels-1}, computed per series.
 * Equidistant values go to the lower level.
 */
public final class Quantize extends AbstractAugmenter {

    private final int levels;

    public Quantize(int levels) {
        super("Quantize");
        requireAtLeast("levels", levels, 1);
        this.levels = levels;
    }

    @Override
    protected double[] transform(double[] sample, RandomGenerator random) {
        if (sample.length == 0) {
            return new double[0];
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : sample) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double step = (max - min) / levels;
        double[] out = new double[sample.length];
        for (int i = 0; i < sample.length; i++) {
            int best = 0;
            double bestDistance = Math.abs(min - sample[i]);
            for (int l = 1; l < levels; l++) {
                double distance = Math.abs(min + l * step - sample[i]);
                if (distance < bestDistance) {
                    best = l;
                    bestDistance = distance;
                }
            }
            out[i] = min + best * step;
        }
        return out;
    }
}
