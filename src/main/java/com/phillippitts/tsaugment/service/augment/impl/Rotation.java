package com.phillippitts.tsaugment.service.augment.impl;

import com.phillippitts.tsaugment.service.augment.AbstractAugmenter;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Mirrors every value around {@code anchor} (a 180 degree rotation of the series).
 */
public final class Rotation extends AbstractAugmenter {

    private final double anchor;

    public Rotation(double anchor) {
        super("Rotation");
        requireFinite("anchor", anchor);
        this.anchor = anchor;
    }

    @Override
    protected double[] transform(double[] sample, RandomGenerator random) {
        double[] out = new double[sample.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = (sample[i] - anchor) * -1.0 + anchor;
        }
        return out;
    }
}
