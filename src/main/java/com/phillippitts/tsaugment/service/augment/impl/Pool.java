package com.phillippitts.tsaugment.service.augment.impl;

import com.phillippitts.tsaugment.service.augment.AbstractAugmenter;
import com.phillippitts.tsaugment.service.augment.PoolingMethod;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.Arrays;
import java.util.Objects;

/**
 * Replaces every block of {@code size} points with the block's max, min or average. The last
 * block may be shorter. Series length is unchanged.
 */
public final class Pool extends AbstractAugmenter {

    private final PoolingMethod kind;
    private final int size;

    public Pool(PoolingMethod kind, int size) {
        super("Pool");
        this.kind = Objects.requireNonNull(kind, "kind");
        requireAtLeast("size", size, 1);
        this.size = size;
    }

    @Override
    protected double[] transform(double[] sample, RandomGenerator random) {
        double[] out = new double[sample.length];
        for (int from = 0; from < sample.length; from += size) {
            int to = Math.min(from + size, sample.length);
            Arrays.fill(out, from, to, kind.reduce(sample, from, to));
        }
        return out;
    }
}
