package com.phillippitts.tsaugment.service.augment.impl;

import com.phillippitts.tsaugment.service.augment.AbstractAugmenter;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Adds a slowly varying random offset to a series.
 *
 * <p>{@code nDriftPoints + 1} anchors are spread evenly over the series, each drawn from
 * {@code U[-maxDrift, maxDrift]}; the offset between two anchors is linearly interpolated.
 * The anchor count is clamped to the series length.
 */
public final class Drift extends AbstractAugmenter {

    private final double maxDrift;
    private final int nDriftPoints;

    public Drift(double maxDrift, int nDriftPoints) {
        super("Drift");
        requireNonNegative("maxDrift", maxDrift);
        requireAtLeast("nDriftPoints", nDriftPoints, 1);
        this.maxDrift = maxDrift;
        this.nDriftPoints = nDriftPoints;
    }

    @Override
    protected double[] transform(double[] sample, RandomGenerator random) {
        int len = sample.length;
        double[] out = sample.clone();
        if (len < 2) {
            return out;
        }
        int segments = Math.min(nDriftPoints, len - 1);
        double[] anchors = new double[segments + 1];
        for (int a = 0; a <= segments; a++) {
            anchors[a] = (2.0 * random.nextDouble() - 1.0) * maxDrift;
        }
        double spacing = (len - 1) / (double) segments;
        for (int i = 0; i < len; i++) {
            double pos = i / spacing;
            int left = Math.min((int) Math.floor(pos), segments - 1);
            double frac = pos - left;
            out[i] += anchors[left] * (1.0 - frac) + anchors[left + 1] * frac;
        }
        return out;
    }
}
