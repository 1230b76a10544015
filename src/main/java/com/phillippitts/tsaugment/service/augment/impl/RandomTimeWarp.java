package com.phillippitts.tsaugment.service.augment.impl;

import com.phillippitts.tsaugment.exception.ConfigurationExceptionBuilder;
import com.phillippitts.tsaugment.service.augment.AbstractAugmenter;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Changes the playback speed inside a random window.
 *
 * <p>For every series a window of {@code windowSize} points is picked at random (the whole series
 * when {@code windowSize} is 0 or not smaller than the series) and a speed ratio {@code r} is drawn
 * from {@code [low, high]}. Point {@code i} of the window is replaced by the window read at position
 * {@code i * r}, linearly interpolated and held at the window's last point once the read position
 * runs past it. {@code r < 1} slows the window down, {@code r > 1} speeds it up; the length never
 * changes.
 */
public final class RandomTimeWarp extends AbstractAugmenter {

    private final int windowSize;
    private final double lowRatio;
    private final double highRatio;

    public RandomTimeWarp(int windowSize, double lowRatio, double highRatio) {
        super("RandomTimeWarp");
        requireAtLeast("windowSize", windowSize, 0);
        requireRange("speedRatioRange", lowRatio, highRatio);
        if (lowRatio <= 0.0) {
            throw ConfigurationExceptionBuilder.create("speed ratios must be positive")
                    .augmenter(getName())
                    .parameter("speedRatioRange")
                    .metadata("low", lowRatio)
                    .build();
        }
        this.windowSize = windowSize;
        this.lowRatio = lowRatio;
        this.highRatio = highRatio;
    }

    @Override
    protected double[] transform(double[] sample, RandomGenerator random) {
        int len = sample.length;
        double[] out = sample.clone();
        if (len < 2) {
            return out;
        }
        int start = 0;
        int width = len;
        if (windowSize != 0 && windowSize < len) {
            width = windowSize;
            start = random.nextInt(len - windowSize + 1);
        }
        double ratio = lowRatio + (highRatio - lowRatio) * random.nextDouble();
        int last = width - 1;
        for (int i = 0; i < width; i++) {
            double t = Math.min(i * ratio, last);
            int floor = (int) Math.floor(t);
            int ceil = Math.min(floor + 1, last);
            double frac = t - floor;
            out[start + i] = sample[start + floor] * (1.0 - frac) + sample[start + ceil] * frac;
        }
        return out;
    }
}
