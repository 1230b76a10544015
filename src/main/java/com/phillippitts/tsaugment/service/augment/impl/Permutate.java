package com.phillippitts.tsaugment.service.augment.impl;

import com.phillippitts.tsaugment.service.augment.AbstractAugmenter;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Cuts the series into windows of {@code windowSize} points, cuts every window into segments of
 * {@code segmentSize} points and shuffles the segments inside each window. Trailing windows and
 * segments may be shorter. Values never leave their window.
 */
public final class Permutate extends AbstractAugmenter {

    private final int windowSize;
    private final int segmentSize;

    public Permutate(int windowSize, int segmentSize) {
        super("Permutate");
        requireAtLeast("windowSize", windowSize, 1);
        requireAtLeast("segmentSize", segmentSize, 1);
        this.windowSize = windowSize;
        this.segmentSize = segmentSize;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getSegmentSize() {
        return segmentSize;
    }

    @Override
    protected double[] transform(double[] sample, RandomGenerator random) {
        int n = sample.length;
        double[] out = new double[n];
        int write = 0;
        for (int windowStart = 0; windowStart < n; windowStart += windowSize) {
            int windowEnd = Math.min(windowStart + windowSize, n);
            int segments = (windowEnd - windowStart + segmentSize - 1) / segmentSize;
            int[] order = new int[segments];
            for (int s = 0; s < segments; s++) {
                order[s] = s;
            }
            // Fisher-Yates
            for (int s = segments - 1; s > 0; s--) {
                int j = random.nextInt(s + 1);
                int tmp = order[s];
                order[s] = order[j];
                order[j] = tmp;
            }
            for (int s : order) {
                int from = windowStart + s * segmentSize;
                int to = Math.min(from + segmentSize, windowEnd);
                System.arraycopy(sample, from, out, write, to - from);
                write += to - from;
            }
        }
        return out;
    }
}
