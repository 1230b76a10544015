package com.phillippitts.tsaugment.service.augment.impl;

import com.phillippitts.tsaugment.domain.Dataset;
import com.phillippitts.tsaugment.service.augment.AbstractAugmenter;
import com.phillippitts.tsaugment.service.augment.BatchExecution;
import com.phillippitts.tsaugment.service.augment.ConvolveWindow;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.Objects;

/**
 * Smooths a series by convolving it with a flat or Gaussian kernel.
 *
 * <p>The output keeps the input length; samples outside the series count as zero. A kernel
 * longer than the series is clamped to the series length.
 */
public final class Convolve extends AbstractAugmenter {

    private final ConvolveWindow window;
    private final int size;

    public Convolve(ConvolveWindow window, int size) {
        super("Convolve");
        this.window = Objects.requireNonNull(window, "window");
        requireAtLeast("size", size, 1);
        this.size = size;
    }

    public ConvolveWindow getWindow() {
        return window;
    }

    public int getSize() {
        return size;
    }

    @Override
    protected double[] transform(double[] sample, RandomGenerator random) {
        return convolve(sample, kernelFor(sample.length));
    }

    @Override
    public void augmentBatch(Dataset dataset, BatchExecution execution) {
        Objects.requireNonNull(dataset, "dataset");
        // rows share one length, so one kernel serves the whole batch
        double[] kernel = kernelFor(dataset.rowLength());
        applyRowwise(dataset, execution, (index, row, random) -> convolve(row, kernel));
    }

    private double[] kernelFor(int length) {
        return window.kernel(Math.max(1, Math.min(size, length)));
    }

    static double[] convolve(double[] x, double[] kernel) {
        int len = x.length;
        int half = kernel.length / 2;
        double[] out = new double[len];
        for (int i = 0; i < len; i++) {
            double acc = 0.0;
            for (int k = 0; k < kernel.length; k++) {
                int idx = i + k - half;
                if (idx >= 0 && idx < len) {
                    acc += x[idx] * kernel[k];
                }
            }
            out[i] = acc;
        }
        return out;
    }
}
