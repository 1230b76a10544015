package com.phillippitts.tsaugment.service.augment.impl;

import com.phillippitts.tsaugment.service.augment.AbstractAugmenter;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.Arrays;

/**
 * Keeps a random contiguous window of {@code size} points.
 *
 * <p>A series no longer than {@code size} is returned whole, so a batch of equal-length rows always
 * ends at {@code min(size, length)}.
 */
public final class Crop extends AbstractAugmenter {

    private final int size;

    public Crop(int size) {
        super("Crop");
        requireAtLeast("size", size, 1);
        this.size = size;
    }

    public int getSize() {
        return size;
    }

    @Override
    protected double[] transform(double[] sample, RandomGenerator random) {
        int n = sample.length;
        if (size >= n) {
            return sample.clone();
        }
        int start = random.nextInt(n - size + 1);
        return Arrays.copyOfRange(sample, start, start + size);
    }
}
