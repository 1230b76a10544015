package com.phillippitts.tsaugment.service.augment;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Derives independent random generators for rows of a batch.
 *
 * <p>A row's generator depends only on the batch seed and the row index, never on which worker
 * runs it or when.
 */
public final class RowRandom {

    private RowRandom() {}

    /**
     * Returns a new generator for row {@code row} of a batch seeded with {@code batchSeed}.
     */
    public static RandomGenerator forRow(long batchSeed, int row) {
        return new Well19937c(mix(batchSeed, row));
    }

    /**
     * Returns a new generator seeded from the current thread's random source.
     */
    public static RandomGenerator fresh() {
        return new Well19937c(newSeed());
    }

    /**
     * Draws a new batch seed.
     */
    public static long newSeed() {
        return ThreadLocalRandom.current().nextLong();
    }

    /**
     * Combines a seed with a salt (row or stage index) using the SplitMix64 finalizer.
     */
    public static long mix(long seed, long salt) {
        long z = seed + (salt + 1) * 0x9E3779B97F4A7C15L;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
