package com.phillippitts.tsaugment.domain;

/**
 * One step of a DTW alignment: index {@code i} of the first sequence is matched with index
 * {@code j} of the second.
 */
public record AlignedPair(int i, int j) {

    public AlignedPair {
        if (i < 0 || j < 0) {
            throw new IllegalArgumentException("Alignment indices must be non-negative, got (" + i + ", " + j + ")");
        }
    }
}
