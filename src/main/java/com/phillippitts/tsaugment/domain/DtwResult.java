package com.phillippitts.tsaugment.domain;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a dynamic time warping alignment.
 *
 * @param distance accumulated absolute-difference cost along the optimal path (never negative)
 * @param path     aligned index pairs from (0, 0) to (|a|-1, |b|-1), in order
 */
public record DtwResult(double distance, List<AlignedPair> path) {

    public DtwResult {
        if (distance < 0.0 || Double.isNaN(distance)) {
            throw new IllegalArgumentException("DTW distance must be non-negative, got: " + distance);
        }
        path = List.copyOf(Objects.requireNonNull(path, "path must not be null"));
    }

    /**
     * Distance divided by the length of the first sequence, the figure reported by the
     * qualitative benchmark scripts. The length is read off the last aligned pair.
     */
    public double normalizedDistance() {
        if (path.isEmpty()) {
            return distance;
        }
        return distance / (path.get(path.size() - 1).i() + 1);
    }
}
