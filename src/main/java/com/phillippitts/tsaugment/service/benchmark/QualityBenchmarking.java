package com.phillippitts.tsaugment.service.benchmark;

import com.phillippitts.tsaugment.domain.AlignedPair;
import com.phillippitts.tsaugment.domain.Dataset;
import com.phillippitts.tsaugment.domain.DtwResult;
import com.phillippitts.tsaugment.exception.EmptySequenceException;
import com.phillippitts.tsaugment.exception.NonFiniteValueException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Similarity measures for comparing original and augmented series.
 *
 * <p><b>DTW contract:</b>
 * <ul>
 *   <li>local cost is the absolute difference {@code |a[i] - b[j]|}</li>
 *   <li>the distance is the accumulated cost along the optimal path, not normalized</li>
 *   <li>on equal costs the backtrack prefers the diagonal move, then {@code (i-1, j)},
 *       then {@code (i, j-1)}</li>
 *   <li>the path runs from {@code (0, 0)} to {@code (|a|-1, |b|-1)}</li>
 * </ul>
 */
public final class QualityBenchmarking {

    private QualityBenchmarking() {}

    /**
     * Aligns {@code a} and {@code b} with dynamic time warping.
     *
     * @throws EmptySequenceException if either sequence is empty
     * @throws NonFiniteValueException if either sequence contains NaN or an infinity
     */
    public static DtwResult computeDtw(double[] a, double[] b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a.length == 0 || b.length == 0) {
            throw new EmptySequenceException("DTW needs two non-empty sequences, got lengths "
                    + a.length + " and " + b.length);
        }
        requireFinite(a, "a");
        requireFinite(b, "b");
        int n = a.length;
        int m = b.length;
        double[][] cost = new double[n + 1][m + 1];
        for (double[] row : cost) {
            Arrays.fill(row, Double.POSITIVE_INFINITY);
        }
        cost[0][0] = 0.0;
        for (int i = 1; i <= n; i++) {
            for (int j = 1; j <= m; j++) {
                double local = Math.abs(a[i - 1] - b[j - 1]);
                cost[i][j] = local + Math.min(cost[i - 1][j - 1], Math.min(cost[i - 1][j], cost[i][j - 1]));
            }
        }

        List<AlignedPair> path = new ArrayList<>(n + m);
        int i = n;
        int j = m;
        while (i > 0 && j > 0) {
            path.add(new AlignedPair(i - 1, j - 1));
            if (i == 1 && j == 1) {
                break;
            }
            double diagonal = cost[i - 1][j - 1];
            double up = cost[i - 1][j];
            double left = cost[i][j - 1];
            if (diagonal <= up && diagonal <= left) {
                i--;
                j--;
            } else if (up <= left) {
                i--;
            } else {
                j--;
            }
        }
        Collections.reverse(path);
        return new DtwResult(cost[n][m], path);
    }

    private static void requireFinite(double[] sequence, String name) {
        for (int i = 0; i < sequence.length; i++) {
            if (!Double.isFinite(sequence[i])) {
                throw new NonFiniteValueException("DTW input " + name + " has non-finite value "
                        + sequence[i] + " at index " + i, i);
            }
        }
    }

    /**
     * Symmetric matrix of DTW distances between every pair of rows; the diagonal is zero.
     */
    public static double[][] pairwiseDtw(Dataset dataset) {
        Objects.requireNonNull(dataset, "dataset");
        int n = dataset.rowCount();
        double[][] distances = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = computeDtw(dataset.getRow(i), dataset.getRow(j)).distance();
                distances[i][j] = d;
                distances[j][i] = d;
            }
        }
        return distances;
    }
}
