package com.phillippitts.tsaugment.service.transform;

import com.phillippitts.tsaugment.domain.Dataset;
import com.phillippitts.tsaugment.domain.ToleranceComparison;
import com.phillippitts.tsaugment.exception.ConfigurationException;
import com.phillippitts.tsaugment.exception.DimensionException;
import com.phillippitts.tsaugment.exception.ShapeMismatchException;
import com.phillippitts.tsaugment.service.augment.BatchExecution;
import com.phillippitts.tsaugment.service.augment.RowBatchRunner;

import java.util.Objects;

/**
 * Row-wise frequency and cosine domain transforms over a {@link Dataset}.
 *
 * <p>All functions are pure: they return a new dataset with the input's labels and never touch
 * the input. Rows are transformed independently, on a worker pool when the execution is parallel.
 *
 * <p><b>FFT layout:</b> a row of {@code n} samples becomes {@code 2n} values
 * {@code [re0, im0, re1, im1, ...]}; {@link #ifft(Dataset, BatchExecution)} expects that layout and
 * returns the real part, scaled by {@code 1/n}.
 *
 * <p><b>DCT:</b> unnormalised DCT-II forward, DCT-III scaled by {@code 2/n} inverse. Row length is
 * unchanged.
 *
 * <p>Results carry no domain tag; callers must not mix time-domain and transformed datasets.
 */
public final class SpectralTransforms {

    private SpectralTransforms() {}

    public static Dataset fft(Dataset dataset, boolean parallel) {
        return fft(dataset, BatchExecution.of(parallel));
    }

    /**
     * Forward DFT of every row, interleaved real/imaginary output.
     */
    public static Dataset fft(Dataset dataset, BatchExecution execution) {
        Objects.requireNonNull(dataset, "dataset");
        double[][] rows = RowBatchRunner.mapRowsDeterministic(dataset.getFeatures(), execution,
                FourierKernel::forwardInterleaved);
        return new Dataset(rows, dataset.getLabels());
    }

    public static Dataset ifft(Dataset dataset, boolean parallel) {
        return ifft(dataset, BatchExecution.of(parallel));
    }

    /**
     * Inverse DFT of every interleaved row.
     *
     * @throws DimensionException if the row length is odd
     */
    public static Dataset ifft(Dataset dataset, BatchExecution execution) {
        Objects.requireNonNull(dataset, "dataset");
        requireInterleaved(dataset.rowLength());
        double[][] rows = RowBatchRunner.mapRowsDeterministic(dataset.getFeatures(), execution,
                FourierKernel::inverseInterleaved);
        return new Dataset(rows, dataset.getLabels());
    }

    public static Dataset dct(Dataset dataset, boolean parallel) {
        return dct(dataset, BatchExecution.of(parallel));
    }

    /**
     * DCT-II of every row.
     */
    public static Dataset dct(Dataset dataset, BatchExecution execution) {
        Objects.requireNonNull(dataset, "dataset");
        double[][] rows = RowBatchRunner.mapRowsDeterministic(dataset.getFeatures(), execution,
                CosineKernel::forward);
        return new Dataset(rows, dataset.getLabels());
    }

    public static Dataset idct(Dataset dataset, boolean parallel) {
        return idct(dataset, BatchExecution.of(parallel));
    }

    /**
     * Scaled DCT-III of every row, the inverse of {@link #dct(Dataset, BatchExecution)}.
     */
    public static Dataset idct(Dataset dataset, BatchExecution execution) {
        Objects.requireNonNull(dataset, "dataset");
        double[][] rows = RowBatchRunner.mapRowsDeterministic(dataset.getFeatures(), execution,
                CosineKernel::inverse);
        return new Dataset(rows, dataset.getLabels());
    }

    /**
     * Forward DFT of a single series, interleaved layout.
     */
    public static double[] fftRow(double[] row) {
        return FourierKernel.forwardInterleaved(Objects.requireNonNull(row, "row"));
    }

    /**
     * Inverse DFT of a single interleaved series.
     *
     * @throws DimensionException if the length is odd
     */
    public static double[] ifftRow(double[] interleaved) {
        Objects.requireNonNull(interleaved, "interleaved");
        requireInterleaved(interleaved.length);
        return FourierKernel.inverseInterleaved(interleaved);
    }

    /**
     * Computes the largest element-wise absolute difference between two datasets.
     *
     * @param tolerance non-negative bound
     * @return the maximum difference and whether it is within {@code tolerance}
     * @throws ShapeMismatchException if row counts or row lengths differ
     * @throws ConfigurationException if tolerance is negative or NaN
     */
    public static ToleranceComparison compareWithinTolerance(Dataset a, Dataset b, double tolerance) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (Double.isNaN(tolerance) || tolerance < 0.0) {
            throw new ConfigurationException("tolerance must be non-negative, got: " + tolerance);
        }
        if (a.rowCount() != b.rowCount()) {
            throw new ShapeMismatchException("Cannot compare datasets with " + a.rowCount()
                    + " and " + b.rowCount() + " rows");
        }
        if (a.rowLength() != b.rowLength()) {
            throw new ShapeMismatchException("Cannot compare rows of length " + a.rowLength()
                    + " and " + b.rowLength());
        }

        double maxDiff = 0.0;
        for (int r = 0; r < a.rowCount(); r++) {
            double[] left = a.getRow(r);
            double[] right = b.getRow(r);
            for (int i = 0; i < left.length; i++) {
                double diff = Math.abs(left[i] - right[i]);
                // NaN must not slip through as "within tolerance"
                if (diff > maxDiff || Double.isNaN(diff)) {
                    maxDiff = diff;
                }
            }
        }
        return new ToleranceComparison(maxDiff, maxDiff <= tolerance);
    }

    private static void requireInterleaved(int length) {
        if (length % 2 != 0) {
            throw new DimensionException("Interleaved spectrum rows must have even length", length + 1, length);
        }
    }
}
