package com.phillippitts.tsaugment.domain;

import com.phillippitts.tsaugment.exception.ShapeMismatchException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Labeled collection of equal-length univariate time series.
 *
 * <p>Rows of {@code features} and entries of {@code labels} are index-aligned. Two invariants
 * hold for every instance at all times:
 * <ul>
 *   <li>the number of feature rows equals the number of labels</li>
 *   <li>all feature rows share one length (the length may change as a whole, e.g. after a crop)</li>
 * </ul>
 *
 * <p>The dataset is mutable and exclusively owned by the caller. Augmenters borrow it for the
 * duration of one call and replace its contents atomically through
 * {@link #replaceFeatures(double[][])} and {@link #replaceContents(double[][], List)}.
 *
 * <p>Not thread-safe: callers must not touch a dataset while a batch call on it is in flight.
 */
public final class Dataset {

    private double[][] features;
    private List<String> labels;

    /**
     * Creates a dataset over the given arrays. The arrays are used as-is (no copy), so the caller
     * hands ownership of them to the dataset.
     *
     * @param features feature rows, all of equal length
     * @param labels one label per row
     * @throws ShapeMismatchException if counts differ or rows have different lengths
     * @throws NullPointerException if any argument, row or label is null
     */
    public Dataset(double[][] features, List<String> labels) {
        validate(features, labels);
        this.features = features;
        this.labels = new ArrayList<>(labels);
    }

    /**
     * Convenience factory mirroring the loader contract: a 2D array plus a label array.
     */
    public static Dataset of(double[][] features, String... labels) {
        return new Dataset(features, List.of(labels));
    }

    /** Returns the number of rows. */
    public int rowCount() {
        return features.length;
    }

    /** Returns the common row length, or 0 for a dataset without rows. */
    public int rowLength() {
        return features.length == 0 ? 0 : features[0].length;
    }

    /**
     * Returns the underlying feature matrix. Writes through the returned array are visible to the
     * dataset; callers that change row lengths must go through {@link #replaceFeatures(double[][])}.
     */
    public double[][] getFeatures() {
        return features;
    }

    /** Returns the row at {@code index} (live reference). */
    public double[] getRow(int index) {
        return features[index];
    }

    /** Returns a read-only view of the labels. */
    public List<String> getLabels() {
        return Collections.unmodifiableList(labels);
    }

    /**
     * Replaces the label of row {@code index}.
     *
     * @throws IndexOutOfBoundsException if there is no such row
     */
    public void setLabel(int index, String label) {
        labels.set(index, Objects.requireNonNull(label, "label must not be null"));
    }

    /**
     * Replaces all feature rows while keeping the labels.
     *
     * @throws ShapeMismatchException if the new row count differs from the label count or the
     *         new rows are not of equal length
     */
    public void replaceFeatures(double[][] newFeatures) {
        validate(newFeatures, labels);
        this.features = newFeatures;
    }

    /**
     * Replaces features and labels together, for operations that change the row count.
     *
     * @throws ShapeMismatchException if the new arrays are inconsistent with each other
     */
    public void replaceContents(double[][] newFeatures, List<String> newLabels) {
        validate(newFeatures, newLabels);
        this.features = newFeatures;
        this.labels = new ArrayList<>(newLabels);
    }

    /**
     * Copies the state of {@code other} into this dataset (deep copy).
     */
    public void replaceWith(Dataset other) {
        Dataset snapshot = other.copy();
        this.features = snapshot.features;
        this.labels = snapshot.labels;
    }

    /**
     * Returns an independent deep copy: no row array or label list is shared with this dataset.
     */
    public Dataset copy() {
        double[][] rows = new double[features.length][];
        for (int i = 0; i < features.length; i++) {
            rows[i] = features[i].clone();
        }
        return new Dataset(rows, labels);
    }

    private static void validate(double[][] features, List<String> labels) {
        Objects.requireNonNull(features, "features must not be null");
        Objects.requireNonNull(labels, "labels must not be null");
        if (features.length != labels.size()) {
            throw new ShapeMismatchException(features.length, labels.size());
        }
        int expected = -1;
        for (int i = 0; i < features.length; i++) {
            double[] row = Objects.requireNonNull(features[i], "feature row " + i + " must not be null");
            if (expected < 0) {
                expected = row.length;
            } else if (row.length != expected) {
                throw new ShapeMismatchException("Row " + i + " has length " + row.length
                        + " but row 0 has length " + expected);
            }
        }
        for (int i = 0; i < labels.size(); i++) {
            Objects.requireNonNull(labels.get(i), "label " + i + " must not be null");
        }
    }

    @Override
    public String toString() {
        return "Dataset[rows=" + rowCount() + ", length=" + rowLength() + "]";
    }
}
