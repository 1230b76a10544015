package com.phillippitts.tsaugment.exception;

/**
 * Thrown when the feature matrix and label vector disagree in size, or when rows of one
 * dataset do not share a common length.
 */
public class ShapeMismatchException extends TsAugmentException {

    private final int rowCount;
    private final int labelCount;

    public ShapeMismatchException(String message) {
        super(message);
        this.rowCount = -1;
        this.labelCount = -1;
    }

    public ShapeMismatchException(int rowCount, int labelCount) {
        super("Feature rows (" + rowCount + ") and labels (" + labelCount + ") must have the same count");
        this.rowCount = rowCount;
        this.labelCount = labelCount;
    }

    /** Row count observed when the mismatch was detected, or -1 for row-length mismatches. */
    public int getRowCount() {
        return rowCount;
    }

    /** Label count observed when the mismatch was detected, or -1 for row-length mismatches. */
    public int getLabelCount() {
        return labelCount;
    }
}
