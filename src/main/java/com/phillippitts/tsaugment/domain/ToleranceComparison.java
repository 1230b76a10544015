package com.phillippitts.tsaugment.domain;

/**
 * Result of comparing two datasets element-wise.
 *
 * @param maxAbsDifference     largest absolute difference over all elements of all rows
 * @param allWithinTolerance   true when {@code maxAbsDifference <= tolerance}
 */
public record ToleranceComparison(double maxAbsDifference, boolean allWithinTolerance) {
}
