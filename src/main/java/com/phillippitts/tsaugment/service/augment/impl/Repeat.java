package com.phillippitts.tsaugment.service.augment.impl;

import com.phillippitts.tsaugment.domain.Dataset;
import com.phillippitts.tsaugment.exception.ConfigurationException;
import com.phillippitts.tsaugment.service.augment.AbstractAugmenter;
import com.phillippitts.tsaugment.service.augment.BatchExecution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Appends {@code times - 1} copies of the whole dataset to itself, in block order:
 * rows {@code [f0, f1]} with labels {@code [a, b]} and {@code times = 2} become
 * {@code [f0, f1, f0, f1]} / {@code [a, b, a, b]}.
 *
 * <p>Only meaningful on a whole batch. A single series is returned unchanged, and the augmenter
 * cannot be gated per row.
 */
public final class Repeat extends AbstractAugmenter {

    private static final Logger LOG = LogManager.getLogger(Repeat.class);

    private final int times;

    public Repeat(int times) {
        super("Repeat");
        requireAtLeast("times", times, 1);
        this.times = times;
    }

    public int getTimes() {
        return times;
    }

    @Override
    protected double[] transform(double[] sample, RandomGenerator random) {
        return sample.clone();
    }

    @Override
    public void augmentBatch(Dataset dataset, BatchExecution execution) {
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(execution, "execution");
        if (execution.isGated()) {
            throw new ConfigurationException("Repeat changes the row count and cannot be applied conditionally",
                    getName());
        }
        int rows = dataset.rowCount();
        int total;
        try {
            total = Math.multiplyExact(rows, times);
        } catch (ArithmeticException e) {
            throw new ConfigurationException("Repeating " + rows + " rows " + times
                    + " times exceeds the maximum row count", getName(), "times", e);
        }
        double[][] features = new double[total][];
        List<String> labels = new ArrayList<>(total);
        for (int t = 0; t < times; t++) {
            for (int r = 0; r < rows; r++) {
                features[t * rows + r] = dataset.getRow(r).clone();
                labels.add(dataset.getLabels().get(r));
            }
        }
        LOG.debug("Repeat: {} rows -> {} rows", rows, features.length);
        dataset.replaceContents(features, labels);
    }

    @Override
    public boolean supportsPerSamplePipelining() {
        return false;
    }

    @Override
    public boolean preservesRowCount() {
        return false;
    }
}
