package com.phillippitts.tsaugment.service.pipeline;

import com.phillippitts.tsaugment.domain.Dataset;
import com.phillippitts.tsaugment.exception.ConfigurationExceptionBuilder;
import com.phillippitts.tsaugment.service.augment.Augmenter;
import com.phillippitts.tsaugment.service.augment.BatchExecution;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.Objects;

/**
 * Applies a wrapped augmenter to each series with probability {@code p}.
 *
 * <p>Every row gets its own independent Bernoulli draw. With {@code p = 0} nothing changes, with
 * {@code p = 1} every row is augmented. Augmenters that change the row count cannot be gated and
 * are rejected.
 */
public final class ConditionalAugmenter implements Augmenter {

    private final Augmenter augmenter;
    private final double probability;

    public ConditionalAugmenter(Augmenter augmenter, double probability) {
        this.augmenter = Objects.requireNonNull(augmenter, "augmenter");
        if (Double.isNaN(probability) || probability < 0.0 || probability > 1.0) {
            throw ConfigurationExceptionBuilder.create("probability must be in [0, 1]")
                    .augmenter(augmenter.getName())
                    .parameter("probability")
                    .metadata("value", probability)
                    .build();
        }
        if (!augmenter.preservesRowCount()) {
            throw ConfigurationExceptionBuilder.create("cannot gate an augmenter that changes the row count")
                    .augmenter(augmenter.getName())
                    .parameter("probability")
                    .build();
        }
        this.probability = probability;
    }

    public Augmenter getAugmenter() {
        return augmenter;
    }

    public double getProbability() {
        return probability;
    }

    @Override
    public String getName() {
        return "Conditional(" + augmenter.getName() + ")";
    }

    @Override
    public double[] augmentOne(double[] sample, RandomGenerator random) {
        Objects.requireNonNull(sample, "sample");
        if (random.nextDouble() < probability) {
            return augmenter.augmentOne(sample, random);
        }
        return sample.clone();
    }

    @Override
    public void augmentBatch(Dataset dataset, BatchExecution execution) {
        Objects.requireNonNull(execution, "execution");
        augmenter.augmentBatch(dataset, execution.gated(probability));
    }

    @Override
    public boolean supportsPerSamplePipelining() {
        return augmenter.supportsPerSamplePipelining();
    }

    @Override
    public String toString() {
        return getName() + "@" + probability;
    }
}
