package com.phillippitts.tsaugment.service.augment.impl;

import com.phillippitts.tsaugment.exception.ConfigurationExceptionBuilder;
import com.phillippitts.tsaugment.service.augment.AbstractAugmenter;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Replaces each point with {@code defaultValue} with probability {@code percentage}.
 */
public final class Drop extends AbstractAugmenter {

    private final double percentage;
    private final double defaultValue;

    public Drop(double percentage) {
        this(percentage, 0.0);
    }

    public Drop(double percentage, double defaultValue) {
        super("Drop");
        if (Double.isNaN(percentage) || percentage < 0.0 || percentage > 1.0) {
            throw ConfigurationExceptionBuilder.create("percentage must be in [0, 1]")
                    .augmenter(getName())
                    .parameter("percentage")
                    .metadata("value", percentage)
                    .build();
        }
        requireFinite("defaultValue", defaultValue);
        this.percentage = percentage;
        this.defaultValue = defaultValue;
    }

    @Override
    protected double[] transform(double[] sample, RandomGenerator random) {
        double[] out = new double[sample.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = random.nextDouble() < percentage ? defaultValue : sample[i];
        }
        return out;
    }
}
