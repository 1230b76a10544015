package com.phillippitts.tsaugment.service.augment;

import com.phillippitts.tsaugment.domain.Dataset;
import com.phillippitts.tsaugment.exception.ConfigurationExceptionBuilder;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Base class for row-wise augmenters.
 *
 * <p>This class implements the Template Method pattern: {@link #augmentOne(double[], RandomGenerator)}
 * and {@link #augmentBatch(Dataset, BatchExecution)} handle argument checks, gating, scheduling and
 * the atomic commit, and delegate the per-series work to {@link #transform(double[], RandomGenerator)}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * public final class Negate extends AbstractAugmenter {
 *     public Negate() {
 *         super("Negate");
 *     }
 *
 *     @Override
 *     protected double[] transform(double[] sample, RandomGenerator random) {
 *         double[] out = new double[sample.length];
 *         for (int i = 0; i < sample.length; i++) {
 *             out[i] = -sample[i];
 *         }
 *         return out;
 *     }
 * }
 * }</pre>
 *
 * @since 1.0
 */
public abstract class AbstractAugmenter implements Augmenter {

    private static final Logger LOG = LogManager.getLogger(AbstractAugmenter.class);

    private final String name;

    protected AbstractAugmenter(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public final String getName() {
        return name;
    }

    @Override
    public final double[] augmentOne(double[] sample, RandomGenerator random) {
        Objects.requireNonNull(sample, "sample");
        Objects.requireNonNull(random, "random");
        return transform(sample, random);
    }

    /**
     * Transforms one series. Must return a new array and leave {@code sample} untouched.
     *
     * @param sample input series (never null)
     * @param random generator owned by the caller for this series
     * @return transformed series
     */
    protected abstract double[] transform(double[] sample, RandomGenerator random);

    @Override
    public void augmentBatch(Dataset dataset, BatchExecution execution) {
        applyRowwise(dataset, execution, (index, row, random) -> transform(row, random));
    }

    /**
     * Runs {@code rowTransform} over every admitted row and commits the result.
     *
     * <p>Rows rejected by the execution gate are carried over unchanged. The dataset is replaced
     * only after all rows finished and the new rows are of uniform length.
     *
     * @throws com.phillippitts.tsaugment.exception.DimensionException if rows end up with different lengths
     */
    protected final void applyRowwise(Dataset dataset, BatchExecution execution,
                                      RowBatchRunner.RowTransform rowTransform) {
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(execution, "execution");
        LOG.debug("{}: augmenting {} rows (parallel={}, gate={})",
                name, dataset.rowCount(), execution.parallel(), execution.gateProbability());

        double[][] out = RowBatchRunner.mapRows(dataset.getFeatures(), execution,
                (index, row, random) -> execution.admits(random) ? rowTransform.apply(index, row, random) : row);
        RowBatchRunner.requireUniformLength(out, name);
        dataset.replaceFeatures(out);
    }

    /**
     * Checks a size-like parameter is at least {@code min}.
     */
    protected final void requireAtLeast(String parameter, long value, long min) {
        if (value < min) {
            throw ConfigurationExceptionBuilder.create(parameter + " must be at least " + min)
                    .augmenter(name)
                    .parameter(parameter)
                    .metadata("value", value)
                    .build();
        }
    }

    /**
     * Checks a real parameter is finite and not negative.
     */
    protected final void requireNonNegative(String parameter, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw ConfigurationExceptionBuilder.create(parameter + " must be a finite non-negative number")
                    .augmenter(name)
                    .parameter(parameter)
                    .metadata("value", value)
                    .build();
        }
    }

    /**
     * Checks a real parameter is finite.
     */
    protected final void requireFinite(String parameter, double value) {
        if (!Double.isFinite(value)) {
            throw ConfigurationExceptionBuilder.create(parameter + " must be finite")
                    .augmenter(name)
                    .parameter(parameter)
                    .metadata("value", value)
                    .build();
        }
    }

    /**
     * Checks {@code low <= high} for a range parameter, both finite.
     */
    protected final void requireRange(String parameter, double low, double high) {
        if (!Double.isFinite(low) || !Double.isFinite(high) || low > high) {
            throw ConfigurationExceptionBuilder.create(parameter + " must be a finite range with low <= high")
                    .augmenter(name)
                    .parameter(parameter)
                    .metadata("low", low)
                    .metadata("high", high)
                    .build();
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
