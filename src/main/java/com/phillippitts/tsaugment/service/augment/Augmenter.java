package com.phillippitts.tsaugment.service.augment;

import com.phillippitts.tsaugment.domain.Dataset;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * A configured, possibly stochastic transformation of univariate time series.
 *
 * <p>Every augmenter works at two granularities:
 * <ul>
 *   <li>{@link #augmentOne(double[], RandomGenerator)} transforms a single series and always
 *       executes; there is no probability gate at this level</li>
 *   <li>{@link #augmentBatch(Dataset, BatchExecution)} applies the same semantic to every row of a
 *       dataset, sequentially or on a worker pool, and commits the result atomically</li>
 * </ul>
 *
 * <p><b>Ordering:</b> batch output row {@code i} is always derived from input row {@code i},
 * whatever order the workers finish in.
 *
 * <p><b>Randomness:</b> batch calls give every row its own generator derived from the batch seed
 * and the row index, so a sequential and a parallel run with the same seed produce the same rows.
 *
 * <p><b>Thread Safety:</b> implementations hold only immutable configuration and must be safe to
 * call from many worker threads at once.
 *
 * @see AbstractAugmenter
 * @see com.phillippitts.tsaugment.service.pipeline.AugmentationPipeline
 * @since 1.0
 */
public interface Augmenter {

    /**
     * Returns the display name used in logs and error messages (e.g. "Crop").
     */
    String getName();

    /**
     * Transforms one series using the supplied random source. The input array is never modified.
     *
     * @param sample series to transform
     * @param random random source for stochastic augmenters
     * @return transformed series (a new array)
     */
    double[] augmentOne(double[] sample, RandomGenerator random);

    /**
     * Transforms one series with a fresh, unseeded random source.
     */
    default double[] augmentOne(double[] sample) {
        return augmentOne(sample, RowRandom.fresh());
    }

    /**
     * Transforms every row of {@code dataset} in place.
     *
     * <p>Either all rows are committed or, on failure, the dataset is left untouched.
     *
     * @param dataset dataset to transform
     * @param execution scheduling, seed and gate settings for this call
     */
    void augmentBatch(Dataset dataset, BatchExecution execution);

    /**
     * Transforms every row of {@code dataset} in place, on the common pool when
     * {@code parallel} is set and on the calling thread otherwise.
     */
    default void augmentBatch(Dataset dataset, boolean parallel) {
        augmentBatch(dataset, BatchExecution.of(parallel));
    }

    /**
     * Indicates whether this augmenter can be interleaved row by row with other stages.
     * Augmenters that need a whole-batch view return false.
     */
    default boolean supportsPerSamplePipelining() {
        return true;
    }

    /**
     * Indicates whether a batch call keeps the number of rows unchanged.
     */
    default boolean preservesRowCount() {
        return true;
    }
}
