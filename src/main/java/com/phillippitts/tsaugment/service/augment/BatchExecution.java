package com.phillippitts.tsaugment.service.augment;

import com.phillippitts.tsaugment.exception.ConfigurationException;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Settings for one batch call: where rows run, how their random state is seeded and with
 * which probability each row is admitted to the transform.
 *
 * @param parallel        run rows concurrently on {@code executor} when true, in index order otherwise
 * @param executor        worker pool for parallel runs (ignored when {@code parallel} is false)
 * @param seed            batch seed from which per-row generators are derived
 * @param gateProbability probability that a row is transformed; 1.0 means every row
 */
public record BatchExecution(boolean parallel, Executor executor, long seed, double gateProbability) {

    private static final Executor CALLER_THREAD = Runnable::run;

    public BatchExecution {
        Objects.requireNonNull(executor, "executor must not be null");
        if (Double.isNaN(gateProbability) || gateProbability < 0.0 || gateProbability > 1.0) {
            throw new ConfigurationException("Gate probability must be in [0, 1], got: " + gateProbability);
        }
    }

    /** Sequential execution on the calling thread with a random seed. */
    public static BatchExecution sequential() {
        return new BatchExecution(false, CALLER_THREAD, RowRandom.newSeed(), 1.0);
    }

    /** Parallel execution on the given pool with a random seed. */
    public static BatchExecution parallel(Executor executor) {
        return new BatchExecution(true, executor, RowRandom.newSeed(), 1.0);
    }

    /**
     * Parallel execution on the common fork-join pool (sized to the available processors),
     * or sequential execution.
     */
    public static BatchExecution of(boolean parallel) {
        return parallel ? parallel(ForkJoinPool.commonPool()) : sequential();
    }

    /** Returns a copy that uses {@code newSeed} for per-row generators. */
    public BatchExecution withSeed(long newSeed) {
        return new BatchExecution(parallel, executor, newSeed, gateProbability);
    }

    /** Returns a copy whose seed is derived from this seed and {@code stageIndex}. */
    public BatchExecution forStage(int stageIndex) {
        return new BatchExecution(parallel, executor, RowRandom.mix(seed, stageIndex), gateProbability);
    }

    /** Returns a copy that admits rows with this gate and {@code probability} both passing. */
    public BatchExecution gated(double probability) {
        if (Double.isNaN(probability) || probability < 0.0 || probability > 1.0) {
            throw new ConfigurationException("Gate probability must be in [0, 1], got: " + probability);
        }
        return new BatchExecution(parallel, executor, seed, gateProbability * probability);
    }

    /** Returns a copy that admits every row. */
    public BatchExecution ungated() {
        return new BatchExecution(parallel, executor, seed, 1.0);
    }

    public boolean isGated() {
        return gateProbability < 1.0;
    }

    /**
     * Decides whether a row is transformed. Draws one uniform value when gated.
     */
    public boolean admits(RandomGenerator random) {
        return gateProbability >= 1.0 || random.nextDouble() < gateProbability;
    }
}
