package com.phillippitts.tsaugment.service.augment;

import com.phillippitts.tsaugment.exception.DimensionException;
import com.phillippitts.tsaugment.exception.TsAugmentException;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.IntFunction;

/**
 * Fans row-level work out over a {@link BatchExecution} and gathers results by row index.
 *
 * <p>Results go into an arena of slots, one per input row. Each task writes only its own slot,
 * so no locking is needed and completion order has no effect on output order. The input array
 * is never written; callers commit the returned rows once the whole batch succeeded.
 */
public final class RowBatchRunner {

    /**
     * Transformation of one row.
     */
    @FunctionalInterface
    public interface RowTransform {
        /**
         * @param index  row index in the batch
         * @param row    input row (must not be modified)
         * @param random generator owned by this row
         * @return output row
         */
        double[] apply(int index, double[] row, RandomGenerator random);
    }

    /**
     * Deterministic transformation of one row.
     */
    @FunctionalInterface
    public interface RowFunction {
        double[] apply(double[] row);
    }

    private RowBatchRunner() {}

    /**
     * Applies {@code transform} to every row, each row with its own generator.
     *
     * @return new row array, index-aligned with {@code rows}
     * @throws TsAugmentException (or subclass) rethrown from a failing row
     */
    public static double[][] mapRows(double[][] rows, BatchExecution execution, RowTransform transform) {
        long seed = execution.seed();
        return run(rows, execution, index -> transform.apply(index, rows[index], RowRandom.forRow(seed, index)));
    }

    /**
     * Applies a deterministic {@code function} to every row. No random state is created.
     *
     * @return new row array, index-aligned with {@code rows}
     */
    public static double[][] mapRowsDeterministic(double[][] rows, BatchExecution execution, RowFunction function) {
        return run(rows, execution, index -> function.apply(rows[index]));
    }

    private static double[][] run(double[][] rows, BatchExecution execution, IntFunction<double[]> task) {
        double[][] out = new double[rows.length][];
        if (!execution.parallel() || rows.length < 2) {
            for (int i = 0; i < rows.length; i++) {
                out[i] = task.apply(i);
            }
            return out;
        }

        CompletableFuture<?>[] futures = new CompletableFuture<?>[rows.length];
        for (int i = 0; i < rows.length; i++) {
            final int index = i;
            futures[i] = CompletableFuture.runAsync(() -> out[index] = task.apply(index), execution.executor());
        }
        try {
            // allOf completes only after every row has finished, failed rows included
            CompletableFuture.allOf(futures).join();
        } catch (CompletionException ce) {
            throw unwrap(ce);
        }
        return out;
    }

    /**
     * Verifies that all rows share one length.
     *
     * @param operation name used in the error message
     * @throws DimensionException if two rows differ in length
     */
    public static void requireUniformLength(double[][] rows, String operation) {
        if (rows.length == 0) {
            return;
        }
        int expected = rows[0].length;
        for (int i = 1; i < rows.length; i++) {
            if (rows[i].length != expected) {
                throw new DimensionException(operation + " produced rows of different lengths at row " + i,
                        expected, rows[i].length);
            }
        }
    }

    private static RuntimeException unwrap(CompletionException ce) {
        Throwable cause = ce.getCause() != null ? ce.getCause() : ce;
        if (cause instanceof RuntimeException re) {
            return re;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return new TsAugmentException("Row task failed", cause);
    }
}
