package com.phillippitts.tsaugment.service.pipeline;

import com.phillippitts.tsaugment.domain.Dataset;
import com.phillippitts.tsaugment.exception.PipelineCompatibilityException;
import com.phillippitts.tsaugment.service.augment.Augmenter;
import com.phillippitts.tsaugment.service.augment.BatchExecution;
import com.phillippitts.tsaugment.service.augment.RowBatchRunner;
import com.phillippitts.tsaugment.service.augment.RowRandom;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered composition of augmenters. Insertion order is application order.
 *
 * <p><b>Stage-wise mode</b> (default): each stage runs its batch call over the whole dataset before
 * the next stage starts; parallelism exists only inside a stage.
 *
 * <p><b>Per-sample mode</b>: each row flows through all stages before the next row is started
 * (rows themselves still run concurrently when the execution is parallel). Every stage must
 * report {@link Augmenter#supportsPerSamplePipelining()}; otherwise the call fails before anything
 * is touched.
 *
 * <p>Either mode works on a private copy of the dataset and commits only after every stage
 * succeeded, so a failing stage never leaves the caller's dataset half-augmented.
 *
 * <p>The pipeline is itself an {@link Augmenter} and nests inside other pipelines and
 * {@link ConditionalAugmenter}s. It is not thread-safe while stages are being added.
 */
public final class AugmentationPipeline implements Augmenter {

    private static final Logger LOG = LogManager.getLogger(AugmentationPipeline.class);

    private final List<Augmenter> stages = new ArrayList<>();

    public AugmentationPipeline() {
    }

    public AugmentationPipeline(List<? extends Augmenter> initialStages) {
        Objects.requireNonNull(initialStages, "initialStages").forEach(this::add);
    }

    /**
     * Appends a stage.
     *
     * @return this pipeline, for chaining
     */
    public AugmentationPipeline add(Augmenter augmenter) {
        stages.add(Objects.requireNonNull(augmenter, "augmenter"));
        return this;
    }

    public List<Augmenter> getStages() {
        return Collections.unmodifiableList(stages);
    }

    public int size() {
        return stages.size();
    }

    @Override
    public String getName() {
        return stages.stream().map(Augmenter::getName)
                .collect(Collectors.joining(" -> ", "Pipeline[", "]"));
    }

    /**
     * Applies every stage's single-sample transform in order. The pipeline adds no gate of its own.
     */
    @Override
    public double[] augmentOne(double[] sample, RandomGenerator random) {
        Objects.requireNonNull(sample, "sample");
        double[] current = sample;
        for (Augmenter stage : stages) {
            current = stage.augmentOne(current, random);
        }
        return current == sample ? sample.clone() : current;
    }

    @Override
    public void augmentBatch(Dataset dataset, BatchExecution execution) {
        augmentBatch(dataset, execution, false);
    }

    /**
     * Runs the pipeline over {@code dataset} with a common-pool or sequential execution.
     */
    public void augmentBatch(Dataset dataset, boolean parallel, boolean perSample) {
        augmentBatch(dataset, BatchExecution.of(parallel), perSample);
    }

    /**
     * Runs the pipeline over {@code dataset}.
     *
     * @param perSample run rows through all stages one at a time instead of stage by stage
     * @throws PipelineCompatibilityException if {@code perSample} is set and a stage cannot be
     *         pipelined per sample; the dataset is left unmodified
     */
    public void augmentBatch(Dataset dataset, BatchExecution execution, boolean perSample) {
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(execution, "execution");
        if (perSample) {
            requirePerSampleCompatible();
            runPerSample(dataset, execution);
        } else {
            runStageWise(dataset, execution);
        }
    }

    private void runStageWise(Dataset dataset, BatchExecution execution) {
        if (!execution.isGated()) {
            Dataset work = dataset.copy();
            applyStages(work, execution);
            dataset.replaceWith(work);
            return;
        }

        // gate whole rows once, then run the admitted rows through every stage
        List<Integer> admitted = new ArrayList<>();
        for (int r = 0; r < dataset.rowCount(); r++) {
            if (execution.admits(RowRandom.forRow(RowRandom.mix(execution.seed(), -1), r))) {
                admitted.add(r);
            }
        }
        double[][] subset = new double[admitted.size()][];
        List<String> subsetLabels = new ArrayList<>(admitted.size());
        for (int k = 0; k < admitted.size(); k++) {
            subset[k] = dataset.getRow(admitted.get(k)).clone();
            subsetLabels.add(dataset.getLabels().get(admitted.get(k)));
        }
        Dataset work = new Dataset(subset, subsetLabels);
        applyStages(work, execution.ungated());

        double[][] merged = dataset.getFeatures().clone();
        for (int k = 0; k < admitted.size(); k++) {
            merged[admitted.get(k)] = work.getRow(k);
        }
        RowBatchRunner.requireUniformLength(merged, getName());
        dataset.replaceFeatures(merged);
    }

    private void applyStages(Dataset work, BatchExecution execution) {
        for (int i = 0; i < stages.size(); i++) {
            Augmenter stage = stages.get(i);
            ThreadContext.put("stage", stage.getName());
            try {
                LOG.debug("Stage {}/{}: {} on {}", i + 1, stages.size(), stage.getName(), work);
                stage.augmentBatch(work, execution.forStage(i));
            } finally {
                ThreadContext.remove("stage");
            }
        }
    }

    private void runPerSample(Dataset dataset, BatchExecution execution) {
        LOG.debug("Per-sample run of {} over {}", getName(), dataset);
        double[][] out = RowBatchRunner.mapRows(dataset.getFeatures(), execution,
                (index, row, random) -> execution.admits(random) ? augmentOne(row, random) : row);
        RowBatchRunner.requireUniformLength(out, getName());
        dataset.replaceFeatures(out);
    }

    private void requirePerSampleCompatible() {
        for (Augmenter stage : stages) {
            if (!stage.supportsPerSamplePipelining()) {
                throw new PipelineCompatibilityException(stage.getName());
            }
        }
    }

    @Override
    public boolean supportsPerSamplePipelining() {
        return stages.stream().allMatch(Augmenter::supportsPerSamplePipelining);
    }

    @Override
    public boolean preservesRowCount() {
        return stages.stream().allMatch(Augmenter::preservesRowCount);
    }

    @Override
    public String toString() {
        return getName();
    }
}
