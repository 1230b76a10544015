package com.phillippitts.tsaugment.service;

import com.phillippitts.tsaugment.config.properties.AugmentationProperties;
import com.phillippitts.tsaugment.domain.Dataset;
import com.phillippitts.tsaugment.domain.DtwResult;
import com.phillippitts.tsaugment.domain.ToleranceComparison;
import com.phillippitts.tsaugment.exception.TsAugmentException;
import com.phillippitts.tsaugment.service.augment.Augmenter;
import com.phillippitts.tsaugment.service.augment.BatchExecution;
import com.phillippitts.tsaugment.service.augment.RowRandom;
import com.phillippitts.tsaugment.service.benchmark.QualityBenchmarking;
import com.phillippitts.tsaugment.service.pipeline.AugmentationPipeline;
import com.phillippitts.tsaugment.service.transform.SpectralTransforms;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Entry point for callers (loaders, benchmarking harnesses) that run the configured engine.
 *
 * <p>Every call gets a batch id in the Log4j2 ThreadContext; the worker pool copies it onto the
 * row threads. Failures are logged once here and rethrown unchanged.
 *
 * <p>Thread-safe: holds only immutable collaborators. The pipeline must not be modified after
 * startup.
 */
@Service
public class AugmentationService {

    private static final Logger LOG = LogManager.getLogger(AugmentationService.class);
    private static final String BATCH_ID = "batchId";

    private final AugmentationPipeline pipeline;
    private final Executor executor;
    private final AugmentationProperties properties;

    public AugmentationService(AugmentationPipeline pipeline,
                               @Qualifier("augmentExecutor") Executor executor,
                               AugmentationProperties properties) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * Runs the configured pipeline over {@code dataset} in place.
     */
    public void augment(Dataset dataset) {
        Objects.requireNonNull(dataset, "dataset");
        traced("augment", () -> {
            LOG.info("Augmenting {} with {} (parallel={}, perSample={})",
                    dataset, pipeline.getName(), properties.isParallel(), properties.isPerSample());
            pipeline.augmentBatch(dataset, execution(), properties.isPerSample());
            LOG.info("Augmentation finished: {}", dataset);
            return null;
        });
    }

    /**
     * Runs a single augmenter over {@code dataset} in place, with the configured execution settings.
     */
    public void augment(Dataset dataset, Augmenter augmenter) {
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(augmenter, "augmenter");
        traced("augment", () -> {
            LOG.info("Augmenting {} with {} (parallel={})", dataset, augmenter.getName(), properties.isParallel());
            augmenter.augmentBatch(dataset, execution());
            return null;
        });
    }

    public Dataset fft(Dataset dataset) {
        return traced("fft", () -> SpectralTransforms.fft(dataset, execution()));
    }

    public Dataset ifft(Dataset dataset) {
        return traced("ifft", () -> SpectralTransforms.ifft(dataset, execution()));
    }

    public Dataset dct(Dataset dataset) {
        return traced("dct", () -> SpectralTransforms.dct(dataset, execution()));
    }

    public Dataset idct(Dataset dataset) {
        return traced("idct", () -> SpectralTransforms.idct(dataset, execution()));
    }

    /**
     * Checks {@code ifft(fft(dataset))} against {@code dataset} with the configured tolerance.
     */
    public ToleranceComparison verifyFourierRoundTrip(Dataset dataset) {
        return traced("fft-roundtrip", () -> {
            BatchExecution execution = execution();
            Dataset restored = SpectralTransforms.ifft(SpectralTransforms.fft(dataset, execution), execution);
            return report("FFT", SpectralTransforms.compareWithinTolerance(dataset, restored, properties.getTolerance()));
        });
    }

    /**
     * Checks {@code idct(dct(dataset))} against {@code dataset} with the configured tolerance.
     */
    public ToleranceComparison verifyCosineRoundTrip(Dataset dataset) {
        return traced("dct-roundtrip", () -> {
            BatchExecution execution = execution();
            Dataset restored = SpectralTransforms.idct(SpectralTransforms.dct(dataset, execution), execution);
            return report("DCT", SpectralTransforms.compareWithinTolerance(dataset, restored, properties.getTolerance()));
        });
    }

    public DtwResult dtw(double[] a, double[] b) {
        return traced("dtw", () -> QualityBenchmarking.computeDtw(a, b));
    }

    private ToleranceComparison report(String transform, ToleranceComparison comparison) {
        if (comparison.allWithinTolerance()) {
            LOG.info("{} round trip within tolerance {} (max difference {})",
                    transform, properties.getTolerance(), comparison.maxAbsDifference());
        } else {
            LOG.warn("{} round trip exceeds tolerance {} (max difference {})",
                    transform, properties.getTolerance(), comparison.maxAbsDifference());
        }
        return comparison;
    }

    private BatchExecution execution() {
        long seed = properties.getSeed().orElseGet(RowRandom::newSeed);
        return new BatchExecution(properties.isParallel(), executor, seed, 1.0);
    }

    private <T> T traced(String operation, Supplier<T> body) {
        String previous = ThreadContext.get(BATCH_ID);
        ThreadContext.put(BATCH_ID, UUID.randomUUID().toString().substring(0, 8));
        try {
            return body.get();
        } catch (TsAugmentException e) {
            LOG.warn("{} failed: {}", operation, e.getMessage());
            throw e;
        } finally {
            if (previous != null) {
                ThreadContext.put(BATCH_ID, previous);
            } else {
                ThreadContext.remove(BATCH_ID);
            }
        }
    }
}
