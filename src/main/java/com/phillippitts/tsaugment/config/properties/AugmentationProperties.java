package com.phillippitts.tsaugment.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Engine settings and the configured augmentation pipeline.
 *
 * <pre>
 * augmentation.parallel=true
 * augmentation.per-sample=false
 * augmentation.seed=42
 * augmentation.tolerance=1e-6
 * augmentation.pipeline[0].name=Crop
 * augmentation.pipeline[0].params.size=64
 * augmentation.pipeline[1].name=Jittering
 * augmentation.pipeline[1].probability=0.5
 * augmentation.pipeline[1].params.standard-deviation=0.1
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "augmentation")
public class AugmentationProperties {

    /** Run rows of a batch on the worker pool. */
    private final boolean parallel;

    /** Push every row through all stages before starting the next row. */
    private final boolean perSample;

    /** Fixed batch seed for reproducible runs; a fresh seed per call when absent. */
    private final Long seed;

    /** Absolute tolerance for round-trip verification. */
    @DecimalMin("0.0")
    private final double tolerance;

    @NotNull
    @Valid
    private final List<Stage> pipeline;

    @ConstructorBinding
    public AugmentationProperties(Boolean parallel, Boolean perSample, Long seed, Double tolerance,
                                  List<Stage> pipeline) {
        this.parallel = parallel == null ? true : parallel;
        this.perSample = perSample == null ? false : perSample;
        this.seed = seed;
        double t = tolerance == null ? 1e-6 : tolerance;
        if (Double.isNaN(t) || t < 0.0) {
            throw new IllegalArgumentException("augmentation.tolerance must be non-negative");
        }
        this.tolerance = t;
        this.pipeline = pipeline == null ? List.of() : List.copyOf(pipeline);
    }

    public boolean isParallel() {
        return parallel;
    }

    public boolean isPerSample() {
        return perSample;
    }

    public Optional<Long> getSeed() {
        return Optional.ofNullable(seed);
    }

    public double getTolerance() {
        return tolerance;
    }

    public List<Stage> getPipeline() {
        return pipeline;
    }

    /**
     * One configured pipeline stage.
     *
     * @param name        augmenter name, e.g. {@code AddNoise}
     * @param probability optional gate; the stage is wrapped conditionally when present
     * @param params      keyword arguments for the augmenter
     */
    public record Stage(
            @NotBlank String name,
            @DecimalMin("0.0") @DecimalMax("1.0") Double probability,
            Map<String, String> params) {

        public Stage {
            params = params == null ? Map.of() : Map.copyOf(params);
        }
    }
}
