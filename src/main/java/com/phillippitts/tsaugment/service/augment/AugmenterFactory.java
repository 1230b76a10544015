package com.phillippitts.tsaugment.service.augment;

import com.phillippitts.tsaugment.service.augment.impl.AddNoise;
import com.phillippitts.tsaugment.service.augment.impl.AmplitudePhasePerturbation;
import com.phillippitts.tsaugment.service.augment.impl.Convolve;
import com.phillippitts.tsaugment.service.augment.impl.Crop;
import com.phillippitts.tsaugment.service.augment.impl.Drift;
import com.phillippitts.tsaugment.service.augment.impl.Drop;
import com.phillippitts.tsaugment.service.augment.impl.FrequencyMask;
import com.phillippitts.tsaugment.service.augment.impl.Jittering;
import com.phillippitts.tsaugment.service.augment.impl.Permutate;
import com.phillippitts.tsaugment.service.augment.impl.Pool;
import com.phillippitts.tsaugment.service.augment.impl.Quantize;
import com.phillippitts.tsaugment.service.augment.impl.RandomTimeWarp;
import com.phillippitts.tsaugment.service.augment.impl.Repeat;
import com.phillippitts.tsaugment.service.augment.impl.Resize;
import com.phillippitts.tsaugment.service.augment.impl.Reverse;
import com.phillippitts.tsaugment.service.augment.impl.Rotation;
import com.phillippitts.tsaugment.service.augment.impl.Scaling;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds augmenters from {@code (name, keyword arguments)} records supplied by configuration.
 *
 * <p>Parameter keys are the camelCase constructor argument names ({@code windowSize},
 * {@code segmentSize}, ...); {@code window_size} and {@code window-size} are accepted as well.
 * Unknown names, unknown enumeration values, unknown or missing keys and malformed numbers all
 * fail with a {@link com.phillippitts.tsaugment.exception.ConfigurationException}.
 *
 * <p>Example:
 * <pre>
 * Augmenter crop = factory.create("Crop", Map.of("size", 64));
 * Augmenter noise = factory.create("AddNoise", Map.of("noiseType", "Gaussian", "mean", 0, "stdDev", 0.1));
 * </pre>
 */
@Component
public class AugmenterFactory {

    private static final Logger LOG = LogManager.getLogger(AugmenterFactory.class);

    /**
     * Creates the augmenter called {@code name}.
     *
     * @param name   augmenter name, case- and separator-insensitive
     * @param params keyword arguments (may be null for augmenters without parameters)
     * @return configured augmenter
     */
    public Augmenter create(String name, Map<String, ?> params) {
        AugmenterKind kind = AugmenterKind.fromString(name);
        AugmenterParameters p = new AugmenterParameters(name, params);
        Augmenter augmenter = build(kind, p);
        p.rejectUnknown();
        LOG.debug("Created augmenter {} from '{}'", augmenter.getName(), name);
        return augmenter;
    }

    private Augmenter build(AugmenterKind kind, AugmenterParameters p) {
        switch (kind) {
            case ADD_NOISE:
                return addNoise(p);
            case CONVOLVE:
                return new Convolve(ConvolveWindow.fromString(p.requireString("window")), p.requireInt("size"));
            case DRIFT:
                return new Drift(p.requireDouble("maxDrift"), p.requireInt("nDriftPoints"));
            case JITTERING:
                return new Jittering(p.requireDouble("standardDeviation"));
            case DROP:
                return new Drop(p.requireDouble("percentage"), p.optDouble("defaultValue", 0.0));
            case CROP:
                return new Crop(p.requireInt("size"));
            case ROTATION:
                return new Rotation(p.requireDouble("anchor"));
            case SCALING:
                return new Scaling(p.requireDouble("min"), p.requireDouble("max"));
            case QUANTIZE:
                return new Quantize(p.requireInt("levels"));
            case REVERSE:
                return new Reverse();
            case PERMUTATE:
                return new Permutate(p.requireInt("windowSize"), p.requireInt("segmentSize"));
            case POOL:
                return new Pool(PoolingMethod.fromString(p.requireString("kind")), p.requireInt("size"));
            case RESIZE:
                return new Resize(p.requireInt("size"));
            case AMPLITUDE_PHASE_PERTURBATION:
                return new AmplitudePhasePerturbation(p.requireDouble("magnitudeStd"), p.requireDouble("phaseStd"),
                        p.optBoolean("timeDomain", true));
            case FREQUENCY_MASK:
                return new FrequencyMask(p.requireInt("maskWidth"), p.optBoolean("timeDomain", true));
            case RANDOM_TIME_WARP:
                double[] ratio = p.requireRange("speedRatioRange");
                return new RandomTimeWarp(p.optInt("windowSize", 0), ratio[0], ratio[1]);
            case REPEAT:
                return new Repeat(p.requireInt("times"));
            default:
                throw new IllegalStateException("Unhandled augmenter kind: " + kind);
        }
    }

    private static Augmenter addNoise(AugmenterParameters p) {
        NoiseType type = NoiseType.fromString(p.requireString("noiseType"));
        if (type == NoiseType.GAUSSIAN) {
            return AddNoise.gaussian(p.optDouble("mean", 0.0), p.requireDouble("stdDev"));
        }
        double[] bounds = p.requireRange("bounds");
        return new AddNoise(type, bounds[0], bounds[1], 0.0, 0.0);
    }
}
