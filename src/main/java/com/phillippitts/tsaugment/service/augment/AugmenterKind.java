package com.phillippitts.tsaugment.service.augment;

import com.phillippitts.tsaugment.exception.ConfigurationException;

/**
 * Closed set of augmenter variants that {@link AugmenterFactory} can build from configuration.
 */
public enum AugmenterKind {
    ADD_NOISE,
    CONVOLVE,
    DRIFT,
    JITTERING,
    DROP,
    CROP,
    ROTATION,
    SCALING,
    QUANTIZE,
    REVERSE,
    PERMUTATE,
    POOL,
    RESIZE,
    AMPLITUDE_PHASE_PERTURBATION,
    FREQUENCY_MASK,
    RANDOM_TIME_WARP,
    REPEAT;

    /**
     * Parses an augmenter name such as {@code "AddNoise"}, {@code "add_noise"} or {@code "Crop"}.
     *
     * @throws ConfigurationException if the name matches no augmenter
     */
    public static AugmenterKind fromString(String name) {
        switch (ConfigNames.normalize(name)) {
            case "addnoise":
            case "noise":
                return ADD_NOISE;
            case "convolve":
                return CONVOLVE;
            case "drift":
                return DRIFT;
            case "jittering":
            case "jitter":
                return JITTERING;
            case "drop":
                return DROP;
            case "crop":
                return CROP;
            case "rotation":
                return ROTATION;
            case "scaling":
                return SCALING;
            case "quantize":
                return QUANTIZE;
            case "reverse":
                return REVERSE;
            case "permutate":
            case "permutation":
                return PERMUTATE;
            case "pool":
                return POOL;
            case "resize":
                return RESIZE;
            case "amplitudephaseperturbation":
                return AMPLITUDE_PHASE_PERTURBATION;
            case "frequencymask":
                return FREQUENCY_MASK;
            case "randomtimewarp":
            case "randomtimewarpaugmenter":
                return RANDOM_TIME_WARP;
            case "repeat":
                return REPEAT;
            default:
                throw new ConfigurationException("Unknown augmenter: " + name, String.valueOf(name));
        }
    }
}
