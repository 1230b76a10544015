package com.phillippitts.tsaugment.service.augment.impl;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Zeroes a random contiguous block of {@code maskWidth} frequency bins. The width is clamped to the
 * number of bins.
 */
public final class FrequencyMask extends AbstractSpectralAugmenter {

    private final int maskWidth;

    public FrequencyMask(int maskWidth, boolean timeDomain) {
        super("FrequencyMask", timeDomain);
        requireAtLeast("maskWidth", maskWidth, 1);
        this.maskWidth = maskWidth;
    }

    @Override
    protected double[] perturbSpectrum(double[] spectrum, RandomGenerator random) {
        double[] out = spectrum.clone();
        int bins = out.length / 2;
        if (bins == 0) {
            return out;
        }
        int width = Math.min(maskWidth, bins);
        int start = random.nextInt(bins - width + 1);
        for (int bin = start; bin < start + width; bin++) {
            out[2 * bin] = 0.0;
            out[2 * bin + 1] = 0.0;
        }
        return out;
    }
}
