package com.phillippitts.tsaugment.service.augment.impl;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Perturbs magnitude and phase of every frequency bin with Gaussian noise. Perturbed magnitudes
 * are clamped at zero.
 */
public final class AmplitudePhasePerturbation extends AbstractSpectralAugmenter {

    private final double magnitudeStd;
    private final double phaseStd;

    public AmplitudePhasePerturbation(double magnitudeStd, double phaseStd, boolean timeDomain) {
        super("AmplitudePhasePerturbation", timeDomain);
        requireNonNegative("magnitudeStd", magnitudeStd);
        requireNonNegative("phaseStd", phaseStd);
        this.magnitudeStd = magnitudeStd;
        this.phaseStd = phaseStd;
    }

    @Override
    protected double[] perturbSpectrum(double[] spectrum, RandomGenerator random) {
        double[] out = spectrum.clone();
        int bins = out.length / 2;
        for (int bin = 0; bin < bins; bin++) {
            double re = out[2 * bin];
            double im = out[2 * bin + 1];
            double magnitude = Math.sqrt(re * re + im * im);
            double phase = Math.atan2(im, re);
            double newMagnitude = Math.max(0.0, magnitude + magnitudeStd * random.nextGaussian());
            double newPhase = phase + phaseStd * random.nextGaussian();
            out[2 * bin] = newMagnitude * Math.cos(newPhase);
            out[2 * bin + 1] = newMagnitude * Math.sin(newPhase);
        }
        return out;
    }
}
