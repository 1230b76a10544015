package com.phillippitts.tsaugment.service.augment.impl;

import com.phillippitts.tsaugment.domain.Dataset;
import com.phillippitts.tsaugment.exception.DimensionException;
import com.phillippitts.tsaugment.service.augment.AbstractAugmenter;
import com.phillippitts.tsaugment.service.augment.BatchExecution;
import com.phillippitts.tsaugment.service.augment.RowBatchRunner;
import com.phillippitts.tsaugment.service.transform.SpectralTransforms;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.Objects;

/**
 * Base for augmenters that edit an interleaved {@code [re, im, ...]} spectrum.
 *
 * <p>In frequency-domain mode the rows already are spectra and are edited directly. In time-domain
 * mode a batch call transforms the whole dataset with {@link SpectralTransforms#fft}, edits the
 * admitted rows and transforms back; such augmenters need the whole batch and do not take part in
 * per-sample pipelining. Rows rejected by the gate are committed unchanged. A single-row call in time-domain mode does the round trip for that row.
 */
abstract class AbstractSpectralAugmenter extends AbstractAugmenter {

    private final boolean timeDomain;

    protected AbstractSpectralAugmenter(String name, boolean timeDomain) {
        super(name);
        this.timeDomain = timeDomain;
    }

    public boolean isTimeDomain() {
        return timeDomain;
    }

    /**
     * Edits one interleaved spectrum. Must return a new array of the same length.
     */
    protected abstract double[] perturbSpectrum(double[] spectrum, RandomGenerator random);

    @Override
    protected final double[] transform(double[] sample, RandomGenerator random) {
        if (timeDomain) {
            return SpectralTransforms.ifftRow(perturbSpectrum(SpectralTransforms.fftRow(sample), random));
        }
        requireInterleaved(sample.length);
        return perturbSpectrum(sample, random);
    }

    @Override
    public void augmentBatch(Dataset dataset, BatchExecution execution) {
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(execution, "execution");
        if (!timeDomain) {
            requireInterleaved(dataset.rowLength());
            applyRowwise(dataset, execution, (index, row, random) -> perturbSpectrum(row, random));
            return;
        }
        Dataset spectrum = SpectralTransforms.fft(dataset, execution);
        boolean[] admitted = new boolean[dataset.rowCount()];
        double[][] edited = RowBatchRunner.mapRows(spectrum.getFeatures(), execution, (index, row, random) -> {
            if (!execution.admits(random)) {
                return row;
            }
            admitted[index] = true;
            return perturbSpectrum(row, random);
        });
        Dataset restored = SpectralTransforms.ifft(new Dataset(edited, spectrum.getLabels()), execution);

        // rejected rows keep their original values, not the round-tripped ones
        double[][] merged = new double[admitted.length][];
        for (int r = 0; r < merged.length; r++) {
            merged[r] = admitted[r] ? restored.getRow(r) : dataset.getRow(r);
        }
        dataset.replaceFeatures(merged);
    }

    @Override
    public boolean supportsPerSamplePipelining() {
        return !timeDomain;
    }

    private void requireInterleaved(int length) {
        if (length % 2 != 0) {
            throw new DimensionException(getName() + " expects interleaved spectra of even length",
                    length + 1, length);
        }
    }
}
