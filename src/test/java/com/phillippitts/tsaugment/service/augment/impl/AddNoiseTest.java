package com.phillippitts.tsaugment.service.augment.impl;

import com.phillippitts.tsaugment.exception.ConfigurationException;
import com.phillippitts.tsaugment.service.augment.NoiseType;
import com.phillippitts.tsaugment.testutil.Series;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AddNoiseTest {

    @Test
    void uniformNoiseStaysWithinBounds() {
        double[] out = AddNoise.uniform(-1.0, 1.0).augmentOne(Series.constant(100, 1.0), new Well19937c(1L));

        for (double v : out) {
            assertThat(v).isBetween(0.0, 2.0);
        }
        assertThat(out).isNotEqualTo(Series.constant(100, 1.0));
    }

    @Test
    void gaussianNoiseChangesSeries() {
        double[] out = AddNoise.gaussian(0.0, 0.5).augmentOne(Series.constant(100, 1.0), new Well19937c(2L));

        assertThat(out).isNotEqualTo(Series.constant(100, 1.0));
    }

    @Test
    void gaussianWithZeroDeviationAddsMean() {
        double[] out = AddNoise.gaussian(2.0, 0.0).augmentOne(Series.constant(4, 1.0), new Well19937c(2L));

        assertThat(out).containsExactly(3, 3, 3, 3);
    }

    @Test
    void spikeChangesExactlyOnePoint() {
        double[] input = Series.ramp(100);

        double[] out = AddNoise.spike(-2.0, 2.0).augmentOne(input, new Well19937c(3L));

        int different = 0;
        for (int i = 0; i < input.length; i++) {
            if (out[i] != input[i]) {
                different++;
            }
        }
        assertThat(different).isLessThanOrEqualTo(1);
    }

    @Test
    void slopeAddsLinearTrend() {
        double[] out = AddNoise.slope(1.0, 2.0).augmentOne(Series.constant(100, 0.0), new Well19937c(4L));

        assertThat(out[0]).isEqualTo(0.0);
        assertThat(out[99]).isBetween(99.0, 198.0);
        double slope = out[1];
        for (int i = 0; i < out.length; i++) {
            assertThat(out[i]).isCloseTo(i * slope, within(1e-9));
        }
    }

    @Test
    void rejectsInvertedBounds() {
        assertThatThrownBy(() -> AddNoise.uniform(1.0, -1.0))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("AddNoise");
    }

    @Test
    void rejectsNegativeDeviation() {
        assertThatThrownBy(() -> new AddNoise(NoiseType.GAUSSIAN, 0, 0, 0, -0.1))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void leavesEmptySeriesEmpty() {
        assertThat(AddNoise.spike(0, 1).augmentOne(new double[0], new Well19937c(5L))).isEmpty();
    }
}
