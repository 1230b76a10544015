package com.phillippitts.tsaugment.service.augment;

import com.phillippitts.tsaugment.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;

class EnumParsingTest {

    @ParameterizedTest
    @CsvSource({
            "Gaussian, GAUSSIAN",
            "gaussian, GAUSSIAN",
            "UNIFORM, UNIFORM",
            "' spike ', SPIKE",
            "Slope, SLOPE"
    })
    void parsesNoiseTypes(String text, NoiseType expected) {
        assertThat(NoiseType.fromString(text)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "Max, MAX",
            "min, MIN",
            "Average, AVERAGE",
            "avg, AVERAGE"
    })
    void parsesPoolingMethods(String text, PoolingMethod expected) {
        assertThat(PoolingMethod.fromString(text)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "AddNoise, ADD_NOISE",
            "add_noise, ADD_NOISE",
            "RandomTimeWarpAugmenter, RANDOM_TIME_WARP",
            "random-time-warp, RANDOM_TIME_WARP",
            "AmplitudePhasePerturbation, AMPLITUDE_PHASE_PERTURBATION",
            "frequency mask, FREQUENCY_MASK",
            "Repeat, REPEAT"
    })
    void parsesAugmenterKinds(String text, AugmenterKind expected) {
        assertThat(AugmenterKind.fromString(text)).isEqualTo(expected);
    }

    @Test
    void parsesConvolveWindows() {
        assertThat(ConvolveWindow.fromString("Flat")).isEqualTo(ConvolveWindow.FLAT);
        assertThat(ConvolveWindow.fromString("gaussian")).isEqualTo(ConvolveWindow.GAUSSIAN);
    }

    @Test
    void rejectsUnknownValues() {
        assertThatThrownBy(() -> NoiseType.fromString("Pink"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Unknown noise type: Pink");
        assertThatThrownBy(() -> PoolingMethod.fromString("median"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> ConvolveWindow.fromString("hann"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> AugmenterKind.fromString("Teleport"))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> NoiseType.fromString(null))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void kernelsSumToOne() {
        for (ConvolveWindow window : ConvolveWindow.values()) {
            double sum = 0.0;
            for (double w : window.kernel(7)) {
                sum += w;
            }
            assertThat(sum).isCloseTo(1.0, offset(1e-12));
        }
    }

    @Test
    void gaussianKernelPeaksInTheMiddle() {
        double[] kernel = ConvolveWindow.GAUSSIAN.kernel(5);

        assertThat(kernel[2]).isGreaterThan(kernel[1]);
        assertThat(kernel[1]).isGreaterThan(kernel[0]);
        assertThat(kernel[0]).isCloseTo(kernel[4], offset(1e-15));
    }

    @Test
    void normalizesConfigNames() {
        assertThat(ConfigNames.normalize("Window_Size")).isEqualTo("windowsize");
        assertThat(ConfigNames.normalize(" window-size ")).isEqualTo("windowsize");
        assertThat(ConfigNames.normalize("windowSize")).isEqualTo("windowsize");
        assertThat(ConfigNames.normalize(null)).isEmpty();
    }
}
