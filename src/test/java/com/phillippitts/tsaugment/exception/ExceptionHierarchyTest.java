package com.phillippitts.tsaugment.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void tsAugmentExceptionShouldIncludeMessageAndCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        TsAugmentException ex = new TsAugmentException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void allEngineExceptionsShareOneRoot() {
        assertThat(new ShapeMismatchException(1, 2)).isInstanceOf(TsAugmentException.class);
        assertThat(new ConfigurationException("bad")).isInstanceOf(TsAugmentException.class);
        assertThat(new DimensionException("bad")).isInstanceOf(TsAugmentException.class);
        assertThat(new PipelineCompatibilityException("Repeat")).isInstanceOf(TsAugmentException.class);
        assertThat(new EmptySequenceException("empty")).isInstanceOf(TsAugmentException.class);
        assertThat(new NonFiniteValueException("nan", 0)).isInstanceOf(TsAugmentException.class);
        assertThat(new TsAugmentException("x")).isInstanceOf(RuntimeException.class);
    }

    @Test
    void shapeMismatchExceptionShouldReportCounts() {
        ShapeMismatchException ex = new ShapeMismatchException(3, 2);

        assertThat(ex.getMessage()).isEqualTo("Feature rows (3) and labels (2) must have the same count");
        assertThat(ex.getRowCount()).isEqualTo(3);
        assertThat(ex.getLabelCount()).isEqualTo(2);
    }

    @Test
    void shapeMismatchExceptionWithoutCountsShouldUseSentinel() {
        ShapeMismatchException ex = new ShapeMismatchException("Row 1 has length 4");

        assertThat(ex.getRowCount()).isEqualTo(-1);
        assertThat(ex.getLabelCount()).isEqualTo(-1);
    }

    @Test
    void configurationExceptionShouldDefaultAugmenterToUnknown() {
        ConfigurationException ex = new ConfigurationException("invalid");

        assertThat(ex.getMessage()).isEqualTo("invalid");
        assertThat(ex.getAugmenterName()).isEqualTo("unknown");
        assertThat(ex.getParameter()).isNull();
    }

    @Test
    void configurationExceptionShouldIncludeAugmenterAndParameter() {
        ConfigurationException ex = new ConfigurationException("size must be at least 1", "Crop", "size");

        assertThat(ex.getMessage()).isEqualTo("size must be at least 1 (augmenter: Crop, parameter: size)");
        assertThat(ex.getAugmenterName()).isEqualTo("Crop");
        assertThat(ex.getParameter()).isEqualTo("size");
    }

    @Test
    void dimensionExceptionShouldIncludeLengths() {
        DimensionException ex = new DimensionException("Crop produced ragged rows", 5, 4);

        assertThat(ex.getMessage()).contains("expected length 5, got 4");
        assertThat(ex.getExpectedLength()).isEqualTo(5);
        assertThat(ex.getActualLength()).isEqualTo(4);
    }

    @Test
    void pipelineCompatibilityExceptionShouldNameStage() {
        PipelineCompatibilityException ex = new PipelineCompatibilityException("Repeat");

        assertThat(ex.getMessage()).contains("'Repeat'");
        assertThat(ex.getStageName()).isEqualTo("Repeat");
    }
}
