package com.phillippitts.tsaugment.domain;

import com.phillippitts.tsaugment.exception.ShapeMismatchException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DatasetTest {

    @Test
    void exposesShape() {
        Dataset dataset = Dataset.of(new double[][] {{1, 2, 3}, {4, 5, 6}}, "0", "1");

        assertThat(dataset.rowCount()).isEqualTo(2);
        assertThat(dataset.rowLength()).isEqualTo(3);
        assertThat(dataset.getLabels()).containsExactly("0", "1");
        assertThat(dataset.getRow(1)).containsExactly(4, 5, 6);
    }

    @Test
    void emptyDatasetHasZeroRowLength() {
        Dataset dataset = new Dataset(new double[0][], List.of());

        assertThat(dataset.rowCount()).isZero();
        assertThat(dataset.rowLength()).isZero();
    }

    @Test
    void rejectsLabelCountMismatch() {
        assertThatThrownBy(() -> Dataset.of(new double[][] {{1}, {2}}, "a"))
                .isInstanceOf(ShapeMismatchException.class)
                .hasMessageContaining("Feature rows (2) and labels (1)");
    }

    @Test
    void rejectsRaggedRows() {
        assertThatThrownBy(() -> Dataset.of(new double[][] {{1, 2}, {3}}, "a", "b"))
                .isInstanceOf(ShapeMismatchException.class)
                .hasMessageContaining("Row 1 has length 1");
    }

    @Test
    void rejectsNullRowsAndLabels() {
        assertThatThrownBy(() -> Dataset.of(new double[][] {null}, "a"))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new Dataset(new double[][] {{1}}, Arrays.asList((String) null)))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void replaceFeaturesMustKeepRowCount() {
        Dataset dataset = Dataset.of(new double[][] {{1, 2}, {3, 4}}, "a", "b");

        assertThatThrownBy(() -> dataset.replaceFeatures(new double[][] {{1, 2}}))
                .isInstanceOf(ShapeMismatchException.class);
        assertThat(dataset.rowCount()).isEqualTo(2);
    }

    @Test
    void replaceFeaturesMayChangeRowLengthUniformly() {
        Dataset dataset = Dataset.of(new double[][] {{1, 2, 3}, {4, 5, 6}}, "a", "b");

        dataset.replaceFeatures(new double[][] {{1}, {4}});

        assertThat(dataset.rowLength()).isEqualTo(1);
        assertThat(dataset.getLabels()).containsExactly("a", "b");
    }

    @Test
    void replaceContentsChangesRowsAndLabelsTogether() {
        Dataset dataset = Dataset.of(new double[][] {{1}}, "a");

        dataset.replaceContents(new double[][] {{1}, {1}}, List.of("a", "a"));

        assertThat(dataset.rowCount()).isEqualTo(2);
        assertThat(dataset.getLabels()).containsExactly("a", "a");
    }

    @Test
    void copyIsIndependent() {
        Dataset original = Dataset.of(new double[][] {{1, 2}, {3, 4}}, "a", "b");

        Dataset copy = original.copy();
        copy.getRow(0)[0] = 99;
        copy.setLabel(1, "z");

        assertThat(original.getRow(0)).containsExactly(1, 2);
        assertThat(original.getLabels()).containsExactly("a", "b");
    }

    @Test
    void labelsCannotBeResizedThroughView() {
        Dataset dataset = Dataset.of(new double[][] {{1}, {2}}, "a", "b");

        assertThatThrownBy(() -> dataset.getLabels().add("c"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(dataset.getLabels()).hasSize(dataset.rowCount());
    }

    @Test
    void setLabelReplacesSingleLabel() {
        Dataset dataset = Dataset.of(new double[][] {{1}, {2}}, "a", "b");

        dataset.setLabel(0, "x");

        assertThat(dataset.getLabels()).containsExactly("x", "b");
        assertThatThrownBy(() -> dataset.setLabel(0, null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> dataset.setLabel(2, "c")).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void replaceWithTakesDeepCopy() {
        Dataset target = Dataset.of(new double[][] {{0}}, "x");
        Dataset source = Dataset.of(new double[][] {{1, 2}, {3, 4}}, "a", "b");

        target.replaceWith(source);
        source.getRow(0)[0] = 42;

        assertThat(target.rowCount()).isEqualTo(2);
        assertThat(target.getRow(0)).containsExactly(1, 2);
        assertThat(target.getLabels()).containsExactly("a", "b");
    }
}
