package com.phillippitts.tsaugment.service.pipeline;

import com.phillippitts.tsaugment.domain.Dataset;
import com.phillippitts.tsaugment.exception.DimensionException;
import com.phillippitts.tsaugment.exception.PipelineCompatibilityException;
import com.phillippitts.tsaugment.service.augment.BatchExecution;
import com.phillippitts.tsaugment.service.augment.impl.Crop;
import com.phillippitts.tsaugment.service.augment.impl.FrequencyMask;
import com.phillippitts.tsaugment.service.augment.impl.Repeat;
import com.phillippitts.tsaugment.service.augment.impl.Reverse;
import com.phillippitts.tsaugment.service.augment.impl.Scaling;
import com.phillippitts.tsaugment.testutil.ReverseCompletionExecutor;
import com.phillippitts.tsaugment.testutil.Series;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AugmentationPipelineTest {

    @Test
    void stageWiseRunsStagesInInsertionOrder() {
        Dataset dataset = Series.waves(3, 10);
        AugmentationPipeline pipeline = new AugmentationPipeline()
                .add(new Repeat(2))
                .add(new Crop(4));

        pipeline.augmentBatch(dataset, false, false);

        assertThat(dataset.rowCount()).isEqualTo(6);
        assertThat(dataset.rowLength()).isEqualTo(4);
        assertThat(dataset.getLabels()).containsExactly("0", "1", "2", "0", "1", "2");
    }

    @Test
    void emptyPipelineLeavesDatasetAlone() {
        Dataset dataset = Series.waves(2, 5);
        Dataset before = dataset.copy();

        new AugmentationPipeline().augmentBatch(dataset, true, false);

        assertThat(dataset.getFeatures()).isDeepEqualTo(before.getFeatures());
        assertThat(dataset.getLabels()).isEqualTo(before.getLabels());
    }

    @Test
    void perSampleRunsEveryStageOnEveryRow() {
        Dataset dataset = Series.waves(4, 10);
        AugmentationPipeline pipeline = new AugmentationPipeline(List.of(new Scaling(2.0, 2.0), new Crop(5)));

        pipeline.augmentBatch(dataset, BatchExecution.parallel(new ReverseCompletionExecutor(4)), true);

        assertThat(dataset.rowCount()).isEqualTo(4);
        assertThat(dataset.rowLength()).isEqualTo(5);
        assertThat(dataset.getLabels()).containsExactly("0", "1", "2", "3");
    }

    @Test
    void perSampleMatchesStageWiseForDeterministicStages() {
        Dataset stageWise = Series.waves(3, 6);
        Dataset perSample = stageWise.copy();
        AugmentationPipeline pipeline = new AugmentationPipeline()
                .add(new Reverse())
                .add(new Scaling(3.0, 3.0));

        pipeline.augmentBatch(stageWise, false, false);
        pipeline.augmentBatch(perSample, false, true);

        assertThat(perSample.getFeatures()).isDeepEqualTo(stageWise.getFeatures());
    }

    @Test
    void perSampleRejectsBatchOnlyStageBeforeTouchingData() {
        Dataset dataset = Series.waves(2, 6);
        Dataset before = dataset.copy();
        AugmentationPipeline pipeline = new AugmentationPipeline()
                .add(new Reverse())
                .add(new Repeat(2));

        assertThatThrownBy(() -> pipeline.augmentBatch(dataset, false, true))
                .isInstanceOf(PipelineCompatibilityException.class)
                .hasMessageContaining("Repeat");
        assertThat(dataset.getFeatures()).isDeepEqualTo(before.getFeatures());
        assertThat(pipeline.supportsPerSamplePipelining()).isFalse();
    }

    @Test
    void failingStageLeavesDatasetUnmodified() {
        Dataset dataset = Series.waves(2, 8);
        Dataset before = dataset.copy();
        AugmentationPipeline pipeline = new AugmentationPipeline()
                .add(new Crop(3))
                .add(new FrequencyMask(1, false));

        assertThatThrownBy(() -> pipeline.augmentBatch(dataset, false, false))
                .isInstanceOf(DimensionException.class);
        assertThat(dataset.rowLength()).isEqualTo(8);
        assertThat(dataset.getFeatures()).isDeepEqualTo(before.getFeatures());
    }

    @Test
    void augmentOneChainsStages() {
        AugmentationPipeline pipeline = new AugmentationPipeline()
                .add(new Reverse())
                .add(new Scaling(2.0, 2.0));

        assertThat(pipeline.augmentOne(new double[] {1, 2, 3})).containsExactly(6, 4, 2);
    }

    @Test
    void augmentOneWithoutStagesReturnsCopy() {
        double[] sample = {1, 2};

        double[] out = new AugmentationPipeline().augmentOne(sample);

        assertThat(out).containsExactly(1, 2).isNotSameAs(sample);
    }

    @Test
    void nameListsStages() {
        AugmentationPipeline pipeline = new AugmentationPipeline().add(new Crop(2)).add(new Reverse());

        assertThat(pipeline.getName()).isEqualTo("Pipeline[Crop -> Reverse]");
        assertThat(pipeline.size()).isEqualTo(2);
        assertThat(pipeline.getStages()).hasSize(2);
        assertThatThrownBy(() -> pipeline.getStages().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void pipelinesNest() {
        Dataset dataset = Dataset.of(new double[][] {{1, 2, 3}}, "x");
        AugmentationPipeline inner = new AugmentationPipeline().add(new Reverse());
        AugmentationPipeline outer = new AugmentationPipeline().add(inner).add(new Scaling(10.0, 10.0));

        outer.augmentBatch(dataset, false, false);

        assertThat(dataset.getRow(0)).containsExactly(30, 20, 10);
    }

    @Test
    void gatedPipelineAppliesAllStagesOrNone() {
        int rows = 200;
        double[][] features = new double[rows][];
        for (int r = 0; r < rows; r++) {
            features[r] = new double[] {r, r + 1, r + 2};
        }
        Dataset dataset = new Dataset(features, Collections.nCopies(rows, "l"));
        AugmentationPipeline pipeline = new AugmentationPipeline()
                .add(new Reverse())
                .add(new Scaling(2.0, 2.0));

        new ConditionalAugmenter(pipeline, 0.5).augmentBatch(dataset, BatchExecution.sequential());

        int augmented = 0;
        for (int r = 0; r < rows; r++) {
            double[] row = dataset.getRow(r);
            if (row[0] == r) {
                assertThat(row).containsExactly(r, r + 1, r + 2);
            } else {
                assertThat(row).containsExactly(2.0 * (r + 2), 2.0 * (r + 1), 2.0 * r);
                augmented++;
            }
        }
        assertThat(augmented).isBetween(50, 150);
    }
}
