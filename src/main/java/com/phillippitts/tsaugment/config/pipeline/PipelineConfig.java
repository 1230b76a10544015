package com.phillippitts.tsaugment.config.pipeline;

import com.phillippitts.tsaugment.config.properties.AugmentationProperties;
import com.phillippitts.tsaugment.service.augment.Augmenter;
import com.phillippitts.tsaugment.service.augment.AugmenterFactory;
import com.phillippitts.tsaugment.service.pipeline.AugmentationPipeline;
import com.phillippitts.tsaugment.service.pipeline.ConditionalAugmenter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the application pipeline from {@code augmentation.pipeline[*]}.
 *
 * <p>Invalid stages fail context startup with a ConfigurationException.
 */
@Configuration
public class PipelineConfig {

    private static final Logger LOG = LogManager.getLogger(PipelineConfig.class);

    @Bean
    public AugmentationPipeline augmentationPipeline(AugmentationProperties properties, AugmenterFactory factory) {
        AugmentationPipeline pipeline = new AugmentationPipeline();
        for (AugmentationProperties.Stage stage : properties.getPipeline()) {
            Augmenter augmenter = factory.create(stage.name(), stage.params());
            if (stage.probability() != null) {
                augmenter = new ConditionalAugmenter(augmenter, stage.probability());
            }
            pipeline.add(augmenter);
        }
        LOG.info("Configured augmentation pipeline with {} stage(s): {}", pipeline.size(), pipeline.getName());
        return pipeline;
    }
}
