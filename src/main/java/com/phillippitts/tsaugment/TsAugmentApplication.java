package com.phillippitts.tsaugment;

import com.phillippitts.tsaugment.config.properties.AugmentationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AugmentationProperties.class
})
public class TsAugmentApplication {

    public static void main(String[] args) {
        SpringApplication.run(TsAugmentApplication.class, args);
    }

}
