package com.frostguard.acoustic.training;

import com.frostguard.acoustic.config.DetectionProperties;
import com.frostguard.acoustic.model.FeatureVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;

@Slf4j
@SpringBootApplication(scanBasePackages = {
        "com.frostguard.acoustic.config",
        "com.frostguard.acoustic.ml",
        "com.frostguard.acoustic.services",
        "com.frostguard.acoustic.training"})
@EnableConfigurationProperties(DetectionProperties.class)
public class CompressorModelTrainingApplication {

    public static void main(String[] args) {
        SpringApplication.run(CompressorModelTrainingApplication.class, args);
    }

    @Bean
    public CommandLineRunner trainModels(NormalDataPreparationService dataPreparationService,
                                         TrainOutlierModelService trainOutlierModelService,
                                         ProbeDiagnosisService probeDiagnosisService) {
        return args -> {
            log.info("Preparing normal operation windows...");
            List<FeatureVector> windows = dataPreparationService.prepareNormalWindows();
            log.info("Preparing normal operation windows Completed, {} windows", windows.size());

            log.info("Train detectors...");
            trainOutlierModelService.trainAndSave(windows);
            log.info("Train detectors Completed...");

            log.info("Probe diagnosis against saved models...");
            probeDiagnosisService.probe();
            log.info("Probe diagnosis Completed...");
        };
    }
}
