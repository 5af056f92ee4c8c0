package com.frostguard.acoustic.training;

import com.frostguard.acoustic.dto.TrainingResult;
import com.frostguard.acoustic.model.FeatureVector;
import com.frostguard.acoustic.model.OutlierModelState;
import com.frostguard.acoustic.ml.Percentiles;
import com.frostguard.acoustic.services.EnsembleDiagnosisService;
import com.frostguard.acoustic.services.ModelRegistryService;
import com.frostguard.acoustic.services.OutlierScoringService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class TrainOutlierModelService {

    private final EnsembleDiagnosisService ensembleDiagnosisService;
    private final OutlierScoringService outlierScoringService;
    private final ModelRegistryService modelRegistryService;

    public TrainingResult trainAndSave(List<FeatureVector> windows) {
        TrainingResult result = ensembleDiagnosisService.initializeWithNormalData(windows);
        log.info("Dataset size: {} windows", result.getTotalSamples());
        log.info("PCA components: {} (explained variance {})", result.getComponents(),
                String.format("%.3f", Arrays.stream(result.getExplainedVarianceRatio()).sum()));
        log.info("Mean training score: {}, score threshold: {}", result.getMeanTrainingScore(), result.getScoreThreshold());

        // lower = worse
        OutlierModelState state = outlierScoringService.getState();
        double[] scores = windows.stream().mapToDouble(w -> state.getPipeline().score(w)).toArray();
        log.info("Calibrated percentiles (lower=worse): p1={}, p2={}, p5={}",
                Percentiles.of(scores, 1), Percentiles.of(scores, 2), Percentiles.of(scores, 5));

        modelRegistryService.saveAll();
        log.info("Models saved to {}", modelRegistryService.modelDirectory().toAbsolutePath());
        return result;
    }
}
