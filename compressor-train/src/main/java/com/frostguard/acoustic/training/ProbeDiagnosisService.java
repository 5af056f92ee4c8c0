package com.frostguard.acoustic.training;

import com.frostguard.acoustic.dto.Verdict;
import com.frostguard.acoustic.services.EnsembleDiagnosisService;
import com.frostguard.acoustic.services.ModelRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reloads the saved detectors and diagnoses a healthy and a faulty window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProbeDiagnosisService {

    private final ModelRegistryService modelRegistryService;
    private final EnsembleDiagnosisService ensembleDiagnosisService;
    private final NormalDataPreparationService dataPreparationService;

    public List<Verdict> probe() {
        modelRegistryService.loadAll();
        Verdict healthy = ensembleDiagnosisService.diagnose(dataPreparationService.baselineWindow());
        log.info(" baseline window : [{}] {} votes={} confidence={}", healthy.getAnomalyType().code(),
                healthy.getMessage(), healthy.getVotes(), String.format("%.3f", healthy.getConfidence()));
        Verdict faulty = ensembleDiagnosisService.diagnose(dataPreparationService.bearingWearWindow());
        log.info(" bearing wear window : [{}] {} votes={} confidence={}", faulty.getAnomalyType().code(),
                faulty.getMessage(), faulty.getVotes(), String.format("%.3f", faulty.getConfidence()));
        return List.of(healthy, faulty);
    }
}
