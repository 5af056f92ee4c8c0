package com.frostguard.acoustic;

import com.frostguard.acoustic.config.DetectionProperties;
import com.frostguard.acoustic.dto.SystemStatus;
import com.frostguard.acoustic.dto.Verdict;
import com.frostguard.acoustic.model.AnomalyType;
import com.frostguard.acoustic.services.EnsembleDiagnosisService;
import com.frostguard.acoustic.services.ModelRegistryService;
import com.frostguard.acoustic.services.MonitoringService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "acoustic.bootstrap.load-on-start=false",
        "acoustic.model-directory=target/test-models",
        "acoustic.threshold.sensitivity=0.2"
})
class AcousticMonitorApplicationTests {

    @Autowired
    private DetectionProperties properties;
    @Autowired
    private EnsembleDiagnosisService ensemble;
    @Autowired
    private MonitoringService monitoringService;
    @Autowired
    private ModelRegistryService modelRegistryService;

    @Test
    void contextWiresDetectors() {
        assertThat(properties.getThreshold().getSensitivity()).isEqualTo(0.2);
        assertThat(properties.getMonitoring().getWindow().getSeconds()).isEqualTo(5);
        assertThat(modelRegistryService.modelDirectory().toString()).endsWith("test-models");
        assertThat(monitoringService.isRunning()).isFalse();
    }

    @Test
    void untrainedEnsembleDiagnosesAsNormal() {
        Verdict verdict = ensemble.diagnose(TestWindows.center());

        assertThat(verdict.isAnomaly()).isFalse();
        assertThat(verdict.getAnomalyType()).isEqualTo(AnomalyType.NORMAL);
        assertThat(verdict.getOutlier().isTrained()).isFalse();
        assertThat(verdict.getOnline().isTrained()).isFalse();

        SystemStatus status = ensemble.getSystemStatus();
        assertThat(status.isOutlierModelTrained()).isFalse();
        assertThat(status.getPerformance().getTotalDiagnoses()).isGreaterThanOrEqualTo(1);
    }
}
