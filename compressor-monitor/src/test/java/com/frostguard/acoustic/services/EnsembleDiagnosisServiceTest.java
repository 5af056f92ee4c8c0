package com.frostguard.acoustic.services;

import com.frostguard.acoustic.TestWindows;
import com.frostguard.acoustic.config.DetectionProperties;
import com.frostguard.acoustic.dto.DetectorVerdict;
import com.frostguard.acoustic.dto.PerformanceMetrics;
import com.frostguard.acoustic.dto.TrainingResult;
import com.frostguard.acoustic.dto.Verdict;
import com.frostguard.acoustic.model.AnomalyType;
import com.frostguard.acoustic.model.FeatureVector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.frostguard.acoustic.model.CompressorFeatures.RMS_ENERGY;
import static com.frostguard.acoustic.model.CompressorFeatures.SPECTRAL_CENTROID;
import static com.frostguard.acoustic.model.CompressorFeatures.TEMPORAL_STD;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnsembleDiagnosisServiceTest {

    @Mock
    private StatisticalThresholdService thresholdService;
    @Mock
    private OutlierScoringService outlierService;
    @Mock
    private OnlineLearningService onlineService;

    private DetectionProperties properties;
    private EnsembleDiagnosisService ensemble;
    private final FeatureVector window = TestWindows.center();

    @BeforeEach
    void setUp() {
        properties = new DetectionProperties();
        ensemble = new EnsembleDiagnosisService(thresholdService, outlierService, onlineService,
                new EnsembleVotingPolicy(properties), properties,
                Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneOffset.UTC));
    }

    private static DetectorVerdict verdict(String detector, boolean anomaly, double confidence, AnomalyType type) {
        return DetectorVerdict.builder()
                .detector(detector)
                .anomaly(anomaly)
                .confidence(confidence)
                .anomalyType(type)
                .trained(true)
                .trippedFeatures(List.of())
                .build();
    }

    private void thresholdsFlag(String... features) {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        window.names().forEach(n -> flags.put(n, false));
        for (String feature : features) {
            flags.put(feature, true);
        }
        when(thresholdService.hasThresholds()).thenReturn(true);
        when(thresholdService.checkAnomaly(window)).thenReturn(flags);
        when(thresholdService.getAnomalyScore(window)).thenReturn(0.9);
    }

    @Test
    void agreeingDetectorsProduceTypedAnomaly() {
        when(outlierService.detect(window))
                .thenReturn(verdict(OutlierScoringService.DETECTOR, true, 0.9, AnomalyType.BEARING_WEAR));
        thresholdsFlag(RMS_ENERGY, SPECTRAL_CENTROID, TEMPORAL_STD);
        when(onlineService.predict(window))
                .thenReturn(verdict(OnlineLearningService.DETECTOR, false, 0.9, AnomalyType.NORMAL));

        Verdict result = ensemble.diagnose(window);

        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getVotes()).isEqualTo(2);
        assertThat(result.getAnomalyType()).isEqualTo(AnomalyType.BEARING_WEAR);
        assertThat(result.getThreshold().getTrippedFeatures()).containsExactly(RMS_ENERGY, TEMPORAL_STD, SPECTRAL_CENTROID);
        assertThat(result.getThreshold().isAnomaly()).isTrue();
        assertThat(result.getProcessingTimeMs()).isGreaterThanOrEqualTo(0.0);
        assertThat(ensemble.getDiagnosisHistory()).containsExactly(result);
    }

    @Test
    void twoTrippedFeaturesAreNotAThresholdVote() {
        when(outlierService.detect(window))
                .thenReturn(verdict(OutlierScoringService.DETECTOR, true, 0.9, AnomalyType.GENERAL_ANOMALY));
        thresholdsFlag(RMS_ENERGY, SPECTRAL_CENTROID);
        when(onlineService.predict(window))
                .thenReturn(verdict(OnlineLearningService.DETECTOR, false, 0.1, AnomalyType.NORMAL));

        Verdict result = ensemble.diagnose(window);

        assertThat(result.getThreshold().isAnomaly()).isFalse();
        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getAnomalyType()).isEqualTo(AnomalyType.NORMAL);
    }

    @Test
    void groundTruthIsFedBackAndScored() {
        properties.getEnsemble().setConfidenceThreshold(0.5);
        when(outlierService.detect(window))
                .thenReturn(verdict(OutlierScoringService.DETECTOR, true, 1.0, AnomalyType.GENERAL_ANOMALY));
        when(thresholdService.hasThresholds()).thenReturn(false);
        when(onlineService.predict(window))
                .thenReturn(verdict(OnlineLearningService.DETECTOR, true, 1.0, AnomalyType.GENERAL_ANOMALY));

        ensemble.diagnose(window, false);
        ensemble.diagnose(window, true);
        ensemble.diagnose(window);

        verify(thresholdService).addObservation(window, false);
        verify(thresholdService).addObservation(window, true);
        verify(onlineService).addSample(window, false);
        verify(onlineService).addSample(window, true);

        PerformanceMetrics metrics = ensemble.getPerformanceMetrics();
        assertThat(metrics.getTotalDiagnoses()).isEqualTo(3);
        assertThat(metrics.getAnomaliesDetected()).isEqualTo(3);
        assertThat(metrics.getFalsePositives()).isEqualTo(1);
        assertThat(metrics.getTruePositives()).isEqualTo(1);
        assertThat(metrics.getFalseNegatives()).isZero();
        assertThat(metrics.accuracy()).isEqualTo(0.5);
    }

    @Test
    void missedFaultCountsAsFalseNegative() {
        when(outlierService.detect(window)).thenReturn(DetectorVerdict.notTrained(OutlierScoringService.DETECTOR));
        when(thresholdService.hasThresholds()).thenReturn(false);
        when(onlineService.predict(window)).thenReturn(DetectorVerdict.notTrained(OnlineLearningService.DETECTOR));

        Verdict result = ensemble.diagnose(window, true);

        assertThat(result.isAnomaly()).isFalse();
        assertThat(ensemble.getPerformanceMetrics().getFalseNegatives()).isEqualTo(1);
    }

    @Test
    void failingDetectorDegradesToErrorVerdict() {
        when(outlierService.detect(window)).thenThrow(new IllegalStateException("boom"));

        Verdict result = ensemble.diagnose(window, true);

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getAnomalyType()).isEqualTo(AnomalyType.ERROR);
        assertThat(result.getMessage()).contains("boom");
        verify(thresholdService, never()).addObservation(any(), anyBoolean());
        assertThat(ensemble.getPerformanceMetrics().getTotalDiagnoses()).isEqualTo(1);
    }

    @Test
    void diagnosisHistoryIsBounded() {
        properties.getEnsemble().setHistorySize(3);
        when(outlierService.detect(window)).thenReturn(DetectorVerdict.notTrained(OutlierScoringService.DETECTOR));
        when(thresholdService.hasThresholds()).thenReturn(false);
        when(onlineService.predict(window)).thenReturn(DetectorVerdict.notTrained(OnlineLearningService.DETECTOR));

        for (int i = 0; i < 5; i++) {
            ensemble.diagnose(window);
        }

        assertThat(ensemble.getDiagnosisHistory()).hasSize(3);
        assertThat(ensemble.getPerformanceMetrics().getTotalDiagnoses()).isEqualTo(5);
    }

    @Test
    void initializationSeedsAllDetectors() {
        List<FeatureVector> samples = TestWindows.normal(21, 1);
        TrainingResult trained = TrainingResult.builder().totalSamples(21).build();
        when(outlierService.trainOnNormalData(samples)).thenReturn(trained);
        when(onlineService.awaitPendingRefit(properties.getOnline().getRefitAwaitTimeout())).thenReturn(true);

        TrainingResult result = ensemble.initializeWithNormalData(samples);

        assertThat(result).isSameAs(trained);
        verify(thresholdService, times(21)).addObservation(any(FeatureVector.class), anyBoolean());
        verify(thresholdService).recompute();
        verify(onlineService, times(11)).addSample(any(FeatureVector.class), anyBoolean());
        verify(onlineService).awaitPendingRefit(properties.getOnline().getRefitAwaitTimeout());
        assertThat(ensemble.isInitialized()).isTrue();
    }
}
