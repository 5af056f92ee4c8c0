package com.frostguard.acoustic.services;

import com.frostguard.acoustic.config.DetectionProperties;
import com.frostguard.acoustic.dto.DetectorVerdict;
import com.frostguard.acoustic.dto.PerformanceMetrics;
import com.frostguard.acoustic.dto.SystemStatus;
import com.frostguard.acoustic.dto.TrainingResult;
import com.frostguard.acoustic.dto.Verdict;
import com.frostguard.acoustic.model.AnomalyType;
import com.frostguard.acoustic.model.CompressorFeatures;
import com.frostguard.acoustic.model.FeatureSchema;
import com.frostguard.acoustic.model.FeatureVector;
import com.frostguard.acoustic.model.OutlierModelState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs the statistical threshold, outlier and online detectors on each
 * window and fuses their sub-verdicts into one diagnosis.
 */
@Slf4j
@Service
public class EnsembleDiagnosisService {

    public static final String THRESHOLD_DETECTOR = "threshold";

    private final StatisticalThresholdService thresholdService;
    private final OutlierScoringService outlierService;
    private final OnlineLearningService onlineService;
    private final EnsembleVotingPolicy votingPolicy;
    private final DetectionProperties properties;
    private final Clock clock;

    private final Deque<Verdict> history = new ArrayDeque<>();
    private final Object metricsLock = new Object();
    // guarded by metricsLock
    private long totalDiagnoses;
    private long anomaliesDetected;
    private long truePositives;
    private long trueNegatives;
    private long falsePositives;
    private long falseNegatives;
    private double averageProcessingTimeMs;

    private volatile boolean initialized;
    private volatile boolean monitoringActive;

    public EnsembleDiagnosisService(StatisticalThresholdService thresholdService,
                                    OutlierScoringService outlierService,
                                    OnlineLearningService onlineService,
                                    EnsembleVotingPolicy votingPolicy,
                                    DetectionProperties properties,
                                    Clock clock) {
        this.thresholdService = thresholdService;
        this.outlierService = outlierService;
        this.onlineService = onlineService;
        this.votingPolicy = votingPolicy;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Trains the outlier model on the samples, seeds the threshold table with
     * all of them and the online learner with the first half.
     */
    public TrainingResult initializeWithNormalData(List<FeatureVector> samples) {
        log.info("Initializing detectors with {} normal samples...", samples.size());
        TrainingResult result = outlierService.trainOnNormalData(samples);

        samples.forEach(s -> thresholdService.addObservation(s, false));
        thresholdService.recompute();

        int onlineSeed = (samples.size() + 1) / 2;
        samples.subList(0, onlineSeed).forEach(s -> onlineService.addSample(s, false));
        if (!onlineService.awaitPendingRefit(properties.getOnline().getRefitAwaitTimeout())) {
            log.warn("Online learner still refitting after seeding, model version {}", onlineService.getModelVersion());
        }

        initialized = true;
        log.info("Detectors initialized: {} threshold features, online learner seeded with {} samples",
                thresholdService.getThresholds().size(), onlineSeed);
        return result;
    }

    public Verdict diagnose(FeatureVector features) {
        return diagnose(features, null);
    }

    /**
     * @param groundTruth true label of the window when known, fed back into the
     *                    threshold table and the online learner
     */
    public Verdict diagnose(FeatureVector features, Boolean groundTruth) {
        long start = System.nanoTime();
        Verdict verdict;
        try {
            DetectorVerdict outlier = outlierService.detect(features);
            DetectorVerdict threshold = thresholdVerdict(features);
            DetectorVerdict online = onlineService.predict(features);
            EnsembleVotingPolicy.Fusion fusion = votingPolicy.fuse(outlier, threshold, online);

            if (groundTruth != null) {
                thresholdService.addObservation(features, groundTruth);
                onlineService.addSample(features, groundTruth);
            }
            verdict = Verdict.builder()
                    .anomaly(fusion.isAnomaly())
                    .confidence(fusion.getConfidence())
                    .anomalyType(fusion.getAnomalyType())
                    .message(fusion.getMessage())
                    .outlier(outlier)
                    .threshold(threshold)
                    .online(online)
                    .votes(fusion.getVotes())
                    .majorityVote(fusion.isMajorityVote())
                    .timestamp(clock.instant())
                    .build();
        } catch (RuntimeException e) {
            log.error("Diagnosis failed", e);
            verdict = Verdict.builder()
                    .anomaly(false)
                    .confidence(0.0)
                    .anomalyType(AnomalyType.ERROR)
                    .message("Diagnosis failed: " + e.getMessage())
                    .timestamp(clock.instant())
                    .build();
        }
        double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
        verdict.setProcessingTimeMs(elapsedMs);
        recordMetrics(verdict, groundTruth, elapsedMs);
        remember(verdict);
        return verdict;
    }

    private DetectorVerdict thresholdVerdict(FeatureVector features) {
        if (!thresholdService.hasThresholds()) {
            return DetectorVerdict.notTrained(THRESHOLD_DETECTOR);
        }
        Map<String, Boolean> flags = thresholdService.checkAnomaly(features);
        List<String> tripped = flags.entrySet().stream()
                .filter(Map.Entry::getValue)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        double score = thresholdService.getAnomalyScore(features);
        boolean anomaly = tripped.size() > properties.getThreshold().getVoteFeatureCount();
        return DetectorVerdict.builder()
                .detector(THRESHOLD_DETECTOR)
                .anomaly(anomaly)
                .confidence(score)
                .score(score)
                .anomalyType(anomaly ? AnomalyType.GENERAL_ANOMALY : AnomalyType.NORMAL)
                .message(tripped.isEmpty() ? "All features within bounds" : "Out of bounds: " + tripped)
                .trained(true)
                .trippedFeatures(tripped)
                .build();
    }

    private void recordMetrics(Verdict verdict, Boolean groundTruth, double elapsedMs) {
        synchronized (metricsLock) {
            totalDiagnoses++;
            if (verdict.isAnomaly()) {
                anomaliesDetected++;
            }
            if (groundTruth != null) {
                if (verdict.isAnomaly()) {
                    if (groundTruth) {
                        truePositives++;
                    } else {
                        falsePositives++;
                    }
                } else if (groundTruth) {
                    falseNegatives++;
                } else {
                    trueNegatives++;
                }
            }
            double alpha = properties.getEnsemble().getLatencySmoothing();
            averageProcessingTimeMs = totalDiagnoses == 1
                    ? elapsedMs
                    : alpha * elapsedMs + (1 - alpha) * averageProcessingTimeMs;
        }
    }

    private void remember(Verdict verdict) {
        int capacity = properties.getEnsemble().getHistorySize();
        synchronized (history) {
            history.addLast(verdict);
            while (history.size() > capacity) {
                history.removeFirst();
            }
        }
    }

    public List<Verdict> getDiagnosisHistory() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    public PerformanceMetrics getPerformanceMetrics() {
        synchronized (metricsLock) {
            return PerformanceMetrics.builder()
                    .totalDiagnoses(totalDiagnoses)
                    .anomaliesDetected(anomaliesDetected)
                    .truePositives(truePositives)
                    .trueNegatives(trueNegatives)
                    .falsePositives(falsePositives)
                    .falseNegatives(falseNegatives)
                    .averageProcessingTimeMs(averageProcessingTimeMs)
                    .build();
        }
    }

    public SystemStatus getSystemStatus() {
        return SystemStatus.builder()
                .initialized(initialized)
                .monitoring(monitoringActive)
                .outlierModelTrained(outlierService.isTrained())
                .onlineModelTrained(onlineService.isTrained())
                .thresholdFeatureCount(thresholdService.getThresholds().size())
                .thresholdLastUpdate(thresholdService.getLastUpdate())
                .performance(getPerformanceMetrics())
                .learning(onlineService.getLearningStatistics())
                .outlierMonitoring(outlierService.getMonitoringSummary())
                .build();
    }

    /** Schema of the trained outlier model, or the default compressor schema. */
    public FeatureSchema deploymentSchema() {
        OutlierModelState state = outlierService.getState();
        return state != null ? state.getSchema() : CompressorFeatures.DEFAULT_SCHEMA;
    }

    public boolean isInitialized() {
        return initialized;
    }

    void markInitialized() {
        initialized = true;
    }

    void monitoringStateChanged(boolean active) {
        monitoringActive = active;
    }
}
