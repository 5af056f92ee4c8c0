package com.frostguard.acoustic.services;

import com.frostguard.acoustic.config.DetectionProperties;
import com.frostguard.acoustic.dto.DetectorVerdict;
import com.frostguard.acoustic.dto.MonitoringSummary;
import com.frostguard.acoustic.dto.TrainingResult;
import com.frostguard.acoustic.exception.InsufficientDataException;
import com.frostguard.acoustic.ml.IsolationForestScorer;
import com.frostguard.acoustic.ml.OutlierPipeline;
import com.frostguard.acoustic.ml.OutlierPipelineFactory;
import com.frostguard.acoustic.ml.Percentiles;
import com.frostguard.acoustic.model.AnomalyType;
import com.frostguard.acoustic.model.FeatureBand;
import com.frostguard.acoustic.model.FeatureSchema;
import com.frostguard.acoustic.model.FeatureVector;
import com.frostguard.acoustic.model.ModelRegistryEntry;
import com.frostguard.acoustic.model.OutlierModelState;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static com.frostguard.acoustic.model.CompressorFeatures.HIGH_FREQ_RATIO;
import static com.frostguard.acoustic.model.CompressorFeatures.LOW_FREQ_RATIO;
import static com.frostguard.acoustic.model.CompressorFeatures.RMS_ENERGY;
import static com.frostguard.acoustic.model.CompressorFeatures.SPECTRAL_CENTROID;
import static com.frostguard.acoustic.model.CompressorFeatures.TEMPORAL_STD;
import static com.frostguard.acoustic.model.CompressorFeatures.ZERO_CROSSING_RATE;

/**
 * Outlier detector trained offline on normal operation windows. Scores are
 * computed in PCA space, lower scores are more anomalous.
 */
@Slf4j
@Service
public class OutlierScoringService {

    public static final String DETECTOR = "outlier";

    // monitoring ring entries per hour at the slowest supported cadence of one window a second
    private static final int ENTRIES_PER_HOUR = 3600;

    private final DetectionProperties.Outlier config;
    private final OutlierPipelineFactory pipelineFactory;
    private final Clock clock;
    private final AtomicReference<OutlierModelState> state = new AtomicReference<>();
    private final AtomicLong versions = new AtomicLong();
    private final Deque<MonitoringRecord> monitoringHistory = new ArrayDeque<>();

    public OutlierScoringService(DetectionProperties properties, OutlierPipelineFactory pipelineFactory, Clock clock) {
        this.config = properties.getOutlier();
        this.pipelineFactory = pipelineFactory;
        this.clock = clock;
    }

    /**
     * Fits scaler, PCA and isolation forest on presumed normal samples and
     * derives the score threshold and per-feature bands.
     *
     * @throws InsufficientDataException when fewer than the minimum number of samples are given
     */
    public TrainingResult trainOnNormalData(List<FeatureVector> samples) {
        if (samples == null || samples.size() < config.getMinSamples()) {
            throw new InsufficientDataException("Outlier model training", config.getMinSamples(),
                    samples == null ? 0 : samples.size());
        }
        log.info("Training outlier model on {} normal samples...", samples.size());
        FeatureSchema schema = samples.get(0).schema();
        double[][] rows = new double[samples.size()][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = schema.toArray(samples.get(i));
        }

        OutlierPipeline pipeline = pipelineFactory.fit(schema, rows, config.getComponents(), config.getContamination());

        double[] scores = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            scores[i] = pipeline.score(samples.get(i));
        }
        double scoreThreshold = Percentiles.of(scores, 5);

        Map<String, FeatureBand> bounds = new LinkedHashMap<>();
        for (int j = 0; j < schema.size(); j++) {
            double[] column = Percentiles.column(rows, j);
            bounds.put(schema.name(j), new FeatureBand(Percentiles.of(column, 5), Percentiles.of(column, 95)));
        }

        ModelRegistryEntry metadata = ModelRegistryEntry.builder()
                .createdAt(clock.instant())
                .trees(pipeline.getScorer() instanceof IsolationForestScorer
                        ? ((IsolationForestScorer) pipeline.getScorer()).trees() : config.getTrees())
                .subsample(pipeline.getScorer() instanceof IsolationForestScorer
                        ? ((IsolationForestScorer) pipeline.getScorer()).samplingRate() : null)
                .components(pipeline.getReducer().outputDimension())
                .contamination(config.getContamination())
                .featureSchema(schema.toString())
                .schemaHash(schema.hash())
                .trainedRows((long) rows.length)
                .scoreThreshold(scoreThreshold)
                .notes("Isolation forest trained from normal compressor windows")
                .build();
        state.set(new OutlierModelState(pipeline, scoreThreshold, bounds, metadata, versions.incrementAndGet()));

        double[] ratio = pipeline.getReducer().explainedVarianceRatio();
        TrainingResult result = TrainingResult.builder()
                .totalSamples(rows.length)
                .featureDimensions(schema.size())
                .components(pipeline.getReducer().outputDimension())
                .explainedVarianceRatio(ratio)
                .meanTrainingScore(Percentiles.mean(scores))
                .scoreThreshold(scoreThreshold)
                .build();
        log.info("Outlier model trained: components={}, explained variance={}, threshold={}",
                result.getComponents(), Arrays.stream(ratio).sum(), scoreThreshold);
        return result;
    }

    public DetectorVerdict detect(FeatureVector features) {
        OutlierModelState current = state.get();
        if (current == null) {
            return DetectorVerdict.notTrained(DETECTOR);
        }
        try {
            double score = current.getPipeline().score(features);
            List<String> tripped = trippedFeatures(current, features);
            boolean anomaly = score < current.getScoreThreshold() || tripped.size() > config.getMaxTrippedFeatures();
            AnomalyType type = classify(tripped);
            double confidence = 0.7 * Percentiles.clamp(Math.abs(score) / 2.0, 0.0, 1.0)
                    + 0.3 * Percentiles.clamp(tripped.size() / 5.0, 0.0, 1.0);

            record(anomaly, type);
            return DetectorVerdict.builder()
                    .detector(DETECTOR)
                    .anomaly(anomaly)
                    .confidence(confidence)
                    .score(score)
                    .anomalyType(type)
                    .message(type == AnomalyType.NORMAL
                            ? type.description()
                            : String.format("%s (confidence %.1f%%)", type.description(), confidence * 100))
                    .trained(true)
                    .trippedFeatures(tripped)
                    .modelVersion(current.getVersion())
                    .build();
        } catch (RuntimeException e) {
            log.error("Outlier detection failed", e);
            return DetectorVerdict.failed(DETECTOR, e);
        }
    }

    private static List<String> trippedFeatures(OutlierModelState current, FeatureVector features) {
        List<String> tripped = new ArrayList<>();
        features.asMap().forEach((name, value) -> {
            FeatureBand band = current.getFeatureBounds().get(name);
            if (band != null && !band.contains(value)) {
                tripped.add(name);
            }
        });
        return tripped;
    }

    static AnomalyType classify(List<String> tripped) {
        if (tripped.isEmpty()) {
            return AnomalyType.NORMAL;
        }
        if (tripped.contains(SPECTRAL_CENTROID)
                && (tripped.contains(ZERO_CROSSING_RATE) || tripped.contains(HIGH_FREQ_RATIO))) {
            return AnomalyType.BEARING_WEAR;
        }
        if (tripped.contains(RMS_ENERGY) && tripped.contains(TEMPORAL_STD)) {
            return AnomalyType.COMPRESSOR_ABNORMAL;
        }
        if (tripped.contains(LOW_FREQ_RATIO)) {
            return AnomalyType.REFRIGERANT_LEAK;
        }
        return AnomalyType.GENERAL_ANOMALY;
    }

    private void record(boolean anomaly, AnomalyType type) {
        Instant now = clock.instant();
        int capacity = config.getMonitoringWindowHours() * ENTRIES_PER_HOUR;
        synchronized (monitoringHistory) {
            monitoringHistory.addLast(new MonitoringRecord(now, anomaly, type));
            while (monitoringHistory.size() > capacity) {
                monitoringHistory.removeFirst();
            }
            evictBefore(windowStart(now));
        }
    }

    private Instant windowStart(Instant now) {
        return now.minus(Duration.ofHours(config.getMonitoringWindowHours()));
    }

    // caller holds the monitoringHistory lock
    private void evictBefore(Instant cutoff) {
        while (!monitoringHistory.isEmpty() && !monitoringHistory.peekFirst().getTimestamp().isAfter(cutoff)) {
            monitoringHistory.removeFirst();
        }
    }

    public MonitoringSummary getMonitoringSummary() {
        List<MonitoringRecord> records;
        synchronized (monitoringHistory) {
            evictBefore(windowStart(clock.instant()));
            records = new ArrayList<>(monitoringHistory);
        }
        Map<AnomalyType, Long> byType = new EnumMap<>(AnomalyType.class);
        int anomalies = 0;
        for (MonitoringRecord record : records) {
            if (record.isAnomaly()) {
                anomalies++;
                byType.merge(record.getType(), 1L, Long::sum);
            }
        }
        return MonitoringSummary.builder()
                .totalSamples(records.size())
                .anomalyCount(anomalies)
                .anomalyRate(records.isEmpty() ? 0.0 : (double) anomalies / records.size())
                .countsByType(byType)
                .windowHours(config.getMonitoringWindowHours())
                .lastUpdate(records.isEmpty() ? null : records.get(records.size() - 1).getTimestamp())
                .build();
    }

    public boolean isTrained() {
        return state.get() != null;
    }

    /** Current fitted state, null while untrained. */
    public OutlierModelState getState() {
        return state.get();
    }

    public void restore(OutlierModelState restored) {
        versions.accumulateAndGet(restored.getVersion(), Math::max);
        state.set(restored);
        log.info("Outlier model restored: version={}, schema={}", restored.getVersion(), restored.getSchema());
    }

    @Value
    private static class MonitoringRecord {
        Instant timestamp;
        boolean anomaly;
        AnomalyType type;
    }
}
