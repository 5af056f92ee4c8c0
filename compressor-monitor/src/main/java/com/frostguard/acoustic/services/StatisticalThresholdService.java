package com.frostguard.acoustic.services;

import com.frostguard.acoustic.config.DetectionProperties;
import com.frostguard.acoustic.dto.HistoryRecord;
import com.frostguard.acoustic.dto.ThresholdRecord;
import com.frostguard.acoustic.dto.ThresholdSummary;
import com.frostguard.acoustic.dto.ThresholdTableDocument;
import com.frostguard.acoustic.exception.InvalidConfigurationException;
import com.frostguard.acoustic.ml.Percentiles;
import com.frostguard.acoustic.model.FeatureVector;
import com.frostguard.acoustic.model.HistoryEntry;
import com.frostguard.acoustic.model.RollingHistory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-feature adaptive bounds recalibrated from a rolling window of normal
 * observations. The table is republished as a whole on every recompute.
 */
@Slf4j
@Service
public class StatisticalThresholdService {

    static final double[] PERCENTILES = {1, 5, 10, 25, 50, 75, 90, 95, 99};

    private final DetectionProperties.Threshold config;
    private final Clock clock;
    private final Object recomputeLock = new Object();

    private volatile RollingHistory history;
    private volatile Map<String, ThresholdRecord> thresholds = Collections.emptyMap();
    private volatile double sensitivity;
    private volatile int updateIntervalHours;
    private volatile int historyDays;
    private volatile Instant lastUpdate;

    public StatisticalThresholdService(DetectionProperties properties, Clock clock) {
        this.config = properties.getThreshold();
        this.clock = clock;
        validateSensitivity(config.getSensitivity());
        this.sensitivity = config.getSensitivity();
        this.updateIntervalHours = config.getUpdateIntervalHours();
        this.historyDays = config.getHistoryDays();
        this.history = new RollingHistory(config.historyCapacity());
    }

    public void addObservation(FeatureVector features, boolean isAnomaly) {
        addObservation(features, isAnomaly, clock.instant());
    }

    /**
     * Adds a normal observation to the history and recomputes the bounds once
     * the update interval has elapsed. Anomalous observations are ignored.
     */
    public void addObservation(FeatureVector features, boolean isAnomaly, Instant timestamp) {
        if (isAnomaly) {
            return;
        }
        synchronized (recomputeLock) {
            // restore swaps the ring under the same lock
            history.append(timestamp, features, false);
        }
        if (isUpdateDue()) {
            recompute();
        }
    }

    private boolean isUpdateDue() {
        Instant last = lastUpdate;
        return last == null
                || Duration.between(last, clock.instant()).compareTo(Duration.ofHours(updateIntervalHours)) >= 0;
    }

    /**
     * Rebuilds the table from the most recent history.
     *
     * @return false when there was not enough history and nothing changed
     */
    public boolean recompute() {
        synchronized (recomputeLock) {
            List<HistoryEntry> recent = history.recent(config.getMaxRecomputeSamples());
            if (recent.size() < config.getMinSamples()) {
                log.debug("Threshold recompute skipped, {} samples in history", recent.size());
                return false;
            }
            Instant now = clock.instant();
            double factor = 1.0 - sensitivity;
            Map<String, ThresholdRecord> table = new LinkedHashMap<>();
            for (String name : recent.get(0).getFeatures().names()) {
                double[] values = recent.stream()
                        .filter(e -> e.getFeatures().contains(name))
                        .mapToDouble(e -> e.getFeatures().get(name))
                        .toArray();
                table.put(name, buildRecord(values, factor, now));
            }
            thresholds = Collections.unmodifiableMap(table);
            lastUpdate = now;
            log.info("Thresholds recomputed for {} features from {} samples (sensitivity {})",
                    table.size(), recent.size(), sensitivity);
            return true;
        }
    }

    private static ThresholdRecord buildRecord(double[] values, double factor, Instant now) {
        double mean = Percentiles.mean(values);
        double std = Percentiles.sampleStd(values);
        Map<String, Double> percentiles = new LinkedHashMap<>();
        for (double p : PERCENTILES) {
            percentiles.put("p" + (int) p, Percentiles.of(values, p));
        }
        double percentileLower = percentiles.get("p5") * factor;
        double percentileUpper = percentiles.get("p95") * (1 + factor);
        double zLower = mean - 3 * std * factor;
        double zUpper = mean + 3 * std * (1 + factor);

        return ThresholdRecord.builder()
                .lower(Math.min(percentileLower, zLower))
                .upper(Math.max(percentileUpper, zUpper))
                .mean(mean)
                .std(std)
                .percentiles(Collections.unmodifiableMap(percentiles))
                .sampleCount(values.length)
                .lastUpdated(now)
                .build();
    }

    /** Out-of-band flag per feature of the vector, false where no bound is known. */
    public Map<String, Boolean> checkAnomaly(FeatureVector features) {
        Map<String, ThresholdRecord> table = thresholds;
        Map<String, Boolean> flags = new LinkedHashMap<>();
        features.asMap().forEach((name, value) -> {
            ThresholdRecord record = table.get(name);
            flags.put(name, record != null && !record.contains(value));
        });
        return flags;
    }

    public double getAnomalyScore(FeatureVector features) {
        Map<String, ThresholdRecord> table = thresholds;
        List<Double> scores = new ArrayList<>();
        features.asMap().forEach((name, value) -> {
            ThresholdRecord record = table.get(name);
            if (record != null && record.getStd() > 0) {
                double z = Math.abs((value - record.getMean()) / record.getStd());
                scores.add(Math.min(1.0, z / 3.0));
            }
        });
        if (scores.isEmpty()) {
            return 0.0;
        }
        double max = scores.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double mean = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return 0.7 * max + 0.3 * mean;
    }

    public void adjustSensitivity(double newSensitivity) {
        validateSensitivity(newSensitivity);
        synchronized (recomputeLock) {
            sensitivity = newSensitivity;
        }
        log.info("Threshold sensitivity set to {}", newSensitivity);
        if (!history.isEmpty()) {
            recompute();
        }
    }

    private static void validateSensitivity(double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new InvalidConfigurationException("sensitivity", value, 0.0, 1.0);
        }
    }

    public Map<String, ThresholdRecord> getThresholds() {
        Map<String, ThresholdRecord> copy = new LinkedHashMap<>();
        thresholds.forEach((name, record) -> copy.put(name, record.toBuilder().build()));
        return Collections.unmodifiableMap(copy);
    }

    /** Coefficient of variation per feature, normalised to the most variable feature. */
    public Map<String, Double> getFeatureImportance() {
        Map<String, Double> importance = new LinkedHashMap<>();
        thresholds.forEach((name, record) -> importance.put(name,
                record.getMean() != 0 ? record.getStd() / Math.abs(record.getMean()) : 0.0));
        double max = importance.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        if (max > 0) {
            importance.replaceAll((name, cv) -> cv / max);
        }
        return importance;
    }

    public ThresholdSummary getStatisticsSummary() {
        Map<String, ThresholdRecord> table = thresholds;
        Map<String, ThresholdSummary.FeatureSummary> features = new LinkedHashMap<>();
        table.forEach((name, record) -> features.put(name, ThresholdSummary.FeatureSummary.builder()
                .mean(record.getMean())
                .std(record.getStd())
                .range(record.getUpper() - record.getLower())
                .sampleCount(record.getSampleCount())
                .build()));
        return ThresholdSummary.builder()
                .featureCount(table.size())
                .lastUpdate(lastUpdate)
                .historySize(history.size())
                .updateIntervalHours(updateIntervalHours)
                .sensitivity(sensitivity)
                .features(features)
                .featureImportance(getFeatureImportance())
                .build();
    }

    public boolean hasThresholds() {
        return !thresholds.isEmpty();
    }

    public double getSensitivity() {
        return sensitivity;
    }

    public Instant getLastUpdate() {
        return lastUpdate;
    }

    public int getHistorySize() {
        return history.size();
    }

    public int getHistoryCapacity() {
        return history.capacity();
    }

    public ThresholdTableDocument toDocument() {
        List<HistoryRecord> records = new ArrayList<>();
        for (HistoryEntry entry : history.snapshot()) {
            records.add(HistoryRecord.builder()
                    .timestamp(entry.getTimestamp())
                    .features(new LinkedHashMap<>(entry.getFeatures().asMap()))
                    .anomaly(entry.isAnomaly())
                    .build());
        }
        return ThresholdTableDocument.builder()
                .updateIntervalHours(updateIntervalHours)
                .historyDays(historyDays)
                .sensitivity(sensitivity)
                .lastUpdate(lastUpdate)
                .thresholds(new LinkedHashMap<>(getThresholds()))
                .history(records)
                .build();
    }

    public void restore(ThresholdTableDocument document) {
        validateSensitivity(document.getSensitivity());
        synchronized (recomputeLock) {
            RollingHistory restored = new RollingHistory(document.getHistoryDays() * config.getSamplesPerDay());
            if (document.getHistory() != null) {
                for (HistoryRecord record : document.getHistory()) {
                    restored.append(record.getTimestamp(), FeatureVector.of(record.getFeatures()), record.isAnomaly());
                }
            }
            Map<String, ThresholdRecord> table = document.getThresholds() == null
                    ? Collections.emptyMap() : new LinkedHashMap<>(document.getThresholds());
            this.history = restored;
            this.updateIntervalHours = document.getUpdateIntervalHours();
            this.historyDays = document.getHistoryDays();
            this.sensitivity = document.getSensitivity();
            this.lastUpdate = document.getLastUpdate();
            this.thresholds = Collections.unmodifiableMap(table);
        }
        log.info("Thresholds restored for {} features", thresholds.size());
    }
}
