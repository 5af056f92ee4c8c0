package com.frostguard.acoustic.services;

import com.frostguard.acoustic.config.DetectionProperties;
import com.frostguard.acoustic.dto.HistoryRecord;
import com.frostguard.acoustic.dto.ThresholdRecord;
import com.frostguard.acoustic.dto.ThresholdTableDocument;
import com.frostguard.acoustic.exception.InvalidConfigurationException;
import com.frostguard.acoustic.model.FeatureVector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.frostguard.acoustic.model.CompressorFeatures.RMS_ENERGY;
import static com.frostguard.acoustic.model.CompressorFeatures.SPECTRAL_CENTROID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StatisticalThresholdServiceTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneOffset.UTC);
    private DetectionProperties properties;

    @BeforeEach
    void setUp() {
        properties = new DetectionProperties();
        properties.getThreshold().setSensitivity(0.1);
    }

    private StatisticalThresholdService seeded(int samples, double mean, double std, long seed) {
        StatisticalThresholdService service = new StatisticalThresholdService(properties, clock);
        Random rnd = new Random(seed);
        for (int i = 0; i < samples; i++) {
            service.addObservation(FeatureVector.of(Map.of(RMS_ENERGY, mean + std * rnd.nextGaussian())), false);
        }
        service.recompute();
        return service;
    }

    @Test
    void flagsEnergySpikeAgainstLearnedBounds() {
        StatisticalThresholdService service = seeded(100, 0.5, 0.1, 7);
        FeatureVector probe = FeatureVector.of(Map.of(RMS_ENERGY, 2.0));

        assertThat(service.checkAnomaly(probe)).containsEntry(RMS_ENERGY, true);
        assertThat(service.getAnomalyScore(probe)).isGreaterThan(0.5);
        assertThat(service.checkAnomaly(FeatureVector.of(Map.of(RMS_ENERGY, 0.5)))).containsEntry(RMS_ENERGY, false);
    }

    @Test
    void recordCarriesStatisticsAndPercentiles() {
        StatisticalThresholdService service = seeded(100, 0.5, 0.1, 7);
        ThresholdRecord record = service.getThresholds().get(RMS_ENERGY);

        assertThat(record.getSampleCount()).isEqualTo(100);
        assertThat(record.getMean()).isCloseTo(0.5, within(0.05));
        assertThat(record.getPercentiles()).containsOnlyKeys("p1", "p5", "p10", "p25", "p50", "p75", "p90", "p95", "p99");
        assertThat(record.getLower()).isLessThan(record.getPercentiles().get("p5"));
        assertThat(record.getUpper()).isGreaterThan(record.getPercentiles().get("p95"));
        assertThat(record.getLastUpdated()).isEqualTo(clock.instant());
    }

    @Test
    void boundsNarrowAsSensitivityRises() {
        StatisticalThresholdService service = seeded(200, 0.5, 0.1, 11);
        double previousUpper = Double.POSITIVE_INFINITY;
        double previousWidth = Double.POSITIVE_INFINITY;
        for (double s = 0.0; s <= 1.0001; s += 0.1) {
            service.adjustSensitivity(Math.min(1.0, s));
            ThresholdRecord record = service.getThresholds().get(RMS_ENERGY);
            double width = record.getUpper() - record.getLower();
            assertThat(record.getUpper()).isLessThanOrEqualTo(previousUpper);
            assertThat(width).isLessThanOrEqualTo(previousWidth);
            previousUpper = record.getUpper();
            previousWidth = width;
        }
    }

    @Test
    void flagsTenfoldFeatureAfterThousandNearIdenticalWindows() {
        StatisticalThresholdService service = new StatisticalThresholdService(properties, clock);
        Random rnd = new Random(3);
        for (int i = 0; i < 1000; i++) {
            service.addObservation(FeatureVector.of(Map.of(
                    RMS_ENERGY, 0.5 + 0.001 * rnd.nextGaussian(),
                    SPECTRAL_CENTROID, 1500 + 0.5 * rnd.nextGaussian())), false);
        }
        service.recompute();

        FeatureVector probe = FeatureVector.of(Map.of(RMS_ENERGY, 5.0, SPECTRAL_CENTROID, 1500.0));
        assertThat(service.checkAnomaly(probe)).containsEntry(RMS_ENERGY, true);
        assertThat(service.getAnomalyScore(probe)).isGreaterThan(0.0);
    }

    @Test
    void historyNeverExceedsCapacity() {
        properties.getThreshold().setHistoryDays(1);
        properties.getThreshold().setSamplesPerDay(5);
        StatisticalThresholdService service = new StatisticalThresholdService(properties, clock);

        for (int i = 0; i < 12; i++) {
            service.addObservation(FeatureVector.of(Map.of(RMS_ENERGY, (double) i)), false);
            assertThat(service.getHistorySize()).isLessThanOrEqualTo(5);
        }
        assertThat(service.getHistoryCapacity()).isEqualTo(5);
        assertThat(service.getHistorySize()).isEqualTo(5);
    }

    @Test
    void anomalousObservationsAreIgnored() {
        StatisticalThresholdService service = new StatisticalThresholdService(properties, clock);
        service.addObservation(FeatureVector.of(Map.of(RMS_ENERGY, 9.0)), true);

        assertThat(service.getHistorySize()).isZero();
    }

    @Test
    void recomputeNeedsTenSamples() {
        StatisticalThresholdService service = new StatisticalThresholdService(properties, clock);
        for (int i = 0; i < 9; i++) {
            service.addObservation(FeatureVector.of(Map.of(RMS_ENERGY, 0.5 + i * 0.01)), false);
        }

        assertThat(service.recompute()).isFalse();
        assertThat(service.hasThresholds()).isFalse();
        assertThat(service.getLastUpdate()).isNull();
        assertThat(service.getAnomalyScore(FeatureVector.of(Map.of(RMS_ENERGY, 100.0)))).isZero();
        assertThat(service.checkAnomaly(FeatureVector.of(Map.of(RMS_ENERGY, 100.0)))).containsEntry(RMS_ENERGY, false);
    }

    @Test
    void invalidSensitivityLeavesStateUnchanged() {
        StatisticalThresholdService service = seeded(50, 0.5, 0.1, 5);
        Map<String, ThresholdRecord> before = service.getThresholds();

        assertThatThrownBy(() -> service.adjustSensitivity(1.5)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> service.adjustSensitivity(-0.1)).isInstanceOf(InvalidConfigurationException.class);

        assertThat(service.getSensitivity()).isEqualTo(0.1);
        assertThat(service.getThresholds()).isEqualTo(before);
    }

    @Test
    void featureImportanceIsNormalisedToMostVariableFeature() {
        StatisticalThresholdService service = new StatisticalThresholdService(properties, clock);
        Random rnd = new Random(1);
        for (int i = 0; i < 50; i++) {
            service.addObservation(FeatureVector.of(Map.of(
                    RMS_ENERGY, 0.5 + 0.2 * rnd.nextGaussian(),
                    SPECTRAL_CENTROID, 1500 + 10 * rnd.nextGaussian())), false);
        }
        service.recompute();

        Map<String, Double> importance = service.getFeatureImportance();
        assertThat(importance.get(RMS_ENERGY)).isEqualTo(1.0);
        assertThat(importance.get(SPECTRAL_CENTROID)).isBetween(0.0, 0.1);
        assertThat(service.getStatisticsSummary().getFeatureCount()).isEqualTo(2);
        assertThat(service.getStatisticsSummary().getHistorySize()).isEqualTo(50);
    }

    @Test
    void observationDuringRestoreLandsInRestoredHistory() throws Exception {
        StatisticalThresholdService service = new StatisticalThresholdService(properties, clock);
        CountDownLatch insideRestore = new CountDownLatch(1);
        CountDownLatch releaseRestore = new CountDownLatch(1);
        ThresholdTableDocument slowDocument = new ThresholdTableDocument() {
            @Override
            public List<HistoryRecord> getHistory() {
                insideRestore.countDown();
                try {
                    releaseRestore.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of();
            }
        };
        slowDocument.setUpdateIntervalHours(6);
        slowDocument.setHistoryDays(7);
        slowDocument.setSensitivity(0.1);
        slowDocument.setLastUpdate(clock.instant());
        slowDocument.setThresholds(Map.of());

        Thread loader = new Thread(() -> service.restore(slowDocument));
        loader.start();
        assertThat(insideRestore.await(10, TimeUnit.SECONDS)).isTrue();

        Thread feedback = new Thread(() -> service.addObservation(FeatureVector.of(Map.of(RMS_ENERGY, 0.5)), false));
        feedback.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (feedback.getState() != Thread.State.BLOCKED && feedback.isAlive() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        releaseRestore.countDown();
        loader.join(10_000);
        feedback.join(10_000);

        assertThat(service.getHistorySize()).isEqualTo(1);
    }
}
