package com.frostguard.acoustic.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.frostguard.acoustic.TestWindows;
import com.frostguard.acoustic.config.DetectionProperties;
import com.frostguard.acoustic.dto.DetectorVerdict;
import com.frostguard.acoustic.exception.ModelPersistenceException;
import com.frostguard.acoustic.ml.DefaultPipelineFactory;
import com.frostguard.acoustic.model.FeatureVector;
import com.frostguard.acoustic.model.ModelRegistryEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.frostguard.acoustic.model.CompressorFeatures.HIGH_FREQ_RATIO;
import static com.frostguard.acoustic.model.CompressorFeatures.SPECTRAL_CENTROID;
import static com.frostguard.acoustic.model.CompressorFeatures.ZERO_CROSSING_RATE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelRegistryServiceTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneOffset.UTC);
    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @TempDir
    Path modelDir;

    private DetectionProperties properties;

    @BeforeEach
    void setUp() {
        properties = new DetectionProperties();
        properties.setModelDirectory(modelDir.toString());
        properties.getOnline().setUpdateFrequency(50);
        properties.getOutlier().setTrees(50);
    }

    private Stack newStack() {
        return new Stack(properties, objectMapper, clock);
    }

    @Test
    void saveLoadRoundTripReproducesOutputs() {
        Stack original = newStack();
        List<FeatureVector> samples = TestWindows.normal(200, 21);
        original.ensemble.initializeWithNormalData(samples);
        TestWindows.normal(30, 22).forEach(s -> original.online.addSample(s, true));
        original.registry.saveAll();

        assertThat(modelDir.resolve(ModelRegistryService.THRESHOLDS_FILE)).exists();
        assertThat(modelDir.resolve(ModelRegistryService.OUTLIER_MODEL_FILE)).exists();
        assertThat(modelDir.resolve(ModelRegistryService.OUTLIER_METADATA_FILE)).exists();
        assertThat(modelDir.resolve(ModelRegistryService.ONLINE_LEARNER_FILE)).exists();

        Stack restored = newStack();
        assertThat(restored.registry.loadAll()).isEqualTo(3);
        assertThat(restored.ensemble.isInitialized()).isTrue();

        FeatureVector probe = TestWindows.shifted(4, SPECTRAL_CENTROID, ZERO_CROSSING_RATE, HIGH_FREQ_RATIO);

        assertThat(restored.thresholds.getThresholds()).isEqualTo(original.thresholds.getThresholds());
        assertThat(restored.thresholds.checkAnomaly(probe)).isEqualTo(original.thresholds.checkAnomaly(probe));
        assertThat(restored.thresholds.getAnomalyScore(probe)).isEqualTo(original.thresholds.getAnomalyScore(probe));
        assertThat(restored.thresholds.getHistorySize()).isEqualTo(original.thresholds.getHistorySize());
        assertThat(restored.thresholds.getLastUpdate()).isEqualTo(original.thresholds.getLastUpdate());

        DetectorVerdict outlierBefore = original.outlier.detect(probe);
        DetectorVerdict outlierAfter = restored.outlier.detect(probe);
        assertThat(outlierAfter.getScore()).isEqualTo(outlierBefore.getScore());
        assertThat(outlierAfter.isAnomaly()).isEqualTo(outlierBefore.isAnomaly());
        assertThat(outlierAfter.getAnomalyType()).isEqualTo(outlierBefore.getAnomalyType());
        assertThat(outlierAfter.getTrippedFeatures()).isEqualTo(outlierBefore.getTrippedFeatures());

        DetectorVerdict onlineBefore = original.online.predict(probe);
        DetectorVerdict onlineAfter = restored.online.predict(probe);
        assertThat(onlineAfter.getScore()).isEqualTo(onlineBefore.getScore());
        assertThat(onlineAfter.isAnomaly()).isEqualTo(onlineBefore.isAnomaly());
        assertThat(onlineAfter.getModelVersion()).isEqualTo(onlineBefore.getModelVersion());
        assertThat(restored.online.getLearningStatistics()).isEqualTo(original.online.getLearningStatistics());
        assertThat(restored.online.getFeatureStatistics()).isEqualTo(original.online.getFeatureStatistics());
    }

    @Test
    void metadataSidecarDescribesModel() {
        Stack stack = newStack();
        stack.outlier.trainOnNormalData(TestWindows.normal(120, 5));
        stack.registry.saveOutlierModel(modelDir);

        ModelRegistryEntry metadata = stack.registry.readOutlierMetadata(modelDir);

        assertThat(metadata.getTrainedRows()).isEqualTo(120L);
        assertThat(metadata.getTrees()).isEqualTo(50);
        assertThat(metadata.getSchemaHash()).isEqualTo(TestWindows.SCHEMA.hash());
        assertThat(metadata.getFeatureSchema()).isEqualTo(TestWindows.SCHEMA.toString());
        assertThat(metadata.getCreatedAt()).isEqualTo(clock.instant());
    }

    @Test
    void missingFilesAreSkipped() {
        Stack stack = newStack();

        assertThat(stack.registry.loadAll()).isZero();
        assertThat(stack.outlier.isTrained()).isFalse();
        assertThat(stack.ensemble.isInitialized()).isFalse();
    }

    @Test
    void corruptModelFileIsReported() throws Exception {
        Files.write(modelDir.resolve(ModelRegistryService.OUTLIER_MODEL_FILE), new byte[]{1, 2, 3});
        Stack stack = newStack();

        assertThatThrownBy(() -> stack.registry.loadOutlierModel(modelDir))
                .isInstanceOf(ModelPersistenceException.class);
        assertThat(stack.outlier.isTrained()).isFalse();
    }

    @Test
    void savingUntrainedOutlierModelIsRejected() {
        Stack stack = newStack();

        assertThatThrownBy(() -> stack.registry.saveOutlierModel(modelDir))
                .isInstanceOf(ModelPersistenceException.class);
    }

    private static final class Stack {
        final StatisticalThresholdService thresholds;
        final OutlierScoringService outlier;
        final OnlineLearningService online;
        final EnsembleDiagnosisService ensemble;
        final ModelRegistryService registry;

        Stack(DetectionProperties properties, ObjectMapper objectMapper, Clock clock) {
            DefaultPipelineFactory factory = new DefaultPipelineFactory(properties);
            thresholds = new StatisticalThresholdService(properties, clock);
            outlier = new OutlierScoringService(properties, factory, clock);
            online = new OnlineLearningService(properties, factory, Runnable::run, clock);
            ensemble = new EnsembleDiagnosisService(thresholds, outlier, online,
                    new EnsembleVotingPolicy(properties), properties, clock);
            registry = new ModelRegistryService(properties, objectMapper, thresholds, outlier, online, ensemble);
        }
    }
}
