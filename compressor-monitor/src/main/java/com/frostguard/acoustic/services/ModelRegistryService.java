package com.frostguard.acoustic.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.frostguard.acoustic.config.DetectionProperties;
import com.frostguard.acoustic.dto.ThresholdTableDocument;
import com.frostguard.acoustic.exception.ModelPersistenceException;
import com.frostguard.acoustic.model.ModelRegistryEntry;
import com.frostguard.acoustic.model.OnlineLearnerSnapshot;
import com.frostguard.acoustic.model.OutlierModelState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Saves and loads the state of every detector under the model directory.
 * The threshold table is stored as JSON, fitted models as Java serialized
 * objects.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelRegistryService {

    public static final String THRESHOLDS_FILE = "adaptive_thresholds.json";
    public static final String OUTLIER_MODEL_FILE = "outlier_model.ser";
    public static final String OUTLIER_METADATA_FILE = "outlier_model_metadata.json";
    public static final String ONLINE_LEARNER_FILE = "online_learner.ser";

    private final DetectionProperties properties;
    private final ObjectMapper objectMapper;
    private final StatisticalThresholdService thresholdService;
    private final OutlierScoringService outlierService;
    private final OnlineLearningService onlineService;
    private final EnsembleDiagnosisService ensemble;

    public Path modelDirectory() {
        return Paths.get(properties.getModelDirectory());
    }

    public void saveAll() {
        Path dir = modelDirectory();
        saveThresholds(dir);
        if (outlierService.isTrained()) {
            saveOutlierModel(dir);
        }
        saveOnlineLearner(dir);
    }

    /**
     * Loads whatever state files are present. Missing files are skipped.
     *
     * @return number of components restored
     */
    public int loadAll() {
        Path dir = modelDirectory();
        int loaded = 0;
        loaded += loadThresholds(dir) ? 1 : 0;
        loaded += loadOutlierModel(dir) ? 1 : 0;
        loaded += loadOnlineLearner(dir) ? 1 : 0;
        if (outlierService.isTrained()) {
            ensemble.markInitialized();
        }
        log.info("Loaded {} of 3 detector states from {}", loaded, dir.toAbsolutePath());
        return loaded;
    }

    public void saveThresholds(Path dir) {
        Path file = dir.resolve(THRESHOLDS_FILE);
        try {
            Files.createDirectories(dir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), thresholdService.toDocument());
        } catch (IOException e) {
            throw new ModelPersistenceException("Unable to save thresholds to " + file, e);
        }
        log.info("Thresholds saved: {}", file);
    }

    public boolean loadThresholds(Path dir) {
        Path file = dir.resolve(THRESHOLDS_FILE);
        if (!Files.exists(file)) {
            log.info("No threshold table at {}", file);
            return false;
        }
        try {
            thresholdService.restore(objectMapper.readValue(file.toFile(), ThresholdTableDocument.class));
        } catch (IOException e) {
            throw new ModelPersistenceException("Unable to load thresholds from " + file, e);
        }
        return true;
    }

    public void saveOutlierModel(Path dir) {
        OutlierModelState state = outlierService.getState();
        if (state == null) {
            throw new ModelPersistenceException("Outlier model is not trained, nothing to save");
        }
        Path file = dir.resolve(OUTLIER_MODEL_FILE);
        try {
            Files.createDirectories(dir);
            writeObject(file, state);
            objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValue(dir.resolve(OUTLIER_METADATA_FILE).toFile(), state.getMetadata());
        } catch (IOException e) {
            throw new ModelPersistenceException("Unable to save outlier model to " + file, e);
        }
        log.info("Outlier model saved: {} (version {}, {} rows)", file, state.getVersion(),
                state.getMetadata().getTrainedRows());
    }

    public boolean loadOutlierModel(Path dir) {
        Path file = dir.resolve(OUTLIER_MODEL_FILE);
        if (!Files.exists(file)) {
            log.info("No outlier model at {}", file);
            return false;
        }
        OutlierModelState state = readObject(file, OutlierModelState.class);
        Path metadataFile = dir.resolve(OUTLIER_METADATA_FILE);
        if (Files.exists(metadataFile)) {
            ModelRegistryEntry metadata = readOutlierMetadata(dir);
            if (!Objects.equals(metadata.getSchemaHash(), state.getSchema().hash())) {
                throw new ModelPersistenceException("Outlier model schema hash " + state.getSchema().hash()
                        + " does not match metadata " + metadata.getSchemaHash());
            }
        }
        outlierService.restore(state);
        return true;
    }

    public ModelRegistryEntry readOutlierMetadata(Path dir) {
        Path file = dir.resolve(OUTLIER_METADATA_FILE);
        try {
            return objectMapper.readValue(file.toFile(), ModelRegistryEntry.class);
        } catch (IOException e) {
            throw new ModelPersistenceException("Unable to read model metadata " + file, e);
        }
    }

    public void saveOnlineLearner(Path dir) {
        Path file = dir.resolve(ONLINE_LEARNER_FILE);
        try {
            Files.createDirectories(dir);
            writeObject(file, onlineService.snapshot());
        } catch (IOException e) {
            throw new ModelPersistenceException("Unable to save online learner to " + file, e);
        }
        log.info("Online learner saved: {}", file);
    }

    public boolean loadOnlineLearner(Path dir) {
        Path file = dir.resolve(ONLINE_LEARNER_FILE);
        if (!Files.exists(file)) {
            log.info("No online learner state at {}", file);
            return false;
        }
        onlineService.restore(readObject(file, OnlineLearnerSnapshot.class));
        return true;
    }

    private static void writeObject(Path file, Object value) throws IOException {
        try (OutputStream out = Files.newOutputStream(file);
             ObjectOutputStream oos = new ObjectOutputStream(out)) {
            oos.writeObject(value);
            oos.flush();
        }
    }

    private static <T> T readObject(Path file, Class<T> type) {
        try (InputStream in = Files.newInputStream(file);
             ObjectInputStream ois = new ObjectInputStream(in)) {
            return type.cast(ois.readObject());
        } catch (IOException | ClassNotFoundException | ClassCastException e) {
            throw new ModelPersistenceException("Unable to read " + type.getSimpleName() + " from " + file, e);
        }
    }
}
