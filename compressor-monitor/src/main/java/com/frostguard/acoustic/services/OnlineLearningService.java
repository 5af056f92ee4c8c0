package com.frostguard.acoustic.services;

import com.frostguard.acoustic.config.DetectionProperties;
import com.frostguard.acoustic.dto.DetectorVerdict;
import com.frostguard.acoustic.dto.FeatureStatistic;
import com.frostguard.acoustic.dto.FeatureStatistics;
import com.frostguard.acoustic.dto.LearningStatistics;
import com.frostguard.acoustic.exception.InvalidConfigurationException;
import com.frostguard.acoustic.ml.OutlierPipeline;
import com.frostguard.acoustic.ml.OutlierPipelineFactory;
import com.frostguard.acoustic.ml.Percentiles;
import com.frostguard.acoustic.model.AnomalyType;
import com.frostguard.acoustic.model.ClassStatistics;
import com.frostguard.acoustic.model.FeatureSchema;
import com.frostguard.acoustic.model.FeatureVector;
import com.frostguard.acoustic.model.LabeledSample;
import com.frostguard.acoustic.model.OnlineBuffers;
import com.frostguard.acoustic.model.OnlineLearnerSnapshot;
import com.frostguard.acoustic.model.OnlineModelState;
import com.frostguard.acoustic.model.RunningStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Incremental detector fed with every diagnosed window. Samples land in
 * bounded buffers; every {@code updateFrequency} samples the outlier pipeline
 * is refitted on the refit executor and swapped in as a new versioned state.
 * Predictions only ever read the current state reference.
 */
@Slf4j
@Service
public class OnlineLearningService {

    public static final String DETECTOR = "online";

    private static final double MIN_LEARNING_RATE = 0.001;
    private static final double MAX_LEARNING_RATE = 1.0;

    private final DetectionProperties.Online config;
    private final OutlierPipelineFactory pipelineFactory;
    private final Executor refitExecutor;
    private final Clock clock;

    private final Object lock = new Object();
    // guarded by lock
    private OnlineBuffers buffers;
    private long totalSamples;
    private long samplesSinceRefit;
    private long generation;

    private final AtomicReference<OnlineModelState> model = new AtomicReference<>(OnlineModelState.untrained());
    private final AtomicLong versions = new AtomicLong();
    private final AtomicLong refitCount = new AtomicLong();
    private volatile CompletableFuture<Void> pendingRefit = CompletableFuture.completedFuture(null);
    private volatile double learningRate;
    private volatile Instant lastUpdate;

    public OnlineLearningService(DetectionProperties properties,
                                 OutlierPipelineFactory pipelineFactory,
                                 @Qualifier("refitExecutor") Executor refitExecutor,
                                 Clock clock) {
        this.config = properties.getOnline();
        this.pipelineFactory = pipelineFactory;
        this.refitExecutor = refitExecutor;
        this.clock = clock;
        validateLearningRate(config.getLearningRate());
        this.learningRate = config.getLearningRate();
        this.buffers = new OnlineBuffers(config.getNormalBufferSize(), config.getAnomalyBufferSize());
    }

    public void addSample(FeatureVector features, boolean isAnomaly) {
        addSample(features, isAnomaly, 1.0, clock.instant());
    }

    public void addSample(FeatureVector features, boolean isAnomaly, double confidence, Instant timestamp) {
        List<FeatureVector> refitData = null;
        double anomalyFraction = 0.0;
        long refitGeneration = 0;
        synchronized (lock) {
            buffers.add(new LabeledSample(features, isAnomaly, confidence, timestamp));
            totalSamples++;
            samplesSinceRefit++;
            if (samplesSinceRefit >= config.getUpdateFrequency()) {
                samplesSinceRefit = 0;
                refitData = buffers.normalFeatures();
                anomalyFraction = buffers.anomalyFraction();
                refitGeneration = generation;
            }
        }
        if (refitData != null) {
            submitRefit(refitData, anomalyFraction, refitGeneration);
        }
    }

    private void submitRefit(List<FeatureVector> normal, double anomalyFraction, long refitGeneration) {
        try {
            pendingRefit = CompletableFuture.runAsync(() -> refit(normal, anomalyFraction, refitGeneration), refitExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Online refit rejected, keeping model version {}", model.get().getVersion());
        }
    }

    private void refit(List<FeatureVector> normal, double anomalyFraction, long refitGeneration) {
        if (normal.size() < config.getMinSamples()) {
            log.info("Online refit skipped, only {} normal samples buffered", normal.size());
            return;
        }
        try {
            double contamination = Percentiles.clamp(anomalyFraction,
                    config.getMinContamination(), config.getMaxContamination());
            FeatureSchema schema = normal.get(0).schema();
            double[][] rows = new double[normal.size()][];
            for (int i = 0; i < rows.length; i++) {
                rows[i] = schema.toArray(normal.get(i));
            }
            OutlierPipeline pipeline = pipelineFactory.fit(schema, rows, config.getComponents(), contamination);
            Instant now = clock.instant();
            synchronized (lock) {
                if (refitGeneration != generation) {
                    log.info("Online refit discarded, learner was reset meanwhile");
                    return;
                }
                OnlineModelState next = new OnlineModelState(pipeline, versions.incrementAndGet(), now, contamination, rows.length);
                model.set(next);
                lastUpdate = now;
                refitCount.incrementAndGet();
                log.info("Online model refitted: version={}, rows={}, contamination={}",
                        next.getVersion(), rows.length, String.format("%.3f", contamination));
            }
        } catch (RuntimeException e) {
            log.error("Online refit failed, keeping model version {}", model.get().getVersion(), e);
        }
    }

    /**
     * Blocks until the most recently submitted refit has finished. Refits run in
     * submission order on the refit executor, so every earlier one is done too.
     *
     * @return false when the timeout elapsed or the caller was interrupted
     */
    public boolean awaitPendingRefit(Duration timeout) {
        try {
            pendingRefit.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("Online refit still running after {}", timeout);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Online refit failed", e.getCause());
        }
    }

    public DetectorVerdict predict(FeatureVector features) {
        OnlineModelState current = model.get();
        if (!current.isTrained()) {
            return DetectorVerdict.notTrained(DETECTOR);
        }
        try {
            OutlierPipeline pipeline = current.getPipeline();
            double[] reduced = pipeline.reduce(features);
            double score = pipeline.getScorer().score(reduced);
            boolean outlier = pipeline.getScorer().decision(reduced) < 0;
            boolean statistical = isStatisticalAnomaly(features);
            boolean anomaly = outlier || statistical;
            double confidence = Percentiles.clamp(Math.abs(score), 0.0, 1.0);

            AnomalyType type = statistical ? AnomalyType.STATISTICAL_ANOMALY
                    : anomaly ? AnomalyType.GENERAL_ANOMALY : AnomalyType.NORMAL;
            String message;
            if (!anomaly) {
                message = AnomalyType.NORMAL.description();
            } else if (statistical) {
                message = String.format("Statistical anomaly detected (confidence %.1f%%)", confidence * 100);
            } else {
                message = String.format("Model-based anomaly detected (confidence %.1f%%)", confidence * 100);
            }
            return DetectorVerdict.builder()
                    .detector(DETECTOR)
                    .anomaly(anomaly)
                    .confidence(confidence)
                    .score(score)
                    .anomalyType(type)
                    .message(message)
                    .trained(true)
                    .trippedFeatures(List.of())
                    .statisticalAnomaly(statistical)
                    .modelVersion(current.getVersion())
                    .build();
        } catch (RuntimeException e) {
            log.error("Online prediction failed", e);
            return DetectorVerdict.failed(DETECTOR, e);
        }
    }

    /** True when more than the configured share of features sit beyond the z-score limit of normal samples. */
    private boolean isStatisticalAnomaly(FeatureVector features) {
        int beyond = 0;
        int checked = 0;
        synchronized (lock) {
            ClassStatistics normal = buffers.normalStats();
            for (Map.Entry<String, Double> entry : features.asMap().entrySet()) {
                RunningStatistics stats = normal.get(entry.getKey());
                if (stats == null || stats.getCount() == 0 || stats.std() <= 0) {
                    continue;
                }
                checked++;
                if (Math.abs((entry.getValue() - stats.getMean()) / stats.std()) > config.getZScoreLimit()) {
                    beyond++;
                }
            }
        }
        return checked > 0 && (double) beyond / checked > config.getStatisticalFeatureShare();
    }

    /** The rate is reported and persisted with the learner; refits do not read it. */
    public void adjustLearningRate(double rate) {
        validateLearningRate(rate);
        learningRate = rate;
        log.info("Online learning rate set to {}", rate);
    }

    private static void validateLearningRate(double rate) {
        if (!(rate >= MIN_LEARNING_RATE && rate <= MAX_LEARNING_RATE)) {
            throw new InvalidConfigurationException("learningRate", rate, MIN_LEARNING_RATE, MAX_LEARNING_RATE);
        }
    }

    /** Drops buffered samples, statistics, counters and the fitted model. */
    public void resetLearning() {
        synchronized (lock) {
            buffers.clear();
            totalSamples = 0;
            samplesSinceRefit = 0;
            generation++;
            model.set(OnlineModelState.untrained());
            lastUpdate = null;
        }
        log.info("Online learning state reset");
    }

    public LearningStatistics getLearningStatistics() {
        OnlineModelState current = model.get();
        synchronized (lock) {
            int normal = buffers.normalSize();
            int anomalies = buffers.anomalySize();
            return LearningStatistics.builder()
                    .totalSamples(totalSamples)
                    .bufferSize(normal + anomalies)
                    .normalSamples(normal)
                    .anomalySamples(anomalies)
                    .anomalyRate(buffers.anomalyFraction())
                    .lastUpdate(lastUpdate)
                    .learningRate(learningRate)
                    .updateFrequency(config.getUpdateFrequency())
                    .modelVersion(current.getVersion())
                    .refitCount(refitCount.get())
                    .trained(current.isTrained())
                    .build();
        }
    }

    public FeatureStatistics getFeatureStatistics() {
        synchronized (lock) {
            return FeatureStatistics.builder()
                    .normal(toView(buffers.normalStats()))
                    .anomaly(toView(buffers.anomalyStats()))
                    .build();
        }
    }

    private static Map<String, FeatureStatistic> toView(ClassStatistics stats) {
        Map<String, FeatureStatistic> view = new LinkedHashMap<>();
        stats.view().forEach((name, s) -> view.put(name, FeatureStatistic.builder()
                .count(s.getCount())
                .mean(s.getMean())
                .std(s.std())
                .build()));
        return view;
    }

    public boolean isTrained() {
        return model.get().isTrained();
    }

    public long getModelVersion() {
        return model.get().getVersion();
    }

    public OnlineLearnerSnapshot snapshot() {
        synchronized (lock) {
            return OnlineLearnerSnapshot.builder()
                    .buffers(buffers.copy())
                    .model(model.get())
                    .totalSamples(totalSamples)
                    .samplesSinceRefit(samplesSinceRefit)
                    .refitCount(refitCount.get())
                    .learningRate(learningRate)
                    .lastUpdate(lastUpdate)
                    .build();
        }
    }

    public void restore(OnlineLearnerSnapshot snapshot) {
        validateLearningRate(snapshot.getLearningRate());
        synchronized (lock) {
            buffers = snapshot.getBuffers().copy();
            totalSamples = snapshot.getTotalSamples();
            samplesSinceRefit = snapshot.getSamplesSinceRefit();
            generation++;
            versions.accumulateAndGet(snapshot.getModel().getVersion(), Math::max);
            refitCount.set(snapshot.getRefitCount());
            model.set(snapshot.getModel());
            learningRate = snapshot.getLearningRate();
            lastUpdate = snapshot.getLastUpdate();
        }
        log.info("Online learner restored: {} buffered samples, model version {}",
                snapshot.getBuffers().normalSize() + snapshot.getBuffers().anomalySize(), snapshot.getModel().getVersion());
    }
}
