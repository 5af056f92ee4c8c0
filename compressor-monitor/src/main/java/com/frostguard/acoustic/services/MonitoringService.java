package com.frostguard.acoustic.services;

import com.frostguard.acoustic.config.DetectionProperties;
import com.frostguard.acoustic.dto.Verdict;
import com.frostguard.acoustic.exception.FeatureExtractionException;
import com.frostguard.acoustic.model.FeatureSchema;
import com.frostguard.acoustic.model.FeatureVector;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic monitoring loop: pulls a window from the feature source, diagnoses
 * it and notifies the alert listeners of positive verdicts. At most one loop
 * runs at a time.
 */
@Slf4j
@Service
public class MonitoringService {

    private final EnsembleDiagnosisService ensemble;
    private final List<AnomalyAlertListener> listeners;
    private final DetectionProperties.Monitoring config;

    private final Object lifecycle = new Object();
    // guarded by lifecycle
    private ExecutorService loop;
    private volatile boolean running;
    private volatile FeatureSchema lastSchema;
    private final AtomicLong iterations = new AtomicLong();

    public MonitoringService(EnsembleDiagnosisService ensemble,
                             List<AnomalyAlertListener> listeners,
                             DetectionProperties properties) {
        this.ensemble = ensemble;
        this.listeners = listeners;
        this.config = properties.getMonitoring();
    }

    /**
     * @return false when a loop is already running
     */
    public boolean start(FeatureSource source) {
        synchronized (lifecycle) {
            if (running) {
                log.warn("Monitoring already running");
                return false;
            }
            running = true;
            loop = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "acoustic-monitor");
                t.setDaemon(true);
                return t;
            });
            loop.execute(() -> run(source));
            ensemble.monitoringStateChanged(true);
        }
        log.info("Monitoring started, window {}", config.getWindow());
        return true;
    }

    private void run(FeatureSource source) {
        Duration window = config.getWindow();
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                runOnce(source);
            } catch (RuntimeException e) {
                log.error("Monitoring iteration failed", e);
            }
            try {
                Thread.sleep(window.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.debug("Monitoring loop exited after {} iterations", iterations.get());
    }

    /**
     * One monitoring cycle. A window that fails extraction is diagnosed as a
     * zero vector of the deployment schema.
     *
     * @return the verdict, or null when the source had no window
     */
    Verdict runOnce(FeatureSource source) {
        iterations.incrementAndGet();
        FeatureVector features;
        try {
            features = source.nextWindow();
        } catch (FeatureExtractionException e) {
            FeatureSchema schema = lastSchema != null ? lastSchema : ensemble.deploymentSchema();
            log.warn("Feature extraction failed, substituting zero vector: {}", e.getMessage());
            features = FeatureVector.zeros(schema);
        }
        if (features == null) {
            return null;
        }
        lastSchema = features.schema();
        Verdict verdict = ensemble.diagnose(features);
        if (verdict.isAnomaly()) {
            for (AnomalyAlertListener listener : listeners) {
                try {
                    listener.onAnomaly(verdict);
                } catch (RuntimeException e) {
                    log.error("Alert listener {} failed", listener.getClass().getSimpleName(), e);
                }
            }
        }
        return verdict;
    }

    /**
     * Stops the loop and waits up to the configured timeout for it to exit.
     *
     * @return true when the loop thread terminated within the timeout
     */
    public boolean stop() {
        ExecutorService current;
        synchronized (lifecycle) {
            if (!running) {
                return true;
            }
            running = false;
            current = loop;
            loop = null;
            ensemble.monitoringStateChanged(false);
        }
        current.shutdownNow();
        boolean terminated = false;
        try {
            terminated = current.awaitTermination(config.getStopTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (terminated) {
            log.info("Monitoring stopped after {} iterations", iterations.get());
        } else {
            log.warn("Monitoring loop did not stop within {}", config.getStopTimeout());
        }
        return terminated;
    }

    public boolean isRunning() {
        return running;
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }
}
