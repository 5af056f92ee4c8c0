package com.frostguard.acoustic.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables of the detectors, bound from the {@code acoustic.*} properties.
 */
@Data
@ConfigurationProperties(prefix = "acoustic")
public class DetectionProperties {

    /** Directory the model registry reads from and writes to. */
    private String modelDirectory = "models";

    private Threshold threshold = new Threshold();
    private Outlier outlier = new Outlier();
    private Online online = new Online();
    private Ensemble ensemble = new Ensemble();
    private Monitoring monitoring = new Monitoring();
    private Bootstrap bootstrap = new Bootstrap();

    @Data
    public static class Threshold {
        private int updateIntervalHours = 6;
        private int historyDays = 7;
        /** One analysis window every five minutes. */
        private int samplesPerDay = 288;
        /** 0 widens the bounds the most, 1 keeps them tight. */
        private double sensitivity = 0.1;
        private int minSamples = 10;
        private int maxRecomputeSamples = 1000;
        /** Per-feature anomalies needed before the ensemble counts a threshold vote. */
        private int voteFeatureCount = 2;

        public int historyCapacity() {
            return historyDays * samplesPerDay;
        }
    }

    @Data
    public static class Outlier {
        private int components = 10;
        private double contamination = 0.05;
        private int trees = 100;
        private long randomSeed = 42L;
        private int minSamples = 10;
        /** Features outside their [p5, p95] band before a detection is raised on bounds alone. */
        private int maxTrippedFeatures = 2;
        private int monitoringWindowHours = 24;
    }

    @Data
    public static class Online {
        private int normalBufferSize = 5000;
        private int anomalyBufferSize = 1000;
        private int updateFrequency = 100;
        private double learningRate = 0.01;
        private int minSamples = 10;
        private int components = 10;
        private double minContamination = 0.01;
        private double maxContamination = 0.1;
        private double zScoreLimit = 3.0;
        /** Share of features beyond the z-score limit that marks a statistical anomaly. */
        private double statisticalFeatureShare = 0.3;
        private Duration refitAwaitTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Ensemble {
        private double outlierWeight = 0.4;
        private double thresholdWeight = 0.3;
        private double onlineWeight = 0.3;
        private double confidenceThreshold = 0.7;
        private int historySize = 1000;
        private double latencySmoothing = 0.1;
    }

    @Data
    public static class Monitoring {
        private Duration window = Duration.ofSeconds(5);
        private Duration stopTimeout = Duration.ofSeconds(5);
        private boolean autoStart = false;
    }

    @Data
    public static class Bootstrap {
        private boolean loadOnStart = true;
    }
}
