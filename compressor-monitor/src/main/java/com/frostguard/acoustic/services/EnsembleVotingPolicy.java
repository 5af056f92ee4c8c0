package com.frostguard.acoustic.services;

import com.frostguard.acoustic.config.DetectionProperties;
import com.frostguard.acoustic.dto.DetectorVerdict;
import com.frostguard.acoustic.model.AnomalyType;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.frostguard.acoustic.model.CompressorFeatures.LOW_FREQ_RATIO;
import static com.frostguard.acoustic.model.CompressorFeatures.RMS_ENERGY;
import static com.frostguard.acoustic.model.CompressorFeatures.SPECTRAL_CENTROID;
import static com.frostguard.acoustic.model.CompressorFeatures.ZERO_CROSSING_RATE;

/**
 * Majority vote over the three detectors, gated by their weighted confidence.
 */
@Component
@RequiredArgsConstructor
public class EnsembleVotingPolicy {

    private final DetectionProperties properties;

    public Fusion fuse(DetectorVerdict outlier, DetectorVerdict threshold, DetectorVerdict online) {
        DetectionProperties.Ensemble config = properties.getEnsemble();
        int votes = (outlier.isAnomaly() ? 1 : 0) + (threshold.isAnomaly() ? 1 : 0) + (online.isAnomaly() ? 1 : 0);
        double weighted = config.getOutlierWeight() * outlier.getConfidence()
                + config.getThresholdWeight() * threshold.getConfidence()
                + config.getOnlineWeight() * online.getConfidence();
        boolean majority = votes >= 2;
        boolean anomaly = majority && weighted >= config.getConfidenceThreshold();
        AnomalyType type = anomaly ? resolveType(outlier, threshold, online) : AnomalyType.NORMAL;
        return new Fusion(anomaly, weighted, votes, majority, type, message(anomaly, weighted, type, votes));
    }

    /**
     * Outlier model type first, then the threshold features, then the online
     * statistical flag.
     */
    AnomalyType resolveType(DetectorVerdict outlier, DetectorVerdict threshold, DetectorVerdict online) {
        AnomalyType outlierType = outlier.getAnomalyType();
        if (outlierType != null && outlierType.isFault()) {
            return outlierType;
        }
        List<String> tripped = threshold.getTrippedFeatures() == null ? List.of() : threshold.getTrippedFeatures();
        if (tripped.contains(RMS_ENERGY) && tripped.contains(SPECTRAL_CENTROID)) {
            return AnomalyType.COMPRESSOR_ABNORMAL;
        }
        if (tripped.contains(ZERO_CROSSING_RATE)) {
            return AnomalyType.BEARING_WEAR;
        }
        if (tripped.contains(LOW_FREQ_RATIO)) {
            return AnomalyType.REFRIGERANT_LEAK;
        }
        if (online.isStatisticalAnomaly()) {
            return AnomalyType.STATISTICAL_ANOMALY;
        }
        return AnomalyType.GENERAL_ANOMALY;
    }

    private static String message(boolean anomaly, double confidence, AnomalyType type, int votes) {
        if (!anomaly) {
            return AnomalyType.NORMAL.description();
        }
        String level = confidence > 0.8 ? "high" : confidence > 0.6 ? "medium" : "low";
        return String.format("%s (%d/3 models agree, confidence %s)", type.description(), votes, level);
    }

    @Value
    public static class Fusion {
        boolean anomaly;
        double confidence;
        int votes;
        boolean majorityVote;
        AnomalyType anomalyType;
        String message;
    }
}
