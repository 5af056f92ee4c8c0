package com.frostguard.acoustic.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
public class ThresholdSummary {

    private int featureCount;
    private Instant lastUpdate;
    private int historySize;
    private int updateIntervalHours;
    private double sensitivity;
    private Map<String, FeatureSummary> features;
    private Map<String, Double> featureImportance;

    @Data
    @Builder
    public static class FeatureSummary {
        private double mean;
        private double std;
        private double range;
        private int sampleCount;
    }
}
