package com.frostguard.acoustic.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PerformanceMetrics {

    private long totalDiagnoses;
    private long anomaliesDetected;
    private long truePositives;
    private long trueNegatives;
    private long falsePositives;
    private long falseNegatives;
    private double averageProcessingTimeMs;

    /** Share of labelled diagnoses the ensemble got right, 0 when none are labelled. */
    public double accuracy() {
        long labelled = truePositives + trueNegatives + falsePositives + falseNegatives;
        return labelled == 0 ? 0.0 : (double) (truePositives + trueNegatives) / labelled;
    }
}
