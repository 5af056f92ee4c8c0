package com.frostguard.acoustic.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TrainingResult {

    private int totalSamples;
    private int featureDimensions;
    private int components;
    private double[] explainedVarianceRatio;
    private double meanTrainingScore;
    private double scoreThreshold;
}
