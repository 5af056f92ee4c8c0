package com.frostguard.acoustic.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class LearningStatistics {

    private long totalSamples;
    private int bufferSize;
    private int normalSamples;
    private int anomalySamples;
    private double anomalyRate;
    private Instant lastUpdate;
    private double learningRate;
    private int updateFrequency;
    private long modelVersion;
    private long refitCount;
    private boolean trained;
}
