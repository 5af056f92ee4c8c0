package com.frostguard.acoustic.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class SystemStatus {

    private boolean initialized;
    private boolean monitoring;
    private boolean outlierModelTrained;
    private boolean onlineModelTrained;
    private int thresholdFeatureCount;
    private Instant thresholdLastUpdate;
    private PerformanceMetrics performance;
    private LearningStatistics learning;
    private MonitoringSummary outlierMonitoring;
}
