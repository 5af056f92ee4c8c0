package com.frostguard.acoustic.dto;

import com.frostguard.acoustic.model.AnomalyType;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
public class MonitoringSummary {

    private int totalSamples;
    private int anomalyCount;
    private double anomalyRate;
    private Map<AnomalyType, Long> countsByType;
    private int windowHours;
    private Instant lastUpdate;
}
