package com.frostguard.acoustic.dto;

import com.frostguard.acoustic.model.AnomalyType;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class Verdict {

    private boolean anomaly;
    private double confidence;
    private AnomalyType anomalyType;
    private String message;
    private DetectorVerdict outlier;
    private DetectorVerdict threshold;
    private DetectorVerdict online;
    private int votes;
    private boolean majorityVote;
    private double processingTimeMs;
    private Instant timestamp;
}
