package com.frostguard.acoustic.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ThresholdRecord {

    private double lower;
    private double upper;
    private double mean;
    private double std;
    /** p1, p5, p10, p25, p50, p75, p90, p95, p99. */
    private Map<String, Double> percentiles;
    private int sampleCount;
    private Instant lastUpdated;

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }
}
