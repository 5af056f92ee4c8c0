package com.frostguard.acoustic.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryRecord {

    private Instant timestamp;
    private Map<String, Double> features;
    private boolean anomaly;
}
