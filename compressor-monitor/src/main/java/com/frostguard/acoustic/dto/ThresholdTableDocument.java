package com.frostguard.acoustic.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * On-disk form of the adaptive threshold table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThresholdTableDocument {

    private int updateIntervalHours;
    private int historyDays;
    private double sensitivity;
    private Instant lastUpdate;
    private Map<String, ThresholdRecord> thresholds;
    private List<HistoryRecord> history;
}
