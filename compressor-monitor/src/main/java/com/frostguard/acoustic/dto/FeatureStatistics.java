package com.frostguard.acoustic.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class FeatureStatistics {

    private Map<String, FeatureStatistic> normal;
    private Map<String, FeatureStatistic> anomaly;
}
