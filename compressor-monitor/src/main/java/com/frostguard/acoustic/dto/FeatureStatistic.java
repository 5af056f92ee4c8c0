package com.frostguard.acoustic.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class FeatureStatistic {

    private long count;
    private double mean;
    private double std;
}
