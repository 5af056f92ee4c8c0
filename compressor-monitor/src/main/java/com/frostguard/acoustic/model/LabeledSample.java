package com.frostguard.acoustic.model;

import lombok.Value;

import java.io.Serializable;
import java.time.Instant;

@Value
public class LabeledSample implements Serializable {

    private static final long serialVersionUID = 1L;

    FeatureVector features;
    boolean anomaly;
    double confidence;
    Instant timestamp;
}
