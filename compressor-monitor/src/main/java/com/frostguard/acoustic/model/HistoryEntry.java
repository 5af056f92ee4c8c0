package com.frostguard.acoustic.model;

import lombok.Value;

import java.io.Serializable;
import java.time.Instant;

@Value
public class HistoryEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    Instant timestamp;
    FeatureVector features;
    boolean anomaly;
}
