package com.frostguard.acoustic.model;

import lombok.Builder;
import lombok.Getter;

import java.io.Serializable;
import java.time.Instant;

/**
 * Persistable state of the online learner.
 */
@Getter
@Builder
public class OnlineLearnerSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final OnlineBuffers buffers;
    private final OnlineModelState model;
    private final long totalSamples;
    private final long samplesSinceRefit;
    private final long refitCount;
    private final double learningRate;
    private final Instant lastUpdate;
}
