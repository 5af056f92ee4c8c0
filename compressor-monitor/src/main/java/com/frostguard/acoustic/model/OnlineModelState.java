package com.frostguard.acoustic.model;

import com.frostguard.acoustic.ml.OutlierPipeline;
import lombok.Getter;

import java.io.Serializable;
import java.time.Instant;

/**
 * Versioned snapshot of the online learner's fitted pipeline. Version 0 is the
 * untrained state.
 */
@Getter
public final class OnlineModelState implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final OnlineModelState UNTRAINED = new OnlineModelState(null, 0L, null, 0.0, 0);

    private final OutlierPipeline pipeline;
    private final long version;
    private final Instant fittedAt;
    private final double contamination;
    private final int trainedRows;

    public OnlineModelState(OutlierPipeline pipeline, long version, Instant fittedAt, double contamination, int trainedRows) {
        this.pipeline = pipeline;
        this.version = version;
        this.fittedAt = fittedAt;
        this.contamination = contamination;
        this.trainedRows = trainedRows;
    }

    public static OnlineModelState untrained() {
        return UNTRAINED;
    }

    public boolean isTrained() {
        return pipeline != null;
    }
}
