package com.frostguard.acoustic.model;

import com.frostguard.acoustic.ml.OutlierPipeline;
import lombok.Getter;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything a trained outlier model needs to score a vector. Replaced as a
 * whole on retrain.
 */
@Getter
public final class OutlierModelState implements Serializable {

    private static final long serialVersionUID = 1L;

    private final OutlierPipeline pipeline;
    private final double scoreThreshold;
    private final Map<String, FeatureBand> featureBounds;
    private final ModelRegistryEntry metadata;
    private final long version;

    public OutlierModelState(OutlierPipeline pipeline, double scoreThreshold,
                             Map<String, FeatureBand> featureBounds, ModelRegistryEntry metadata, long version) {
        this.pipeline = pipeline;
        this.scoreThreshold = scoreThreshold;
        this.featureBounds = Collections.unmodifiableMap(new LinkedHashMap<>(featureBounds));
        this.metadata = metadata;
        this.version = version;
    }

    public FeatureSchema getSchema() {
        return pipeline.getSchema();
    }
}
