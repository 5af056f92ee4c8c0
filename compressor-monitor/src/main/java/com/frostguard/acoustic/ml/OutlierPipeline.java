package com.frostguard.acoustic.ml;

import com.frostguard.acoustic.model.FeatureSchema;
import com.frostguard.acoustic.model.FeatureVector;
import lombok.Getter;

import java.io.Serializable;

/**
 * Fitted scaler, reducer and scorer applied in sequence to a feature vector
 * conformed to the schema the pipeline was fitted on.
 */
@Getter
public final class OutlierPipeline implements Serializable {

    private static final long serialVersionUID = 1L;

    private final FeatureSchema schema;
    private final Scaler scaler;
    private final DimensionalityReducer reducer;
    private final OutlierScorer scorer;

    public OutlierPipeline(FeatureSchema schema, Scaler scaler, DimensionalityReducer reducer, OutlierScorer scorer) {
        this.schema = schema;
        this.scaler = scaler;
        this.reducer = reducer;
        this.scorer = scorer;
    }

    public double[] reduce(FeatureVector features) {
        return reducer.project(scaler.transform(schema.toArray(features)));
    }

    /** Raw score, lower is more anomalous. */
    public double score(FeatureVector features) {
        return scorer.score(reduce(features));
    }

    public double decision(FeatureVector features) {
        return scorer.decision(reduce(features));
    }
}
