package com.frostguard.acoustic.ml;

import com.frostguard.acoustic.model.FeatureSchema;

/**
 * Fits the three stages of an {@link OutlierPipeline}. Implementations decide
 * which scaler, reducer and scorer are used.
 */
public interface OutlierPipelineFactory {

    Scaler fitScaler(double[][] rows);

    DimensionalityReducer fitReducer(double[][] scaled, int targetDimension);

    OutlierScorer fitScorer(double[][] reduced, double contamination);

    default OutlierPipeline fit(FeatureSchema schema, double[][] rows, int targetDimension, double contamination) {
        Scaler scaler = fitScaler(rows);
        double[][] scaled = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            scaled[i] = scaler.transform(rows[i]);
        }
        DimensionalityReducer reducer = fitReducer(scaled, Math.min(targetDimension, schema.size()));
        double[][] reduced = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            reduced[i] = reducer.project(scaled[i]);
        }
        return new OutlierPipeline(schema, scaler, reducer, fitScorer(reduced, contamination));
    }
}
