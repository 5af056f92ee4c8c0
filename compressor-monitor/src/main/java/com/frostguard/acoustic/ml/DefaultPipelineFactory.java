package com.frostguard.acoustic.ml;

import com.frostguard.acoustic.config.DetectionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Standard scaling, PCA and an isolation forest.
 */
@Component
@RequiredArgsConstructor
public class DefaultPipelineFactory implements OutlierPipelineFactory {

    private final DetectionProperties properties;

    @Override
    public Scaler fitScaler(double[][] rows) {
        return StandardScaler.fit(rows);
    }

    @Override
    public DimensionalityReducer fitReducer(double[][] scaled, int targetDimension) {
        return PcaReducer.fit(scaled, targetDimension);
    }

    @Override
    public OutlierScorer fitScorer(double[][] reduced, double contamination) {
        DetectionProperties.Outlier outlier = properties.getOutlier();
        return IsolationForestScorer.fit(reduced, outlier.getTrees(), contamination, outlier.getRandomSeed());
    }
}
