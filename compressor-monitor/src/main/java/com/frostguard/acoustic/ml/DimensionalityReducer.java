package com.frostguard.acoustic.ml;

import java.io.Serializable;

public interface DimensionalityReducer extends Serializable {

    double[] project(double[] row);

    int outputDimension();

    /** Share of the training variance carried by each output component. */
    double[] explainedVarianceRatio();
}
