package com.frostguard.acoustic.ml;

import java.io.Serializable;

/**
 * Outlierness of a reduced feature row. Higher scores are more normal.
 */
public interface OutlierScorer extends Serializable {

    double score(double[] row);

    /** Score at the configured contamination quantile of the training data. */
    double offset();

    /** Offset shifted score, negative for rows the scorer considers outliers. */
    default double decision(double[] row) {
        return score(row) - offset();
    }
}
