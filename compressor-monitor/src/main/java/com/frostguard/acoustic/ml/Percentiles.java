package com.frostguard.acoustic.ml;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Descriptive statistics helpers. Percentiles interpolate linearly between the
 * closest ranks.
 */
public final class Percentiles {

    private Percentiles() {
    }

    /**
     * @param values sample, not modified
     * @param p      percentile in (0, 100]
     */
    public static double of(double[] values, double p) {
        if (values.length == 0) {
            return Double.NaN;
        }
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, p);
    }

    public static double mean(double[] values) {
        return values.length == 0 ? Double.NaN : new Mean().evaluate(values);
    }

    /** Bias corrected (n - 1) standard deviation, 0 for a single value. */
    public static double sampleStd(double[] values) {
        return values.length < 2 ? 0.0 : new StandardDeviation(true).evaluate(values);
    }

    public static double populationStd(double[] values) {
        return values.length == 0 ? 0.0 : new StandardDeviation(false).evaluate(values);
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    /** Column {@code j} of a row major matrix. */
    public static double[] column(double[][] rows, int j) {
        double[] col = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            col[i] = rows[i][j];
        }
        return col;
    }
}
