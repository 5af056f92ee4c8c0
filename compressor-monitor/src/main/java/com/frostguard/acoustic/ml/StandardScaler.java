package com.frostguard.acoustic.ml;

import lombok.Getter;

/**
 * Zero mean, unit variance scaling. Constant columns are left unscaled.
 */
@Getter
public class StandardScaler implements Scaler {

    private static final long serialVersionUID = 1L;

    private final double[] mean;
    private final double[] scale;

    StandardScaler(double[] mean, double[] scale) {
        this.mean = mean;
        this.scale = scale;
    }

    public static StandardScaler fit(double[][] rows) {
        int d = rows[0].length;
        double[] mean = new double[d];
        double[] scale = new double[d];
        for (int j = 0; j < d; j++) {
            double[] col = Percentiles.column(rows, j);
            mean[j] = Percentiles.mean(col);
            double std = Percentiles.populationStd(col);
            scale[j] = std > 0 ? std : 1.0;
        }
        return new StandardScaler(mean, scale);
    }

    @Override
    public double[] transform(double[] row) {
        double[] out = new double[row.length];
        for (int j = 0; j < row.length; j++) {
            out[j] = (row[j] - mean[j]) / scale[j];
        }
        return out;
    }
}
