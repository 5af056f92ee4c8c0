package com.frostguard.acoustic.ml;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * Principal component projection computed from the SVD of the centred
 * training matrix.
 */
public class PcaReducer implements DimensionalityReducer {

    private static final long serialVersionUID = 1L;

    private final double[] center;
    // components[k] is the k-th principal axis
    private final double[][] components;
    private final double[] explainedVarianceRatio;

    PcaReducer(double[] center, double[][] components, double[] explainedVarianceRatio) {
        this.center = center;
        this.components = components;
        this.explainedVarianceRatio = explainedVarianceRatio;
    }

    public static PcaReducer fit(double[][] rows, int targetDimension) {
        int n = rows.length;
        int d = rows[0].length;
        double[] center = new double[d];
        for (int j = 0; j < d; j++) {
            center[j] = Percentiles.mean(Percentiles.column(rows, j));
        }
        double[][] centred = new double[n][d];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < d; j++) {
                centred[i][j] = rows[i][j] - center[j];
            }
        }

        SingularValueDecomposition svd = new SingularValueDecomposition(new Array2DRowRealMatrix(centred, false));
        double[] singular = svd.getSingularValues();
        RealMatrix v = svd.getV();
        int k = Math.min(targetDimension, Math.min(singular.length, v.getColumnDimension()));

        double total = 0.0;
        for (double s : singular) {
            total += s * s;
        }
        double[][] components = new double[k][];
        double[] ratio = new double[k];
        for (int c = 0; c < k; c++) {
            components[c] = v.getColumn(c);
            ratio[c] = total > 0 ? singular[c] * singular[c] / total : 0.0;
        }
        return new PcaReducer(center, components, ratio);
    }

    @Override
    public double[] project(double[] row) {
        double[] out = new double[components.length];
        for (int c = 0; c < components.length; c++) {
            double sum = 0.0;
            double[] axis = components[c];
            for (int j = 0; j < axis.length; j++) {
                sum += (row[j] - center[j]) * axis[j];
            }
            out[c] = sum;
        }
        return out;
    }

    @Override
    public int outputDimension() {
        return components.length;
    }

    @Override
    public double[] explainedVarianceRatio() {
        return explainedVarianceRatio.clone();
    }
}
