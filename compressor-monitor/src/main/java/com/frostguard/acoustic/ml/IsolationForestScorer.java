package com.frostguard.acoustic.ml;

import lombok.extern.slf4j.Slf4j;
import smile.anomaly.IsolationForest;
import smile.math.MathEx;

/**
 * Smile isolation forest. Smile reports higher values for more anomalous rows,
 * the sign is flipped so that lower scores mean more anomalous.
 */
@Slf4j
public class IsolationForestScorer implements OutlierScorer {

    private static final long serialVersionUID = 1L;

    private static final int TARGET_SUBSAMPLE = 256;
    private static final double MAX_SAMPLING_RATE = 0.7;

    private final IsolationForest forest;
    private final double offset;
    private final double samplingRate;

    IsolationForestScorer(IsolationForest forest, double offset, double samplingRate) {
        this.forest = forest;
        this.offset = offset;
        this.samplingRate = samplingRate;
    }

    public static IsolationForestScorer fit(double[][] rows, int trees, double contamination, long seed) {
        // sampling_rate = min(0.7, TARGET_SUBSAMPLE / n), Smile rejects a rate of 1
        double samplingRate = Math.min(MAX_SAMPLING_RATE, TARGET_SUBSAMPLE / (double) rows.length);
        int subsample = Math.max(2, (int) (rows.length * samplingRate));
        int maxDepth = Math.max(1, (int) Math.ceil(Math.log(subsample) / Math.log(2)));

        MathEx.setSeed(seed);
        IsolationForest forest = IsolationForest.fit(rows, trees, maxDepth, samplingRate, 0);

        double[] trainingScores = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            trainingScores[i] = -forest.score(rows[i]);
        }
        double offset = Percentiles.of(trainingScores, contamination * 100.0);
        log.debug("Isolation forest fitted: trees={}, depth={}, sampling rate={}, offset={}",
                trees, maxDepth, samplingRate, offset);
        return new IsolationForestScorer(forest, offset, samplingRate);
    }

    @Override
    public double score(double[] row) {
        return -forest.score(row);
    }

    @Override
    public double offset() {
        return offset;
    }

    public int trees() {
        return forest.trees().length;
    }

    public double samplingRate() {
        return samplingRate;
    }
}
