package com.frostguard.acoustic.model;

import lombok.Getter;

import java.io.Serializable;

/**
 * Streaming mean and variance of one feature (Welford's update).
 */
@Getter
public class RunningStatistics implements Serializable {

    private static final long serialVersionUID = 1L;

    private long count;
    private double mean;
    private double m2;

    public RunningStatistics() {
    }

    public RunningStatistics(long count, double mean, double m2) {
        this.count = count;
        this.mean = mean;
        this.m2 = m2;
    }

    public void update(double value) {
        count += 1;
        double delta = value - mean;
        mean += delta / count;
        double delta2 = value - mean;
        m2 += delta * delta2;
    }

    /** Sample variance, 0 below two observations. */
    public double variance() {
        return count > 1 ? m2 / (count - 1) : 0.0;
    }

    public double std() {
        return Math.sqrt(variance());
    }

    public RunningStatistics copy() {
        return new RunningStatistics(count, mean, m2);
    }
}
