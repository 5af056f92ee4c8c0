package com.frostguard.acoustic.model;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded FIFO buffers of recent normal and anomalous samples together with
 * the running statistics of each class. Not thread safe, the owning learner
 * guards it with a single lock.
 */
public class OnlineBuffers implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int normalCapacity;
    private final int anomalyCapacity;
    private final Deque<LabeledSample> normal = new ArrayDeque<>();
    private final Deque<LabeledSample> anomalies = new ArrayDeque<>();
    private final ClassStatistics normalStats = new ClassStatistics();
    private final ClassStatistics anomalyStats = new ClassStatistics();

    public OnlineBuffers(int normalCapacity, int anomalyCapacity) {
        if (normalCapacity < 1 || anomalyCapacity < 1) {
            throw new IllegalArgumentException("Buffer capacities must be positive");
        }
        this.normalCapacity = normalCapacity;
        this.anomalyCapacity = anomalyCapacity;
    }

    public void add(LabeledSample sample) {
        if (sample.isAnomaly()) {
            push(anomalies, sample, anomalyCapacity);
            anomalyStats.update(sample.getFeatures());
        } else {
            push(normal, sample, normalCapacity);
            normalStats.update(sample.getFeatures());
        }
    }

    private static void push(Deque<LabeledSample> buffer, LabeledSample sample, int capacity) {
        if (buffer.size() == capacity) {
            buffer.removeFirst();
        }
        buffer.addLast(sample);
    }

    public List<FeatureVector> normalFeatures() {
        List<FeatureVector> out = new ArrayList<>(normal.size());
        normal.forEach(s -> out.add(s.getFeatures()));
        return out;
    }

    public List<LabeledSample> normalSamples() {
        return new ArrayList<>(normal);
    }

    public List<LabeledSample> anomalySamples() {
        return new ArrayList<>(anomalies);
    }

    /** Fraction of buffered samples labelled anomalous. */
    public double anomalyFraction() {
        int total = normal.size() + anomalies.size();
        return total == 0 ? 0.0 : (double) anomalies.size() / total;
    }

    public int normalSize() {
        return normal.size();
    }

    public int anomalySize() {
        return anomalies.size();
    }

    public ClassStatistics normalStats() {
        return normalStats;
    }

    public ClassStatistics anomalyStats() {
        return anomalyStats;
    }

    public void clear() {
        normal.clear();
        anomalies.clear();
        normalStats.clear();
        anomalyStats.clear();
    }

    /** Deep copy, used for snapshots taken under the owner's lock. */
    public OnlineBuffers copy() {
        OnlineBuffers copy = new OnlineBuffers(normalCapacity, anomalyCapacity);
        copy.normal.addAll(normal);
        copy.anomalies.addAll(anomalies);
        normalStats.view().forEach((name, stats) -> copy.normalStats.restore(name, stats.copy()));
        anomalyStats.view().forEach((name, stats) -> copy.anomalyStats.restore(name, stats.copy()));
        return copy;
    }
}
