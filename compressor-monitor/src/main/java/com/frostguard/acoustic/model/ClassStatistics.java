package com.frostguard.acoustic.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-feature running statistics of one class (normal or anomalous samples).
 */
public class ClassStatistics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Map<String, RunningStatistics> byFeature = new LinkedHashMap<>();

    public void update(FeatureVector features) {
        features.asMap().forEach((name, value) ->
                byFeature.computeIfAbsent(name, k -> new RunningStatistics()).update(value));
    }

    public RunningStatistics get(String feature) {
        return byFeature.get(feature);
    }

    public boolean isEmpty() {
        return byFeature.isEmpty();
    }

    public Map<String, RunningStatistics> view() {
        return Collections.unmodifiableMap(byFeature);
    }

    void restore(String feature, RunningStatistics stats) {
        byFeature.put(feature, stats);
    }

    public ClassStatistics copy() {
        ClassStatistics copy = new ClassStatistics();
        byFeature.forEach((name, stats) -> copy.byFeature.put(name, stats.copy()));
        return copy;
    }

    public void clear() {
        byFeature.clear();
    }
}
