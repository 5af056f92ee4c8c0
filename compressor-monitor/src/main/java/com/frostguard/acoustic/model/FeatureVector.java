package com.frostguard.acoustic.model;

import lombok.EqualsAndHashCode;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, insertion ordered feature values of one analysis window.
 */
@EqualsAndHashCode(of = "values")
public final class FeatureVector implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Map<String, Double> values;

    private FeatureVector(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static FeatureVector of(Map<String, ? extends Number> raw) {
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("Feature vector must contain at least one feature");
        }
        Map<String, Double> copy = new LinkedHashMap<>();
        raw.forEach((name, value) -> {
            if (value == null || !Double.isFinite(value.doubleValue())) {
                throw new IllegalArgumentException("Feature " + name + " has a non finite value: " + value);
            }
            copy.put(name, value.doubleValue());
        });
        return new FeatureVector(copy);
    }

    public static FeatureVector of(FeatureSchema schema, double[] row) {
        if (row.length != schema.size()) {
            throw new IllegalArgumentException("Expected " + schema.size() + " values, got " + row.length);
        }
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < row.length; i++) {
            map.put(schema.name(i), row[i]);
        }
        return of(map);
    }

    /** All-zero vector, used in place of a window whose extraction failed. */
    public static FeatureVector zeros(FeatureSchema schema) {
        return of(schema, new double[schema.size()]);
    }

    public double get(String name) {
        Double value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Unknown feature: " + name);
        }
        return value;
    }

    public double getOrDefault(String name, double fallback) {
        return values.getOrDefault(name, fallback);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public Map<String, Double> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    /** Schema in this vector's own feature order. */
    public FeatureSchema schema() {
        return FeatureSchema.of(values.keySet());
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
