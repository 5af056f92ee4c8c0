package com.frostguard.acoustic.model;

import lombok.EqualsAndHashCode;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Ordered list of feature names a detector was fitted against. Vectors are
 * conformed to the schema by name, a feature the vector lacks is read as 0.0.
 */
@EqualsAndHashCode(of = "names")
public final class FeatureSchema implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<String> names;
    private final Map<String, Integer> index;

    private FeatureSchema(List<String> names) {
        this.names = List.copyOf(names);
        this.index = new HashMap<>();
        for (int i = 0; i < this.names.size(); i++) {
            index.put(this.names.get(i), i);
        }
    }

    public static FeatureSchema of(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            throw new IllegalArgumentException("Feature schema needs at least one feature");
        }
        if (new LinkedHashSet<>(names).size() != names.size()) {
            throw new IllegalArgumentException("Duplicate feature names in schema: " + names);
        }
        return new FeatureSchema(new ArrayList<>(names));
    }

    public static FeatureSchema of(String... names) {
        return of(List.of(names));
    }

    public List<String> names() {
        return names;
    }

    public int size() {
        return names.size();
    }

    public String name(int i) {
        return names.get(i);
    }

    public int indexOf(String name) {
        Integer i = index.get(name);
        return i == null ? -1 : i;
    }

    public boolean contains(String name) {
        return index.containsKey(name);
    }

    public double[] toArray(FeatureVector features) {
        double[] row = new double[names.size()];
        for (int i = 0; i < row.length; i++) {
            row[i] = features.getOrDefault(names.get(i), 0.0);
        }
        return row;
    }

    /** Names of the schema the vector does not carry. */
    public List<String> missingFrom(FeatureVector features) {
        List<String> missing = new ArrayList<>();
        for (String name : names) {
            if (!features.contains(name)) {
                missing.add(name);
            }
        }
        return missing;
    }

    /** Hex hash of the ordered names, stored next to persisted models. */
    public String hash() {
        return Integer.toHexString(names.toString().hashCode());
    }

    @Override
    public String toString() {
        return names.toString();
    }
}
