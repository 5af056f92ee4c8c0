package com.frostguard.acoustic.model;

import lombok.Value;

import java.io.Serializable;

/** Inclusive [lower, upper] band of one feature. */
@Value
public class FeatureBand implements Serializable {

    private static final long serialVersionUID = 1L;

    double lower;
    double upper;

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }
}
