package com.frostguard.acoustic.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyType {

    NORMAL("normal", "Operating normally"),
    BEARING_WEAR("bearing_wear", "Bearing wear suspected"),
    COMPRESSOR_ABNORMAL("compressor_abnormal", "Compressor abnormality suspected"),
    REFRIGERANT_LEAK("refrigerant_leak", "Refrigerant leak suspected"),
    STATISTICAL_ANOMALY("statistical_anomaly", "Statistical anomaly detected"),
    GENERAL_ANOMALY("general_anomaly", "Abnormal noise detected"),
    ERROR("error", "Analysis failed");

    private final String code;
    private final String description;

    AnomalyType(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String description() {
        return description;
    }

    public boolean isFault() {
        return this != NORMAL && this != ERROR;
    }
}
