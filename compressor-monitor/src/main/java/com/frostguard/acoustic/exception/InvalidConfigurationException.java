package com.frostguard.acoustic.exception;

import lombok.Getter;

@Getter
public class InvalidConfigurationException extends RuntimeException {

    private final String parameter;
    private final double value;

    public InvalidConfigurationException(String parameter, double value, double min, double max) {
        super(String.format("%s must be within [%s, %s], got %s", parameter, min, max, value));
        this.parameter = parameter;
        this.value = value;
    }
}
