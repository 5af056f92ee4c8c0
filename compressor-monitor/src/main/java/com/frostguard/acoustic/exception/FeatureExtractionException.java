package com.frostguard.acoustic.exception;

/**
 * Thrown by a feature source when an analysis window cannot be turned into features.
 */
public class FeatureExtractionException extends Exception {

    public FeatureExtractionException(String message) {
        super(message);
    }

    public FeatureExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
