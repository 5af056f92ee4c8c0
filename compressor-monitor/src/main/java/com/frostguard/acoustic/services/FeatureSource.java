package com.frostguard.acoustic.services;

import com.frostguard.acoustic.exception.FeatureExtractionException;
import com.frostguard.acoustic.model.FeatureVector;

/**
 * Supplies the feature vector of the next analysis window.
 */
@FunctionalInterface
public interface FeatureSource {

    /**
     * @return the next window, or null when no window is available yet
     * @throws FeatureExtractionException when the window could not be turned into features
     */
    FeatureVector nextWindow() throws FeatureExtractionException;
}
