package com.frostguard.acoustic.model;

/**
 * Feature names produced by the compressor audio feature extractor.
 */
public final class CompressorFeatures {

    public static final String RMS_ENERGY = "rms_energy";
    public static final String ENERGY_ENTROPY = "energy_entropy";
    public static final String TEMPORAL_STD = "temporal_std";
    public static final String TEMPORAL_MEAN = "temporal_mean";
    public static final String SPECTRAL_CENTROID = "spectral_centroid";
    public static final String SPECTRAL_ROLLOFF = "spectral_rolloff";
    public static final String SPECTRAL_BANDWIDTH = "spectral_bandwidth";
    public static final String SPECTRAL_CONTRAST = "spectral_contrast";
    public static final String SPECTRAL_FLATNESS = "spectral_flatness";
    public static final String ZERO_CROSSING_RATE = "zero_crossing_rate";
    public static final String LOW_FREQ_RATIO = "low_freq_ratio";
    public static final String MID_FREQ_RATIO = "mid_freq_ratio";
    public static final String HIGH_FREQ_RATIO = "high_freq_ratio";
    public static final String MFCC_1_MEAN = "mfcc_1_mean";
    public static final String MFCC_2_MEAN = "mfcc_2_mean";
    public static final String MFCC_3_MEAN = "mfcc_3_mean";
    public static final String MFCC_1_STD = "mfcc_1_std";
    public static final String MFCC_2_STD = "mfcc_2_std";
    public static final String MFCC_3_STD = "mfcc_3_std";

    public static final FeatureSchema DEFAULT_SCHEMA = FeatureSchema.of(
            RMS_ENERGY, ENERGY_ENTROPY, TEMPORAL_STD, TEMPORAL_MEAN,
            SPECTRAL_CENTROID, SPECTRAL_ROLLOFF, SPECTRAL_BANDWIDTH, SPECTRAL_CONTRAST, SPECTRAL_FLATNESS,
            ZERO_CROSSING_RATE,
            LOW_FREQ_RATIO, MID_FREQ_RATIO, HIGH_FREQ_RATIO,
            MFCC_1_MEAN, MFCC_2_MEAN, MFCC_3_MEAN, MFCC_1_STD, MFCC_2_STD, MFCC_3_STD);

    private CompressorFeatures() {
    }
}
