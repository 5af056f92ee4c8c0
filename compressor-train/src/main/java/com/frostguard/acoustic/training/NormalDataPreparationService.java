package com.frostguard.acoustic.training;

import com.frostguard.acoustic.model.CompressorFeatures;
import com.frostguard.acoustic.model.FeatureSchema;
import com.frostguard.acoustic.model.FeatureVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.frostguard.acoustic.model.CompressorFeatures.*;

/**
 * Simulated feature windows of a healthy compressor, one every five minutes,
 * with a slow daily load cycle on top of measurement noise.
 */
@Slf4j
@Component
public class NormalDataPreparationService {

    private static final Map<String, Double> BASELINE = new LinkedHashMap<>();

    static {
        BASELINE.put(RMS_ENERGY, 0.5);
        BASELINE.put(ENERGY_ENTROPY, 3.2);
        BASELINE.put(TEMPORAL_STD, 0.12);
        BASELINE.put(TEMPORAL_MEAN, 0.02);
        BASELINE.put(SPECTRAL_CENTROID, 1500.0);
        BASELINE.put(SPECTRAL_ROLLOFF, 3200.0);
        BASELINE.put(SPECTRAL_BANDWIDTH, 1250.0);
        BASELINE.put(SPECTRAL_CONTRAST, 21.0);
        BASELINE.put(SPECTRAL_FLATNESS, 0.08);
        BASELINE.put(ZERO_CROSSING_RATE, 0.07);
        BASELINE.put(LOW_FREQ_RATIO, 0.5);
        BASELINE.put(MID_FREQ_RATIO, 0.35);
        BASELINE.put(HIGH_FREQ_RATIO, 0.15);
        BASELINE.put(MFCC_1_MEAN, -210.0);
        BASELINE.put(MFCC_2_MEAN, 85.0);
        BASELINE.put(MFCC_3_MEAN, -12.0);
        BASELINE.put(MFCC_1_STD, 22.0);
        BASELINE.put(MFCC_2_STD, 14.0);
        BASELINE.put(MFCC_3_STD, 9.0);
    }

    private final Random rnd = new Random(42);

    @Value("${training.windows:2016}")
    private int windows; // 7 days of five minute windows

    @Value("${training.noise:0.05}")
    private double noise;

    public List<FeatureVector> prepareNormalWindows() {
        FeatureSchema schema = CompressorFeatures.DEFAULT_SCHEMA;
        List<FeatureVector> out = new ArrayList<>(windows);
        for (int i = 0; i < windows; i++) {
            double hourOfDay = (i * 5.0 / 60.0) % 24;
            // +-3% load swing peaking mid afternoon
            double load = 1.0 + 0.03 * Math.sin(2 * Math.PI * (hourOfDay - 9) / 24);
            double[] row = new double[schema.size()];
            for (int j = 0; j < row.length; j++) {
                double base = BASELINE.get(schema.name(j));
                row[j] = base * load + Math.abs(base) * noise * rnd.nextGaussian();
            }
            out.add(FeatureVector.of(schema, row));
        }
        log.info("Generated {} normal windows over {} days", out.size(), windows / 288.0);
        return out;
    }

    /** Healthy window with the bearing wear signature: brighter spectrum and more zero crossings. */
    public FeatureVector bearingWearWindow() {
        Map<String, Double> values = new LinkedHashMap<>(BASELINE);
        values.put(SPECTRAL_CENTROID, BASELINE.get(SPECTRAL_CENTROID) * 1.8);
        values.put(ZERO_CROSSING_RATE, BASELINE.get(ZERO_CROSSING_RATE) * 2.5);
        values.put(HIGH_FREQ_RATIO, BASELINE.get(HIGH_FREQ_RATIO) * 2.2);
        values.put(SPECTRAL_ROLLOFF, BASELINE.get(SPECTRAL_ROLLOFF) * 1.6);
        values.put(LOW_FREQ_RATIO, BASELINE.get(LOW_FREQ_RATIO) * 0.6);
        return FeatureVector.of(values);
    }

    public FeatureVector baselineWindow() {
        return FeatureVector.of(BASELINE);
    }
}
