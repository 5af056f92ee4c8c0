package com.frostguard.acoustic.dto;

import com.frostguard.acoustic.model.AnomalyType;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class DetectorVerdict {

    private String detector;
    private boolean anomaly;
    private double confidence;
    private double score;
    private AnomalyType anomalyType;
    private String message;
    private boolean trained;
    private List<String> trippedFeatures;
    private boolean statisticalAnomaly;
    private long modelVersion;

    public static DetectorVerdict notTrained(String detector) {
        return DetectorVerdict.builder()
                .detector(detector)
                .anomalyType(AnomalyType.NORMAL)
                .message("Model not trained yet")
                .trippedFeatures(List.of())
                .build();
    }

    public static DetectorVerdict failed(String detector, Exception e) {
        return DetectorVerdict.builder()
                .detector(detector)
                .anomalyType(AnomalyType.ERROR)
                .message("Detection failed: " + e.getMessage())
                .trained(true)
                .trippedFeatures(List.of())
                .build();
    }
}
