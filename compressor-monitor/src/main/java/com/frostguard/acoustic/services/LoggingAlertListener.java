package com.frostguard.acoustic.services;

import com.frostguard.acoustic.dto.Verdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingAlertListener implements AnomalyAlertListener {

    @Override
    public void onAnomaly(Verdict verdict) {
        log.warn("Anomaly detected: {} [type={}, confidence={}, votes={}]",
                verdict.getMessage(), verdict.getAnomalyType().code(),
                String.format("%.3f", verdict.getConfidence()), verdict.getVotes());
    }
}
