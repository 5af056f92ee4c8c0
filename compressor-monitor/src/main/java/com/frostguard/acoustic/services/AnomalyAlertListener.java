package com.frostguard.acoustic.services;

import com.frostguard.acoustic.dto.Verdict;

public interface AnomalyAlertListener {

    void onAnomaly(Verdict verdict);
}
