package com.motaz.fraudscan.services;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Picks the threshold and limit for a scan. Values are used as given:
 * range checks belong to whoever collects them.
 */
@Service
@RequiredArgsConstructor
public class ThresholdService {

    private final AlertPreferenceService alertPreferenceService;

    @Value("${fraud.scan.default-threshold:200}")
    private double defaultThreshold;

    @Value("${fraud.scan.default-limit:100}")
    private int defaultLimit;

    /** Request parameter first, then the caller's stored preference, then the configured default. */
    public double resolveThreshold(String userId, Double requested) {
        if (requested != null) {
            return requested;
        }
        return alertPreferenceService.findThreshold(userId)
                .map(Integer::doubleValue)
                .orElse(defaultThreshold);
    }

    public int resolveLimit(Integer requested) {
        return requested != null ? requested : defaultLimit;
    }
}
