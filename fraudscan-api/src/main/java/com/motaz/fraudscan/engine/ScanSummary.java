package com.motaz.fraudscan.engine;

import com.motaz.fraudscan.engine.model.FraudAlert;
import lombok.Getter;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/** Facts derived from one assembled alert list for other views. */
@Getter
public class ScanSummary {

    private final int totalAlertCount;
    private final Set<String> flaggedProviderIds;

    ScanSummary(List<FraudAlert> alerts) {
        Set<String> providers = new TreeSet<>();
        alerts.forEach(alert -> providers.add(alert.getProviderId()));
        this.totalAlertCount = alerts.size();
        this.flaggedProviderIds = Set.copyOf(providers);
    }

    public int getFlaggedProviderCount() {
        return flaggedProviderIds.size();
    }

    public boolean isFlagged(String providerId) {
        return flaggedProviderIds.contains(providerId);
    }
}
