package com.motaz.fraudscan.services;

import com.motaz.fraudscan.dto.ScanStatsDto;
import com.motaz.fraudscan.engine.FraudScanEngine;
import com.motaz.fraudscan.engine.ScanSummary;
import com.motaz.fraudscan.engine.model.ClaimCounts;
import com.motaz.fraudscan.engine.model.ClaimSnapshot;
import com.motaz.fraudscan.engine.model.FraudAlert;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Request-level entry points of the scanner. Every call loads a fresh
 * snapshot and recomputes; no alert outlives its request.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FraudScanService {

    private final ClaimSnapshotService claimSnapshotService;
    private final FraudScanEngine fraudScanEngine;
    private final ThresholdService thresholdService;

    public List<FraudAlert> runScan(String userId, Double threshold, Integer limit) {
        double effectiveThreshold = thresholdService.resolveThreshold(userId, threshold);
        int effectiveLimit = thresholdService.resolveLimit(limit);
        log.info("---Start Fraud Scan threshold: {} limit: {}", effectiveThreshold, effectiveLimit);

        List<FraudAlert> alerts = fraudScanEngine.scan(claimSnapshotService.load(), effectiveThreshold, effectiveLimit);

        log.info("--- Fraud Scan Completed with {} alerts", alerts.size());
        return alerts;
    }

    public List<FraudAlert> getProviderAlerts(String userId, String providerId) {
        double effectiveThreshold = thresholdService.resolveThreshold(userId, null);
        log.info("Scanning alerts for providerId: {} threshold: {}", providerId, effectiveThreshold);

        return fraudScanEngine.scanAll(claimSnapshotService.load(), effectiveThreshold).stream()
                .filter(alert -> alert.getProviderId().equals(providerId))
                .toList();
    }

    public ScanStatsDto getAggregateCounts(String userId) {
        double effectiveThreshold = thresholdService.resolveThreshold(userId, null);
        ClaimSnapshot snapshot = claimSnapshotService.load();
        ScanSummary summary = fraudScanEngine.summarize(fraudScanEngine.scanAll(snapshot, effectiveThreshold));

        ClaimCounts counts = snapshot.getCounts();
        ScanStatsDto stats = ScanStatsDto.builder()
                .totalClaims(counts.getTotalClaims())
                .totalProviders(counts.getTotalProviders())
                .totalStates(counts.getTotalStates())
                .totalSpend(counts.getTotalSpend())
                .flaggedProviders(summary.getFlaggedProviderCount())
                .totalAlerts(summary.getTotalAlertCount())
                .build();
        log.info("Aggregate counts : {}", stats);
        return stats;
    }
}
