package com.motaz.fraudscan.engine;

import com.motaz.fraudscan.config.CohortScanProperties;
import com.motaz.fraudscan.engine.model.ClaimDirectory;
import com.motaz.fraudscan.engine.model.ClaimSnapshot;
import com.motaz.fraudscan.engine.model.FraudAlert;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs both detectors over one claim snapshot. Holds no state between
 * calls; concurrent scans with different thresholds need no locking.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FraudScanEngine {

    private final ClaimAggregator aggregator;
    private final TemporalGrowthDetector temporalDetector;
    private final CohortOutlierDetector cohortDetector;
    private final AlertAssembler assembler;
    private final CohortScanProperties cohortProperties;

    /** Top {@code limit} alerts, ranked by deviation. */
    public List<FraudAlert> scan(ClaimSnapshot snapshot, double threshold, int limit) {
        return detect(snapshot, threshold, limit);
    }

    public List<FraudAlert> scanAll(ClaimSnapshot snapshot, double threshold) {
        return detect(snapshot, threshold, Integer.MAX_VALUE);
    }

    private List<FraudAlert> detect(ClaimSnapshot snapshot, double threshold, int limit) {
        ClaimDirectory directory = ClaimDirectory.of(snapshot.getRecords());

        List<FraudAlert> temporal = temporalDetector.scanAll(
                aggregator.aggregate(snapshot.getRecords()), threshold, directory);
        List<FraudAlert> cohort = cohortDetector.scanCohort(
                aggregator.totalsByProviderState(snapshot.getRecords()),
                cohortProperties.getMinSize(),
                cohortProperties.getMinSpendFloor(),
                threshold,
                directory);
        log.debug("Detectors finished: {} temporal, {} peer-outlier alerts", temporal.size(), cohort.size());

        return assembler.assemble(temporal, cohort, limit);
    }

    public ScanSummary summarize(List<FraudAlert> alerts) {
        return assembler.summarize(alerts);
    }
}
