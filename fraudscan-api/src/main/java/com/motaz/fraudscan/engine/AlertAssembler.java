package com.motaz.fraudscan.engine;

import com.motaz.fraudscan.engine.model.FraudAlert;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merges the output of both detectors into one ranked list. A provider may
 * show up once per detector; the signals are different and both are kept.
 */
@Component
public class AlertAssembler {

    static final Comparator<FraudAlert> RANKING = Comparator
            .comparingDouble(FraudAlert::getDeviationPercent).reversed()
            .thenComparing(FraudAlert::getProviderId)
            .thenComparing(FraudAlert::getProcedureCode)
            .thenComparing(FraudAlert::getAlertType)
            .thenComparing(FraudAlert::getPeriod)
            .thenComparing(FraudAlert::getStateCode, Comparator.nullsFirst(Comparator.naturalOrder()));

    /** Concatenates and sorts by deviation, highest first. */
    public List<FraudAlert> assemble(List<FraudAlert> temporalAlerts, List<FraudAlert> cohortAlerts) {
        List<FraudAlert> combined = new ArrayList<>(temporalAlerts.size() + cohortAlerts.size());
        combined.addAll(temporalAlerts);
        combined.addAll(cohortAlerts);
        combined.sort(RANKING);
        return List.copyOf(combined);
    }

    /** Sorts first, then keeps the top {@code limit}. A limit of zero or less keeps nothing. */
    public List<FraudAlert> assemble(List<FraudAlert> temporalAlerts, List<FraudAlert> cohortAlerts, int limit) {
        List<FraudAlert> ranked = assemble(temporalAlerts, cohortAlerts);
        if (limit <= 0) {
            return List.of();
        }
        return ranked.size() <= limit ? ranked : ranked.subList(0, limit);
    }

    public ScanSummary summarize(List<FraudAlert> alerts) {
        return new ScanSummary(alerts);
    }
}
