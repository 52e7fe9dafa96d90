package com.motaz.fraudscan.engine;

import com.motaz.fraudscan.engine.model.AlertType;
import com.motaz.fraudscan.engine.model.ClaimDirectory;
import com.motaz.fraudscan.engine.model.FraudAlert;
import com.motaz.fraudscan.engine.model.MonthlyTotal;
import com.motaz.fraudscan.engine.model.SeriesKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Flags month-over-month spikes within a single provider/procedure series.
 */
@Slf4j
@Component
public class TemporalGrowthDetector {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /** Scans every series independently, in key order. */
    public List<FraudAlert> scanAll(Map<SeriesKey, List<MonthlyTotal>> series, double threshold, ClaimDirectory directory) {
        List<FraudAlert> alerts = new ArrayList<>();
        series.values().forEach(monthly -> alerts.addAll(scanTemporal(monthly, threshold, directory)));
        return alerts;
    }

    /**
     * Walks {@code series} pairwise and emits an alert whenever growth over the
     * previous period is strictly above {@code threshold}. The series must be
     * sorted ascending by period. A previous total of zero has no defined
     * growth and is skipped.
     */
    public List<FraudAlert> scanTemporal(List<MonthlyTotal> series, double threshold, ClaimDirectory directory) {
        List<FraudAlert> alerts = new ArrayList<>();
        for (int i = 1; i < series.size(); i++) {
            MonthlyTotal previous = series.get(i - 1);
            MonthlyTotal current = series.get(i);
            if (previous.getTotal().signum() <= 0) {
                log.debug("Skipping {}/{} at {}: previous total is zero",
                        current.getProviderId(), current.getProcedureCode(), current.getPeriod());
                continue;
            }

            double growth = growthPercent(previous.getTotal(), current.getTotal());
            if (growth > threshold) {
                alerts.add(toAlert(previous, current, growth, directory));
            }
        }
        return alerts;
    }

    static double growthPercent(BigDecimal previous, BigDecimal current) {
        return current.subtract(previous)
                .divide(previous, MathContext.DECIMAL64)
                .multiply(HUNDRED)
                .doubleValue();
    }

    private FraudAlert toAlert(MonthlyTotal previous, MonthlyTotal current, double growth, ClaimDirectory directory) {
        String stateCode = directory.providerState(current.getProviderId());
        return FraudAlert.builder()
                .alertType(AlertType.TEMPORAL_GROWTH)
                .providerId(current.getProviderId())
                .providerName(directory.providerName(current.getProviderId()))
                .stateCode(stateCode)
                .stateName(StateNames.nameOf(stateCode))
                .procedureCode(current.getProcedureCode())
                .procedureDescription(directory.procedureDescription(current.getProcedureCode()))
                .period(current.getPeriod().toString())
                .currentAmount(current.getTotal())
                .comparisonAmount(previous.getTotal())
                .deviationPercent(growth)
                .severity(SeverityClassifier.classify(growth))
                .build();
    }
}
