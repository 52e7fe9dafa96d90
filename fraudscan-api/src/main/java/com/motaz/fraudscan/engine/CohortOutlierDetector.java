package com.motaz.fraudscan.engine;

import com.motaz.fraudscan.engine.model.AlertType;
import com.motaz.fraudscan.engine.model.ClaimDirectory;
import com.motaz.fraudscan.engine.model.CohortKey;
import com.motaz.fraudscan.engine.model.CohortStat;
import com.motaz.fraudscan.engine.model.FraudAlert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Compares each provider's total spend on a procedure against the other
 * providers billing that procedure in the same state.
 */
@Slf4j
@Component
public class CohortOutlierDetector {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public List<FraudAlert> scanCohort(Map<CohortKey, ? extends Map<String, BigDecimal>> providerTotals,
                                       int minCohortSize,
                                       BigDecimal minSpendFloor,
                                       double threshold,
                                       ClaimDirectory directory) {
        List<FraudAlert> alerts = new ArrayList<>();
        providerTotals.forEach((key, totals) ->
                cohortStat(key, totals, minCohortSize, minSpendFloor)
                        .ifPresent(stat -> alerts.addAll(outliers(stat, threshold, directory))));
        return alerts;
    }

    /**
     * Drops providers under the spend floor, then computes mean and population
     * standard deviation. Empty when fewer than {@code minCohortSize} remain.
     */
    public Optional<CohortStat> cohortStat(CohortKey key,
                                           Map<String, BigDecimal> totals,
                                           int minCohortSize,
                                           BigDecimal minSpendFloor) {
        SortedMap<String, BigDecimal> qualifying = new TreeMap<>();
        totals.forEach((providerId, total) -> {
            if (total.compareTo(minSpendFloor) >= 0) {
                qualifying.put(providerId, total);
            }
        });
        if (qualifying.size() < minCohortSize) {
            log.debug("Skipping cohort {}/{}: {} qualifying providers",
                    key.getProcedureCode(), key.getStateCode(), qualifying.size());
            return Optional.empty();
        }

        BigDecimal n = BigDecimal.valueOf(qualifying.size());
        BigDecimal mean = qualifying.values().stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(n, MathContext.DECIMAL64);
        BigDecimal variance = qualifying.values().stream()
                .map(total -> total.subtract(mean).pow(2))
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .divide(n, MathContext.DECIMAL64);

        return Optional.of(CohortStat.builder()
                .key(key)
                .providerTotals(Collections.unmodifiableSortedMap(qualifying))
                .mean(mean)
                .stddev(variance.sqrt(MathContext.DECIMAL64))
                .build());
    }

    /**
     * A provider is an outlier only when its deviation from the mean is above
     * {@code threshold} and its total also clears mean + 2 stddev.
     */
    List<FraudAlert> outliers(CohortStat stat, double threshold, ClaimDirectory directory) {
        if (stat.getMean().signum() == 0 || stat.getStddev().signum() == 0) {
            log.debug("Skipping cohort {}/{}: degenerate mean {} stddev {}",
                    stat.getKey().getProcedureCode(), stat.getKey().getStateCode(), stat.getMean(), stat.getStddev());
            return List.of();
        }

        BigDecimal significance = stat.getMean().add(stat.getStddev().multiply(TWO));
        List<FraudAlert> alerts = new ArrayList<>();
        stat.getProviderTotals().forEach((providerId, total) -> {
            double deviation = total.subtract(stat.getMean())
                    .divide(stat.getMean(), MathContext.DECIMAL64)
                    .multiply(HUNDRED)
                    .doubleValue();
            if (deviation > threshold && total.compareTo(significance) > 0) {
                alerts.add(toAlert(stat, providerId, total, deviation, directory));
            }
        });
        return alerts;
    }

    private FraudAlert toAlert(CohortStat stat, String providerId, BigDecimal total, double deviation,
                               ClaimDirectory directory) {
        CohortKey key = stat.getKey();
        return FraudAlert.builder()
                .alertType(AlertType.PEER_OUTLIER)
                .providerId(providerId)
                .providerName(directory.providerName(providerId))
                .stateCode(key.getStateCode())
                .stateName(StateNames.nameOf(key.getStateCode()))
                .procedureCode(key.getProcedureCode())
                .procedureDescription(directory.procedureDescription(key.getProcedureCode()))
                .period(FraudAlert.CURRENT_PERIOD)
                .currentAmount(total)
                .comparisonAmount(stat.getMean())
                .deviationPercent(deviation)
                .severity(SeverityClassifier.classify(deviation))
                .build();
    }
}
