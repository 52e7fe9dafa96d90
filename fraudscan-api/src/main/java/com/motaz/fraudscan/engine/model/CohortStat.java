package com.motaz.fraudscan.engine.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Mean and population standard deviation of the provider totals of one
 * cohort, after the spend floor has been applied.
 */
@Value
@Builder
public class CohortStat {
    CohortKey key;
    Map<String, BigDecimal> providerTotals;
    BigDecimal mean;
    BigDecimal stddev;

    public int size() {
        return providerTotals.size();
    }
}
