package com.motaz.fraudscan.engine.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * One billed line item. A remote source may hand out one record per
 * provider, procedure, state and month carrying the summed amount instead;
 * totals are additive so the scan result does not change.
 */
@Value
@Builder
@Jacksonized
public class ClaimRecord {

    @NonNull String providerId;
    String providerName;
    @NonNull String procedureCode;
    String procedureDescription;
    @NonNull String stateCode;
    @NonNull BigDecimal amountPaid;
    @NonNull YearMonth period;

    public SeriesKey seriesKey() {
        return new SeriesKey(providerId, procedureCode);
    }

    public CohortKey cohortKey() {
        return new CohortKey(procedureCode, stateCode);
    }
}
