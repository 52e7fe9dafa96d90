package com.motaz.fraudscan.engine;

import com.motaz.fraudscan.engine.model.ClaimRecord;
import com.motaz.fraudscan.engine.model.CohortKey;
import com.motaz.fraudscan.engine.model.MonthlyTotal;
import com.motaz.fraudscan.engine.model.SeriesKey;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Rolls claim line items up into the time series and cohort totals the
 * detectors consume. Output maps are sorted so iteration order is stable.
 */
@Component
public class ClaimAggregator {

    /**
     * Sums amounts per provider, procedure and month. Each series is sorted
     * ascending by period; months without claims are absent, not zero.
     */
    public SortedMap<SeriesKey, List<MonthlyTotal>> aggregate(Collection<ClaimRecord> claims) {
        Map<SeriesKey, TreeMap<YearMonth, BigDecimal>> byMonth = new TreeMap<>();
        for (ClaimRecord claim : claims) {
            byMonth.computeIfAbsent(claim.seriesKey(), k -> new TreeMap<>())
                    .merge(claim.getPeriod(), claim.getAmountPaid(), BigDecimal::add);
        }

        SortedMap<SeriesKey, List<MonthlyTotal>> series = new TreeMap<>();
        byMonth.forEach((key, months) -> {
            List<MonthlyTotal> totals = new ArrayList<>(months.size());
            months.forEach((period, total) ->
                    totals.add(new MonthlyTotal(key.getProviderId(), key.getProcedureCode(), period, total)));
            series.put(key, Collections.unmodifiableList(totals));
        });
        return Collections.unmodifiableSortedMap(series);
    }

    /** Sums amounts per procedure and state, then per provider, across all months. */
    public SortedMap<CohortKey, SortedMap<String, BigDecimal>> totalsByProviderState(Collection<ClaimRecord> claims) {
        SortedMap<CohortKey, SortedMap<String, BigDecimal>> cohorts = new TreeMap<>();
        for (ClaimRecord claim : claims) {
            cohorts.computeIfAbsent(claim.cohortKey(), k -> new TreeMap<>())
                    .merge(claim.getProviderId(), claim.getAmountPaid(), BigDecimal::add);
        }
        return Collections.unmodifiableSortedMap(cohorts);
    }
}
