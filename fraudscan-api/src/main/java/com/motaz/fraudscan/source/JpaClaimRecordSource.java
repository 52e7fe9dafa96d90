package com.motaz.fraudscan.source;

import com.motaz.fraudscan.engine.model.ClaimCounts;
import com.motaz.fraudscan.engine.model.ClaimRecord;
import com.motaz.fraudscan.engine.model.ClaimSnapshot;
import com.motaz.fraudscan.repositories.ClaimCountsView;
import com.motaz.fraudscan.repositories.ClaimRepository;
import com.motaz.fraudscan.repositories.ClaimRollupView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.stream.Stream;

/**
 * Pushes the monthly grouping down to PostgreSQL so only one row per
 * provider, procedure, state and month crosses the wire.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "fraud.scan.source", havingValue = "jpa", matchIfMissing = true)
public class JpaClaimRecordSource implements ClaimRecordSource {

    private final ClaimRepository claimRepository;

    @Override
    @Transactional(readOnly = true)
    public ClaimSnapshot snapshot() {
        List<ClaimRecord> records;
        try (Stream<ClaimRollupView> rollup = claimRepository.rollupByProviderProcedureStateMonth()) {
            records = rollup.map(JpaClaimRecordSource::toRecord).toList();
        }
        ClaimCountsView counts = claimRepository.countClaims();
        log.info("Loaded {} monthly claim rollups covering {} claims", records.size(), counts.getTotalClaims());

        return new ClaimSnapshot(records, ClaimCounts.builder()
                .totalClaims(valueOf(counts.getTotalClaims()))
                .totalProviders(valueOf(counts.getTotalProviders()))
                .totalStates(valueOf(counts.getTotalStates()))
                .totalSpend(counts.getTotalSpend() == null ? BigDecimal.ZERO : counts.getTotalSpend())
                .build());
    }

    private static ClaimRecord toRecord(ClaimRollupView row) {
        return ClaimRecord.builder()
                .providerId(row.getProviderId())
                .providerName(row.getProviderName())
                .procedureCode(row.getProcedureCode())
                .procedureDescription(row.getProcedureDescription())
                .stateCode(row.getStateCode())
                .amountPaid(row.getAmountPaid())
                .period(YearMonth.from(row.getPeriodMonth()))
                .build();
    }

    private static long valueOf(Long count) {
        return count == null ? 0L : count;
    }
}
