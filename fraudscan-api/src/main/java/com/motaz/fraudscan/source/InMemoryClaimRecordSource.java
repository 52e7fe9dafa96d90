package com.motaz.fraudscan.source;

import com.motaz.fraudscan.engine.model.ClaimCounts;
import com.motaz.fraudscan.engine.model.ClaimRecord;
import com.motaz.fraudscan.engine.model.ClaimSnapshot;

import java.math.BigDecimal;
import java.util.List;

/** Serves a fixed list of claim line items. */
public class InMemoryClaimRecordSource implements ClaimRecordSource {

    private final ClaimSnapshot snapshot;

    public InMemoryClaimRecordSource(List<ClaimRecord> claims) {
        ClaimCounts counts = ClaimCounts.builder()
                .totalClaims(claims.size())
                .totalProviders(claims.stream().map(ClaimRecord::getProviderId).distinct().count())
                .totalStates(claims.stream().map(ClaimRecord::getStateCode).distinct().count())
                .totalSpend(claims.stream().map(ClaimRecord::getAmountPaid).reduce(BigDecimal.ZERO, BigDecimal::add))
                .build();
        this.snapshot = new ClaimSnapshot(claims, counts);
    }

    @Override
    public ClaimSnapshot snapshot() {
        return snapshot;
    }
}
