package com.motaz.fraudscan.engine.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ClaimCounts {
    long totalClaims;
    long totalProviders;
    long totalStates;
    BigDecimal totalSpend;
}
