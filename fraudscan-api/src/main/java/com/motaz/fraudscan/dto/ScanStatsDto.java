package com.motaz.fraudscan.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class ScanStatsDto {
    private long totalClaims;
    private long totalProviders;
    private long totalStates;
    private BigDecimal totalSpend;
    private int flaggedProviders;
    private int totalAlerts;
}
