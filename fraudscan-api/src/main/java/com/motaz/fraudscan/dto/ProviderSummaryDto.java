package com.motaz.fraudscan.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Builder
public class ProviderSummaryDto {
    private String id;
    private String name;
    private String stateCode;
    private String stateName;
    private String procedureCode;
    private String procedureDescription;
    private BigDecimal totalSpend;
    private long claimCount;
    private boolean flagged;
}
