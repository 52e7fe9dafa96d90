package com.motaz.fraudscan.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ProcedureSummaryDto {
    private String code;
    private String description;
    private long claimCount;
}
