package com.motaz.fraudscan.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class StateSummaryDto {
    private String code;
    private String name;
    private long claimCount;
}
