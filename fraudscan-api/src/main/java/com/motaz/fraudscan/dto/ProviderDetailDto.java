package com.motaz.fraudscan.dto;

import com.motaz.fraudscan.engine.model.FraudAlert;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

@Data
@Builder
public class ProviderDetailDto {

    private String id;
    private String name;
    private String stateCode;
    private String stateName;
    private String procedureCode;
    private String procedureDescription;
    private BigDecimal totalSpend;
    private long claimCount;

    private List<ProcedureSpend> topProcedures;
    private PeerComparison peerComparison;
    private List<FraudAlert> fraudAlerts;
    private boolean flagged;
    private List<MonthlySpend> monthlyTotals;
    private List<MonthlyGrowth> growthData;

    @Data
    @Builder
    public static class ProcedureSpend {
        private String code;
        private String description;
        private BigDecimal totalPaid;
    }

    /** Provider's spend on its top procedure against every peer in its state. */
    @Data
    @Builder
    public static class PeerComparison {
        private BigDecimal peerAverage;
        private BigDecimal providerPaid;
        private double percentileRank;
    }

    @Data
    @Builder
    public static class MonthlySpend {
        private String month;
        private BigDecimal total;
    }

    @Data
    @Builder
    public static class MonthlyGrowth {
        private String month;
        private double growthPercent;
    }
}
