package com.motaz.fraudscan.services;

import com.motaz.fraudscan.dto.ProviderDetailDto;
import com.motaz.fraudscan.dto.ProviderSummaryDto;
import com.motaz.fraudscan.engine.ClaimAggregator;
import com.motaz.fraudscan.engine.FraudScanEngine;
import com.motaz.fraudscan.engine.ScanSummary;
import com.motaz.fraudscan.engine.StateNames;
import com.motaz.fraudscan.engine.model.ClaimDirectory;
import com.motaz.fraudscan.engine.model.ClaimRecord;
import com.motaz.fraudscan.engine.model.ClaimSnapshot;
import com.motaz.fraudscan.engine.model.CohortKey;
import com.motaz.fraudscan.engine.model.FraudAlert;
import com.motaz.fraudscan.exception.ProviderNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Provider listing and provider detail views, decorated with the scan's
 * flagged status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderInsightService {

    private static final int TOP_PROCEDURES = 10;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final Comparator<Map.Entry<String, BigDecimal>> BY_SPEND_DESC =
            Map.Entry.<String, BigDecimal>comparingByValue().reversed().thenComparing(Map.Entry.<String, BigDecimal>comparingByKey());

    private final ClaimSnapshotService claimSnapshotService;
    private final FraudScanEngine fraudScanEngine;
    private final ClaimAggregator claimAggregator;
    private final ThresholdService thresholdService;

    public List<ProviderSummaryDto> listProviders(String userId, String stateCode, String procedureCode,
                                                  int limit, int offset) {
        ClaimSnapshot snapshot = claimSnapshotService.load();
        ClaimDirectory directory = ClaimDirectory.of(snapshot.getRecords());
        ScanSummary summary = fraudScanEngine.summarize(
                fraudScanEngine.scanAll(snapshot, thresholdService.resolveThreshold(userId, null)));

        Map<String, SortedMap<String, BigDecimal>> spendByProvider = new TreeMap<>();
        Map<String, Long> claimsByProvider = new TreeMap<>();
        for (ClaimRecord claim : snapshot.getRecords()) {
            if (stateCode != null && !stateCode.equals(claim.getStateCode())) {
                continue;
            }
            if (procedureCode != null && !procedureCode.equals(claim.getProcedureCode())) {
                continue;
            }
            spendByProvider.computeIfAbsent(claim.getProviderId(), k -> new TreeMap<>())
                    .merge(claim.getProcedureCode(), claim.getAmountPaid(), BigDecimal::add);
            claimsByProvider.merge(claim.getProviderId(), 1L, Long::sum);
        }

        List<ProviderSummaryDto> providers = new ArrayList<>();
        spendByProvider.forEach((providerId, procedures) -> {
            String topProcedure = procedures.entrySet().stream().min(BY_SPEND_DESC).orElseThrow().getKey();
            // a provider billing in several states is listed under the state asked for
            String providerState = stateCode != null ? stateCode : directory.providerState(providerId);
            providers.add(ProviderSummaryDto.builder()
                    .id(providerId)
                    .name(directory.providerName(providerId))
                    .stateCode(providerState)
                    .stateName(StateNames.nameOf(providerState))
                    .procedureCode(topProcedure)
                    .procedureDescription(directory.procedureDescription(topProcedure))
                    .totalSpend(sum(procedures))
                    .claimCount(claimsByProvider.get(providerId))
                    .flagged(summary.isFlagged(providerId))
                    .build());
        });

        return providers.stream()
                .sorted(Comparator.comparing(ProviderSummaryDto::getTotalSpend).reversed()
                        .thenComparing(ProviderSummaryDto::getId))
                .skip(Math.max(offset, 0))
                .limit(Math.max(limit, 0))
                .toList();
    }

    public ProviderDetailDto getProviderDetail(String userId, String providerId) {
        log.info("Loading provider detail for providerId:{}", providerId);
        ClaimSnapshot snapshot = claimSnapshotService.load();
        ClaimDirectory directory = ClaimDirectory.of(snapshot.getRecords());
        if (!directory.knowsProvider(providerId)) {
            throw new ProviderNotFoundException(providerId);
        }

        List<ClaimRecord> claims = snapshot.getRecords().stream()
                .filter(claim -> claim.getProviderId().equals(providerId))
                .toList();
        Map<String, BigDecimal> spendByProcedure = new TreeMap<>();
        SortedMap<YearMonth, BigDecimal> spendByMonth = new TreeMap<>();
        claims.forEach(claim -> {
            spendByProcedure.merge(claim.getProcedureCode(), claim.getAmountPaid(), BigDecimal::add);
            spendByMonth.merge(claim.getPeriod(), claim.getAmountPaid(), BigDecimal::add);
        });

        List<ProviderDetailDto.ProcedureSpend> topProcedures = spendByProcedure.entrySet().stream()
                .sorted(BY_SPEND_DESC)
                .limit(TOP_PROCEDURES)
                .map(entry -> ProviderDetailDto.ProcedureSpend.builder()
                        .code(entry.getKey())
                        .description(directory.procedureDescription(entry.getKey()))
                        .totalPaid(entry.getValue())
                        .build())
                .toList();
        String topProcedure = topProcedures.get(0).getCode();
        String stateCode = directory.providerState(providerId);

        List<FraudAlert> alerts = fraudScanEngine.scanAll(snapshot, thresholdService.resolveThreshold(userId, null))
                .stream()
                .filter(alert -> alert.getProviderId().equals(providerId))
                .toList();

        return ProviderDetailDto.builder()
                .id(providerId)
                .name(directory.providerName(providerId))
                .stateCode(stateCode)
                .stateName(StateNames.nameOf(stateCode))
                .procedureCode(topProcedure)
                .procedureDescription(directory.procedureDescription(topProcedure))
                .totalSpend(sum(spendByProcedure))
                .claimCount(claims.size())
                .topProcedures(topProcedures)
                .peerComparison(peerComparison(snapshot, providerId, new CohortKey(topProcedure, stateCode)))
                .fraudAlerts(alerts)
                .flagged(!alerts.isEmpty())
                .monthlyTotals(spendByMonth.entrySet().stream()
                        .map(entry -> ProviderDetailDto.MonthlySpend.builder()
                                .month(entry.getKey().toString())
                                .total(entry.getValue())
                                .build())
                        .toList())
                .growthData(growth(spendByMonth))
                .build();
    }

    /**
     * Unlike the outlier detector, the comparison covers every peer: no spend
     * floor and no minimum cohort size.
     */
    private ProviderDetailDto.PeerComparison peerComparison(ClaimSnapshot snapshot, String providerId, CohortKey cohort) {
        Map<String, BigDecimal> peers = claimAggregator.totalsByProviderState(snapshot.getRecords())
                .getOrDefault(cohort, new TreeMap<>());
        BigDecimal providerPaid = peers.getOrDefault(providerId, BigDecimal.ZERO);
        if (peers.isEmpty()) {
            return ProviderDetailDto.PeerComparison.builder()
                    .peerAverage(BigDecimal.ZERO)
                    .providerPaid(providerPaid)
                    .percentileRank(0)
                    .build();
        }

        long atOrBelow = peers.values().stream().filter(total -> total.compareTo(providerPaid) <= 0).count();
        return ProviderDetailDto.PeerComparison.builder()
                .peerAverage(sum(peers).divide(BigDecimal.valueOf(peers.size()), MathContext.DECIMAL64))
                .providerPaid(providerPaid)
                .percentileRank(atOrBelow * 100.0 / peers.size())
                .build();
    }

    private static List<ProviderDetailDto.MonthlyGrowth> growth(SortedMap<YearMonth, BigDecimal> spendByMonth) {
        List<ProviderDetailDto.MonthlyGrowth> growth = new ArrayList<>();
        BigDecimal previous = null;
        for (Map.Entry<YearMonth, BigDecimal> month : spendByMonth.entrySet()) {
            if (previous != null) {
                double percent = previous.signum() > 0
                        ? month.getValue().subtract(previous)
                                .multiply(HUNDRED)
                                .divide(previous, 2, RoundingMode.HALF_UP)
                                .doubleValue()
                        : 0;
                growth.add(ProviderDetailDto.MonthlyGrowth.builder()
                        .month(month.getKey().toString())
                        .growthPercent(percent)
                        .build());
            }
            previous = month.getValue();
        }
        return growth;
    }

    private static BigDecimal sum(Map<String, BigDecimal> totals) {
        return totals.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
