package com.motaz.fraudscan.services;

import com.motaz.fraudscan.dto.ProcedureSummaryDto;
import com.motaz.fraudscan.dto.StateSummaryDto;
import com.motaz.fraudscan.engine.StateNames;
import com.motaz.fraudscan.engine.model.ClaimDirectory;
import com.motaz.fraudscan.engine.model.ClaimRecord;
import com.motaz.fraudscan.engine.model.ClaimSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Raw claim browsing plus the state and procedure pick lists. Plain
 * counts over the snapshot, no scanning involved.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimCatalogService {

    static final int MAX_PROCEDURES = 200;

    private static final Comparator<ClaimRecord> BY_AMOUNT_DESC = Comparator
            .comparing(ClaimRecord::getAmountPaid).reversed()
            .thenComparing(ClaimRecord::getProviderId)
            .thenComparing(ClaimRecord::getProcedureCode)
            .thenComparing(ClaimRecord::getPeriod);

    private static final Comparator<Map.Entry<String, Long>> BY_COUNT_DESC =
            Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.<String, Long>comparingByKey());

    private final ClaimSnapshotService claimSnapshotService;

    public List<ClaimRecord> listClaims(String stateCode, String procedureCode, String providerId,
                                        int limit, int offset) {
        log.info("Listing claims state: {} code: {} provider: {} limit: {} offset: {}",
                stateCode, procedureCode, providerId, limit, offset);
        return claimSnapshotService.load().getRecords().stream()
                .filter(claim -> stateCode == null || stateCode.equals(claim.getStateCode()))
                .filter(claim -> procedureCode == null || procedureCode.equals(claim.getProcedureCode()))
                .filter(claim -> providerId == null || providerId.equals(claim.getProviderId()))
                .sorted(BY_AMOUNT_DESC)
                .skip(Math.max(offset, 0))
                .limit(Math.max(limit, 0))
                .toList();
    }

    public List<StateSummaryDto> listStates() {
        Map<String, Long> claimsByState = new TreeMap<>();
        claimSnapshotService.load().getRecords()
                .forEach(claim -> claimsByState.merge(claim.getStateCode(), 1L, Long::sum));

        return claimsByState.entrySet().stream()
                .sorted(BY_COUNT_DESC)
                .map(entry -> StateSummaryDto.builder()
                        .code(entry.getKey())
                        .name(StateNames.nameOf(entry.getKey()))
                        .claimCount(entry.getValue())
                        .build())
                .toList();
    }

    public List<ProcedureSummaryDto> listProcedures() {
        ClaimSnapshot snapshot = claimSnapshotService.load();
        ClaimDirectory directory = ClaimDirectory.of(snapshot.getRecords());
        Map<String, Long> claimsByProcedure = new TreeMap<>();
        snapshot.getRecords().forEach(claim -> claimsByProcedure.merge(claim.getProcedureCode(), 1L, Long::sum));

        return claimsByProcedure.entrySet().stream()
                .sorted(BY_COUNT_DESC)
                .limit(MAX_PROCEDURES)
                .map(entry -> ProcedureSummaryDto.builder()
                        .code(entry.getKey())
                        .description(directory.procedureDescription(entry.getKey()))
                        .claimCount(entry.getValue())
                        .build())
                .toList();
    }
}
