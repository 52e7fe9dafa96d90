package com.motaz.fraudscan.controller;

import com.motaz.fraudscan.dto.ProcedureSummaryDto;
import com.motaz.fraudscan.dto.ProviderDetailDto;
import com.motaz.fraudscan.dto.ProviderSummaryDto;
import com.motaz.fraudscan.dto.ScanStatsDto;
import com.motaz.fraudscan.dto.StateSummaryDto;
import com.motaz.fraudscan.engine.model.ClaimRecord;
import com.motaz.fraudscan.engine.model.FraudAlert;
import com.motaz.fraudscan.services.AlertExportService;
import com.motaz.fraudscan.services.ClaimCatalogService;
import com.motaz.fraudscan.services.FraudScanService;
import com.motaz.fraudscan.services.ProviderInsightService;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/fraud")
@RequiredArgsConstructor
public class FraudScanController {

    static final String USER_HEADER = "X-User-Id";
    private static final MediaType TEXT_CSV = new MediaType("text", "csv");

    private final FraudScanService fraudScanService;
    private final ProviderInsightService providerInsightService;
    private final AlertExportService alertExportService;
    private final ClaimCatalogService claimCatalogService;

    @GetMapping("/scan")
    public List<FraudAlert> scan(
            @RequestHeader(name = USER_HEADER, required = false) String userId,
            @Parameter(description = "Minimum deviation percent to alert on; defaults to the caller's preference", example = "200")
            @RequestParam(name = "threshold", required = false) Double threshold,
            @Parameter(description = "Maximum number of alerts, highest deviation first", example = "100")
            @RequestParam(name = "limit", required = false) Integer limit) {
        return fraudScanService.runScan(userId, threshold, limit);
    }

    @GetMapping("/scan/export")
    public ResponseEntity<String> exportScan(
            @RequestHeader(name = USER_HEADER, required = false) String userId,
            @RequestParam(name = "threshold", required = false) Double threshold,
            @RequestParam(name = "limit", required = false) Integer limit) {
        String csv = alertExportService.exportAlertsAsDelimitedText(fraudScanService.runScan(userId, threshold, limit));
        return ResponseEntity.ok()
                .contentType(TEXT_CSV)
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"fraud-alerts.csv\"")
                .body(csv);
    }

    @GetMapping("/stats")
    public ScanStatsDto stats(@RequestHeader(name = USER_HEADER, required = false) String userId) {
        return fraudScanService.getAggregateCounts(userId);
    }

    @GetMapping("/providers")
    public List<ProviderSummaryDto> providers(
            @RequestHeader(name = USER_HEADER, required = false) String userId,
            @Parameter(description = "Two-letter state code", example = "CA")
            @RequestParam(name = "state", required = false) String state,
            @Parameter(description = "Procedure code", example = "99213")
            @RequestParam(name = "code", required = false) String code,
            @RequestParam(name = "limit", defaultValue = "200") int limit,
            @RequestParam(name = "offset", defaultValue = "0") int offset) {
        return providerInsightService.listProviders(userId, state, code, limit, offset);
    }

    @GetMapping("/providers/{providerId}")
    public ProviderDetailDto provider(
            @RequestHeader(name = USER_HEADER, required = false) String userId,
            @Parameter(description = "The unique identifier of the provider", required = true, example = "1003000126")
            @PathVariable(name = "providerId") String providerId) {
        return providerInsightService.getProviderDetail(userId, providerId);
    }

    @GetMapping("/providers/{providerId}/alerts")
    public List<FraudAlert> providerAlerts(
            @RequestHeader(name = USER_HEADER, required = false) String userId,
            @Parameter(description = "The unique identifier of the provider", required = true, example = "1003000126")
            @PathVariable(name = "providerId") String providerId) {
        return fraudScanService.getProviderAlerts(userId, providerId);
    }

    @GetMapping("/claims")
    public List<ClaimRecord> claims(
            @Parameter(description = "Two-letter state code", example = "TX")
            @RequestParam(name = "state", required = false) String state,
            @Parameter(description = "Procedure code", example = "97110")
            @RequestParam(name = "code", required = false) String code,
            @Parameter(description = "Provider identifier", example = "1003000126")
            @RequestParam(name = "provider", required = false) String provider,
            @RequestParam(name = "limit", defaultValue = "500") int limit,
            @RequestParam(name = "offset", defaultValue = "0") int offset) {
        return claimCatalogService.listClaims(state, code, provider, limit, offset);
    }

    @GetMapping("/states")
    public List<StateSummaryDto> states() {
        return claimCatalogService.listStates();
    }

    @GetMapping("/procedures")
    public List<ProcedureSummaryDto> procedures() {
        return claimCatalogService.listProcedures();
    }
}
