package com.motaz.fraudscan.controller;

import com.motaz.fraudscan.dto.ProcedureSummaryDto;
import com.motaz.fraudscan.dto.ScanStatsDto;
import com.motaz.fraudscan.dto.StateSummaryDto;
import com.motaz.fraudscan.engine.model.AlertType;
import com.motaz.fraudscan.engine.model.FraudAlert;
import com.motaz.fraudscan.engine.model.Severity;
import com.motaz.fraudscan.exception.ClaimSourceUnavailableException;
import com.motaz.fraudscan.exception.GlobalExceptionHandler;
import com.motaz.fraudscan.exception.ProviderNotFoundException;
import com.motaz.fraudscan.services.AlertExportService;
import com.motaz.fraudscan.services.ClaimCatalogService;
import com.motaz.fraudscan.services.FraudScanService;
import com.motaz.fraudscan.services.ProviderInsightService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.util.List;

import static com.motaz.fraudscan.engine.ClaimFixtures.JAN;
import static com.motaz.fraudscan.engine.ClaimFixtures.claim;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class FraudScanControllerTest {

    @Mock
    private FraudScanService fraudScanService;

    @Mock
    private ProviderInsightService providerInsightService;

    @Mock
    private ClaimCatalogService claimCatalogService;

    private MockMvc mockMvc;

    private final FraudAlert alert = FraudAlert.builder()
            .alertType(AlertType.TEMPORAL_GROWTH)
            .providerId("1000000011")
            .providerName("Lone Star Rehab")
            .stateCode("TX")
            .stateName("Texas")
            .procedureCode("97110")
            .procedureDescription("Therapeutic exercises")
            .period("2023-03")
            .currentAmount(new BigDecimal("55000"))
            .comparisonAmount(new BigDecimal("2600"))
            .deviationPercent(2015.38)
            .severity(Severity.CRITICAL)
            .build();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        FraudScanController controller =
                new FraudScanController(fraudScanService, providerInsightService, new AlertExportService(),
                        claimCatalogService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void scanPassesCallerAndParameters() throws Exception {
        when(fraudScanService.runScan("alice", 300.0, 5)).thenReturn(List.of(alert));

        mockMvc.perform(get("/api/v1/fraud/scan")
                        .header(FraudScanController.USER_HEADER, "alice")
                        .param("threshold", "300")
                        .param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].providerId").value("1000000011"))
                .andExpect(jsonPath("$[0].alertType").value("TEMPORAL_GROWTH"))
                .andExpect(jsonPath("$[0].severity").value("critical"));
    }

    @Test
    void scanWithoutParametersLeavesDefaultsToTheService() throws Exception {
        when(fraudScanService.runScan(isNull(), isNull(), isNull())).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/fraud/scan"))
                .andExpect(status().isOk())
                .andExpect(content().json("[]"));
        verify(fraudScanService).runScan(null, null, null);
    }

    @Test
    void exportReturnsCsvAttachment() throws Exception {
        when(fraudScanService.runScan(any(), any(), any())).thenReturn(List.of(alert));

        mockMvc.perform(get("/api/v1/fraud/scan/export"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Type", containsString("text/csv")))
                .andExpect(header().string("Content-Disposition", containsString("fraud-alerts.csv")))
                .andExpect(content().string(containsString("\"Lone Star Rehab\"")));
    }

    @Test
    void unavailableSourceIs503() throws Exception {
        when(fraudScanService.getAggregateCounts(any())).thenThrow(new ClaimSourceUnavailableException(
                "Claim source could not be queried", new DataAccessResourceFailureException("refused")));

        mockMvc.perform(get("/api/v1/fraud/stats"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error_code").value("SOURCE_UNAVAILABLE"))
                .andExpect(jsonPath("$.status").value(503));
    }

    @Test
    void statsAreReturned() throws Exception {
        when(fraudScanService.getAggregateCounts("alice")).thenReturn(ScanStatsDto.builder()
                .totalClaims(33).totalProviders(11).totalStates(2)
                .totalSpend(new BigDecimal("265500")).flaggedProviders(2).totalAlerts(2)
                .build());

        mockMvc.perform(get("/api/v1/fraud/stats").header(FraudScanController.USER_HEADER, "alice"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalProviders").value(11))
                .andExpect(jsonPath("$.flaggedProviders").value(2));
    }

    @Test
    void unknownProviderIs404() throws Exception {
        when(providerInsightService.getProviderDetail(any(), eq("42"))).thenThrow(new ProviderNotFoundException("42"));

        mockMvc.perform(get("/api/v1/fraud/providers/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("NOT_FOUND"));
    }

    @Test
    void providerListingUsesPagingDefaults() throws Exception {
        when(providerInsightService.listProviders(any(), any(), any(), eq(200), eq(0))).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/fraud/providers"))
                .andExpect(status().isOk());
        verify(providerInsightService).listProviders(null, null, null, 200, 0);
    }

    @Test
    void nonNumericThresholdIs400() throws Exception {
        mockMvc.perform(get("/api/v1/fraud/scan").param("threshold", "high"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_INPUT"));
        verifyNoInteractions(fraudScanService);
    }

    @Test
    void providerAlertsAreScopedToThePathId() throws Exception {
        when(fraudScanService.getProviderAlerts(any(), anyString())).thenReturn(List.of(alert));

        mockMvc.perform(get("/api/v1/fraud/providers/1000000011/alerts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].period").value("2023-03"));
        verify(fraudScanService).getProviderAlerts(null, "1000000011");
    }

    @Test
    void claimsExplorerPassesFiltersAndPagingDefaults() throws Exception {
        when(claimCatalogService.listClaims("TX", null, "1000000011", 500, 0))
                .thenReturn(List.of(claim("1000000011", "97110", "TX", "55000", JAN)));

        mockMvc.perform(get("/api/v1/fraud/claims").param("state", "TX").param("provider", "1000000011"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].providerId").value("1000000011"))
                .andExpect(jsonPath("$[0].amountPaid").value(55000));
        verify(claimCatalogService).listClaims("TX", null, "1000000011", 500, 0);
    }

    @Test
    void statesAndProceduresAreListed() throws Exception {
        when(claimCatalogService.listStates()).thenReturn(List.of(
                StateSummaryDto.builder().code("CA").name("California").claimCount(30).build()));
        when(claimCatalogService.listProcedures()).thenReturn(List.of(
                ProcedureSummaryDto.builder().code("99213").description("Office visit").claimCount(30).build()));

        mockMvc.perform(get("/api/v1/fraud/states"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("California"))
                .andExpect(jsonPath("$[0].claimCount").value(30));
        mockMvc.perform(get("/api/v1/fraud/procedures"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].code").value("99213"));
    }
}
