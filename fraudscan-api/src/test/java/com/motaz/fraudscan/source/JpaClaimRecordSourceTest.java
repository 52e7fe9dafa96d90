package com.motaz.fraudscan.source;

import com.motaz.fraudscan.engine.FraudScanEngine;
import com.motaz.fraudscan.engine.model.ClaimRecord;
import com.motaz.fraudscan.engine.model.ClaimSnapshot;
import com.motaz.fraudscan.engine.model.FraudAlert;
import com.motaz.fraudscan.repositories.ClaimCountsView;
import com.motaz.fraudscan.repositories.ClaimRepository;
import com.motaz.fraudscan.repositories.ClaimRollupView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static com.motaz.fraudscan.engine.ClaimFixtures.claim;
import static com.motaz.fraudscan.engine.ClaimFixtures.engine;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JpaClaimRecordSourceTest {

    @Mock
    private ClaimRepository claimRepository;

    private JpaClaimRecordSource source;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        source = new JpaClaimRecordSource(claimRepository);
    }

    private static ClaimRollupView row(String providerId, String procedureCode, String stateCode,
                                       LocalDate month, String amount) {
        ClaimRollupView row = mock(ClaimRollupView.class);
        when(row.getProviderId()).thenReturn(providerId);
        when(row.getProviderName()).thenReturn("Provider " + providerId);
        when(row.getProcedureCode()).thenReturn(procedureCode);
        when(row.getProcedureDescription()).thenReturn("Procedure " + procedureCode);
        when(row.getStateCode()).thenReturn(stateCode);
        when(row.getPeriodMonth()).thenReturn(month);
        when(row.getAmountPaid()).thenReturn(new BigDecimal(amount));
        return row;
    }

    private void stubCounts(long claims, long providers, long states, BigDecimal spend) {
        ClaimCountsView counts = mock(ClaimCountsView.class);
        when(counts.getTotalClaims()).thenReturn(claims);
        when(counts.getTotalProviders()).thenReturn(providers);
        when(counts.getTotalStates()).thenReturn(states);
        when(counts.getTotalSpend()).thenReturn(spend);
        when(claimRepository.countClaims()).thenReturn(counts);
    }

    @Test
    void mapsRollupRowsToMonthlyRecords() {
        ClaimRollupView january = row("P1", "97110", "TX", LocalDate.of(2023, 1, 1), "2500.00");
        ClaimRollupView february = row("P1", "97110", "TX", LocalDate.of(2023, 2, 1), "55000.00");
        when(claimRepository.rollupByProviderProcedureStateMonth()).thenReturn(Stream.of(january, february));
        stubCounts(42, 1, 1, new BigDecimal("57500.00"));

        ClaimSnapshot snapshot = source.snapshot();

        assertThat(snapshot.getRecords()).hasSize(2);
        ClaimRecord first = snapshot.getRecords().get(0);
        assertThat(first.getPeriod()).isEqualTo(YearMonth.of(2023, 1));
        assertThat(first.getAmountPaid()).isEqualByComparingTo("2500");
        assertThat(first.getProviderName()).isEqualTo("Provider P1");
        assertThat(snapshot.getCounts().getTotalClaims()).isEqualTo(42);
        assertThat(snapshot.getCounts().getTotalSpend()).isEqualByComparingTo("57500");
    }

    @Test
    void emptyTableGivesZeroSpend() {
        when(claimRepository.rollupByProviderProcedureStateMonth()).thenReturn(Stream.empty());
        stubCounts(0, 0, 0, null);

        ClaimSnapshot snapshot = source.snapshot();

        assertThat(snapshot.getRecords()).isEmpty();
        assertThat(snapshot.getCounts().getTotalSpend()).isEqualByComparingTo("0");
    }

    @Test
    void rolledUpRowsScanTheSameAsRawClaims() {
        // raw: several line items per month; rollup: their monthly sums
        List<ClaimRecord> raw = new ArrayList<>();
        raw.add(claim("P1", "97110", "TX", "1000", YearMonth.of(2023, 1)));
        raw.add(claim("P1", "97110", "TX", "1500", YearMonth.of(2023, 1)));
        raw.add(claim("P1", "97110", "TX", "30000", YearMonth.of(2023, 2)));
        raw.add(claim("P1", "97110", "TX", "25000", YearMonth.of(2023, 2)));

        ClaimRollupView january = row("P1", "97110", "TX", LocalDate.of(2023, 1, 1), "2500");
        ClaimRollupView february = row("P1", "97110", "TX", LocalDate.of(2023, 2, 1), "55000");
        when(claimRepository.rollupByProviderProcedureStateMonth()).thenReturn(Stream.of(january, february));
        stubCounts(4, 1, 1, new BigDecimal("57500"));

        FraudScanEngine engine = engine();
        List<FraudAlert> fromRaw = engine.scan(new InMemoryClaimRecordSource(raw).snapshot(), 200, 100);
        List<FraudAlert> fromRollup = engine.scan(source.snapshot(), 200, 100);

        assertThat(fromRollup).hasSize(1);
        assertThat(fromRollup.get(0).getDeviationPercent()).isEqualTo(fromRaw.get(0).getDeviationPercent());
        assertThat(fromRollup.get(0).getCurrentAmount()).isEqualByComparingTo(fromRaw.get(0).getCurrentAmount());
    }
}
