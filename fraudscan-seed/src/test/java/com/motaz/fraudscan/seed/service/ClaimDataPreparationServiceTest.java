package com.motaz.fraudscan.seed.service;

import com.motaz.fraudscan.seed.model.ClaimEntity;
import com.motaz.fraudscan.seed.repository.ClaimRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ClaimDataPreparationServiceTest {

    @Mock
    private ClaimRepository claimRepository;

    @Captor
    private ArgumentCaptor<List<ClaimEntity>> savedClaims;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(claimRepository.count()).thenReturn(0L);
    }

    private List<ClaimEntity> seed() {
        new ClaimDataPreparationService(claimRepository).prepareData();
        verify(claimRepository, times(1)).saveAll(savedClaims.capture());
        return savedClaims.getValue();
    }

    @Test
    void writesOneClaimPerProviderProcedureAndMonth() {
        SeedSummary summary = new ClaimDataPreparationService(claimRepository).prepareData();
        verify(claimRepository).saveAll(savedClaims.capture());
        List<ClaimEntity> claims = savedClaims.getValue();

        // 4 states x 20 providers x 5 procedures x 12 months
        assertThat(claims).hasSize(4800);
        assertThat(summary.getClaims()).isEqualTo(4800);
        assertThat(summary.getProviders()).isEqualTo(80);
        assertThat(summary.getOutliers()).isEqualTo(4);
        assertThat(claims.stream().map(ClaimEntity::getProviderId).distinct()).hasSize(80);
    }

    @Test
    void everyClaimIsPositiveAndMonthAligned() {
        List<ClaimEntity> claims = seed();

        assertThat(claims).allSatisfy(claim -> {
            assertThat(claim.getAmountPaid()).isGreaterThan(BigDecimal.ZERO);
            assertThat(claim.getPeriodMonth().getDayOfMonth()).isEqualTo(1);
            assertThat(claim.getStateCode()).hasSize(2);
        });
        assertThat(claims.stream().map(ClaimEntity::getPeriodMonth).distinct()).hasSize(12);
    }

    @Test
    void sameSeedProducesSameClaims() {
        List<BigDecimal> first = seed().stream().map(ClaimEntity::getAmountPaid).toList();

        ClaimRepository otherRepository = mock(ClaimRepository.class);
        new ClaimDataPreparationService(otherRepository).prepareData();
        verify(otherRepository).saveAll(savedClaims.capture());
        List<BigDecimal> second = savedClaims.getValue().stream().map(ClaimEntity::getAmountPaid).toList();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void plantedSpikesShowUpAsMonthOverMonthJumps() {
        Map<String, List<BigDecimal>> series = new LinkedHashMap<>();
        for (ClaimEntity claim : seed()) {
            series.computeIfAbsent(claim.getProviderId() + "/" + claim.getProcedureCode(), k -> new ArrayList<>())
                    .add(claim.getAmountPaid());
        }

        long jumps = series.values().stream().filter(ClaimDataPreparationServiceTest::hasTripling).count();
        assertThat(jumps).isPositive();
    }

    private static boolean hasTripling(List<BigDecimal> amounts) {
        for (int i = 1; i < amounts.size(); i++) {
            if (amounts.get(i).compareTo(amounts.get(i - 1).multiply(BigDecimal.valueOf(3))) > 0) {
                return true;
            }
        }
        return false;
    }

    @Test
    void populatedTableIsLeftAlone() {
        when(claimRepository.count()).thenReturn(10L);

        SeedSummary summary = new ClaimDataPreparationService(claimRepository).prepareData();

        assertThat(summary.isSkipped()).isTrue();
        verify(claimRepository, never()).saveAll(any());
    }
}
