package com.motaz.fraudscan.seed.service;

import com.motaz.fraudscan.seed.model.ClaimEntity;
import com.motaz.fraudscan.seed.repository.ClaimRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Writes a synthetic claim history into {@code t_claims}: every provider
 * bills every procedure once a month for a year. A few series get a
 * one-month spike and one provider per state is billed far above its
 * peers on one procedure.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimDataPreparationService {

    private final ClaimRepository claimRepository;

    Random rnd = new Random(42);
    int providersPerState = 20;
    int months = 12;
    YearMonth firstMonth = YearMonth.of(2023, 1);
    String[] states = {"CA", "TX", "NY", "FL"};
    Map<String, String> procedures = Map.of(
            "99213", "Office visit, established patient, low complexity",
            "99214", "Office visit, established patient, moderate complexity",
            "97110", "Therapeutic exercises",
            "80053", "Comprehensive metabolic panel",
            "36415", "Routine venipuncture");
    String[] nameWords = {"Bay", "Summit", "Riverside", "Lakeview", "Pioneer", "Cedar", "Harbor", "Valley"};
    String[] nameKinds = {"Clinic", "Medical Group", "Health Partners", "Family Practice", "Care Center"};

    @Transactional
    public SeedSummary prepareData() {
        long existing = claimRepository.count();
        if (existing > 0) {
            log.info("t_claims already holds {} rows, skipping seed", existing);
            return SeedSummary.builder().skipped(true).build();
        }

        List<String> procedureCodes = procedures.keySet().stream().sorted().toList();
        List<ClaimEntity> claims = new ArrayList<>();
        int spikes = 0;
        int providerNumber = 0;
        for (String state : states) {
            int outlierProvider = rnd.nextInt(providersPerState);
            String outlierProcedure = procedureCodes.get(rnd.nextInt(procedureCodes.size()));

            for (int p = 0; p < providersPerState; p++) {
                providerNumber++;
                String providerId = String.valueOf(1000000000L + providerNumber);
                String providerName = nameWords[rnd.nextInt(nameWords.length)] + " "
                        + nameKinds[rnd.nextInt(nameKinds.length)] + " " + providerNumber;

                for (String procedureCode : procedureCodes) {
                    double baseline = 2000 + rnd.nextDouble() * 4000;  // 2k..6k a month
                    if (p == outlierProvider && procedureCode.equals(outlierProcedure)) {
                        baseline *= 8 + rnd.nextDouble() * 7;  // 8x..15x the peers
                    }
                    // inject a one-month spike into ~5% of series
                    int spikeMonth = rnd.nextDouble() < 0.05 ? 1 + rnd.nextInt(months - 1) : -1;
                    if (spikeMonth > 0) {
                        spikes++;
                    }

                    for (int m = 0; m < months; m++) {
                        double amount = Math.max(50, baseline * (1 + rnd.nextGaussian() * 0.08));
                        if (m == spikeMonth) {
                            amount *= 5 + rnd.nextDouble() * 8;  // 5x..13x
                        }
                        ClaimEntity claim = new ClaimEntity();
                        claim.setProviderId(providerId);
                        claim.setProviderName(providerName);
                        claim.setProcedureCode(procedureCode);
                        claim.setProcedureDescription(procedures.get(procedureCode));
                        claim.setStateCode(state);
                        claim.setAmountPaid(BigDecimal.valueOf(Math.round(amount * 100.0) / 100.0));
                        claim.setPeriodMonth(firstMonth.plusMonths(m).atDay(1));
                        claims.add(claim);
                    }
                }
            }
        }

        claimRepository.saveAll(claims);
        log.info("Saved {} claims for {} providers", claims.size(), providerNumber);
        return SeedSummary.builder()
                .claims(claims.size())
                .providers(providerNumber)
                .spikes(spikes)
                .outliers(states.length)
                .build();
    }
}
