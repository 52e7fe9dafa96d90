package com.motaz.fraudscan.repositories;

import com.motaz.fraudscan.model.entities.ClaimEntity;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.stereotype.Repository;

import java.util.stream.Stream;

@Repository
public interface ClaimRepository extends JpaRepository<ClaimEntity, Long> {

    @QueryHints(value = @QueryHint(name = org.hibernate.jpa.AvailableHints.HINT_FETCH_SIZE, value = "1000"))
    @Query("SELECT c.providerId AS providerId, MAX(c.providerName) AS providerName, "
            + "c.procedureCode AS procedureCode, MAX(c.procedureDescription) AS procedureDescription, "
            + "c.stateCode AS stateCode, c.periodMonth AS periodMonth, SUM(c.amountPaid) AS amountPaid "
            + "FROM ClaimEntity c "
            + "GROUP BY c.providerId, c.procedureCode, c.stateCode, c.periodMonth")
    Stream<ClaimRollupView> rollupByProviderProcedureStateMonth();

    @Query("SELECT COUNT(c) AS totalClaims, COUNT(DISTINCT c.providerId) AS totalProviders, "
            + "COUNT(DISTINCT c.stateCode) AS totalStates, COALESCE(SUM(c.amountPaid), 0) AS totalSpend "
            + "FROM ClaimEntity c")
    ClaimCountsView countClaims();
}
