package com.motaz.fraudscan.repositories;

import java.math.BigDecimal;

public interface ClaimCountsView {
    Long getTotalClaims();
    Long getTotalProviders();
    Long getTotalStates();
    BigDecimal getTotalSpend();
}
