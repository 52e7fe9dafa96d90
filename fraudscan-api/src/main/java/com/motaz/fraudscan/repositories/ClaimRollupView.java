package com.motaz.fraudscan.repositories;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Claims summed per provider, procedure, state and month. */
public interface ClaimRollupView {
    String getProviderId();
    String getProviderName();
    String getProcedureCode();
    String getProcedureDescription();
    String getStateCode();
    LocalDate getPeriodMonth();
    BigDecimal getAmountPaid();
}
