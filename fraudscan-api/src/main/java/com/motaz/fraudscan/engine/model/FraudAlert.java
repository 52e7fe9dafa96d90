package com.motaz.fraudscan.engine.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class FraudAlert {

    /** Period marker used by peer-outlier alerts, which span every month. */
    public static final String CURRENT_PERIOD = "current";

    AlertType alertType;
    String providerId;
    String providerName;
    String stateCode;
    String stateName;
    String procedureCode;
    String procedureDescription;
    String period;
    BigDecimal currentAmount;
    BigDecimal comparisonAmount;
    double deviationPercent;
    Severity severity;
}
