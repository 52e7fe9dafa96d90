package com.motaz.fraudscan.engine.model;

import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;

@Value
public class MonthlyTotal {
    String providerId;
    String procedureCode;
    YearMonth period;
    BigDecimal total;
}
