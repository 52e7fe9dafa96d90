package com.motaz.fraudscan.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

@Data
@Configuration
@ConfigurationProperties(prefix = "fraud.scan.cohort")
public class CohortScanProperties {

    // Peer groups smaller than this (after the spend floor) are not scored
    private int minSize = 5;

    // Providers below this total spend are dropped from their peer group
    private BigDecimal minSpendFloor = BigDecimal.valueOf(1000);
}
