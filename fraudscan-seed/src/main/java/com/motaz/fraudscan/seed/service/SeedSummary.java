package com.motaz.fraudscan.seed.service;

import lombok.Builder;
import lombok.Value;

/** What one seeding run wrote, including the anomalies it planted. */
@Value
@Builder
public class SeedSummary {
    int claims;
    int providers;
    int spikes;
    int outliers;
    boolean skipped;
}
