package com.motaz.fraudscan.engine.model;

import lombok.Value;

import java.util.List;

/**
 * Immutable view of the claim data a single scan runs against. Every scan
 * receives its snapshot explicitly; nothing is read from shared state.
 */
@Value
public class ClaimSnapshot {

    List<ClaimRecord> records;
    ClaimCounts counts;

    public ClaimSnapshot(List<ClaimRecord> records, ClaimCounts counts) {
        this.records = List.copyOf(records);
        this.counts = counts;
    }
}
