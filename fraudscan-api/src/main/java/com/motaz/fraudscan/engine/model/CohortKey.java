package com.motaz.fraudscan.engine.model;

import lombok.Value;

import java.util.Comparator;

/** Peer group: every provider billing one procedure code within one state. */
@Value
public class CohortKey implements Comparable<CohortKey> {

    private static final Comparator<CohortKey> ORDER = Comparator
            .comparing(CohortKey::getProcedureCode)
            .thenComparing(CohortKey::getStateCode);

    String procedureCode;
    String stateCode;

    @Override
    public int compareTo(CohortKey other) {
        return ORDER.compare(this, other);
    }
}
