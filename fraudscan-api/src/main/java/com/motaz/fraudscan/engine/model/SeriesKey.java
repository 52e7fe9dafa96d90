package com.motaz.fraudscan.engine.model;

import lombok.Value;

import java.util.Comparator;

/** Identifies one provider/procedure time series. */
@Value
public class SeriesKey implements Comparable<SeriesKey> {

    private static final Comparator<SeriesKey> ORDER = Comparator
            .comparing(SeriesKey::getProviderId)
            .thenComparing(SeriesKey::getProcedureCode);

    String providerId;
    String procedureCode;

    @Override
    public int compareTo(SeriesKey other) {
        return ORDER.compare(this, other);
    }
}
