package com.motaz.fraudscan.engine.model;

public enum AlertType {
    /** Month-over-month spike within one provider/procedure series. */
    TEMPORAL_GROWTH,
    /** Provider total far above its procedure/state peers. */
    PEER_OUTLIER
}
