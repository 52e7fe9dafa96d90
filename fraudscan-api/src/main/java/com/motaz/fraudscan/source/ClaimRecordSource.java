package com.motaz.fraudscan.source;

import com.motaz.fraudscan.engine.model.ClaimSnapshot;

/**
 * Supplies the claim data a scan runs against. Implementations may hand out
 * raw line items or rows already summed per provider, procedure, state and
 * month; either way the snapshot is complete or the call fails.
 */
public interface ClaimRecordSource {

    ClaimSnapshot snapshot();
}
