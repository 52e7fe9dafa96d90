package com.motaz.fraudscan.services;

import com.motaz.fraudscan.engine.model.ClaimSnapshot;
import com.motaz.fraudscan.exception.ClaimSourceUnavailableException;
import com.motaz.fraudscan.source.ClaimRecordSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimSnapshotService {

    private final ClaimRecordSource claimRecordSource;

    /** Loads a fresh snapshot; store failures surface as {@link ClaimSourceUnavailableException}, never retried. */
    public ClaimSnapshot load() {
        try {
            return claimRecordSource.snapshot();
        } catch (DataAccessException | TransactionException e) {
            log.error("Claim source unavailable: {}", e.getMessage());
            throw new ClaimSourceUnavailableException("Claim source could not be queried", e);
        }
    }
}
