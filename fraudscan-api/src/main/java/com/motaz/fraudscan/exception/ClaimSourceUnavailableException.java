package com.motaz.fraudscan.exception;

/** The claim store could not be queried; the scan produced nothing. */
public class ClaimSourceUnavailableException extends RuntimeException {

    public ClaimSourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
