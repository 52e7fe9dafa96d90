package com.motaz.fraudscan.exception;

public class ProviderNotFoundException extends RuntimeException {

    public ProviderNotFoundException(String providerId) {
        super("Provider not found: " + providerId);
    }
}
