package com.delta.ingestion.incremental.service;

public class ProviderNotFoundException extends RuntimeException {
    private final String provider;

    public ProviderNotFoundException(String provider) {
        super("Provider '" + provider + "' not found");
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
