package com.delta.ingestion.incremental.service;

public class PublishUnavailableException extends RuntimeException {
    private final String provider;

    public PublishUnavailableException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public PublishUnavailableException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
