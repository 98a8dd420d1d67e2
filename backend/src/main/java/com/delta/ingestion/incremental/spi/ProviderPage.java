package com.delta.ingestion.incremental.spi;

public record ProviderPage(boolean done, String cursor) {

    public static ProviderPage more(String cursor) {
        return new ProviderPage(false, cursor);
    }

    public static ProviderPage last(String cursor) {
        return new ProviderPage(true, cursor);
    }
}
