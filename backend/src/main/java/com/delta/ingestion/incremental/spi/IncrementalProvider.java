package com.delta.ingestion.incremental.spi;

/**
 * Provider-specific page fetching. Implementations are registered as Spring beans and driven by
 * the ingestion state machine one page at a time; they never touch ingestion state themselves.
 */
public interface IncrementalProvider {

    /**
     * Unique name of the provider, used as the key of its ingestion records.
     */
    String getProviderName();

    /**
     * Fetches the page following {@link IngestionContext#cursor()}. A {@code null} cursor means the
     * cycle starts from scratch. Any exception is recorded as the cycle's last error.
     */
    ProviderPage next(IngestionContext context) throws Exception;
}
