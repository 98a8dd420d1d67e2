package com.delta.ingestion.incremental.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    boolean success,
    String provider,
    String message,
    ProviderStatus status,
    @JsonProperty("last_error") String lastError
) {
    public static ErrorResponse of(String message) {
        return new ErrorResponse(false, null, message, null, null);
    }

    public static ErrorResponse forProvider(String provider, String message) {
        return new ErrorResponse(false, provider, message, null, null);
    }

    public static ErrorResponse missingStatus(String lastError) {
        return new ErrorResponse(false, null, null, new ProviderStatus(null, null), lastError);
    }
}
