package com.delta.ingestion.incremental.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderStatusResponse(
    boolean success,
    ProviderStatus status,
    @JsonProperty("last_error") String lastError
) {
}
