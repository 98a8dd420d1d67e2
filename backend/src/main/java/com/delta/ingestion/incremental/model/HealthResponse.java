package com.delta.ingestion.incremental.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(boolean healthy, List<String> duplicateIngestions) {

    public static HealthResponse ok() {
        return new HealthResponse(true, null);
    }

    public static HealthResponse duplicates(List<String> providers) {
        return new HealthResponse(false, List.copyOf(providers));
    }
}
