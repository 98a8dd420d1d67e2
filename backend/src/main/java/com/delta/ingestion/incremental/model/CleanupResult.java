package com.delta.ingestion.incremental.model;

import java.util.List;

public record CleanupResult(
    boolean success,
    List<String> providers,
    int recordsRested,
    List<String> failedProviders
) {
}
