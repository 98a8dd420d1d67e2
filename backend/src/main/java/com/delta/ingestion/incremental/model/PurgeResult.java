package com.delta.ingestion.incremental.model;

import java.time.Instant;

public record PurgeResult(
    boolean success,
    String provider,
    int recordsDeleted,
    int marksDeleted,
    Instant nextActionAt
) {
}
