package com.delta.ingestion.incremental.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

public record IngestionMark(
    UUID id,
    @JsonProperty("ingestion_id") UUID ingestionId,
    String cursor,
    long sequence,
    @JsonProperty("created_at") Instant createdAt
) {
}
