package com.delta.ingestion.incremental.model;

import java.time.Instant;
import java.util.UUID;

public record IngestionRecord(
    UUID id,
    String providerName,
    IngestionStatus status,
    String nextAction,
    Instant nextActionAt,
    Instant ingestionCompletedAt,
    String lastError,
    int attempts,
    long lastMarkSequence,
    String completionTicket,
    String leaseOwner,
    Instant leaseUntil,
    Instant createdAt,
    Instant updatedAt
) {
    public static final String OPEN_TICKET = "open";

    public boolean isCurrent() {
        return OPEN_TICKET.equals(completionTicket);
    }

    public boolean isDue(Instant now) {
        return nextActionAt == null || !nextActionAt.isAfter(now);
    }
}
