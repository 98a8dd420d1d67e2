package com.delta.ingestion.incremental.model;

import java.time.Instant;

public record IngestionRecordUpdate(
    IngestionStatus status,
    String nextAction,
    Instant nextActionAt,
    Instant ingestionCompletedAt,
    String lastError,
    Integer attempts,
    boolean releaseLease
) {
    public static IngestionRecordUpdate toStatus(IngestionStatus status) {
        return new IngestionRecordUpdate(status, null, null, null, null, null, false);
    }

    public IngestionRecordUpdate nextAction(String action, Instant at) {
        return new IngestionRecordUpdate(status, action, at, ingestionCompletedAt, lastError, attempts, releaseLease);
    }

    public IngestionRecordUpdate completedAt(Instant completedAt) {
        return new IngestionRecordUpdate(status, nextAction, nextActionAt, completedAt, lastError, attempts, releaseLease);
    }

    public IngestionRecordUpdate failure(String error, int attemptCount) {
        return new IngestionRecordUpdate(status, nextAction, nextActionAt, ingestionCompletedAt, error, attemptCount, releaseLease);
    }

    public IngestionRecordUpdate attempts(int attemptCount) {
        return new IngestionRecordUpdate(status, nextAction, nextActionAt, ingestionCompletedAt, lastError, attemptCount, releaseLease);
    }

    public IngestionRecordUpdate releasingLease() {
        return new IngestionRecordUpdate(status, nextAction, nextActionAt, ingestionCompletedAt, lastError, attempts, true);
    }
}
