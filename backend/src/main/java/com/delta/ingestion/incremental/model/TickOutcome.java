package com.delta.ingestion.incremental.model;

public enum TickOutcome {
    WAITING,
    CYCLE_STARTED,
    PAUSED,
    COMPLETED,
    BACKING_OFF,
    FAILED,
    CANCELED,
    INTERRUPTED,
    BUSY,
    PROVIDER_UNAVAILABLE
}
