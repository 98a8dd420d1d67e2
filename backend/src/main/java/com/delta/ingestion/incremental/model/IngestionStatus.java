package com.delta.ingestion.incremental.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IngestionStatus {
    INGESTING("ingesting", true),
    RESTING("resting", true),
    CANCELING("canceling", true),
    COMPLETE("complete", false),
    ERROR("error", false);

    private final String value;
    private final boolean open;

    IngestionStatus(String value, boolean open) {
        this.value = value;
        this.open = open;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isOpen() {
        return open;
    }

    public static IngestionStatus fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Ingestion status is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (IngestionStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown ingestion status: " + value);
    }
}
