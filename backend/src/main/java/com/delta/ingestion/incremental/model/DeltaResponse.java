package com.delta.ingestion.incremental.model;

public record DeltaResponse(boolean success, String provider, String message) {
}
