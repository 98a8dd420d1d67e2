package com.delta.ingestion.incremental.model;

public record MarkDeletionResponse(boolean success, String message, int deletions) {
}
