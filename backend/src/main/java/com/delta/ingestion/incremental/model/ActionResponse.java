package com.delta.ingestion.incremental.model;

public record ActionResponse(boolean success, String message) {
}
