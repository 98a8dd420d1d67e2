package com.delta.ingestion.incremental.model;

public enum ManualActionResult {
    APPLIED,
    NO_CURRENT_RECORD
}
