package com.delta.ingestion.incremental.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MarksResponse(boolean success, List<IngestionMark> records, String message) {
}
