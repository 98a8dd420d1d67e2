package com.delta.ingestion.incremental.spi;

import java.util.UUID;

public record IngestionContext(String providerName, UUID ingestionId, String cursor) {
}
