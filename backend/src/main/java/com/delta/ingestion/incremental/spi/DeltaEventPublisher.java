package com.delta.ingestion.incremental.spi;

public interface DeltaEventPublisher {
    void publish(String topic, String key, String payload);
}
