package com.delta.ingestion.incremental.support;

import com.delta.ingestion.incremental.spi.DeltaEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingDeltaEventPublisher implements DeltaEventPublisher {

    public record PublishedEvent(String topic, String key, String payload) {
    }

    private final List<PublishedEvent> publishedEvents = new CopyOnWriteArrayList<>();
    private volatile RuntimeException nextFailure;

    @Override
    public void publish(String topic, String key, String payload) {
        RuntimeException failure = nextFailure;
        if (failure != null) {
            nextFailure = null;
            throw failure;
        }
        publishedEvents.add(new PublishedEvent(topic, key, payload));
    }

    public void failNext(RuntimeException failure) {
        nextFailure = failure;
    }

    public List<PublishedEvent> getPublishedEvents() {
        return publishedEvents;
    }

    public void clear() {
        publishedEvents.clear();
        nextFailure = null;
    }
}
