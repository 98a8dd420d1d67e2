package com.delta.ingestion.incremental.service;

import com.delta.ingestion.incremental.spi.DeltaEventPublisher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

@Service
public class DeltaPublishService {
    private static final Logger log = LoggerFactory.getLogger(DeltaPublishService.class);
    static final String TOPIC_SUFFIX = "-push";
    static final String PUBLISHER_MISSING = "The payload could not be processed!";
    static final String PUBLISH_FAILED = "There was an error submitting the payload: ";

    private final ObjectProvider<DeltaEventPublisher> publisher;
    private final ObjectMapper objectMapper;

    public DeltaPublishService(ObjectProvider<DeltaEventPublisher> publisher, ObjectMapper objectMapper) {
        this.publisher = publisher;
        this.objectMapper = objectMapper;
    }

    public String publish(String provider, JsonNode payload) {
        DeltaEventPublisher target = publisher.getIfAvailable();
        if (target == null) {
            log.error("No delta event publisher configured, dropping payload for provider {}", provider);
            throw new PublishUnavailableException(provider, PUBLISHER_MISSING);
        }
        String topic = provider + TOPIC_SUFFIX;
        try {
            target.publish(topic, provider, objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to publish delta payload to topic {}", topic, e);
            throw new PublishUnavailableException(provider, PUBLISH_FAILED + describe(e), e);
        }
        log.info("Delta payload submitted to topic {}", topic);
        return topic;
    }

    private static String describe(Exception error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return error.getClass().getSimpleName() + ": " + message;
    }
}
