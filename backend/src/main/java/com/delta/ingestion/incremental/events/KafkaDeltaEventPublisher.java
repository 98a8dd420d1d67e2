package com.delta.ingestion.incremental.events;

import com.delta.ingestion.incremental.spi.DeltaEventPublisher;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class KafkaDeltaEventPublisher implements DeltaEventPublisher {
    private static final Logger log = LoggerFactory.getLogger(KafkaDeltaEventPublisher.class);

    private final Producer<String, String> producer;
    private final long sendTimeoutMs;

    public KafkaDeltaEventPublisher(Producer<String, String> producer, long sendTimeoutMs) {
        this.producer = producer;
        this.sendTimeoutMs = sendTimeoutMs;
    }

    @Override
    public void publish(String topic, String key, String payload) {
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, payload);
        Future<RecordMetadata> pending;
        try {
            pending = producer.send(record);
        } catch (RuntimeException e) {
            throw new EventPublishException("Failed to publish to topic " + topic + ": " + e.getMessage(), e);
        }
        try {
            RecordMetadata metadata = pending.get(sendTimeoutMs, TimeUnit.MILLISECONDS);
            log.debug(
                "Published delta to topic {} partition {} offset {}",
                metadata.topic(),
                metadata.partition(),
                metadata.offset()
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventPublishException("Interrupted while publishing to topic " + topic, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new EventPublishException("Failed to publish to topic " + topic + ": " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new EventPublishException("Timed out publishing to topic " + topic, e);
        }
    }
}
