package com.delta.ingestion.incremental.events;

import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class KafkaDeltaEventPublisherTest {

    @Test
    void publishesRecordKeyedByProvider() {
        MockProducer<String, String> producer = new MockProducer<>(true, new StringSerializer(), new StringSerializer());
        KafkaDeltaEventPublisher publisher = new KafkaDeltaEventPublisher(producer, 1000);

        publisher.publish("catalog-push", "catalog", "{\"removed\":[]}");

        List<ProducerRecord<String, String>> history = producer.history();
        assertThat(history).hasSize(1);
        assertEquals("catalog-push", history.get(0).topic());
        assertEquals("catalog", history.get(0).key());
        assertEquals("{\"removed\":[]}", history.get(0).value());
    }

    @Test
    void unacknowledgedSendTimesOut() {
        MockProducer<String, String> producer = new MockProducer<>(false, new StringSerializer(), new StringSerializer());
        KafkaDeltaEventPublisher publisher = new KafkaDeltaEventPublisher(producer, 50);

        EventPublishException ex = assertThrows(
            EventPublishException.class,
            () -> publisher.publish("catalog-push", "catalog", "{}")
        );

        assertThat(ex.getMessage()).contains("Timed out");
    }

    @Test
    void failedSendIsWrapped() throws Exception {
        MockProducer<String, String> producer = new MockProducer<>(false, new StringSerializer(), new StringSerializer());
        KafkaDeltaEventPublisher publisher = new KafkaDeltaEventPublisher(producer, 5000);
        Thread broker = new Thread(() -> {
            while (producer.history().isEmpty()) {
                Thread.onSpinWait();
            }
            producer.errorNext(new IllegalStateException("broker down"));
        });
        broker.setDaemon(true);
        broker.start();

        EventPublishException ex = assertThrows(
            EventPublishException.class,
            () -> publisher.publish("catalog-push", "catalog", "{}")
        );
        broker.join(1000);

        assertThat(ex.getMessage()).contains("broker down");
        assertThat(ex.getCause()).isInstanceOf(IllegalStateException.class);
    }
}
