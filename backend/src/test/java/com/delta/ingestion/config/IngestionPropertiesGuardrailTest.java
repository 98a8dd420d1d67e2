package com.delta.ingestion.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class IngestionPropertiesGuardrailTest {

    @Test
    void durationsAreClamped() {
        IngestionProperties properties = new IngestionProperties();
        properties.setRestLengthMinutes(0);
        properties.setCancelCooldownHours(-3);
        properties.setBurstLengthSeconds(0);
        properties.setBurstIntervalSeconds(-1);
        properties.setMarkRetentionMinutes(-5);

        assertEquals(Duration.ofMinutes(1), properties.getRestLength());
        assertEquals(Duration.ofHours(1), properties.getCancelCooldown());
        assertEquals(1, properties.getBurstLengthSeconds());
        assertEquals(0, properties.getBurstIntervalSeconds());
        assertEquals(0, properties.getMarkRetentionMinutes());
    }

    @Test
    void leaseOutlivesBurst() {
        IngestionProperties properties = new IngestionProperties();
        properties.setBurstLengthSeconds(30);
        properties.setLeaseSeconds(5);

        assertEquals(31, properties.getLeaseSeconds());
    }

    @Test
    void backoffFallsBackToDefaultSchedule() {
        IngestionProperties properties = new IngestionProperties();
        properties.setBackoffMinutes(Arrays.asList(null, 0, -2));
        assertEquals(List.of(1, 5, 30, 180), properties.getBackoffMinutes());

        properties.setBackoffMinutes(List.of(2, 0, 10));
        assertEquals(List.of(2, 10), properties.getBackoffMinutes());
    }

    @Test
    void schedulerAndKafkaSettingsAreClamped() {
        IngestionProperties properties = new IngestionProperties();
        properties.getScheduler().setWorkerCount(0);
        properties.getScheduler().setPollIntervalMs(5);
        properties.getEvents().getKafka().setSendTimeoutMs(1);

        assertEquals(1, properties.getScheduler().getWorkerCount());
        assertEquals(100, properties.getScheduler().getPollIntervalMs());
        assertEquals(100, properties.getEvents().getKafka().getSendTimeoutMs());
    }
}
