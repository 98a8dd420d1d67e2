package com.delta.ingestion.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "ingestion")
public class IngestionProperties {
    private static final List<Integer> DEFAULT_BACKOFF_MINUTES = List.of(1, 5, 30, 180);

    private int restLengthMinutes = 1440;
    private int cancelCooldownHours = 24;
    private int burstLengthSeconds = 3;
    private int burstIntervalSeconds = 3;
    private int leaseSeconds = 300;
    private int markRetentionMinutes = 0;
    private List<Integer> backoffMinutes = new ArrayList<>(DEFAULT_BACKOFF_MINUTES);
    private Scheduler scheduler = new Scheduler();
    private Events events = new Events();

    public int getRestLengthMinutes() {
        return Math.max(1, restLengthMinutes);
    }

    public void setRestLengthMinutes(int restLengthMinutes) {
        this.restLengthMinutes = Math.max(1, restLengthMinutes);
    }

    public Duration getRestLength() {
        return Duration.ofMinutes(getRestLengthMinutes());
    }

    public int getCancelCooldownHours() {
        return Math.max(1, cancelCooldownHours);
    }

    public void setCancelCooldownHours(int cancelCooldownHours) {
        this.cancelCooldownHours = Math.max(1, cancelCooldownHours);
    }

    public Duration getCancelCooldown() {
        return Duration.ofHours(getCancelCooldownHours());
    }

    public int getBurstLengthSeconds() {
        return Math.max(1, burstLengthSeconds);
    }

    public void setBurstLengthSeconds(int burstLengthSeconds) {
        this.burstLengthSeconds = Math.max(1, burstLengthSeconds);
    }

    public int getBurstIntervalSeconds() {
        return Math.max(0, burstIntervalSeconds);
    }

    public void setBurstIntervalSeconds(int burstIntervalSeconds) {
        this.burstIntervalSeconds = Math.max(0, burstIntervalSeconds);
    }

    public int getLeaseSeconds() {
        return Math.max(getBurstLengthSeconds() + 1, leaseSeconds);
    }

    public void setLeaseSeconds(int leaseSeconds) {
        this.leaseSeconds = Math.max(1, leaseSeconds);
    }

    public int getMarkRetentionMinutes() {
        return Math.max(0, markRetentionMinutes);
    }

    public void setMarkRetentionMinutes(int markRetentionMinutes) {
        this.markRetentionMinutes = Math.max(0, markRetentionMinutes);
    }

    public List<Integer> getBackoffMinutes() {
        if (backoffMinutes == null || backoffMinutes.isEmpty()) {
            return DEFAULT_BACKOFF_MINUTES;
        }
        return backoffMinutes;
    }

    public void setBackoffMinutes(List<Integer> backoffMinutes) {
        List<Integer> sanitized = new ArrayList<>();
        if (backoffMinutes != null) {
            for (Integer minutes : backoffMinutes) {
                if (minutes != null && minutes > 0) {
                    sanitized.add(minutes);
                }
            }
        }
        this.backoffMinutes = sanitized;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Events getEvents() {
        return events;
    }

    public void setEvents(Events events) {
        this.events = events;
    }

    public static class Scheduler {
        private boolean enabled = false;
        private int workerCount = 1;
        private int pollIntervalMs = 5000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerCount() {
            return Math.max(1, workerCount);
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = Math.max(1, workerCount);
        }

        public int getPollIntervalMs() {
            return Math.max(100, pollIntervalMs);
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = Math.max(100, pollIntervalMs);
        }
    }

    public static class Events {
        private Kafka kafka = new Kafka();

        public Kafka getKafka() {
            return kafka;
        }

        public void setKafka(Kafka kafka) {
            this.kafka = kafka;
        }
    }

    public static class Kafka {
        private boolean enabled = false;
        private String bootstrapServers = "localhost:9092";
        private String clientId = "incremental-ingestion";
        private int sendTimeoutMs = 10000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBootstrapServers() {
            return bootstrapServers;
        }

        public void setBootstrapServers(String bootstrapServers) {
            this.bootstrapServers = bootstrapServers;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public int getSendTimeoutMs() {
            return Math.max(100, sendTimeoutMs);
        }

        public void setSendTimeoutMs(int sendTimeoutMs) {
            this.sendTimeoutMs = Math.max(100, sendTimeoutMs);
        }
    }
}
