package com.delta.ingestion.config;

import com.delta.ingestion.incremental.events.KafkaDeltaEventPublisher;
import com.delta.ingestion.incremental.spi.DeltaEventPublisher;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Properties;

@Configuration
@ConditionalOnProperty(prefix = "ingestion.events.kafka", name = "enabled", havingValue = "true")
public class KafkaEventsConfig {

    @Bean(destroyMethod = "close")
    public KafkaProducer<String, String> deltaKafkaProducer(IngestionProperties properties) {
        IngestionProperties.Kafka kafka = properties.getEvents().getKafka();
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ProducerConfig.CLIENT_ID_CONFIG, kafka.getClientId());
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, kafka.getSendTimeoutMs());
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, kafka.getSendTimeoutMs());
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, Math.max(kafka.getSendTimeoutMs() + 1, 120000));
        return new KafkaProducer<>(props);
    }

    @Bean
    public DeltaEventPublisher kafkaDeltaEventPublisher(
        KafkaProducer<String, String> deltaKafkaProducer,
        IngestionProperties properties
    ) {
        return new KafkaDeltaEventPublisher(deltaKafkaProducer, properties.getEvents().getKafka().getSendTimeoutMs());
    }
}
