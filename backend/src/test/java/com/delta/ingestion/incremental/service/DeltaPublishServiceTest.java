package com.delta.ingestion.incremental.service;

import com.delta.ingestion.incremental.spi.DeltaEventPublisher;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DeltaPublishServiceTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private ObjectProvider<DeltaEventPublisher> publisherProvider;

    @Mock
    private DeltaEventPublisher publisher;

    @Test
    void payloadIsPublishedToProviderPushTopic() throws Exception {
        when(publisherProvider.getIfAvailable()).thenReturn(publisher);
        JsonNode payload = objectMapper.readTree("{\"added\":[{\"id\":1}]}");

        String topic = new DeltaPublishService(publisherProvider, objectMapper).publish("catalog", payload);

        assertEquals("catalog-push", topic);
        verify(publisher).publish("catalog-push", "catalog", "{\"added\":[{\"id\":1}]}");
    }

    @Test
    void missingPublisherIsUnavailable() throws Exception {
        when(publisherProvider.getIfAvailable()).thenReturn(null);
        DeltaPublishService service = new DeltaPublishService(publisherProvider, objectMapper);
        JsonNode payload = objectMapper.readTree("{}");

        PublishUnavailableException ex = assertThrows(
            PublishUnavailableException.class,
            () -> service.publish("catalog", payload)
        );

        assertEquals("The payload could not be processed!", ex.getMessage());
        assertEquals("catalog", ex.getProvider());
    }

    @Test
    void publisherFailureIsDescribed() throws Exception {
        when(publisherProvider.getIfAvailable()).thenReturn(publisher);
        doThrow(new IllegalStateException("broker down")).when(publisher).publish(anyString(), anyString(), anyString());
        DeltaPublishService service = new DeltaPublishService(publisherProvider, objectMapper);
        JsonNode payload = objectMapper.readTree("[1,2]");

        PublishUnavailableException ex = assertThrows(
            PublishUnavailableException.class,
            () -> service.publish("catalog", payload)
        );

        assertEquals("There was an error submitting the payload: IllegalStateException: broker down", ex.getMessage());
    }
}
