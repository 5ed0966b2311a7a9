package com.confluencesentinel.monitor;

import com.confluencesentinel.core.alert.AlertPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;

/**
 * Kafka {@link Serializer} that converts {@link AlertPayload} to JSON bytes
 * for the alerts topic.
 */
public class AlertPayloadSerializer implements Serializer<AlertPayload> {

    private final ObjectMapper mapper = JsonMappers.create();

    @Override
    public byte[] serialize(String topic, AlertPayload payload) {
        if (payload == null) {
            return null;
        }
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new SerializationException(
                    "Failed to serialize alert for " + payload.getScopeKey() + ": " + e.getMessage(), e);
        }
    }
}
