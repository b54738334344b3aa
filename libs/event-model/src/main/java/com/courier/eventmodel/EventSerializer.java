package com.courier.eventmodel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;

/**
 * JSON serialization for event payloads.
 * <p>
 * Floating point numbers are read back as {@link java.math.BigDecimal} so that monetary payload
 * values survive a store round-trip exactly. Date and time values are written as ISO-8601 strings.
 */
public final class EventSerializer {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private static final ObjectMapper MAPPER = createMapper();

    private EventSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    /**
     * Serializes an event payload to a JSON object string.
     *
     * @throws EventSerializationException if serialization fails
     */
    public static String serializePayload(Map<String, Object> payload) {
        try {
            return MAPPER.writeValueAsString(payload == null ? Map.of() : payload);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize event payload", e);
        }
    }

    /**
     * Deserializes a JSON object string to a payload map.
     *
     * @throws EventSerializationException if the JSON is malformed or not an object
     */
    public static Map<String, Object> deserializePayload(String json) {
        try {
            Map<String, Object> payload = MAPPER.readValue(json, PAYLOAD_TYPE);
            return payload == null ? Map.of() : payload;
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize event payload", e);
        }
    }

    /**
     * Exception thrown when event serialization/deserialization fails.
     */
    public static class EventSerializationException extends RuntimeException {
        public EventSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
