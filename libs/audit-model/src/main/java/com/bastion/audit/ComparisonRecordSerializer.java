package com.bastion.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Optional;

/**
 * JSON serialization for {@link ComparisonRecord}, one compact document per record.
 * <p>
 * Instants are written as ISO-8601 strings and durations as ISO-8601 periods so audit files stay
 * readable. Unknown properties are ignored on read, so older readers accept records written by
 * newer gateways.
 */
public final class ComparisonRecordSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private ComparisonRecordSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Serializes a record to a single-line JSON string.
     *
     * @throws RecordSerializationException if serialization fails
     */
    public static String serialize(ComparisonRecord record) {
        try {
            return MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new RecordSerializationException("Failed to serialize comparison record: " + record.requestId(), e);
        }
    }

    /**
     * Deserializes a JSON string to a record.
     *
     * @throws RecordSerializationException if the JSON is malformed or does not describe a record
     */
    public static ComparisonRecord deserialize(String json) {
        try {
            ComparisonRecord record = MAPPER.readValue(json, ComparisonRecord.class);
            if (record == null) {
                throw new RecordSerializationException("JSON document is null", null);
            }
            return record;
        } catch (JsonProcessingException e) {
            throw new RecordSerializationException("Failed to deserialize comparison record", e);
        }
    }

    /**
     * Deserializes, returning empty when the input is not a valid record.
     */
    public static Optional<ComparisonRecord> tryDeserialize(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(deserialize(json));
        } catch (RecordSerializationException e) {
            return Optional.empty();
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper objectMapper() {
        return MAPPER;
    }

    /**
     * Thrown when a record cannot be serialized or deserialized.
     */
    public static class RecordSerializationException extends RuntimeException {
        public RecordSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
