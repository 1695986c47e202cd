package io.assay.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.assay.core.result.OutcomeRecord;

/// Utility class for serializing and deserializing outcome records to/from JSON.
///
/// ### Usage
/// {@snippet :
/// String json = OutcomeRecordSerializer.toJson(result.toOutcomeRecord(true));
/// OutcomeRecord restored = OutcomeRecordSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. The mapper is created per call via `createMapper()`. For
/// high-throughput scenarios, cache the mapper, as {@link JsonLinesResultSink} does.
///
/// @see AssayJacksonModule for the registered mixins
public final class OutcomeRecordSerializer {

    private OutcomeRecordSerializer() {}

    /// Serializes an outcome record to single-line JSON.
    ///
    /// @param record the record to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(OutcomeRecord record) {
        try {
            return createMapper().writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize outcome record: " + e.getMessage(), e);
        }
    }

    /// Deserializes an outcome record from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized record, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static OutcomeRecord fromJson(String json) {
        try {
            return createMapper().readValue(json, OutcomeRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize outcome record: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for outcome records.
    ///
    /// Registers:
    /// - `AssayJacksonModule` for the record mixins
    /// - `JavaTimeModule` for `Duration` and `Instant` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps and durations written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new AssayJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }
}
