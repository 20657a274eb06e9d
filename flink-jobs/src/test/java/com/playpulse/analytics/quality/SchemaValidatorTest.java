package com.playpulse.analytics.quality;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import com.playpulse.analytics.util.JsonSupport;

import java.util.Collections;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SchemaValidatorTest {
    private final SchemaValidator validator = new SchemaValidator(Set.of("1", "v1"));

    @Test
    void validEventPassesValidation() throws Exception {
        String json = "{\"id\":\"evt-1\",\"type\":\"sensor_readings\",\"timestamp\":1718000000000,\"session_id\":\"s1\","
                + "\"data\":{\"stream\":\"physio\",\"readings\":[{\"timestamp_sec\":0,\"values\":{\"heart_rate\":0.5}}]}}";

        SchemaValidator.ValidationResult result = validator.validate(JsonSupport.MAPPER.readTree(json));

        assertTrue(result.valid);
        assertEquals("1", result.eventVersion);
    }

    @Test
    void finalizeNeedsNoDataFields() throws Exception {
        String json = "{\"type\":\"session_finalize\",\"timestamp\":\"1718000000000\",\"session_id\":\"s1\",\"data\":{}}";

        assertTrue(validator.validate(JsonSupport.MAPPER.readTree(json)).valid);
    }

    @Test
    void missingSessionIdFailsValidation() throws Exception {
        String json = "{\"type\":\"session_finalize\",\"timestamp\":1718000000000,\"session_id\":\"  \",\"data\":{}}";

        SchemaValidator.ValidationResult result = validator.validate(JsonSupport.MAPPER.readTree(json));

        assertFalse(result.valid);
        assertEquals("missing_session_id", result.reason);
        assertEquals("session_id", result.field);
    }

    @Test
    void missingFieldFailsValidation() throws Exception {
        String json = "{\"type\":\"chunk_analysis_request\",\"timestamp\":1718000000000,\"session_id\":\"s1\","
                + "\"data\":{\"window_index\":0,\"window_start_sec\":0,\"window_end_sec\":10}}";

        SchemaValidator.ValidationResult result = validator.validate(JsonSupport.MAPPER.readTree(json));

        assertFalse(result.valid);
        assertEquals("SCHEMA_INVALID", result.failureClass);
        assertEquals("missing_field", result.reason);
        assertEquals("data.media_uri", result.field);
    }

    @Test
    void emptyReadingsArrayFailsValidation() throws Exception {
        String json = "{\"type\":\"sensor_readings\",\"timestamp\":1718000000000,\"session_id\":\"s1\","
                + "\"data\":{\"stream\":\"affect\",\"readings\":[]}}";

        SchemaValidator.ValidationResult result = validator.validate(JsonSupport.MAPPER.readTree(json));

        assertFalse(result.valid);
        assertEquals("empty_array", result.reason);
    }

    @Test
    void unsupportedEventTypeFailsValidation() throws Exception {
        String json = "{\"type\":\"heartbeat\",\"timestamp\":1718000000000,\"session_id\":\"s1\",\"data\":{}}";

        SchemaValidator.ValidationResult result = validator.validate(JsonSupport.MAPPER.readTree(json));

        assertFalse(result.valid);
        assertEquals("unsupported_event_type", result.reason);
    }

    @Test
    void unsupportedVersionFailsValidation() throws Exception {
        String json = "{\"type\":\"session_finalize\",\"version\":\"2\",\"timestamp\":1718000000000,\"session_id\":\"s1\",\"data\":{}}";
        JsonNode node = JsonSupport.MAPPER.readTree(json);

        SchemaValidator.ValidationResult result = new SchemaValidator(Collections.singleton("1")).validate(node);

        assertFalse(result.valid);
        assertEquals("UNSUPPORTED_VERSION", result.failureClass);
    }

    @Test
    void nonObjectRootFailsValidation() throws Exception {
        SchemaValidator.ValidationResult result = validator.validate(JsonSupport.MAPPER.readTree("[1,2]"));

        assertFalse(result.valid);
        assertEquals("root_not_object", result.reason);
    }
}
