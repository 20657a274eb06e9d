package com.playpulse.analytics.quality;

import org.junit.jupiter.api.Test;

import com.playpulse.analytics.model.RejectedEventEnvelope;
import com.playpulse.analytics.model.TelemetryEvent;
import com.playpulse.analytics.parse.TelemetryValidationException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RejectedEventEnvelopeFactoryTest {

    @Test
    void parseFailureIncludesExceptionClassWhenMessageMissing() {
        RejectedEventEnvelope envelope = RejectedEventEnvelopeFactory.forParseFailure(event(), new NullPointerException());

        assertNotNull(envelope.failure);
        assertEquals("PARSE", envelope.failure.stage);
        assertEquals("PARSING_FAILED", envelope.failure.failureClass);
        assertEquals("parse_exception", envelope.failure.reason);
        assertTrue(envelope.failure.details.contains("NullPointerException"));
        assertNull(envelope.failure.field);
    }

    @Test
    void valueValidationFailureKeepsOffendingField() {
        TelemetryValidationException invalid =
                new TelemetryValidationException("data.readings[2].values.delight", "value 1.3 outside [0, 1]");

        RejectedEventEnvelope envelope = RejectedEventEnvelopeFactory.forParseFailure(event(), invalid);

        assertEquals("VALIDATION", envelope.failure.stage);
        assertEquals("VALUE_OUT_OF_RANGE", envelope.failure.failureClass);
        assertEquals("invalid_value", envelope.failure.reason);
        assertEquals("data.readings[2].values.delight", envelope.failure.field);
        assertEquals("s1", envelope.identity.sessionId);
        assertEquals("demo", envelope.identity.projectId);
        assertEquals(RejectedEventEnvelopeFactory.SCHEMA_VERSION, envelope.schemaVersion);
    }

    @Test
    void derivedRowGuardFailureNamesRecordKind() {
        RejectedEventEnvelope envelope = RejectedEventEnvelopeFactory.forDerivedRowGuardFailure(
                "s1", "demo", "fused_row", "record_too_large", "row exceeded limit");

        assertEquals("SINK_GUARD", envelope.failure.stage);
        assertEquals("RECORD_TOO_LARGE", envelope.failure.failureClass);
        assertEquals("fused_row", envelope.identity.eventType);
        assertNull(envelope.payload);
    }

    private static TelemetryEvent event() {
        TelemetryEvent event = new TelemetryEvent();
        event.eventId = "evt-1";
        event.eventType = "sensor_readings";
        event.sessionId = "s1";
        event.projectId = "demo";
        event.rawJson = "{\"id\":\"evt-1\",\"type\":\"sensor_readings\",\"data\":{}}";
        event.timestamp = 1718000000000L;
        return event;
    }
}
