package com.playpulse.analytics.quality;

import com.fasterxml.jackson.databind.JsonNode;

import com.playpulse.analytics.model.InboundRecord;
import com.playpulse.analytics.model.RejectedEventEnvelope;
import com.playpulse.analytics.model.TelemetryEvent;
import com.playpulse.analytics.parse.JsonNodeUtils;
import com.playpulse.analytics.parse.TelemetryValidationException;
import com.playpulse.analytics.util.JsonSupport;

import java.util.Base64;

/**
 * Builds DLQ/quarantine envelopes for each failure mode of the pipeline.
 */
public final class RejectedEventEnvelopeFactory {
    static final String SCHEMA_VERSION = "v1";

    private RejectedEventEnvelopeFactory() {}

    public static RejectedEventEnvelope forRawRecord(
            InboundRecord record,
            String reason,
            String details,
            String rawJson,
            byte[] rawBytes) {
        RejectedEventEnvelope envelope = baseEnvelope(record, new RejectedEventEnvelope.Identity(), rawJson, null, rawBytes, false);
        envelope.failure = buildFailure("DESERIALIZATION", "DESERIALIZATION_FAILED", reason, null, details);
        return envelope;
    }

    public static RejectedEventEnvelope forSchemaValidationFailure(
            InboundRecord record,
            JsonNode root,
            SchemaValidator.ValidationResult validation,
            String rawJson) {
        RejectedEventEnvelope envelope = baseEnvelope(
                record,
                RejectedEventEnvelopeSupport.extractIdentity(root),
                rawJson,
                JsonSupport.toCanonicalJsonOrNull(root),
                null,
                root.path("__replay").asBoolean(false));
        envelope.eventTimestamp = JsonNodeUtils.parseTimestampMillis(root.path("timestamp"));
        envelope.failure = buildFailure("SCHEMA_VALIDATION", validation.failureClass, validation.reason, validation.field, validation.details);
        return envelope;
    }

    /**
     * Parser failures. Value validation errors are classified separately and keep the offending field.
     */
    public static RejectedEventEnvelope forParseFailure(TelemetryEvent event, Exception ex) {
        RejectedEventEnvelope envelope = baseEnvelopeFromEvent(event);
        if (ex instanceof TelemetryValidationException) {
            TelemetryValidationException invalid = (TelemetryValidationException) ex;
            envelope.failure = buildFailure("VALIDATION", "VALUE_OUT_OF_RANGE", "invalid_value", invalid.field(), invalid.getMessage());
            return envelope;
        }
        String details = ex == null ? "Unknown parse error"
                : (ex.getMessage() == null || ex.getMessage().isBlank()
                ? ex.getClass().getName()
                : ex.getClass().getName() + ": " + ex.getMessage());
        envelope.failure = buildFailure("PARSE", "PARSING_FAILED", "parse_exception", null, details);
        return envelope;
    }

    public static RejectedEventEnvelope forSinkGuardFailure(TelemetryEvent event, String reason, String details) {
        RejectedEventEnvelope envelope = baseEnvelopeFromEvent(event);
        envelope.failure = buildFailure("SINK_GUARD", "RECORD_TOO_LARGE", reason, null, details);
        return envelope;
    }

    /**
     * Guard failure for a row derived at finalization; there is no single source event to attach.
     */
    public static RejectedEventEnvelope forDerivedRowGuardFailure(
            String sessionId,
            String projectId,
            String recordKind,
            String reason,
            String details) {
        RejectedEventEnvelope envelope = new RejectedEventEnvelope();
        envelope.schemaVersion = SCHEMA_VERSION;
        envelope.identity = new RejectedEventEnvelope.Identity();
        envelope.identity.eventType = recordKind;
        envelope.identity.sessionId = sessionId;
        envelope.identity.projectId = projectId;
        envelope.ingestionTimestamp = System.currentTimeMillis();
        envelope.failure = buildFailure("SINK_GUARD", "RECORD_TOO_LARGE", reason, null, details);
        return envelope;
    }

    public static RejectedEventEnvelope forDedupFailure(TelemetryEvent event, String reason, String firstArrival) {
        RejectedEventEnvelope envelope = baseEnvelopeFromEvent(event);
        envelope.failure = buildFailure("DEDUP", "DUPLICATE", reason, null,
                "Duplicate detected for key: " + event.dedupKey + " (strategy=" + event.dedupStrategy + "); "
                        + firstArrival);
        return envelope;
    }

    private static RejectedEventEnvelope baseEnvelopeFromEvent(TelemetryEvent event) {
        RejectedEventEnvelope envelope = new RejectedEventEnvelope();
        envelope.schemaVersion = SCHEMA_VERSION;
        envelope.source = event.source;
        envelope.identity = new RejectedEventEnvelope.Identity();
        envelope.identity.eventId = event.eventId;
        envelope.identity.eventType = event.eventType;
        envelope.identity.eventVersion = event.eventVersion;
        envelope.identity.sessionId = event.sessionId;
        envelope.identity.projectId = event.projectId;
        envelope.payload = new RejectedEventEnvelope.Payload();
        envelope.payload.encoding = "json";
        envelope.payload.body = event.rawJson;
        envelope.dedupKey = event.dedupKey;
        envelope.dedupStrategy = event.dedupStrategy;
        envelope.replay = event.replay;
        envelope.eventTimestamp = event.timestamp;
        envelope.ingestionTimestamp = System.currentTimeMillis();
        return envelope;
    }

    private static RejectedEventEnvelope baseEnvelope(
            InboundRecord record,
            RejectedEventEnvelope.Identity identity,
            String rawJson,
            String canonicalJson,
            byte[] rawBytes,
            boolean replay) {
        RejectedEventEnvelope envelope = new RejectedEventEnvelope();
        envelope.schemaVersion = SCHEMA_VERSION;
        envelope.source = RejectedEventEnvelopeSupport.buildSourcePointer(record);
        envelope.identity = identity;
        envelope.payload = new RejectedEventEnvelope.Payload();
        if (rawBytes != null) {
            envelope.payload.encoding = "base64";
            envelope.payload.body = Base64.getEncoder().encodeToString(rawBytes);
        } else {
            envelope.payload.encoding = "json";
            envelope.payload.body = rawJson;
        }
        envelope.payload.canonicalJson = canonicalJson;
        envelope.ingestionTimestamp = System.currentTimeMillis();
        envelope.replay = replay;
        return envelope;
    }

    private static RejectedEventEnvelope.FailureDetails buildFailure(
            String stage,
            String failureClass,
            String reason,
            String field,
            String details) {
        RejectedEventEnvelope.FailureDetails failure = new RejectedEventEnvelope.FailureDetails();
        failure.stage = stage;
        failure.failureClass = failureClass;
        failure.reason = reason;
        failure.field = field;
        failure.details = details;
        return failure;
    }
}
