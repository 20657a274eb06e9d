package com.playpulse.analytics.quality;

import com.fasterxml.jackson.databind.JsonNode;

import com.playpulse.analytics.parse.JsonNodeUtils;
import com.playpulse.analytics.parse.TelemetryParsers;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural validation of the telemetry envelope: required fields per event type and supported
 * versions. Value ranges are checked later by the typed parsers.
 */
public class SchemaValidator {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(SchemaValidator.class);
    private final Set<String> supportedVersions;
    private final Map<String, List<String>> requiredFieldsByType;

    public SchemaValidator(Set<String> supportedVersions) {
        this.supportedVersions = supportedVersions == null ? Collections.emptySet() : supportedVersions;
        this.requiredFieldsByType = buildRequiredFields();
    }

    public ValidationResult validate(JsonNode root) {
        if (root == null || !root.isObject()) {
            return invalid("SCHEMA_INVALID", "root_not_object", null, "Root node is missing or not an object");
        }

        JsonNode typeNode = root.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            return invalid("SCHEMA_INVALID", "missing_type", "type", "Event type is missing or not a string");
        }
        String eventType = typeNode.asText();

        // Numeric strings are accepted; some producers serialize epoch millis as text.
        if (JsonNodeUtils.parseTimestampMillis(root.get("timestamp")) == null) {
            return invalid("SCHEMA_INVALID", "missing_timestamp", "timestamp", "Event timestamp is missing or not numeric");
        }

        if (JsonNodeUtils.asNullableText(root.get("session_id")) == null || root.get("session_id").asText().isBlank()) {
            return invalid("SCHEMA_INVALID", "missing_session_id", "session_id", "Event session_id is missing or blank");
        }

        JsonNode dataNode = root.get("data");
        if (dataNode == null || !dataNode.isObject()) {
            return invalid("SCHEMA_INVALID", "missing_data", "data", "Event data payload is missing or not an object");
        }

        if (!requiredFieldsByType.containsKey(eventType)) {
            return invalid("SCHEMA_INVALID", "unsupported_event_type", "type", "Unsupported event type: " + eventType);
        }

        String eventVersion = RejectedEventEnvelopeSupport.extractVersion(root);
        if (eventVersion != null && !supportedVersions.isEmpty() && !supportedVersions.contains(eventVersion)) {
            return invalid("UNSUPPORTED_VERSION", "unsupported_version", "version", "Unsupported event version: " + eventVersion);
        }

        for (String requiredPath : requiredFieldsByType.get(eventType)) {
            JsonNode node = resolvePath(root, requiredPath);
            if (node == null || node.isMissingNode() || node.isNull() || (node.isTextual() && node.asText().isEmpty())) {
                return invalid("SCHEMA_INVALID", "missing_field", requiredPath, "Missing required field: " + requiredPath);
            }
        }

        if (TelemetryParsers.SENSOR_READINGS.equals(eventType)) {
            JsonNode readings = dataNode.get("readings");
            if (!readings.isArray() || readings.size() == 0) {
                return invalid("SCHEMA_INVALID", "empty_array", "data.readings", "Expected non-empty readings array");
            }
        }

        if (TelemetryParsers.CHUNK_OBSERVATION.equals(eventType)) {
            JsonNode states = dataNode.get("states_observed");
            if (!states.isArray()) {
                return invalid("SCHEMA_INVALID", "invalid_data_shape", "data.states_observed", "Expected states_observed array");
            }
        }

        return ValidationResult.valid(eventVersion);
    }

    private static ValidationResult invalid(String failureClass, String reason, String field, String details) {
        LOG.debug("Schema validation failed (reason={}, field={}): {}", reason, field, details);
        return ValidationResult.invalid(failureClass, reason, field, details);
    }

    private static Map<String, List<String>> buildRequiredFields() {
        Map<String, List<String>> map = new HashMap<>();
        map.put(TelemetryParsers.SENSOR_READINGS, Arrays.asList(
                "data.stream",
                "data.readings"
        ));
        map.put(TelemetryParsers.CHUNK_OBSERVATION, Arrays.asList(
                "data.window_index",
                "data.window_start_sec",
                "data.window_end_sec",
                "data.states_observed"
        ));
        map.put(TelemetryParsers.CHUNK_ANALYSIS_REQUEST, Arrays.asList(
                "data.window_index",
                "data.window_start_sec",
                "data.window_end_sec",
                "data.media_uri"
        ));
        map.put(TelemetryParsers.SESSION_FINALIZE, Collections.emptyList());
        return map;
    }

    private static JsonNode resolvePath(JsonNode root, String dotPath) {
        JsonNode current = root;
        for (String part : dotPath.split("\\.")) {
            if (current == null) {
                return null;
            }
            current = current.get(part);
        }
        return current;
    }

    public static class ValidationResult {
        public final boolean valid;
        public final String failureClass;
        public final String reason;
        public final String field;
        public final String details;
        public final String eventVersion;

        private ValidationResult(boolean valid, String failureClass, String reason, String field, String details, String eventVersion) {
            this.valid = valid;
            this.failureClass = failureClass;
            this.reason = reason;
            this.field = field;
            this.details = details;
            this.eventVersion = eventVersion;
        }

        public static ValidationResult valid(String eventVersion) {
            return new ValidationResult(true, null, null, null, null, eventVersion == null ? "1" : eventVersion);
        }

        public static ValidationResult invalid(String failureClass, String reason, String field, String details) {
            return new ValidationResult(false, failureClass, reason, field, details, null);
        }
    }
}
