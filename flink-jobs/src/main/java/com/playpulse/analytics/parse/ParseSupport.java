package com.playpulse.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;

import com.playpulse.analytics.quality.ValidatedEvent;

/**
 * Shared parser support helpers.
 */
final class ParseSupport {
    private ParseSupport() {}

    static JsonNode requireData(ValidatedEvent event, String eventType) throws Exception {
        JsonNode data = event.data();
        if (data == null || data.isMissingNode() || data.isNull()) {
            throw new Exception("Missing data payload for " + eventType);
        }
        return data;
    }

    static JsonNode requireArray(JsonNode node, String field) throws TelemetryValidationException {
        if (node == null || !node.isArray()) {
            throw new TelemetryValidationException(field, "expected an array");
        }
        return node;
    }

    /**
     * A second offset within a session: non-negative and no later than {@code maxSessionDurationSec}.
     */
    static double requireSessionSecond(JsonNode node, String field, int maxSessionDurationSec)
            throws TelemetryValidationException {
        double value = JsonNodeUtils.requireNonNegative(node, field);
        if (value > maxSessionDurationSec) {
            throw new TelemetryValidationException(field,
                    "value " + value + " exceeds max session duration " + maxSessionDurationSec + "s");
        }
        return value;
    }

    static String element(String field, int index) {
        return field + "[" + index + "]";
    }
}
