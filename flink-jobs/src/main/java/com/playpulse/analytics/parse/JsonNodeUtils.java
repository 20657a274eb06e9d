package com.playpulse.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Shared JSON helpers for optional fields and validated numeric fields.
 */
public final class JsonNodeUtils {
    private JsonNodeUtils() {}

    public static Long parseTimestampMillis(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            String raw = node.asText().trim();
            if (raw.isEmpty() || !raw.matches("\\d+")) {
                return null;
            }
            try {
                return Long.parseLong(raw);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    public static long parseTimestampMillisOrDefault(JsonNode node, long defaultValue) {
        Long parsed = parseTimestampMillis(node);
        return parsed == null ? defaultValue : parsed;
    }

    public static String asNullableText(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        String value = node.asText();
        return value == null || value.isEmpty() ? null : value;
    }

    /**
     * Numbers and numeric strings; anything else is null.
     */
    public static Double asNullableDouble(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            String raw = node.asText().trim();
            if (raw.isEmpty()) {
                return null;
            }
            try {
                return Double.parseDouble(raw);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    public static double requireDouble(JsonNode node, String field) throws TelemetryValidationException {
        Double value = asNullableDouble(node);
        if (value == null || value.isNaN() || value.isInfinite()) {
            throw new TelemetryValidationException(field, "expected a finite number, got " + describe(node));
        }
        return value;
    }

    public static double requireUnitInterval(JsonNode node, String field) throws TelemetryValidationException {
        double value = requireDouble(node, field);
        if (value < 0.0 || value > 1.0) {
            throw new TelemetryValidationException(field, "value " + value + " outside [0, 1]");
        }
        return value;
    }

    public static double requireNonNegative(JsonNode node, String field) throws TelemetryValidationException {
        double value = requireDouble(node, field);
        if (value < 0.0) {
            throw new TelemetryValidationException(field, "value " + value + " is negative");
        }
        return value;
    }

    public static int requireNonNegativeInt(JsonNode node, String field) throws TelemetryValidationException {
        if (isAbsent(node) || !(node.isIntegralNumber() || node.isTextual())) {
            throw new TelemetryValidationException(field, "expected an integer, got " + describe(node));
        }
        if (node.isIntegralNumber() && !node.canConvertToInt()) {
            throw new TelemetryValidationException(field, "value " + node.asText() + " exceeds integer range");
        }
        int value;
        try {
            value = node.isIntegralNumber() ? node.intValue() : Integer.parseInt(node.asText().trim());
        } catch (NumberFormatException ex) {
            throw new TelemetryValidationException(field, "expected an integer, got " + describe(node));
        }
        if (value < 0) {
            throw new TelemetryValidationException(field, "value " + value + " is negative");
        }
        return value;
    }

    public static String requireText(JsonNode node, String field) throws TelemetryValidationException {
        String value = asNullableText(node);
        if (value == null || value.trim().isEmpty()) {
            throw new TelemetryValidationException(field, "must be a non-blank string");
        }
        return value.trim();
    }

    static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    private static String describe(JsonNode node) {
        return isAbsent(node) ? "nothing" : node.toString();
    }
}
