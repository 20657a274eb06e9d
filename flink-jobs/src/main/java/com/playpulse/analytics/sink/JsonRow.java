package com.playpulse.analytics.sink;

import com.playpulse.analytics.util.JsonSupport;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSONEachRow builder for outbound topics. Field order follows insertion order.
 */
final class JsonRow {
    private static final DateTimeFormatter TS_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    private final Map<String, Object> fields = new LinkedHashMap<>();

    static JsonRow create() {
        return new JsonRow();
    }

    JsonRow addString(String name, String value) {
        fields.put(name, value == null ? "" : value);
        return this;
    }

    JsonRow addNullableString(String name, String value) {
        fields.put(name, value);
        return this;
    }

    JsonRow addInt(String name, int value) {
        fields.put(name, value);
        return this;
    }

    JsonRow addLong(String name, long value) {
        fields.put(name, value);
        return this;
    }

    JsonRow addDouble(String name, double value) {
        fields.put(name, value);
        return this;
    }

    JsonRow addBoolean(String name, boolean value) {
        fields.put(name, value ? 1 : 0);
        return this;
    }

    JsonRow addDoubleMap(String name, Map<String, Double> values) {
        fields.put(name, values == null ? new TreeMap<>() : new TreeMap<>(values));
        return this;
    }

    JsonRow addTimestampMillis(String name, long value) {
        fields.put(name, formatTimestampMillis(value));
        return this;
    }

    JsonRow addNullableTimestampMillis(String name, Long value) {
        fields.put(name, value == null ? null : formatTimestampMillis(value));
        return this;
    }

    String build() {
        try {
            return JsonSupport.MAPPER.writeValueAsString(fields);
        } catch (Exception ex) {
            throw new IllegalStateException("Failed to serialize JSON row", ex);
        }
    }

    private static String formatTimestampMillis(long value) {
        return TS_FORMATTER.format(Instant.ofEpochMilli(value));
    }
}
