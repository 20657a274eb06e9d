package com.playpulse.analytics.quality;

import com.fasterxml.jackson.databind.JsonNode;

import com.playpulse.analytics.model.TelemetryEvent;
import com.playpulse.analytics.util.JsonSupport;

import java.io.IOException;
import java.io.Serializable;

/**
 * A schema-valid telemetry event plus its parsed JSON tree for downstream parsers.
 */
public class ValidatedEvent implements Serializable {
    private static final long serialVersionUID = 1L;

    public TelemetryEvent event;
    // Transient: JsonNode is not a Flink POJO. Re-parsed from rawJson after a network shuffle.
    public transient JsonNode root;

    public ValidatedEvent() {}

    public ValidatedEvent(TelemetryEvent event, JsonNode root) {
        this.event = event;
        this.root = root;
    }

    public JsonNode root() {
        if (root == null && event != null && event.rawJson != null) {
            try {
                root = JsonSupport.MAPPER.readTree(event.rawJson);
            } catch (IOException ex) {
                throw new IllegalStateException("Stored raw JSON is no longer parseable for event " + event.eventId, ex);
            }
        }
        return root;
    }

    public JsonNode data() {
        JsonNode parsed = root();
        return parsed == null ? null : parsed.path("data");
    }
}
