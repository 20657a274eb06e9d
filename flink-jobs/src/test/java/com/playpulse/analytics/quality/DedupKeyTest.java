package com.playpulse.analytics.quality;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import com.playpulse.analytics.model.TelemetryEvent;
import com.playpulse.analytics.util.JsonSupport;

import static org.junit.jupiter.api.Assertions.*;

class DedupKeyTest {

    @Test
    void analysisRequestsAreKeyedBySessionWindow() throws Exception {
        String json = "{\"id\":\"a\",\"type\":\"chunk_analysis_request\",\"session_id\":\"s1\",\"data\":{\"window_index\":5}}";
        JsonNode root = JsonSupport.MAPPER.readTree(json);

        QualityGateProcessFunction.DedupKey key = QualityGateProcessFunction.DedupKey.build(event(root), root);

        assertEquals("chunk_analysis_request|s1|5", key.key);
        assertEquals("session_window", key.strategy);
    }

    @Test
    void eventIdIsUsedWhenPresent() throws Exception {
        String json = "{\"id\":\"evt-9\",\"type\":\"sensor_readings\",\"session_id\":\"s1\",\"data\":{}}";
        JsonNode root = JsonSupport.MAPPER.readTree(json);

        QualityGateProcessFunction.DedupKey key = QualityGateProcessFunction.DedupKey.build(event(root), root);

        assertEquals("evt-9", key.key);
        assertEquals("event_id", key.strategy);
    }

    @Test
    void payloadHashIgnoresReplayMetadataAndFieldOrder() throws Exception {
        JsonNode original = JsonSupport.MAPPER.readTree(
                "{\"type\":\"sensor_readings\",\"session_id\":\"s1\",\"data\":{\"stream\":\"physio\",\"x\":1}}");
        JsonNode replayed = JsonSupport.MAPPER.readTree(
                "{\"__replay\":true,\"data\":{\"x\":1,\"stream\":\"physio\"},\"session_id\":\"s1\",\"type\":\"sensor_readings\"}");

        QualityGateProcessFunction.DedupKey first = QualityGateProcessFunction.DedupKey.build(event(original), original);
        QualityGateProcessFunction.DedupKey second = QualityGateProcessFunction.DedupKey.build(event(replayed), replayed);

        assertEquals("payload_hash", first.strategy);
        assertEquals(first.key, second.key);
        assertEquals(64, first.key.length());
    }

    private static TelemetryEvent event(JsonNode root) {
        TelemetryEvent event = new TelemetryEvent();
        event.eventId = root.path("id").asText("");
        event.eventType = root.path("type").asText("");
        event.sessionId = root.path("session_id").asText("");
        event.rawJson = root.toString();
        return event;
    }
}
