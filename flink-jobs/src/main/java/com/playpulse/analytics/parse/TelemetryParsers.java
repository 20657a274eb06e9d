package com.playpulse.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;

import com.playpulse.analytics.model.ChunkAnalysisRequest;
import com.playpulse.analytics.model.ChunkObservation;
import com.playpulse.analytics.model.FinalizeRequest;
import com.playpulse.analytics.model.SensorReading;
import com.playpulse.analytics.model.SensorStream;
import com.playpulse.analytics.model.Severity;
import com.playpulse.analytics.quality.ValidatedEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Typed parsers for validated telemetry events. Each returns the records an event fans out to.
 *
 * <p>Malformed or out-of-range values throw {@link TelemetryValidationException}; nothing is clamped.
 * Session-relative seconds (reading timestamps, window bounds, requested duration) are capped at the
 * configured max session duration so one record cannot size a session's timeline.</p>
 */
public final class TelemetryParsers {
    public static final String SENSOR_READINGS = "sensor_readings";
    public static final String CHUNK_OBSERVATION = "chunk_observation";
    public static final String CHUNK_ANALYSIS_REQUEST = "chunk_analysis_request";
    public static final String SESSION_FINALIZE = "session_finalize";

    public static final int DEFAULT_MAX_SESSION_DURATION_SEC = 6 * 60 * 60;

    private TelemetryParsers() {}

    public static List<SensorReading> parseSensorReadings(ValidatedEvent event) throws Exception {
        return parseSensorReadings(event, DEFAULT_MAX_SESSION_DURATION_SEC);
    }

    public static List<SensorReading> parseSensorReadings(ValidatedEvent event, int maxSessionDurationSec)
            throws Exception {
        JsonNode data = ParseSupport.requireData(event, SENSOR_READINGS);
        SensorStream stream;
        try {
            stream = SensorStream.fromWire(JsonNodeUtils.asNullableText(data.path("stream")));
        } catch (IllegalArgumentException ex) {
            throw new TelemetryValidationException("data.stream", ex.getMessage());
        }

        JsonNode readings = ParseSupport.requireArray(data.path("readings"), "data.readings");
        List<SensorReading> results = new ArrayList<>(readings.size());
        for (int i = 0; i < readings.size(); i++) {
            String path = ParseSupport.element("data.readings", i);
            JsonNode reading = readings.get(i);
            double ts = ParseSupport.requireSessionSecond(
                    reading.path("timestamp_sec"), path + ".timestamp_sec", maxSessionDurationSec);
            results.add(new SensorReading(event.event.sessionId, stream, ts, parseValues(reading.path("values"), path + ".values")));
        }
        return results;
    }

    public static List<ChunkObservation> parseChunkObservation(ValidatedEvent event) throws Exception {
        return parseChunkObservation(event, DEFAULT_MAX_SESSION_DURATION_SEC);
    }

    public static List<ChunkObservation> parseChunkObservation(ValidatedEvent event, int maxSessionDurationSec)
            throws Exception {
        JsonNode data = ParseSupport.requireData(event, CHUNK_OBSERVATION);
        return Collections.singletonList(
                parseChunkObservationData(data, event.event.sessionId, "data", maxSessionDurationSec));
    }

    /**
     * Parses a chunk observation body. Shared by the event parser and the chunk analysis client.
     */
    public static ChunkObservation parseChunkObservationData(
            JsonNode data, String sessionId, String field, int maxSessionDurationSec)
            throws TelemetryValidationException {
        ChunkObservation chunk = new ChunkObservation();
        chunk.sessionId = sessionId;
        chunk.windowIndex = JsonNodeUtils.requireNonNegativeInt(data.path("window_index"), field + ".window_index");
        chunk.windowStartSec = JsonNodeUtils.requireNonNegative(data.path("window_start_sec"), field + ".window_start_sec");
        chunk.windowEndSec = ParseSupport.requireSessionSecond(
                data.path("window_end_sec"), field + ".window_end_sec", maxSessionDurationSec);
        if (chunk.windowEndSec < chunk.windowStartSec) {
            throw new TelemetryValidationException(field + ".window_end_sec",
                    "window end " + chunk.windowEndSec + " precedes window start " + chunk.windowStartSec);
        }

        JsonNode states = data.path("states_observed");
        if (!JsonNodeUtils.isAbsent(states)) {
            String statesField = field + ".states_observed";
            ParseSupport.requireArray(states, statesField);
            for (int i = 0; i < states.size(); i++) {
                String path = ParseSupport.element(statesField, i);
                JsonNode state = states.get(i);
                chunk.statesObserved.add(new ChunkObservation.StateObservation(
                        JsonNodeUtils.requireText(state.path("segment_name"), path + ".segment_name"),
                        JsonNodeUtils.requireUnitInterval(state.path("confidence"), path + ".confidence"),
                        JsonNodeUtils.requireNonNegative(state.path("offset_sec"), path + ".offset_sec")));
            }
        }

        JsonNode events = data.path("point_events");
        if (!JsonNodeUtils.isAbsent(events)) {
            String eventsField = field + ".point_events";
            ParseSupport.requireArray(events, eventsField);
            for (int i = 0; i < events.size(); i++) {
                String path = ParseSupport.element(eventsField, i);
                JsonNode observed = events.get(i);
                chunk.pointEvents.add(new ChunkObservation.ObservedEvent(
                        JsonNodeUtils.requireText(observed.path("label"), path + ".label"),
                        severity(observed.path("severity"), path + ".severity"),
                        JsonNodeUtils.requireNonNegative(observed.path("offset_sec"), path + ".offset_sec")));
            }
        }

        chunk.endSegment = JsonNodeUtils.asNullableText(data.path("end_segment"));
        chunk.endStatus = JsonNodeUtils.asNullableText(data.path("end_status"));
        chunk.degraded = data.path("degraded").asBoolean(false);
        return chunk;
    }

    public static List<ChunkAnalysisRequest> parseChunkAnalysisRequest(ValidatedEvent event) throws Exception {
        return parseChunkAnalysisRequest(event, DEFAULT_MAX_SESSION_DURATION_SEC);
    }

    public static List<ChunkAnalysisRequest> parseChunkAnalysisRequest(ValidatedEvent event, int maxSessionDurationSec)
            throws Exception {
        JsonNode data = ParseSupport.requireData(event, CHUNK_ANALYSIS_REQUEST);
        ChunkAnalysisRequest request = new ChunkAnalysisRequest();
        request.sessionId = event.event.sessionId;
        request.projectId = event.event.projectId;
        request.windowIndex = JsonNodeUtils.requireNonNegativeInt(data.path("window_index"), "data.window_index");
        request.windowStartSec = JsonNodeUtils.requireNonNegative(data.path("window_start_sec"), "data.window_start_sec");
        request.windowEndSec = ParseSupport.requireSessionSecond(
                data.path("window_end_sec"), "data.window_end_sec", maxSessionDurationSec);
        if (request.windowEndSec < request.windowStartSec) {
            throw new TelemetryValidationException("data.window_end_sec",
                    "window end " + request.windowEndSec + " precedes window start " + request.windowStartSec);
        }
        request.mediaUri = JsonNodeUtils.requireText(data.path("media_uri"), "data.media_uri");
        request.previousEndSegment = JsonNodeUtils.asNullableText(data.path("previous_end_segment"));
        request.previousEndStatus = JsonNodeUtils.asNullableText(data.path("previous_end_status"));
        return Collections.singletonList(request);
    }

    public static List<FinalizeRequest> parseFinalizeRequest(ValidatedEvent event) throws Exception {
        return parseFinalizeRequest(event, DEFAULT_MAX_SESSION_DURATION_SEC);
    }

    public static List<FinalizeRequest> parseFinalizeRequest(ValidatedEvent event, int maxSessionDurationSec)
            throws Exception {
        JsonNode data = ParseSupport.requireData(event, SESSION_FINALIZE);
        FinalizeRequest request = new FinalizeRequest();
        request.sessionId = event.event.sessionId;
        request.projectId = event.event.projectId;
        request.requestedAtMs = event.event.timestamp;
        if (!JsonNodeUtils.isAbsent(data.path("duration_sec"))) {
            int durationSec = JsonNodeUtils.requireNonNegativeInt(data.path("duration_sec"), "data.duration_sec");
            if (durationSec > maxSessionDurationSec) {
                throw new TelemetryValidationException("data.duration_sec",
                        "value " + durationSec + " exceeds max session duration " + maxSessionDurationSec + "s");
            }
            request.durationSec = durationSec;
        }
        if (!JsonNodeUtils.isAbsent(data.path("segments"))) {
            request.segments = SegmentSpecParser.parseList(data.path("segments"), "data.segments");
        }
        return Collections.singletonList(request);
    }

    private static Map<String, Double> parseValues(JsonNode values, String field) throws TelemetryValidationException {
        if (values == null || !values.isObject() || values.size() == 0) {
            throw new TelemetryValidationException(field, "expected a non-empty object of dimension values");
        }
        Map<String, Double> parsed = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = values.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String dimension = entry.getKey() == null ? "" : entry.getKey().trim();
            if (dimension.isEmpty()) {
                throw new TelemetryValidationException(field, "dimension name is blank");
            }
            parsed.put(dimension, JsonNodeUtils.requireUnitInterval(entry.getValue(), field + "." + dimension));
        }
        return parsed;
    }

    private static Severity severity(JsonNode node, String field) throws TelemetryValidationException {
        try {
            return Severity.fromWire(JsonNodeUtils.asNullableText(node));
        } catch (IllegalArgumentException ex) {
            throw new TelemetryValidationException(field, ex.getMessage());
        }
    }
}
