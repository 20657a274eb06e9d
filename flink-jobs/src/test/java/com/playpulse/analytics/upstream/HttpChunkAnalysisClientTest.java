package com.playpulse.analytics.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import com.playpulse.analytics.model.ChunkAnalysisRequest;
import com.playpulse.analytics.model.ChunkObservation;
import com.playpulse.analytics.model.Severity;
import com.playpulse.analytics.util.JsonSupport;

import static org.junit.jupiter.api.Assertions.*;

class HttpChunkAnalysisClientTest {

    @Test
    void requestBodyUsesSnakeCaseFields() throws Exception {
        JsonNode body = JsonSupport.MAPPER.readTree(HttpChunkAnalysisClient.requestBody(request()));

        assertEquals("s1", body.path("session_id").asText());
        assertEquals(2, body.path("window_index").asInt());
        assertEquals(20.0, body.path("window_end_sec").asDouble());
        assertEquals("s3://bucket/chunk-2.mp4", body.path("media_uri").asText());
        assertEquals("menu", body.path("previous_end_segment").asText());
        assertTrue(body.path("previous_end_status").isNull());
    }

    @Test
    void responseWindowFieldsDefaultToRequest() {
        String response = "{\"states_observed\":[{\"segment_name\":\"level_1\",\"confidence\":0.8,\"offset_sec\":1.5}],"
                + "\"point_events\":[{\"label\":\"softlock\",\"severity\":\"warning\",\"offset_sec\":4}],"
                + "\"end_segment\":\"level_1\",\"end_status\":\"in_progress\"}";

        ChunkObservation observation = HttpChunkAnalysisClient.parseResponse(request(), response);

        assertEquals("s1", observation.sessionId);
        assertEquals(2, observation.windowIndex);
        assertEquals(10.0, observation.windowStartSec);
        assertEquals(20.0, observation.windowEndSec);
        assertEquals(1.5, observation.statesObserved.get(0).offsetSec);
        assertEquals(Severity.WARNING, observation.pointEvents.get(0).severity);
        assertEquals("level_1", observation.endSegment);
    }

    @Test
    void invalidResponseValueNamesResponseField() {
        String response = "{\"states_observed\":[{\"segment_name\":\"level_1\",\"confidence\":3,\"offset_sec\":0}]}";

        ChunkAnalysisException ex = assertThrows(ChunkAnalysisException.class,
                () -> HttpChunkAnalysisClient.parseResponse(request(), response));

        assertTrue(ex.getMessage().contains("response.states_observed[0].confidence"));
    }

    @Test
    void nonJsonResponseIsRejected() {
        ChunkAnalysisException ex = assertThrows(ChunkAnalysisException.class,
                () -> HttpChunkAnalysisClient.parseResponse(request(), "<html>busy</html>"));

        assertEquals(-1, ex.statusCode());
    }

    private static ChunkAnalysisRequest request() {
        ChunkAnalysisRequest request = new ChunkAnalysisRequest();
        request.sessionId = "s1";
        request.projectId = "demo";
        request.windowIndex = 2;
        request.windowStartSec = 10.0;
        request.windowEndSec = 20.0;
        request.mediaUri = "s3://bucket/chunk-2.mp4";
        request.previousEndSegment = "menu";
        return request;
    }
}
