package com.playpulse.analytics.upstream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.playpulse.analytics.model.ChunkAnalysisRequest;
import com.playpulse.analytics.model.ChunkObservation;
import com.playpulse.analytics.parse.TelemetryParsers;
import com.playpulse.analytics.parse.TelemetryValidationException;
import com.playpulse.analytics.util.JsonSupport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Posts one window to the chunk analysis endpoint and parses the observation it returns.
 *
 * <p>Request body: {@code session_id, project_id, window_index, window_start_sec, window_end_sec,
 * media_uri, previous_end_segment, previous_end_status}. The response body uses the
 * {@code chunk_observation} data layout; window fields missing from it are taken from the request.</p>
 */
public class HttpChunkAnalysisClient implements ChunkAnalysisClient {
    private final HttpClient httpClient;
    private final URI endpoint;
    private final Duration requestTimeout;
    private final int maxSessionDurationSec;

    public HttpChunkAnalysisClient(String endpoint, Duration requestTimeout, int maxSessionDurationSec) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), URI.create(endpoint),
                requestTimeout, maxSessionDurationSec);
    }

    HttpChunkAnalysisClient(HttpClient httpClient, URI endpoint, Duration requestTimeout, int maxSessionDurationSec) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.requestTimeout = requestTimeout;
        this.maxSessionDurationSec = maxSessionDurationSec;
    }

    @Override
    public CompletableFuture<ChunkObservation> analyze(ChunkAnalysisRequest request) {
        HttpRequest httpRequest;
        try {
            httpRequest = HttpRequest.newBuilder(endpoint)
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody(request), StandardCharsets.UTF_8))
                    .build();
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(new ChunkAnalysisException("Failed to build chunk analysis request", ex));
        }

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .thenApply(response -> {
                    if (response.statusCode() < 200 || response.statusCode() >= 300) {
                        throw new ChunkAnalysisException(
                                "Chunk analysis returned status " + response.statusCode(), response.statusCode());
                    }
                    return parseResponse(request, response.body(), maxSessionDurationSec);
                });
    }

    static String requestBody(ChunkAnalysisRequest request) {
        ObjectNode body = JsonSupport.MAPPER.createObjectNode();
        body.put("session_id", request.sessionId);
        body.put("project_id", request.projectId);
        body.put("window_index", request.windowIndex);
        body.put("window_start_sec", request.windowStartSec);
        body.put("window_end_sec", request.windowEndSec);
        body.put("media_uri", request.mediaUri);
        body.put("previous_end_segment", request.previousEndSegment);
        body.put("previous_end_status", request.previousEndStatus);
        return JsonSupport.toJson(body);
    }

    static ChunkObservation parseResponse(ChunkAnalysisRequest request, String body) {
        return parseResponse(request, body, TelemetryParsers.DEFAULT_MAX_SESSION_DURATION_SEC);
    }

    static ChunkObservation parseResponse(ChunkAnalysisRequest request, String body, int maxSessionDurationSec) {
        JsonNode root;
        try {
            root = JsonSupport.MAPPER.readTree(body);
        } catch (IOException ex) {
            throw new ChunkAnalysisException("Chunk analysis response is not JSON", ex);
        }
        if (root == null || !root.isObject()) {
            throw new ChunkAnalysisException("Chunk analysis response is not a JSON object", 200);
        }
        ObjectNode data = (ObjectNode) root;
        if (!data.hasNonNull("window_index")) {
            data.put("window_index", request.windowIndex);
        }
        if (!data.hasNonNull("window_start_sec")) {
            data.put("window_start_sec", request.windowStartSec);
        }
        if (!data.hasNonNull("window_end_sec")) {
            data.put("window_end_sec", request.windowEndSec);
        }
        try {
            return TelemetryParsers.parseChunkObservationData(data, request.sessionId, "response", maxSessionDurationSec);
        } catch (TelemetryValidationException ex) {
            throw new ChunkAnalysisException("Invalid chunk analysis response: " + ex.getMessage(), ex);
        }
    }
}
