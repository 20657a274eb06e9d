package com.playpulse.analytics.upstream;

import org.apache.flink.streaming.api.functions.async.AsyncRetryStrategy;
import org.junit.jupiter.api.Test;

import com.playpulse.analytics.model.ChunkAnalysisRequest;
import com.playpulse.analytics.model.ChunkObservation;
import com.playpulse.analytics.model.ParsedTelemetry;
import com.playpulse.analytics.model.TelemetryEvent;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class ChunkAnalysisAsyncFunctionTest {

    @Test
    void successfulAttemptPassesObservationThrough() throws Exception {
        ChunkObservation observation = ChunkAnalysisAsyncFunction
                .attempt(new ScriptedClient(0), request("boss_fight"))
                .get(5, TimeUnit.SECONDS);

        assertFalse(observation.degraded);
        assertEquals("level_1", observation.statesObserved.get(0).segmentName);
    }

    @Test
    void failedAttemptYieldsDegradedChunkCarryingPreviousSegment() throws Exception {
        ChunkObservation observation = ChunkAnalysisAsyncFunction
                .attempt(new ScriptedClient(1), request("boss_fight"))
                .get(5, TimeUnit.SECONDS);

        assertTrue(observation.degraded);
        assertEquals(7, observation.windowIndex);
        assertEquals(70.0, observation.windowStartSec);
        assertEquals(80.0, observation.windowEndSec);
        assertEquals(1, observation.statesObserved.size());
        assertEquals("boss_fight", observation.statesObserved.get(0).segmentName);
        assertEquals(ChunkAnalysisAsyncFunction.DEGRADED_CONFIDENCE, observation.statesObserved.get(0).confidence);
        assertEquals("boss_fight", observation.endSegment);
        assertEquals("in_progress", observation.endStatus);
    }

    @Test
    void synchronousClientExceptionDegradesWithoutStates() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ChunkAnalysisClient throwing = request -> {
            calls.incrementAndGet();
            throw new IllegalStateException("connection refused");
        };

        ChunkObservation observation = ChunkAnalysisAsyncFunction
                .attempt(throwing, request(null))
                .get(5, TimeUnit.SECONDS);

        assertEquals(1, calls.get());
        assertTrue(observation.degraded);
        assertTrue(observation.statesObserved.isEmpty());
    }

    @Test
    void retryStrategyBacksOffExponentiallyUpToCap() {
        AsyncRetryStrategy<ParsedTelemetry<ChunkObservation>> strategy =
                ChunkAnalysisAsyncFunction.retryStrategy(4, 500L, 3_000L);

        assertTrue(strategy.canRetry(1));
        assertFalse(strategy.canRetry(4));
        assertEquals(500L, strategy.getBackoffTimeMillis(1));
        assertEquals(1_000L, strategy.getBackoffTimeMillis(2));
        assertEquals(2_000L, strategy.getBackoffTimeMillis(3));
        assertEquals(3_000L, strategy.getBackoffTimeMillis(4));
    }

    @Test
    void retryStrategyRetriesOnlyDegradedResults() throws Exception {
        Predicate<Collection<ParsedTelemetry<ChunkObservation>>> retryIf = ChunkAnalysisAsyncFunction
                .retryStrategy(3, 1L, 2L)
                .getRetryPredicate()
                .resultPredicate()
                .orElseThrow();

        ChunkObservation analyzed = new ScriptedClient(0).analyze(request("boss_fight")).get();
        ChunkObservation degraded = ChunkAnalysisAsyncFunction.degradedObservation(request("boss_fight"));

        assertFalse(retryIf.test(List.of(new ParsedTelemetry<>(new TelemetryEvent(), analyzed))));
        assertTrue(retryIf.test(List.of(new ParsedTelemetry<>(new TelemetryEvent(), degraded))));
        assertTrue(retryIf.test(List.of()));
    }

    private static ChunkAnalysisRequest request(String previousEndSegment) {
        ChunkAnalysisRequest request = new ChunkAnalysisRequest();
        request.sessionId = "s1";
        request.projectId = "demo";
        request.windowIndex = 7;
        request.windowStartSec = 70.0;
        request.windowEndSec = 80.0;
        request.mediaUri = "s3://playtests/s1/chunk-0007.mp4";
        request.previousEndSegment = previousEndSegment;
        request.previousEndStatus = previousEndSegment == null ? null : "in_progress";
        return request;
    }

    private static final class ScriptedClient implements ChunkAnalysisClient {
        private final int failures;
        private final AtomicInteger calls = new AtomicInteger();

        ScriptedClient(int failures) {
            this.failures = failures;
        }

        @Override
        public CompletableFuture<ChunkObservation> analyze(ChunkAnalysisRequest request) {
            if (calls.incrementAndGet() <= failures) {
                return CompletableFuture.failedFuture(new ChunkAnalysisException("upstream unavailable", 503));
            }
            ChunkObservation observation = new ChunkObservation();
            observation.sessionId = request.sessionId;
            observation.windowIndex = request.windowIndex;
            observation.windowStartSec = request.windowStartSec;
            observation.windowEndSec = request.windowEndSec;
            observation.statesObserved.add(new ChunkObservation.StateObservation("level_1", 0.9, 0.0));
            return CompletableFuture.completedFuture(observation);
        }
    }
}
