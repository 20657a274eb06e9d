package com.playpulse.analytics.upstream;

import org.apache.flink.configuration.Configuration;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.streaming.api.functions.async.AsyncRetryStrategy;
import org.apache.flink.streaming.api.functions.async.ResultFuture;
import org.apache.flink.streaming.api.functions.async.RichAsyncFunction;
import org.apache.flink.streaming.util.retryable.AsyncRetryStrategies;

import com.playpulse.analytics.model.ChunkAnalysisRequest;
import com.playpulse.analytics.model.ChunkObservation;
import com.playpulse.analytics.model.ParsedTelemetry;
import com.playpulse.analytics.quality.FusionJobConfig;
import com.playpulse.analytics.util.SessionKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Predicate;

/**
 * Resolves chunk analysis requests into chunk observations.
 *
 * <p>Every attempt completes normally: a failed call yields a degraded observation. Retries are driven
 * by the operator's {@link #retryStrategy(FusionJobConfig)}, which re-invokes while the result is
 * degraded. When attempts run out the last degraded observation flows downstream, so an upstream
 * outage never fails the job. The operator timeout also yields a degraded observation.</p>
 */
public class ChunkAnalysisAsyncFunction
        extends RichAsyncFunction<ParsedTelemetry<ChunkAnalysisRequest>, ParsedTelemetry<ChunkObservation>> {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ChunkAnalysisAsyncFunction.class);

    public static final double DEGRADED_CONFIDENCE = 0.0;
    static final double BACKOFF_MULTIPLIER = 2.0;

    private final FusionJobConfig config;

    private transient ChunkAnalysisClient client;
    private transient Counter attemptCounter;
    private transient Counter failedAttemptCounter;
    private transient Counter timeoutCounter;

    public ChunkAnalysisAsyncFunction(FusionJobConfig config) {
        this.config = config;
    }

    /**
     * Exponential backoff over the configured attempts: the wait before retry {@code n} is
     * {@code min(initialBackoffMs * 2^(n-1), maxBackoffMs)}. Flink counts retries, not attempts.
     */
    public static AsyncRetryStrategy<ParsedTelemetry<ChunkObservation>> retryStrategy(FusionJobConfig config) {
        return retryStrategy(config.chunkAnalysisMaxAttempts,
                config.chunkAnalysisInitialBackoffMs, config.chunkAnalysisMaxBackoffMs);
    }

    static AsyncRetryStrategy<ParsedTelemetry<ChunkObservation>> retryStrategy(
            int maxAttempts, long initialBackoffMs, long maxBackoffMs) {
        long initial = Math.max(0L, initialBackoffMs);
        return new AsyncRetryStrategies.ExponentialBackoffDelayRetryStrategyBuilder<ParsedTelemetry<ChunkObservation>>(
                Math.max(0, maxAttempts - 1), initial, Math.max(initial, maxBackoffMs), BACKOFF_MULTIPLIER)
                .ifResult(new DegradedResultPredicate())
                .build();
    }

    @Override
    public void open(Configuration parameters) {
        client = new HttpChunkAnalysisClient(config.chunkAnalysisUrl,
                Duration.ofMillis(config.chunkAnalysisTimeoutMs), config.maxSessionDurationSec);

        MetricGroup metrics = getRuntimeContext().getMetricGroup()
                .addGroup("playpulse")
                .addGroup("chunk_analysis");
        attemptCounter = metrics.counter("attempts");
        failedAttemptCounter = metrics.counter("failed_attempts");
        timeoutCounter = metrics.counter("timeouts");
        LOG.info("Chunk analysis initialized (url={}, maxAttempts={}, initialBackoffMs={}, maxBackoffMs={})",
                config.chunkAnalysisUrl, config.chunkAnalysisMaxAttempts,
                config.chunkAnalysisInitialBackoffMs, config.chunkAnalysisMaxBackoffMs);
    }

    @Override
    public void asyncInvoke(
            ParsedTelemetry<ChunkAnalysisRequest> input,
            ResultFuture<ParsedTelemetry<ChunkObservation>> resultFuture) {
        attemptCounter.inc();
        attempt(client, input.payload).whenComplete((chunk, error) -> {
            ChunkObservation observation = chunk == null ? degradedObservation(input.payload) : chunk;
            if (observation.degraded) {
                failedAttemptCounter.inc();
            }
            resultFuture.complete(Collections.singleton(new ParsedTelemetry<>(input.event, observation)));
        });
    }

    @Override
    public void timeout(
            ParsedTelemetry<ChunkAnalysisRequest> input,
            ResultFuture<ParsedTelemetry<ChunkObservation>> resultFuture) {
        LOG.warn("Chunk analysis timed out, emitting degraded chunk (session={}, window={})",
                input.payload.sessionId, input.payload.windowIndex);
        timeoutCounter.inc();
        resultFuture.complete(Collections.singleton(
                new ParsedTelemetry<>(input.event, degradedObservation(input.payload))));
    }

    @Override
    public void close() throws Exception {
        if (client != null) {
            client.close();
        }
    }

    /**
     * One call to the analysis service. Never completes exceptionally.
     */
    static CompletableFuture<ChunkObservation> attempt(ChunkAnalysisClient client, ChunkAnalysisRequest request) {
        CompletableFuture<ChunkObservation> call;
        try {
            call = client.analyze(request);
        } catch (RuntimeException ex) {
            call = CompletableFuture.failedFuture(ex);
        }
        return call.handle((observation, error) -> {
            if (error == null && observation != null) {
                return observation;
            }
            LOG.warn("Chunk analysis attempt failed, degrading window (session={}, window={}, cause={})",
                    request.sessionId, request.windowIndex, describe(unwrap(error)));
            return degradedObservation(request);
        });
    }

    /**
     * Stand-in for a window whose analysis could not be obtained. It carries the previous
     * window's end segment at zero confidence so any confident neighbour overrides it.
     */
    public static ChunkObservation degradedObservation(ChunkAnalysisRequest request) {
        ChunkObservation chunk = new ChunkObservation();
        chunk.sessionId = request.sessionId;
        chunk.windowIndex = request.windowIndex;
        chunk.windowStartSec = request.windowStartSec;
        chunk.windowEndSec = Math.max(request.windowStartSec, request.windowEndSec);
        chunk.degraded = true;
        chunk.endSegment = request.previousEndSegment;
        chunk.endStatus = request.previousEndStatus;
        if (!SessionKey.isMissing(request.previousEndSegment)) {
            chunk.statesObserved.add(new ChunkObservation.StateObservation(
                    request.previousEndSegment, DEGRADED_CONFIDENCE, 0.0));
        }
        return chunk;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "empty_response";
        }
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    static final class DegradedResultPredicate
            implements Predicate<Collection<ParsedTelemetry<ChunkObservation>>>, Serializable {
        private static final long serialVersionUID = 1L;

        @Override
        public boolean test(Collection<ParsedTelemetry<ChunkObservation>> results) {
            if (results == null || results.isEmpty()) {
                return true;
            }
            for (ParsedTelemetry<ChunkObservation> result : results) {
                if (result == null || result.payload == null || result.payload.degraded) {
                    return true;
                }
            }
            return false;
        }
    }
}
