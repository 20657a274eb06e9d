package com.playpulse.analytics.upstream;

import com.playpulse.analytics.model.ChunkAnalysisRequest;
import com.playpulse.analytics.model.ChunkObservation;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous access to the chunk analysis service. A failed attempt completes the future exceptionally.
 */
public interface ChunkAnalysisClient extends AutoCloseable {

    CompletableFuture<ChunkObservation> analyze(ChunkAnalysisRequest request);

    @Override
    default void close() {}
}
