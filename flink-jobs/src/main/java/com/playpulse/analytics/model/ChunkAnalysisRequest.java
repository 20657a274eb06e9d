package com.playpulse.analytics.model;

import java.io.Serializable;

/**
 * Request to analyse one window of session video. The previous window's end context is
 * forwarded so the analysis service can continue a segment across the boundary.
 */
public class ChunkAnalysisRequest implements Serializable {
    private static final long serialVersionUID = 1L;

    public String sessionId;
    public String projectId;
    public int windowIndex;
    public double windowStartSec;
    public double windowEndSec;
    public String mediaUri;
    public String previousEndSegment;
    public String previousEndStatus;

    public ChunkAnalysisRequest() {}
}
