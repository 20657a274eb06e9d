package com.playpulse.analytics.upstream;

/**
 * A single chunk analysis attempt failed (transport error, non-2xx status or unusable body).
 */
public class ChunkAnalysisException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int statusCode;

    public ChunkAnalysisException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ChunkAnalysisException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status of the failed attempt, -1 when no response was received. */
    public int statusCode() {
        return statusCode;
    }
}
