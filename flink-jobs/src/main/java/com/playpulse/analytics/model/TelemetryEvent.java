package com.playpulse.analytics.model;

import java.io.Serializable;

/**
 * Envelope metadata of an accepted telemetry event. The payload stays in {@link #rawJson}.
 */
public class TelemetryEvent implements Serializable {
    private static final long serialVersionUID = 1L;

    public String eventId;
    public String eventType;
    public String eventVersion;
    public String sessionId;
    public String projectId;
    public String rawJson;
    public long timestamp;
    public String dedupKey;
    public String dedupStrategy;
    public boolean replay;
    public RejectedEventEnvelope.SourcePointer source;

    public TelemetryEvent() {}
}
