package com.playpulse.analytics.session;

import com.playpulse.analytics.model.ChunkObservation;
import com.playpulse.analytics.model.FinalizeRequest;
import com.playpulse.analytics.model.SensorReading;
import com.playpulse.analytics.model.TelemetryEvent;

import java.io.Serializable;

/**
 * One input to the per-session state machine. Exactly one payload field is set, matching {@link #signalType}.
 */
public class SessionSignal implements Serializable {
    private static final long serialVersionUID = 1L;

    public enum SignalType {
        CHUNK,
        READING,
        FINALIZE
    }

    public SignalType signalType;
    public String sessionId;
    public String projectId;
    public long signalTimestamp;

    public ChunkObservation chunk;
    public SensorReading reading;
    public FinalizeRequest finalizeRequest;

    public TelemetryEvent sourceEvent;

    public SessionSignal() {}
}
