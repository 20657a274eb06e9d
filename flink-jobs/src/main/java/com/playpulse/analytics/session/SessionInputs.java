package com.playpulse.analytics.session;

import com.playpulse.analytics.model.ChunkObservation;
import com.playpulse.analytics.model.FinalizeRequest;
import com.playpulse.analytics.model.SegmentSpec;
import com.playpulse.analytics.model.SensorReading;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything retained for one session at the moment it is finalized.
 */
public class SessionInputs implements Serializable {
    private static final long serialVersionUID = 1L;

    public String sessionId;
    public String projectId;
    // Completion order; the stitcher breaks equal window starts with it.
    public List<ChunkObservation> chunks = new ArrayList<>();
    public List<SensorReading> affect = new ArrayList<>();
    public List<SensorReading> physio = new ArrayList<>();
    public FinalizeRequest request;
    // Spec snapshot frozen for this finalization.
    public List<SegmentSpec> specs = new ArrayList<>();
    public long finalizationVersion;
    public long finalizedAtMs;

    public SessionInputs() {}
}
