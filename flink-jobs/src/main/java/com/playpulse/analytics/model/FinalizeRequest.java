package com.playpulse.analytics.model;

import java.io.Serializable;
import java.util.List;

/**
 * Asks for a session to be scored. {@code segments}, when present, is the project's spec
 * snapshot for this finalization; otherwise the catalog snapshot is used.
 */
public class FinalizeRequest implements Serializable {
    private static final long serialVersionUID = 1L;

    public String sessionId;
    public String projectId;
    public Integer durationSec;
    public List<SegmentSpec> segments;
    public long requestedAtMs;

    public FinalizeRequest() {}
}
