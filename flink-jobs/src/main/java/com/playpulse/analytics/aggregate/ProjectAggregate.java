package com.playpulse.analytics.aggregate;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Derived, non-authoritative view over all finalized sessions of a project.
 */
public class ProjectAggregate implements Serializable {
    private static final long serialVersionUID = 1L;

    public String projectId;
    public int sessionCount;
    // Ranked worst first.
    public List<SegmentRollup> segments = new ArrayList<>();
    // Session scores ordered by finalization time.
    public List<SessionScore> healthTrend = new ArrayList<>();
    public double meanSessionScore;
    public long computedAtMs;

    public ProjectAggregate() {}
}
