package com.playpulse.analytics.aggregate;

import java.io.Serializable;

/**
 * Cross-session statistics for one segment of a project.
 */
public class SegmentRollup implements Serializable {
    private static final long serialVersionUID = 1L;

    public String projectId;
    public String segmentName;
    // 1-based position in pain-point order.
    public int rank;
    public String targetDimension;
    public int passCount;
    public int warnCount;
    public int failCount;
    public int occurrenceCount;
    public int sessionCount;
    public double meanTargetObserved;
    public double meanDeviation;
    public double meanTimeDeltaSec;
    public String mostFrequentDominant;
    public long computedAtMs;

    public SegmentRollup() {}
}
