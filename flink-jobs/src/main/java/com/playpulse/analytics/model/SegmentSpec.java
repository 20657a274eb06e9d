package com.playpulse.analytics.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Developer-authored intent for one named segment of a project.
 *
 * <p>The acceptable range is inclusive on both ends and lies within [0, 1]. The descriptive
 * fields are forwarded to the chunk analysis service and never used for scoring.</p>
 */
public class SegmentSpec implements Serializable {
    private static final long serialVersionUID = 1L;

    public String name;
    public String targetDimension;
    public double rangeLow;
    public double rangeHigh;
    public double expectedDurationSec;
    public String description;
    public List<String> visualCues = new ArrayList<>();
    public List<String> failureIndicators = new ArrayList<>();
    public List<String> successIndicators = new ArrayList<>();

    public SegmentSpec() {}

    public SegmentSpec(String name, String targetDimension, double rangeLow, double rangeHigh, double expectedDurationSec) {
        this.name = name;
        this.targetDimension = targetDimension;
        this.rangeLow = rangeLow;
        this.rangeHigh = rangeHigh;
        this.expectedDurationSec = expectedDurationSec;
    }

    public double midpoint() {
        return (rangeLow + rangeHigh) / 2.0;
    }

    public boolean inRange(double value) {
        return value >= rangeLow && value <= rangeHigh;
    }
}
