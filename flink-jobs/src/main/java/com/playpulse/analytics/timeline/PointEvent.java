package com.playpulse.analytics.timeline;

import com.playpulse.analytics.model.Severity;

import java.io.Serializable;

/**
 * Instantaneous occurrence (death, softlock, transition) at an absolute session time.
 */
public class PointEvent implements Serializable {
    private static final long serialVersionUID = 1L;

    public String label;
    public Severity severity;
    public double timestampSec;

    public PointEvent() {}

    public PointEvent(String label, Severity severity, double timestampSec) {
        this.label = label;
        this.severity = severity;
        this.timestampSec = timestampSec;
    }

    @Override
    public String toString() {
        return label + "@" + timestampSec + "(" + severity + ")";
    }
}
