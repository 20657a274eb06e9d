package com.playpulse.analytics.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of analysing one window of session video.
 *
 * <p>Offsets of states and events are seconds relative to {@link #windowStartSec}. A degraded
 * observation stands in for a window whose analysis could not be obtained; its claims carry zero
 * confidence.</p>
 */
public class ChunkObservation implements Serializable {
    private static final long serialVersionUID = 1L;

    public String sessionId;
    public int windowIndex;
    public double windowStartSec;
    public double windowEndSec;
    public List<StateObservation> statesObserved = new ArrayList<>();
    public List<ObservedEvent> pointEvents = new ArrayList<>();
    public String endSegment;
    public String endStatus;
    public boolean degraded;

    public ChunkObservation() {}

    public static class StateObservation implements Serializable {
        private static final long serialVersionUID = 1L;

        public String segmentName;
        public double confidence;
        public double offsetSec;

        public StateObservation() {}

        public StateObservation(String segmentName, double confidence, double offsetSec) {
            this.segmentName = segmentName;
            this.confidence = confidence;
            this.offsetSec = offsetSec;
        }
    }

    public static class ObservedEvent implements Serializable {
        private static final long serialVersionUID = 1L;

        public String label;
        public Severity severity;
        public double offsetSec;

        public ObservedEvent() {}

        public ObservedEvent(String label, Severity severity, double offsetSec) {
            this.label = label;
            this.severity = severity;
            this.offsetSec = offsetSec;
        }
    }
}
