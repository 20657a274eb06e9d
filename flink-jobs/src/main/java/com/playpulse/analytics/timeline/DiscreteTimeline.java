package com.playpulse.analytics.timeline;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered segment occupancy of a session plus its point events.
 *
 * <p>Intervals are contiguous, start at 0 and end at {@link #durationSec}; every second belongs
 * to exactly one interval. Events are ordered by timestamp.</p>
 */
public class DiscreteTimeline implements Serializable {
    private static final long serialVersionUID = 1L;

    public int durationSec;
    public List<SegmentInterval> intervals = new ArrayList<>();
    public List<PointEvent> events = new ArrayList<>();

    public DiscreteTimeline() {}

    public DiscreteTimeline(int durationSec, List<SegmentInterval> intervals, List<PointEvent> events) {
        this.durationSec = durationSec;
        this.intervals = intervals;
        this.events = events;
    }

    /**
     * Segment covering second {@code t}, or null when {@code t} lies outside the timeline.
     */
    public String segmentAt(int t) {
        int lo = 0;
        int hi = intervals.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            SegmentInterval interval = intervals.get(mid);
            if (t < interval.startSec) {
                hi = mid - 1;
            } else if (t >= interval.endSec) {
                lo = mid + 1;
            } else {
                return interval.segmentName;
            }
        }
        return null;
    }
}
