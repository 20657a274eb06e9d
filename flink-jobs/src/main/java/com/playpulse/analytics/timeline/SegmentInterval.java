package com.playpulse.analytics.timeline;

import java.io.Serializable;
import java.util.Objects;

/**
 * Half-open span {@code [startSec, endSec)} occupied by one segment.
 */
public class SegmentInterval implements Serializable {
    private static final long serialVersionUID = 1L;

    public String segmentName;
    public int startSec;
    public int endSec;

    public SegmentInterval() {}

    public SegmentInterval(String segmentName, int startSec, int endSec) {
        this.segmentName = segmentName;
        this.startSec = startSec;
        this.endSec = endSec;
    }

    public int durationSec() {
        return endSec - startSec;
    }

    public boolean covers(int t) {
        return t >= startSec && t < endSec;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SegmentInterval)) {
            return false;
        }
        SegmentInterval that = (SegmentInterval) o;
        return startSec == that.startSec && endSec == that.endSec && Objects.equals(segmentName, that.segmentName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segmentName, startSec, endSec);
    }

    @Override
    public String toString() {
        return segmentName + "[" + startSec + "," + endSec + ")";
    }
}
