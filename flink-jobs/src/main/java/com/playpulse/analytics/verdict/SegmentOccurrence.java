package com.playpulse.analytics.verdict;

import com.playpulse.analytics.fusion.FusedRow;

import java.util.ArrayList;
import java.util.List;

/**
 * One contiguous run of fused rows sharing a segment name.
 */
public final class SegmentOccurrence {
    public final String segmentName;
    public final int occurrenceIndex;
    public final List<FusedRow> rows = new ArrayList<>();

    SegmentOccurrence(String segmentName, int occurrenceIndex) {
        this.segmentName = segmentName;
        this.occurrenceIndex = occurrenceIndex;
    }

    public int startSec() {
        return rows.get(0).t;
    }

    public int endSec() {
        return rows.get(rows.size() - 1).t + 1;
    }

    public int durationSec() {
        return rows.size();
    }
}
