package com.playpulse.analytics.session;

import com.playpulse.analytics.aggregate.SessionScore;
import com.playpulse.analytics.fusion.FusedRow;
import com.playpulse.analytics.model.SegmentSpec;
import com.playpulse.analytics.timeline.DiscreteTimeline;
import com.playpulse.analytics.verdict.Verdict;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of one finalization run. A later run for the same session carries a higher
 * {@link #finalizationVersion} and replaces every derived row of this one.
 */
public class SessionFinalization implements Serializable {
    private static final long serialVersionUID = 1L;

    public String sessionId;
    public String projectId;
    public FinalizationStatus status;
    public String reason;
    public int durationSec;
    public long finalizationVersion;
    public long finalizedAtMs;
    public List<SegmentSpec> specs = new ArrayList<>();
    public DiscreteTimeline timeline;
    public List<FusedRow> fusedRows = new ArrayList<>();
    public List<Verdict> verdicts = new ArrayList<>();
    public SessionScore score;
    public int unscoredOccurrences;
    public int fullRows;
    public int partialRows;
    public int missingRows;

    public SessionFinalization() {}

    public boolean completed() {
        return status == FinalizationStatus.COMPLETED;
    }
}
