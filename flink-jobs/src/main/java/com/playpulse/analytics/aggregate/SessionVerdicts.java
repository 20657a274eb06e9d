package com.playpulse.analytics.aggregate;

import com.playpulse.analytics.verdict.Verdict;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Latest verdict set of one finalized session, as retained for project rollups.
 */
public class SessionVerdicts implements Serializable {
    private static final long serialVersionUID = 1L;

    public String sessionId;
    public long finalizedAtMs;
    public long finalizationVersion;
    public List<Verdict> verdicts = new ArrayList<>();

    public SessionVerdicts() {}

    public SessionVerdicts(String sessionId, long finalizedAtMs, List<Verdict> verdicts) {
        this.sessionId = sessionId;
        this.finalizedAtMs = finalizedAtMs;
        this.verdicts = verdicts == null ? new ArrayList<>() : new ArrayList<>(verdicts);
    }
}
