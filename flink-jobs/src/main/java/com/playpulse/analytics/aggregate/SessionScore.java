package com.playpulse.analytics.aggregate;

import java.io.Serializable;

/**
 * Headline health score of one finalized session.
 */
public class SessionScore implements Serializable {
    private static final long serialVersionUID = 1L;

    public String sessionId;
    public double score;
    public int passCount;
    public int warnCount;
    public int failCount;
    public long finalizedAtMs;

    public SessionScore() {}

    public int total() {
        return passCount + warnCount + failCount;
    }
}
