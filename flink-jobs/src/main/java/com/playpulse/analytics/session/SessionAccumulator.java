package com.playpulse.analytics.session;

import java.io.Serializable;

/**
 * Per-session bookkeeping kept next to the raw chunk and reading lists.
 */
public class SessionAccumulator implements Serializable {
    private static final long serialVersionUID = 1L;

    public String sessionId;
    public String projectId;
    public long finalizationVersion;
    public int chunkCount;
    public int affectReadingCount;
    public int physioReadingCount;
    public long firstSignalTimestamp;
    public long lastSignalTimestamp;

    public SessionAccumulator() {}
}
