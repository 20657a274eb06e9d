package com.playpulse.analytics.session;

import java.io.Serializable;

/**
 * A derived record tagged with the session and finalization run that produced it.
 */
public class SessionScoped<T> implements Serializable {
    private static final long serialVersionUID = 1L;

    public String sessionId;
    public String projectId;
    public long finalizationVersion;
    public long finalizedAtMs;
    public T payload;

    public SessionScoped() {}

    public SessionScoped(SessionFinalization finalization, T payload) {
        this.sessionId = finalization.sessionId;
        this.projectId = finalization.projectId;
        this.finalizationVersion = finalization.finalizationVersion;
        this.finalizedAtMs = finalization.finalizedAtMs;
        this.payload = payload;
    }
}
