package com.playpulse.analytics.util;

/**
 * Composite keys for session-scoped state and output rows, and the identifier checks behind them.
 * A blank session, project or segment identifier counts as missing.
 */
public final class SessionKey {
    private static final String SEPARATOR = "|";

    private SessionKey() {}

    /**
     * Key of one analysis window within a session; a window is accepted once per session.
     */
    public static String window(String sessionId, int windowIndex) {
        return normalize(sessionId) + SEPARATOR + windowIndex;
    }

    public static String occurrence(String sessionId, String segmentName, int occurrenceIndex) {
        return normalize(sessionId) + SEPARATOR + normalize(segmentName) + SEPARATOR + occurrenceIndex;
    }

    public static String second(String sessionId, int t) {
        return normalize(sessionId) + SEPARATOR + t;
    }

    public static boolean isMissing(String id) {
        return id == null || id.trim().isEmpty();
    }

    /**
     * Trimmed identifier, or null when missing.
     */
    public static String idOrNull(String id) {
        return isMissing(id) ? null : id.trim();
    }

    private static String normalize(String value) {
        return isMissing(value) ? "_missing" : value.trim();
    }
}
