package com.playpulse.analytics.session;

/**
 * Terminal status of a finalization. Partial data still completes; only an empty timeline does not.
 */
public enum FinalizationStatus {
    COMPLETED("completed"),
    INSUFFICIENT_DATA("insufficient_data");

    private final String wireName;

    FinalizationStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
