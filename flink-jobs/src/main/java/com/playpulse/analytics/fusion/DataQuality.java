package com.playpulse.analytics.fusion;

/**
 * How much fresh sensor data backs a fused second.
 */
public enum DataQuality {
    /** Both streams delivered a reading in this second. */
    FULL,
    /** Exactly one stream is fresh, or the forward-filled values are recent. */
    PARTIAL,
    /** Both streams are forward-filled from more than the staleness limit ago. */
    MISSING;

    public String wireName() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
