package com.playpulse.analytics.model;

/**
 * The two continuous sensor streams of a session.
 */
public enum SensorStream {
    /** High-rate facial affect estimates, many dimensions. */
    AFFECT("affect"),
    /** Low-rate physiological readings such as heart rate. */
    PHYSIO("physio");

    private final String wireName;

    SensorStream(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static SensorStream fromWire(String value) {
        if (value != null) {
            for (SensorStream stream : values()) {
                if (stream.wireName.equalsIgnoreCase(value.trim())) {
                    return stream;
                }
            }
        }
        throw new IllegalArgumentException("Unknown sensor stream: " + value);
    }
}
