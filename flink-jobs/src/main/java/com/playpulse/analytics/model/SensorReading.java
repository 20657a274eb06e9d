package com.playpulse.analytics.model;

import java.io.Serializable;
import java.util.Map;
import java.util.TreeMap;

/**
 * One timestamped sample of a sensor stream. Values are normalized to [0, 1].
 */
public class SensorReading implements Serializable {
    private static final long serialVersionUID = 1L;

    public String sessionId;
    public SensorStream stream;
    public double timestampSec;
    public Map<String, Double> values = new TreeMap<>();

    public SensorReading() {}

    public SensorReading(String sessionId, SensorStream stream, double timestampSec, Map<String, Double> values) {
        this.sessionId = sessionId;
        this.stream = stream;
        this.timestampSec = timestampSec;
        this.values = new TreeMap<>(values);
    }

    /** Whole second this reading falls into. */
    public int second() {
        return (int) Math.floor(timestampSec);
    }
}
