package com.playpulse.analytics.fusion;

import java.io.Serializable;
import java.util.Map;
import java.util.TreeMap;

/**
 * One second of the fused session timeline.
 */
public class FusedRow implements Serializable {
    private static final long serialVersionUID = 1L;

    public int t;
    public String segmentName;
    public Map<String, Double> values = new TreeMap<>();
    public DataQuality dataQuality;
    // Seconds since the current segment occurrence began.
    public int timeInSegmentSec;
    public String dominantDimension;
    // |target value - range midpoint| for the row's segment; 0 without a spec.
    public double intentDelta;

    public FusedRow() {}

    public FusedRow(int t, String segmentName, Map<String, Double> values, DataQuality dataQuality) {
        this.t = t;
        this.segmentName = segmentName;
        this.values = new TreeMap<>(values);
        this.dataQuality = dataQuality;
    }

    public double value(String dimension) {
        Double value = values.get(dimension);
        return value == null ? 0.0 : value;
    }
}
