package com.playpulse.analytics.verdict;

import java.io.Serializable;
import java.util.Map;
import java.util.TreeMap;

/**
 * Score of one segment occurrence against its spec.
 */
public class Verdict implements Serializable {
    private static final long serialVersionUID = 1L;

    public String segmentName;
    public int occurrenceIndex;
    public int startSec;
    public int endSec;
    public Map<String, Double> observedAvg = new TreeMap<>();
    public String targetDimension;
    public double targetObserved;
    public String dominantDimension;
    public double deviationScore;
    public int actualDurationSec;
    public double expectedDurationSec;
    public double timeDeltaSec;
    public Outcome outcome;

    public Verdict() {}
}
