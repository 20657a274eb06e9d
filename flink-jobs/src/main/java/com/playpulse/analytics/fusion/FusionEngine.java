package com.playpulse.analytics.fusion;

import com.playpulse.analytics.model.SegmentSpec;
import com.playpulse.analytics.model.SensorReading;
import com.playpulse.analytics.timeline.ChunkStitcher;
import com.playpulse.analytics.timeline.DiscreteTimeline;
import com.playpulse.analytics.timeline.SegmentInterval;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Resamples the discrete timeline and both sensor streams onto one row per whole second.
 *
 * <p>Per second {@code t} of {@code [0, duration)}:
 * - affect dimensions take the mean of readings whose timestamp floors to {@code t}, else the previous value;
 * - physiological dimensions take the last reading at or before {@code t} (step function);
 * - dimensions never observed so far read {@code 0.0}.
 * </p>
 *
 * <p>One pass, one forward cursor per stream. Output depends only on the inputs.</p>
 */
public class FusionEngine implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final int STALE_AFTER_SEC = 5;
    public static final String NO_DOMINANT_DIMENSION = "none";

    private final Set<String> affectDimensions;
    private final Set<String> physioDimensions;
    private final Set<String> baselineDimensions;

    public FusionEngine(Set<String> affectDimensions, Set<String> physioDimensions) {
        this(affectDimensions, physioDimensions, Collections.singleton("neutral"));
    }

    /**
     * @param affectDimensions affect dimensions present on every row from t = 0
     * @param physioDimensions physiological dimensions present on every row from t = 0
     * @param baselineDimensions dimensions ignored when picking a row's dominant dimension
     */
    public FusionEngine(Set<String> affectDimensions, Set<String> physioDimensions, Set<String> baselineDimensions) {
        this.affectDimensions = affectDimensions == null ? Collections.emptySet() : new LinkedHashSet<>(affectDimensions);
        this.physioDimensions = physioDimensions == null ? Collections.emptySet() : new LinkedHashSet<>(physioDimensions);
        this.baselineDimensions = baselineDimensions == null ? Collections.emptySet() : new LinkedHashSet<>(baselineDimensions);
    }

    public List<FusedRow> fuse(
            DiscreteTimeline discrete,
            List<SensorReading> affectStream,
            List<SensorReading> physioStream,
            int durationSec) {
        if (durationSec < 0) {
            throw new IllegalArgumentException("durationSec must be >= 0, got " + durationSec);
        }
        StreamCursor affect = new StreamCursor(affectStream);
        StreamCursor physio = new StreamCursor(physioStream);
        List<SegmentInterval> intervals = discrete == null ? List.of() : discrete.intervals;

        Map<String, Double> affectValues = seed(affectDimensions);
        Map<String, Double> physioValues = seed(physioDimensions);

        List<FusedRow> rows = new ArrayList<>(durationSec);
        int intervalIndex = 0;
        String segment = ChunkStitcher.UNKNOWN_SEGMENT;
        int segmentStart = 0;
        for (int t = 0; t < durationSec; t++) {
            while (intervalIndex < intervals.size() && intervals.get(intervalIndex).endSec <= t) {
                intervalIndex++;
            }
            if (intervalIndex < intervals.size() && intervals.get(intervalIndex).covers(t)) {
                SegmentInterval interval = intervals.get(intervalIndex);
                if (!interval.segmentName.equals(segment) || t == 0) {
                    segmentStart = interval.startSec;
                }
                segment = interval.segmentName;
            }

            applyAffect(affect.advanceTo(t), t, affectValues);
            for (SensorReading reading : physio.advanceTo(t)) {
                physioValues.putAll(reading.values);
            }

            Map<String, Double> values = new TreeMap<>(physioValues);
            values.putAll(affectValues);
            FusedRow row = new FusedRow(t, segment, values, quality(affect, physio, t));
            row.timeInSegmentSec = t - segmentStart;
            row.dominantDimension = dominant(affectValues);
            rows.add(row);
        }
        return rows;
    }

    private static void applyAffect(List<SensorReading> consumed, int t, Map<String, Double> current) {
        Map<String, double[]> sums = new HashMap<>();
        for (SensorReading reading : consumed) {
            if (reading.second() != t) {
                continue;
            }
            for (Map.Entry<String, Double> entry : reading.values.entrySet()) {
                if (entry.getValue() == null) {
                    continue;
                }
                double[] acc = sums.computeIfAbsent(entry.getKey(), k -> new double[2]);
                acc[0] += entry.getValue();
                acc[1] += 1.0;
            }
        }
        for (Map.Entry<String, double[]> entry : sums.entrySet()) {
            current.put(entry.getKey(), entry.getValue()[0] / entry.getValue()[1]);
        }
    }

    /**
     * Sets each row's intent delta: the distance of its target dimension from the midpoint of the
     * acceptable range of the row's segment. Rows of segments without a spec keep 0.
     */
    public static void applyIntentDeltas(List<FusedRow> rows, List<SegmentSpec> specs) {
        if (rows == null) {
            return;
        }
        Map<String, SegmentSpec> byName = new HashMap<>();
        if (specs != null) {
            for (SegmentSpec spec : specs) {
                if (spec != null && spec.name != null) {
                    byName.put(spec.name, spec);
                }
            }
        }
        for (FusedRow row : rows) {
            SegmentSpec spec = byName.get(row.segmentName);
            row.intentDelta = spec == null ? 0.0 : Math.abs(row.value(spec.targetDimension) - spec.midpoint());
        }
    }

    static DataQuality quality(StreamCursor affect, StreamCursor physio, int t) {
        boolean affectFresh = affect.freshAt(t);
        boolean physioFresh = physio.freshAt(t);
        if (affectFresh && physioFresh) {
            return DataQuality.FULL;
        }
        if (affectFresh || physioFresh) {
            return DataQuality.PARTIAL;
        }
        if (t > 0 && affect.ageAt(t) > STALE_AFTER_SEC && physio.ageAt(t) > STALE_AFTER_SEC) {
            return DataQuality.MISSING;
        }
        return DataQuality.PARTIAL;
    }

    private String dominant(Map<String, Double> affectValues) {
        String best = NO_DOMINANT_DIMENSION;
        double bestValue = 0.0;
        for (Map.Entry<String, Double> entry : new TreeMap<>(affectValues).entrySet()) {
            if (baselineDimensions.contains(entry.getKey())) {
                continue;
            }
            if (entry.getValue() > bestValue) {
                best = entry.getKey();
                bestValue = entry.getValue();
            }
        }
        return best;
    }

    private static Map<String, Double> seed(Set<String> dimensions) {
        Map<String, Double> values = new TreeMap<>();
        for (String dimension : dimensions) {
            values.put(dimension, 0.0);
        }
        return values;
    }
}
