package com.playpulse.analytics.verdict;

import com.playpulse.analytics.fusion.FusedRow;
import com.playpulse.analytics.model.SegmentSpec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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
 * Scores every segment occurrence of a fused timeline against the project's segment specs.
 *
 * <p>Outcome rules, first match wins:
 * <ol>
 *   <li>target average within the acceptable range: PASS</li>
 *   <li>dominant dimension is the target and deviation below {@link #WARN_DEVIATION}: WARN</li>
 *   <li>another dimension dominates by more than {@link #FAIL_DOMINANCE_MARGIN}: FAIL</li>
 *   <li>otherwise: WARN</li>
 * </ol>
 * Occurrences of segments without a spec (including the unknown sentinel) are not scored.</p>
 */
public class VerdictEngine implements Serializable {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(VerdictEngine.class);

    public static final double WARN_DEVIATION = 0.25;
    public static final double FAIL_DOMINANCE_MARGIN = 0.2;
    public static final String NO_DOMINANT_DIMENSION = "none";

    private final Set<String> excludedFromDominance;

    public VerdictEngine(Set<String> excludedFromDominance) {
        this.excludedFromDominance = excludedFromDominance == null
                ? Collections.emptySet()
                : new LinkedHashSet<>(excludedFromDominance);
    }

    public List<Verdict> score(List<FusedRow> fused, List<SegmentSpec> specs) {
        Map<String, SegmentSpec> specsByName = indexSpecs(specs);
        List<Verdict> verdicts = new ArrayList<>();
        int unscored = 0;
        for (SegmentOccurrence occurrence : occurrences(fused)) {
            SegmentSpec spec = specsByName.get(occurrence.segmentName);
            if (spec == null) {
                unscored++;
                continue;
            }
            verdicts.add(scoreOccurrence(occurrence, spec));
        }
        if (unscored > 0) {
            LOG.warn("Skipped {} occurrence(s) of segments without a spec (scored={})", unscored, verdicts.size());
        }
        return verdicts;
    }

    /**
     * Splits rows into contiguous runs; each run is numbered per segment name from 0.
     */
    public static List<SegmentOccurrence> occurrences(List<FusedRow> fused) {
        List<SegmentOccurrence> occurrences = new ArrayList<>();
        if (fused == null) {
            return occurrences;
        }
        Map<String, Integer> seen = new HashMap<>();
        SegmentOccurrence current = null;
        for (FusedRow row : fused) {
            if (current == null || !current.segmentName.equals(row.segmentName)) {
                int index = seen.merge(row.segmentName, 1, Integer::sum) - 1;
                current = new SegmentOccurrence(row.segmentName, index);
                occurrences.add(current);
            }
            current.rows.add(row);
        }
        return occurrences;
    }

    Verdict scoreOccurrence(SegmentOccurrence occurrence, SegmentSpec spec) {
        Map<String, Double> averages = observedAverages(occurrence.rows);
        double targetObserved = averages.getOrDefault(spec.targetDimension, 0.0);
        String dominant = dominantDimension(averages);

        Verdict verdict = new Verdict();
        verdict.segmentName = occurrence.segmentName;
        verdict.occurrenceIndex = occurrence.occurrenceIndex;
        verdict.startSec = occurrence.startSec();
        verdict.endSec = occurrence.endSec();
        verdict.observedAvg = averages;
        verdict.targetDimension = spec.targetDimension;
        verdict.targetObserved = targetObserved;
        verdict.dominantDimension = dominant;
        verdict.deviationScore = deviation(targetObserved, spec);
        verdict.actualDurationSec = occurrence.durationSec();
        verdict.expectedDurationSec = spec.expectedDurationSec;
        verdict.timeDeltaSec = verdict.actualDurationSec - spec.expectedDurationSec;
        verdict.outcome = outcome(spec, targetObserved, dominant, averages.getOrDefault(dominant, 0.0), verdict.deviationScore);
        return verdict;
    }

    /**
     * Zero inside the acceptable range; otherwise the distance from the range midpoint, normalized by
     * the midpoint's distance to the far end of [0, 1] and clamped to [0, 1].
     */
    static double deviation(double observed, SegmentSpec spec) {
        if (spec.inRange(observed)) {
            return 0.0;
        }
        double mid = spec.midpoint();
        double scale = Math.max(mid, 1.0 - mid);
        if (scale <= 0.0) {
            return 0.0;
        }
        double raw = Math.abs(observed - mid) / scale;
        return Math.min(1.0, Math.max(0.0, raw));
    }

    static Outcome outcome(SegmentSpec spec, double targetObserved, String dominant, double dominantObserved, double deviation) {
        if (spec.inRange(targetObserved)) {
            return Outcome.PASS;
        }
        boolean targetDominates = spec.targetDimension.equals(dominant);
        if (targetDominates && deviation < WARN_DEVIATION) {
            return Outcome.WARN;
        }
        if (!targetDominates && !NO_DOMINANT_DIMENSION.equals(dominant)
                && dominantObserved - targetObserved > FAIL_DOMINANCE_MARGIN) {
            return Outcome.FAIL;
        }
        return Outcome.WARN;
    }

    private static Map<String, Double> observedAverages(List<FusedRow> rows) {
        Map<String, double[]> sums = new TreeMap<>();
        for (FusedRow row : rows) {
            for (Map.Entry<String, Double> entry : row.values.entrySet()) {
                if (entry.getValue() == null) {
                    continue;
                }
                double[] acc = sums.computeIfAbsent(entry.getKey(), k -> new double[2]);
                acc[0] += entry.getValue();
                acc[1] += 1.0;
            }
        }
        Map<String, Double> averages = new TreeMap<>();
        for (Map.Entry<String, double[]> entry : sums.entrySet()) {
            averages.put(entry.getKey(), entry.getValue()[0] / entry.getValue()[1]);
        }
        return averages;
    }

    // Sorted iteration with a strict comparison keeps the alphabetically first dimension on ties.
    private String dominantDimension(Map<String, Double> averages) {
        String best = NO_DOMINANT_DIMENSION;
        double bestValue = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> entry : averages.entrySet()) {
            if (excludedFromDominance.contains(entry.getKey())) {
                continue;
            }
            if (entry.getValue() > bestValue) {
                best = entry.getKey();
                bestValue = entry.getValue();
            }
        }
        return best;
    }

    private static Map<String, SegmentSpec> indexSpecs(List<SegmentSpec> specs) {
        Map<String, SegmentSpec> byName = new HashMap<>();
        if (specs == null) {
            return byName;
        }
        for (SegmentSpec spec : specs) {
            if (spec == null || spec.name == null) {
                continue;
            }
            if (byName.putIfAbsent(spec.name, spec) != null) {
                throw new IllegalArgumentException("Duplicate segment spec name: " + spec.name);
            }
        }
        return byName;
    }
}
