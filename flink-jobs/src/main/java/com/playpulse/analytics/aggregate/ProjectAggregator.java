package com.playpulse.analytics.aggregate;

import com.playpulse.analytics.verdict.Outcome;
import com.playpulse.analytics.verdict.Verdict;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Rolls per-session verdicts up into per-segment pain points and a session health trend.
 *
 * <p>Segments are ranked by fail count, then mean deviation (both descending), then name. The result
 * is a pure function of the verdict sets; {@code computedAtMs} is only stamped onto the output.</p>
 */
public final class ProjectAggregator {
    static final Comparator<SegmentRollup> PAIN_POINT_ORDER = Comparator
            .comparingInt((SegmentRollup r) -> r.failCount).reversed()
            .thenComparing(Comparator.comparingDouble((SegmentRollup r) -> r.meanDeviation).reversed())
            .thenComparing(r -> r.segmentName);

    private static final Comparator<SessionVerdicts> TREND_ORDER = Comparator
            .comparingLong((SessionVerdicts s) -> s.finalizedAtMs)
            .thenComparing(s -> s.sessionId);

    private ProjectAggregator() {}

    public static ProjectAggregate aggregate(String projectId, Map<String, List<Verdict>> verdictsBySession) {
        List<SessionVerdicts> sessions = new ArrayList<>();
        if (verdictsBySession != null) {
            for (Map.Entry<String, List<Verdict>> entry : new TreeMap<>(verdictsBySession).entrySet()) {
                sessions.add(new SessionVerdicts(entry.getKey(), 0L, entry.getValue()));
            }
        }
        return aggregate(projectId, sessions, 0L);
    }

    public static ProjectAggregate aggregate(String projectId, Collection<SessionVerdicts> sessions, long computedAtMs) {
        List<SessionVerdicts> ordered = new ArrayList<>();
        if (sessions != null) {
            for (SessionVerdicts session : sessions) {
                if (session != null && session.sessionId != null) {
                    ordered.add(session);
                }
            }
        }
        ordered.sort(TREND_ORDER);

        Map<String, Accumulator> bySegment = new TreeMap<>();
        ProjectAggregate aggregate = new ProjectAggregate();
        aggregate.projectId = projectId;
        aggregate.computedAtMs = computedAtMs;
        aggregate.sessionCount = ordered.size();

        double scoreSum = 0.0;
        for (SessionVerdicts session : ordered) {
            SessionScore score = SessionScorer.score(session.sessionId, session.verdicts);
            score.finalizedAtMs = session.finalizedAtMs;
            aggregate.healthTrend.add(score);
            scoreSum += score.score;
            for (Verdict verdict : session.verdicts) {
                if (verdict == null || verdict.segmentName == null || verdict.outcome == null) {
                    continue;
                }
                bySegment.computeIfAbsent(verdict.segmentName, Accumulator::new).add(session.sessionId, verdict);
            }
        }
        aggregate.meanSessionScore = ordered.isEmpty() ? 0.0 : scoreSum / ordered.size();

        List<SegmentRollup> rollups = new ArrayList<>();
        for (Accumulator accumulator : bySegment.values()) {
            rollups.add(accumulator.toRollup(projectId, computedAtMs));
        }
        rollups.sort(PAIN_POINT_ORDER);
        for (int i = 0; i < rollups.size(); i++) {
            rollups.get(i).rank = i + 1;
        }
        aggregate.segments = rollups;
        return aggregate;
    }

    private static final class Accumulator {
        private final String segmentName;
        private final Set<String> sessions = new HashSet<>();
        private final Map<String, Integer> dominantCounts = new TreeMap<>();
        private String targetDimension;
        private int pass;
        private int warn;
        private int fail;
        private double targetSum;
        private double deviationSum;
        private double timeDeltaSum;

        Accumulator(String segmentName) {
            this.segmentName = segmentName;
        }

        void add(String sessionId, Verdict verdict) {
            sessions.add(sessionId);
            if (targetDimension == null) {
                targetDimension = verdict.targetDimension;
            }
            if (verdict.outcome == Outcome.PASS) {
                pass++;
            } else if (verdict.outcome == Outcome.WARN) {
                warn++;
            } else {
                fail++;
            }
            targetSum += verdict.targetObserved;
            deviationSum += verdict.deviationScore;
            timeDeltaSum += verdict.timeDeltaSec;
            if (verdict.dominantDimension != null) {
                dominantCounts.merge(verdict.dominantDimension, 1, Integer::sum);
            }
        }

        SegmentRollup toRollup(String projectId, long computedAtMs) {
            int occurrences = pass + warn + fail;
            SegmentRollup rollup = new SegmentRollup();
            rollup.projectId = projectId;
            rollup.segmentName = segmentName;
            rollup.targetDimension = targetDimension;
            rollup.passCount = pass;
            rollup.warnCount = warn;
            rollup.failCount = fail;
            rollup.occurrenceCount = occurrences;
            rollup.sessionCount = sessions.size();
            rollup.meanTargetObserved = targetSum / occurrences;
            rollup.meanDeviation = deviationSum / occurrences;
            rollup.meanTimeDeltaSec = timeDeltaSum / occurrences;
            rollup.mostFrequentDominant = mostFrequent();
            rollup.computedAtMs = computedAtMs;
            return rollup;
        }

        private String mostFrequent() {
            String best = null;
            int bestCount = 0;
            for (Map.Entry<String, Integer> entry : dominantCounts.entrySet()) {
                if (entry.getValue() > bestCount) {
                    best = entry.getKey();
                    bestCount = entry.getValue();
                }
            }
            return best;
        }
    }
}
