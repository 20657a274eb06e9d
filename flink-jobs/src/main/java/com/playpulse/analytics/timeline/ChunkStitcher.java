package com.playpulse.analytics.timeline;

import com.playpulse.analytics.model.ChunkObservation;
import com.playpulse.analytics.util.SessionKey;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges chunk observations, received in completion order, into one discrete timeline.
 *
 * <p>Merge rules:
 * - Chunks are ordered by window start (then window index, then completion order) before merging.
 * - Each observed state claims whole seconds from its offset up to the next state's offset; the last
 *   state of a chunk runs to the end of the window.
 * - On overlap the later-ordered chunk wins, unless its claim is below {@link #CONFIDENCE_FLOOR} and the
 *   existing claim is not.
 * - Unclaimed seconds inherit the preceding second's segment; a leading gap is {@link #UNKNOWN_SEGMENT}.
 * - Point events are deduplicated on (label, rounded timestamp). Higher severity wins, then first seen.
 * </p>
 *
 * <p>The stitcher holds no state and is called once per finalization.</p>
 */
public final class ChunkStitcher {
    public static final String UNKNOWN_SEGMENT = "unknown";
    public static final double CONFIDENCE_FLOOR = 0.5;

    private static final Comparator<Ranked> WINDOW_ORDER = Comparator
            .comparingDouble((Ranked r) -> r.chunk.windowStartSec)
            .thenComparingInt(r -> r.chunk.windowIndex)
            .thenComparingInt(r -> r.completionOrder);

    private ChunkStitcher() {}

    /**
     * Stitches with the duration implied by the latest window end.
     */
    public static DiscreteTimeline stitch(List<ChunkObservation> chunksInCompletionOrder) {
        return stitch(chunksInCompletionOrder, impliedDurationSec(chunksInCompletionOrder));
    }

    public static DiscreteTimeline stitch(List<ChunkObservation> chunksInCompletionOrder, int durationSec) {
        if (durationSec < 0) {
            throw new IllegalArgumentException("durationSec must be >= 0, got " + durationSec);
        }
        List<ChunkObservation> chunks = chunksInCompletionOrder == null ? List.of() : chunksInCompletionOrder;

        List<Ranked> ordered = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            if (chunks.get(i) != null) {
                ordered.add(new Ranked(chunks.get(i), i));
            }
        }
        ordered.sort(WINDOW_ORDER);

        Claim[] claims = new Claim[durationSec];
        for (Ranked ranked : ordered) {
            applyClaims(claims, ranked.chunk, durationSec);
        }

        return new DiscreteTimeline(durationSec, toIntervals(claims), mergeEvents(chunks, durationSec));
    }

    /**
     * Ceiling of the latest window end, 0 when there are no chunks.
     */
    public static int impliedDurationSec(List<ChunkObservation> chunks) {
        double maxEnd = 0.0;
        if (chunks != null) {
            for (ChunkObservation chunk : chunks) {
                if (chunk != null) {
                    maxEnd = Math.max(maxEnd, chunk.windowEndSec);
                }
            }
        }
        return (int) Math.ceil(maxEnd);
    }

    private static void applyClaims(Claim[] claims, ChunkObservation chunk, int durationSec) {
        if (chunk.statesObserved == null || chunk.statesObserved.isEmpty()) {
            return;
        }
        List<ChunkObservation.StateObservation> states = new ArrayList<>(chunk.statesObserved);
        states.sort(Comparator.comparingDouble(s -> s.offsetSec));

        int windowFrom = (int) Math.floor(chunk.windowStartSec);
        int windowTo = (int) Math.ceil(chunk.windowEndSec);
        for (int i = 0; i < states.size(); i++) {
            ChunkObservation.StateObservation state = states.get(i);
            if (SessionKey.isMissing(state.segmentName)) {
                continue;
            }
            int from = (int) Math.floor(chunk.windowStartSec + state.offsetSec);
            int to = i + 1 < states.size()
                    ? (int) Math.floor(chunk.windowStartSec + states.get(i + 1).offsetSec)
                    : windowTo;
            from = Math.max(Math.max(from, windowFrom), 0);
            to = Math.min(Math.min(to, windowTo), durationSec);
            Claim claim = new Claim(state.segmentName, state.confidence);
            for (int t = from; t < to; t++) {
                if (wins(claim, claims[t])) {
                    claims[t] = claim;
                }
            }
        }
    }

    // Claims arrive in window order, so the challenger always starts no earlier than the holder.
    static boolean wins(Claim challenger, Claim holder) {
        if (holder == null) {
            return true;
        }
        return !(challenger.confidence < CONFIDENCE_FLOOR && holder.confidence >= CONFIDENCE_FLOOR);
    }

    private static List<SegmentInterval> toIntervals(Claim[] claims) {
        List<SegmentInterval> intervals = new ArrayList<>();
        String previous = null;
        for (int t = 0; t < claims.length; t++) {
            String segment;
            if (claims[t] != null) {
                segment = claims[t].segmentName;
            } else {
                segment = previous == null ? UNKNOWN_SEGMENT : previous;
            }
            if (segment.equals(previous)) {
                intervals.get(intervals.size() - 1).endSec = t + 1;
            } else {
                intervals.add(new SegmentInterval(segment, t, t + 1));
            }
            previous = segment;
        }
        return intervals;
    }

    private static List<PointEvent> mergeEvents(List<ChunkObservation> chunksInCompletionOrder, int durationSec) {
        Map<String, PointEvent> byKey = new LinkedHashMap<>();
        for (ChunkObservation chunk : chunksInCompletionOrder) {
            if (chunk == null || chunk.pointEvents == null) {
                continue;
            }
            for (ChunkObservation.ObservedEvent observed : chunk.pointEvents) {
                if (observed == null || SessionKey.isMissing(observed.label) || observed.severity == null) {
                    continue;
                }
                double ts = chunk.windowStartSec + observed.offsetSec;
                if (ts < 0 || ts >= durationSec) {
                    continue;
                }
                String key = observed.label + "|" + Math.round(ts);
                PointEvent existing = byKey.get(key);
                if (existing == null || observed.severity.outranks(existing.severity)) {
                    byKey.put(key, new PointEvent(observed.label, observed.severity, ts));
                }
            }
        }
        List<PointEvent> events = new ArrayList<>(byKey.values());
        events.sort(Comparator.comparingDouble(e -> e.timestampSec));
        return events;
    }

    static final class Claim {
        final String segmentName;
        final double confidence;

        Claim(String segmentName, double confidence) {
            this.segmentName = segmentName;
            this.confidence = confidence;
        }
    }

    private static final class Ranked {
        final ChunkObservation chunk;
        final int completionOrder;

        Ranked(ChunkObservation chunk, int completionOrder) {
            this.chunk = chunk;
            this.completionOrder = completionOrder;
        }
    }
}
