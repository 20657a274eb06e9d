package com.playpulse.analytics.timeline;

import com.playpulse.analytics.model.ChunkObservation;
import com.playpulse.analytics.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChunkStitcherTest {

    @Test
    void laterConfidentChunkWinsOverlap() {
        ChunkObservation first = chunk(0, 0.0, 10.0, state("X", 0.9, 0.0));
        ChunkObservation second = chunk(1, 5.0, 15.0, state("Y", 0.8, 0.0));

        DiscreteTimeline timeline = ChunkStitcher.stitch(Arrays.asList(first, second), 15);

        assertEquals(Arrays.asList(
                new SegmentInterval("X", 0, 5),
                new SegmentInterval("Y", 5, 15)), timeline.intervals);
    }

    @Test
    void confidentLaterWindowOverridesEarlierLowConfidenceClaim() {
        ChunkObservation a = chunk(0, 5.0, 15.0, state("X", 0.4, 5.0));
        ChunkObservation b = chunk(1, 8.0, 15.0, state("Y", 0.9, 2.0));

        // b completes first; window order still applies a before b.
        DiscreteTimeline timeline = ChunkStitcher.stitch(Arrays.asList(b, a), 15);

        assertEquals(Arrays.asList(
                new SegmentInterval(ChunkStitcher.UNKNOWN_SEGMENT, 0, 10),
                new SegmentInterval("Y", 10, 15)), timeline.intervals);
        for (int t = 10; t < 15; t++) {
            assertEquals("Y", timeline.segmentAt(t));
        }
    }

    @Test
    void lowConfidenceClaimDoesNotOverrideConfidentOne() {
        ChunkObservation first = chunk(0, 0.0, 10.0, state("X", 0.9, 0.0));
        ChunkObservation second = chunk(1, 5.0, 15.0, state("Y", 0.3, 0.0));

        DiscreteTimeline timeline = ChunkStitcher.stitch(Arrays.asList(first, second), 15);

        assertEquals(Arrays.asList(
                new SegmentInterval("X", 0, 10),
                new SegmentInterval("Y", 10, 15)), timeline.intervals);
    }

    @Test
    void degradedChunkIsOverriddenByConfidentNeighbour() {
        ChunkObservation degraded = chunk(0, 0.0, 10.0, state("menu", 0.0, 0.0));
        degraded.degraded = true;
        ChunkObservation next = chunk(1, 5.0, 10.0, state("level_1", 0.7, 0.0));

        DiscreteTimeline timeline = ChunkStitcher.stitch(Arrays.asList(degraded, next), 10);

        assertEquals("menu", timeline.segmentAt(4));
        assertEquals("level_1", timeline.segmentAt(5));
    }

    @Test
    void multipleStatesSplitWindowAtOffsets() {
        ChunkObservation chunk = chunk(0, 0.0, 12.0,
                state("B", 0.9, 4.5),
                state("A", 0.9, 0.0));

        DiscreteTimeline timeline = ChunkStitcher.stitch(Collections.singletonList(chunk), 12);

        assertEquals(Arrays.asList(
                new SegmentInterval("A", 0, 4),
                new SegmentInterval("B", 4, 12)), timeline.intervals);
    }

    @Test
    void zeroChunksYieldSingleUnknownInterval() {
        DiscreteTimeline timeline = ChunkStitcher.stitch(new ArrayList<>(), 7);

        assertEquals(Collections.singletonList(new SegmentInterval(ChunkStitcher.UNKNOWN_SEGMENT, 0, 7)), timeline.intervals);
        assertTrue(timeline.events.isEmpty());
    }

    @Test
    void gapsAreForwardFilledAndLeadingGapIsUnknown() {
        ChunkObservation first = chunk(0, 2.0, 4.0, state("X", 0.9, 0.0));
        ChunkObservation second = chunk(1, 8.0, 10.0, state("Y", 0.9, 0.0));

        DiscreteTimeline timeline = ChunkStitcher.stitch(Arrays.asList(first, second), 12);

        assertEquals(Arrays.asList(
                new SegmentInterval(ChunkStitcher.UNKNOWN_SEGMENT, 0, 2),
                new SegmentInterval("X", 2, 8),
                new SegmentInterval("Y", 8, 12)), timeline.intervals);
    }

    @Test
    void intervalsCoverDurationWithoutGapsOrOverlaps() {
        List<ChunkObservation> chunks = Arrays.asList(
                chunk(0, 0.0, 9.5, state("a", 0.6, 0.0), state("b", 0.4, 3.0)),
                chunk(1, 7.0, 18.0, state("c", 0.9, 1.0)),
                chunk(2, 16.0, 25.0, state("a", 0.2, 0.0)));

        DiscreteTimeline timeline = ChunkStitcher.stitch(chunks, 30);

        int expectedStart = 0;
        for (SegmentInterval interval : timeline.intervals) {
            assertEquals(expectedStart, interval.startSec);
            assertTrue(interval.endSec > interval.startSec);
            expectedStart = interval.endSec;
        }
        assertEquals(30, expectedStart);
        for (int i = 1; i < timeline.intervals.size(); i++) {
            assertNotEquals(timeline.intervals.get(i - 1).segmentName, timeline.intervals.get(i).segmentName);
        }
    }

    @Test
    void completionOrderDoesNotMatterForDistinctWindowStarts() {
        ChunkObservation a = chunk(0, 0.0, 10.0, state("X", 0.9, 0.0));
        ChunkObservation b = chunk(1, 8.0, 20.0, state("Y", 0.9, 0.0));
        ChunkObservation c = chunk(2, 15.0, 25.0, state("Z", 0.9, 0.0));

        DiscreteTimeline inOrder = ChunkStitcher.stitch(Arrays.asList(a, b, c), 25);
        DiscreteTimeline shuffled = ChunkStitcher.stitch(Arrays.asList(c, a, b), 25);

        assertEquals(inOrder.intervals, shuffled.intervals);
    }

    @Test
    void equalWindowStartsFallBackToWindowIndex() {
        ChunkObservation low = chunk(3, 0.0, 10.0, state("X", 0.9, 0.0));
        ChunkObservation high = chunk(4, 0.0, 10.0, state("Y", 0.9, 0.0));

        DiscreteTimeline timeline = ChunkStitcher.stitch(Arrays.asList(high, low), 10);

        assertEquals(Collections.singletonList(new SegmentInterval("Y", 0, 10)), timeline.intervals);
    }

    @Test
    void pointEventsDedupOnLabelAndRoundedTimestampKeepingHigherSeverity() {
        ChunkObservation first = chunk(0, 0.0, 10.0, state("X", 0.9, 0.0));
        first.pointEvents.add(new ChunkObservation.ObservedEvent("death", Severity.INFO, 3.2));
        first.pointEvents.add(new ChunkObservation.ObservedEvent("softlock", Severity.WARNING, 8.0));
        ChunkObservation second = chunk(1, 2.0, 12.0, state("X", 0.9, 0.0));
        second.pointEvents.add(new ChunkObservation.ObservedEvent("death", Severity.CRITICAL, 0.9));
        second.pointEvents.add(new ChunkObservation.ObservedEvent("death", Severity.INFO, 7.0));

        DiscreteTimeline timeline = ChunkStitcher.stitch(Arrays.asList(first, second), 12);

        assertEquals(3, timeline.events.size());
        PointEvent death = timeline.events.get(0);
        assertEquals("death", death.label);
        assertEquals(Severity.CRITICAL, death.severity);
        assertEquals(2.9, death.timestampSec, 1e-9);
        assertEquals("softlock", timeline.events.get(1).label);
        assertEquals("death", timeline.events.get(2).label);
        assertEquals(9.0, timeline.events.get(2).timestampSec, 1e-9);
    }

    @Test
    void eventsOutsideTimelineAreDropped() {
        ChunkObservation chunk = chunk(0, 0.0, 10.0, state("X", 0.9, 0.0));
        chunk.pointEvents.add(new ChunkObservation.ObservedEvent("late", Severity.INFO, 9.5));

        DiscreteTimeline timeline = ChunkStitcher.stitch(Collections.singletonList(chunk), 8);

        assertTrue(timeline.events.isEmpty());
        assertEquals(8, timeline.intervals.get(timeline.intervals.size() - 1).endSec);
    }

    @Test
    void impliedDurationIsCeilingOfLatestWindowEnd() {
        assertEquals(0, ChunkStitcher.impliedDurationSec(new ArrayList<>()));
        assertEquals(13, ChunkStitcher.impliedDurationSec(Arrays.asList(
                chunk(0, 0.0, 12.2), chunk(1, 5.0, 9.0))));
    }

    @Test
    void negativeDurationIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ChunkStitcher.stitch(new ArrayList<>(), -1));
    }

    @Test
    void claimRuleKeepsConfidentHolderAgainstWeakChallenger() {
        ChunkStitcher.Claim strong = new ChunkStitcher.Claim("X", 0.9);
        ChunkStitcher.Claim weak = new ChunkStitcher.Claim("Y", 0.1);

        assertTrue(ChunkStitcher.wins(weak, null));
        assertFalse(ChunkStitcher.wins(weak, strong));
        assertTrue(ChunkStitcher.wins(strong, weak));
        assertTrue(ChunkStitcher.wins(new ChunkStitcher.Claim("Z", 0.2), weak));
    }

    static ChunkObservation chunk(int index, double start, double end, ChunkObservation.StateObservation... states) {
        ChunkObservation chunk = new ChunkObservation();
        chunk.sessionId = "sess-1";
        chunk.windowIndex = index;
        chunk.windowStartSec = start;
        chunk.windowEndSec = end;
        chunk.statesObserved.addAll(Arrays.asList(states));
        return chunk;
    }

    static ChunkObservation.StateObservation state(String name, double confidence, double offset) {
        return new ChunkObservation.StateObservation(name, confidence, offset);
    }
}
