package com.playpulse.analytics.fusion;

import com.playpulse.analytics.model.SegmentSpec;
import com.playpulse.analytics.model.SensorReading;
import com.playpulse.analytics.model.SensorStream;
import com.playpulse.analytics.timeline.DiscreteTimeline;
import com.playpulse.analytics.timeline.SegmentInterval;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FusionEngineTest {
    private static final Set<String> AFFECT = new LinkedHashSet<>(Arrays.asList("frustration", "delight", "neutral"));
    private static final Set<String> PHYSIO = new LinkedHashSet<>(Collections.singletonList("heart_rate"));

    private final FusionEngine engine = new FusionEngine(AFFECT, PHYSIO);

    @Test
    void emitsOneRowPerSecondWithSegmentFromTimeline() {
        DiscreteTimeline timeline = timeline(6, new SegmentInterval("menu", 0, 3), new SegmentInterval("level_1", 3, 6));

        List<FusedRow> rows = engine.fuse(timeline, List.of(), List.of(), 6);

        assertEquals(6, rows.size());
        for (int t = 0; t < 6; t++) {
            assertEquals(t, rows.get(t).t);
        }
        assertEquals("menu", rows.get(2).segmentName);
        assertEquals("level_1", rows.get(3).segmentName);
        assertEquals(0, rows.get(3).timeInSegmentSec);
        assertEquals(2, rows.get(5).timeInSegmentSec);
    }

    @Test
    void intentDeltaMeasuresTargetAgainstRangeMidpoint() {
        FusedRow inBoss = new FusedRow(0, "boss_fight", Map.of("frustration", 0.9), DataQuality.FULL);
        FusedRow unspecced = new FusedRow(1, "unknown", Map.of("frustration", 0.9), DataQuality.FULL);
        FusedRow targetAbsent = new FusedRow(2, "boss_fight", Map.of("delight", 0.4), DataQuality.PARTIAL);

        FusionEngine.applyIntentDeltas(List.of(inBoss, unspecced, targetAbsent),
                List.of(new SegmentSpec("boss_fight", "frustration", 0.5, 0.7, 30)));

        assertEquals(0.3, inBoss.intentDelta, 1e-9);
        assertEquals(0.0, unspecced.intentDelta);
        assertEquals(0.6, targetAbsent.intentDelta, 1e-9);
    }

    @Test
    void configuredDimensionsStartAtZero() {
        List<FusedRow> rows = engine.fuse(timeline(2, new SegmentInterval("menu", 0, 2)), List.of(), List.of(), 2);

        Map<String, Double> values = rows.get(0).values;
        assertEquals(0.0, values.get("frustration"));
        assertEquals(0.0, values.get("delight"));
        assertEquals(0.0, values.get("heart_rate"));
        assertEquals(FusionEngine.NO_DOMINANT_DIMENSION, rows.get(0).dominantDimension);
    }

    @Test
    void affectIsMeanOfSameSecondReadingsThenForwardFilled() {
        List<SensorReading> affect = Arrays.asList(
                affect(1.1, Map.of("frustration", 0.2)),
                affect(1.7, Map.of("frustration", 0.6)),
                affect(0.0, Map.of("frustration", 0.1)));

        List<FusedRow> rows = engine.fuse(timeline(4, new SegmentInterval("x", 0, 4)), affect, List.of(), 4);

        assertEquals(0.1, rows.get(0).value("frustration"), 1e-9);
        assertEquals(0.4, rows.get(1).value("frustration"), 1e-9);
        assertEquals(0.4, rows.get(3).value("frustration"), 1e-9);
    }

    @Test
    void physioTakesLastReadingAtOrBeforeSecond() {
        List<SensorReading> physio = Arrays.asList(
                physio(3.2, 0.7),
                physio(0.5, 0.5),
                physio(3.9, 0.8));

        List<FusedRow> rows = engine.fuse(timeline(6, new SegmentInterval("x", 0, 6)), List.of(), physio, 6);

        assertEquals(0.5, rows.get(0).value("heart_rate"), 1e-9);
        assertEquals(0.5, rows.get(2).value("heart_rate"), 1e-9);
        assertEquals(0.8, rows.get(3).value("heart_rate"), 1e-9);
        assertEquals(0.8, rows.get(5).value("heart_rate"), 1e-9);
    }

    @Test
    void fullOnlyWhenBothStreamsFresh() {
        List<SensorReading> affect = Arrays.asList(affect(0.2, Map.of("delight", 0.5)), affect(1.2, Map.of("delight", 0.5)));
        List<SensorReading> physio = Collections.singletonList(physio(0.4, 0.6));

        List<FusedRow> rows = engine.fuse(timeline(3, new SegmentInterval("x", 0, 3)), affect, physio, 3);

        assertEquals(DataQuality.FULL, rows.get(0).dataQuality);
        assertEquals(DataQuality.PARTIAL, rows.get(1).dataQuality);
        assertEquals(DataQuality.PARTIAL, rows.get(2).dataQuality);
    }

    @Test
    void emptyPhysioStreamNeverYieldsFullRows() {
        List<SensorReading> affect = new ArrayList<>();
        for (int t = 0; t < 10; t++) {
            affect.add(affect(t + 0.5, Map.of("frustration", 0.3)));
        }

        List<FusedRow> rows = engine.fuse(timeline(10, new SegmentInterval("x", 0, 10)), affect, List.of(), 10);

        assertEquals(10, rows.size());
        for (FusedRow row : rows) {
            assertEquals(DataQuality.PARTIAL, row.dataQuality);
            assertEquals(0.0, row.value("heart_rate"));
        }
    }

    @Test
    void rowsBecomeMissingOnceBothStreamsAreStale() {
        List<SensorReading> affect = Collections.singletonList(affect(0.0, Map.of("frustration", 0.3)));

        List<FusedRow> rows = engine.fuse(timeline(10, new SegmentInterval("x", 0, 10)), affect, List.of(), 10);

        assertEquals(DataQuality.PARTIAL, rows.get(0).dataQuality);
        assertEquals(DataQuality.PARTIAL, rows.get(FusionEngine.STALE_AFTER_SEC).dataQuality);
        assertEquals(DataQuality.MISSING, rows.get(FusionEngine.STALE_AFTER_SEC + 1).dataQuality);
        assertEquals(0.3, rows.get(9).value("frustration"), 1e-9);
    }

    @Test
    void firstSecondIsNeverMissing() {
        List<FusedRow> rows = engine.fuse(timeline(8, new SegmentInterval("x", 0, 8)), List.of(), List.of(), 8);

        assertEquals(DataQuality.PARTIAL, rows.get(0).dataQuality);
        assertEquals(DataQuality.MISSING, rows.get(1).dataQuality);
    }

    @Test
    void dominantDimensionIgnoresBaselineAndPhysio() {
        List<SensorReading> affect = Collections.singletonList(affect(0.0, Map.of("neutral", 0.9, "delight", 0.3)));
        List<SensorReading> physio = Collections.singletonList(physio(0.0, 0.95));

        List<FusedRow> rows = engine.fuse(timeline(1, new SegmentInterval("x", 0, 1)), affect, physio, 1);

        assertEquals("delight", rows.get(0).dominantDimension);
    }

    @Test
    void segmentIsForwardFilledPastTimelineEnd() {
        List<FusedRow> rows = engine.fuse(timeline(3, new SegmentInterval("boss_fight", 0, 3)), List.of(), List.of(), 5);

        assertEquals(5, rows.size());
        assertEquals("boss_fight", rows.get(4).segmentName);
    }

    @Test
    void fusionIsDeterministic() {
        List<SensorReading> affect = Arrays.asList(
                affect(0.3, Map.of("frustration", 0.2, "delight", 0.4)),
                affect(2.5, Map.of("frustration", 0.7)));
        List<SensorReading> physio = Arrays.asList(physio(1.0, 0.4), physio(4.4, 0.6));
        DiscreteTimeline timeline = timeline(6, new SegmentInterval("a", 0, 2), new SegmentInterval("b", 2, 6));

        List<FusedRow> first = engine.fuse(timeline, affect, physio, 6);
        List<FusedRow> second = engine.fuse(timeline, new ArrayList<>(affect), new ArrayList<>(physio), 6);

        for (int t = 0; t < 6; t++) {
            assertEquals(first.get(t).values, second.get(t).values);
            assertEquals(first.get(t).dataQuality, second.get(t).dataQuality);
            assertEquals(first.get(t).segmentName, second.get(t).segmentName);
        }
    }

    @Test
    void zeroDurationYieldsNoRows() {
        assertTrue(engine.fuse(timeline(0), List.of(), List.of(), 0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> engine.fuse(timeline(0), List.of(), List.of(), -1));
    }

    private static DiscreteTimeline timeline(int duration, SegmentInterval... intervals) {
        return new DiscreteTimeline(duration, new ArrayList<>(Arrays.asList(intervals)), new ArrayList<>());
    }

    private static SensorReading affect(double ts, Map<String, Double> values) {
        return new SensorReading("sess-1", SensorStream.AFFECT, ts, values);
    }

    private static SensorReading physio(double ts, double heartRate) {
        return new SensorReading("sess-1", SensorStream.PHYSIO, ts, Map.of("heart_rate", heartRate));
    }
}
