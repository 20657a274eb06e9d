package com.playpulse.analytics.session;

import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.streaming.util.KeyedOneInputStreamOperatorTestHarness;
import org.apache.flink.streaming.util.ProcessFunctionTestHarnesses;
import org.junit.jupiter.api.Test;

import com.playpulse.analytics.catalog.SegmentSpecCatalog;
import com.playpulse.analytics.model.ChunkObservation;
import com.playpulse.analytics.model.FinalizeRequest;
import com.playpulse.analytics.model.SegmentSpec;
import com.playpulse.analytics.model.SensorReading;
import com.playpulse.analytics.model.SensorStream;
import com.playpulse.analytics.quality.FusionJobConfig;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SessionFinalizeFunctionTest {
    private static final SegmentSpecCatalog CATALOG = new SegmentSpecCatalog(
            "test",
            List.of(new SegmentSpec("tutorial", "engagement", 0.4, 0.8, 30)),
            Map.of("demo", List.of(new SegmentSpec("menu", "delight", 0.4, 0.6, 10))));

    @Test
    void finalizeEmitsScoredSessionFromRetainedState() throws Exception {
        try (KeyedOneInputStreamOperatorTestHarness<String, SessionSignal, SessionFinalization> harness = harness()) {
            harness.open();

            harness.processElement(chunkSignal("s1", SessionFinalizerTest.chunk(0, 0, 10, "menu")), 1L);
            for (int t = 0; t < 10; t++) {
                harness.processElement(readingSignal("s1", t + 0.5, 0.5), 2L);
            }
            harness.processElement(finalizeSignal("s1", "demo", null, 5_000L), 3L);

            List<SessionFinalization> out = harness.extractOutputValues();
            assertEquals(1, out.size());
            SessionFinalization finalization = out.get(0);
            assertEquals(FinalizationStatus.COMPLETED, finalization.status);
            assertEquals(1L, finalization.finalizationVersion);
            assertEquals(5_000L, finalization.finalizedAtMs);
            assertEquals("demo", finalization.projectId);
            assertEquals(10, finalization.durationSec);
            assertEquals("menu", finalization.specs.get(0).name);
            assertEquals(1, finalization.verdicts.size());
        }
    }

    @Test
    void lateChunkAndSecondFinalizeBumpVersion() throws Exception {
        try (KeyedOneInputStreamOperatorTestHarness<String, SessionSignal, SessionFinalization> harness = harness()) {
            harness.open();

            harness.processElement(chunkSignal("s1", SessionFinalizerTest.chunk(0, 0, 10, "menu")), 1L);
            harness.processElement(finalizeSignal("s1", "demo", null, 5_000L), 2L);
            harness.processElement(chunkSignal("s1", SessionFinalizerTest.chunk(1, 10, 20, "menu")), 3L);
            harness.processElement(finalizeSignal("s1", "demo", null, 9_000L), 4L);

            List<SessionFinalization> out = harness.extractOutputValues();
            assertEquals(2, out.size());
            assertEquals(1L, out.get(0).finalizationVersion);
            assertEquals(10, out.get(0).durationSec);
            assertEquals(2L, out.get(1).finalizationVersion);
            assertEquals(20, out.get(1).durationSec);
            assertEquals(9_000L, out.get(1).finalizedAtMs);
        }
    }

    @Test
    void requestSegmentsOverrideCatalog() throws Exception {
        try (KeyedOneInputStreamOperatorTestHarness<String, SessionSignal, SessionFinalization> harness = harness()) {
            harness.open();

            harness.processElement(chunkSignal("s1", SessionFinalizerTest.chunk(0, 0, 5, "boss_fight")), 1L);
            List<SegmentSpec> snapshot = List.of(new SegmentSpec("boss_fight", "frustration", 0.3, 0.7, 5));
            harness.processElement(finalizeSignal("s1", "demo", snapshot, 5_000L), 2L);

            SessionFinalization finalization = harness.extractOutputValues().get(0);
            assertEquals(1, finalization.specs.size());
            assertEquals("boss_fight", finalization.specs.get(0).name);
            assertEquals(1, finalization.verdicts.size());
        }
    }

    @Test
    void unknownProjectFallsBackToCatalogDefaults() throws Exception {
        try (KeyedOneInputStreamOperatorTestHarness<String, SessionSignal, SessionFinalization> harness = harness()) {
            harness.open();

            harness.processElement(chunkSignal("s2", SessionFinalizerTest.chunk(0, 0, 5, "tutorial")), 1L);
            harness.processElement(finalizeSignal("s2", "other-project", null, 5_000L), 2L);

            SessionFinalization finalization = harness.extractOutputValues().get(0);
            assertEquals("tutorial", finalization.specs.get(0).name);
        }
    }

    @Test
    void finalizeWithoutDataIsInsufficient() throws Exception {
        try (KeyedOneInputStreamOperatorTestHarness<String, SessionSignal, SessionFinalization> harness = harness()) {
            harness.open();

            harness.processElement(finalizeSignal("s3", "demo", null, 5_000L), 1L);

            SessionFinalization finalization = harness.extractOutputValues().get(0);
            assertEquals(FinalizationStatus.INSUFFICIENT_DATA, finalization.status);
            assertEquals(1L, finalization.finalizationVersion);
        }
    }

    private static KeyedOneInputStreamOperatorTestHarness<String, SessionSignal, SessionFinalization> harness()
            throws Exception {
        SessionFinalizeFunction function = new SessionFinalizeFunction(FusionJobConfig.fromEnv(), CATALOG);
        return ProcessFunctionTestHarnesses.forKeyedProcessFunction(
                function,
                (SessionSignal signal) -> signal.sessionId,
                Types.STRING);
    }

    private static SessionSignal chunkSignal(String sessionId, ChunkObservation chunk) {
        SessionSignal signal = base(sessionId, SessionSignal.SignalType.CHUNK);
        chunk.sessionId = sessionId;
        signal.chunk = chunk;
        return signal;
    }

    private static SessionSignal readingSignal(String sessionId, double ts, double delight) {
        SessionSignal signal = base(sessionId, SessionSignal.SignalType.READING);
        signal.reading = new SensorReading(sessionId, SensorStream.AFFECT, ts, Map.of("delight", delight));
        return signal;
    }

    private static SessionSignal finalizeSignal(String sessionId, String projectId, List<SegmentSpec> segments, long at) {
        SessionSignal signal = base(sessionId, SessionSignal.SignalType.FINALIZE);
        signal.projectId = projectId;
        signal.signalTimestamp = at;
        FinalizeRequest request = new FinalizeRequest();
        request.sessionId = sessionId;
        request.projectId = projectId;
        request.segments = segments;
        request.requestedAtMs = at;
        signal.finalizeRequest = request;
        return signal;
    }

    private static SessionSignal base(String sessionId, SessionSignal.SignalType type) {
        SessionSignal signal = new SessionSignal();
        signal.signalType = type;
        signal.sessionId = sessionId;
        signal.signalTimestamp = 1_000L;
        return signal;
    }
}
