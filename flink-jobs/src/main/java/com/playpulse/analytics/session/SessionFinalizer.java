package com.playpulse.analytics.session;

import com.playpulse.analytics.aggregate.SessionScore;
import com.playpulse.analytics.aggregate.SessionScorer;
import com.playpulse.analytics.fusion.FusedRow;
import com.playpulse.analytics.fusion.FusionEngine;
import com.playpulse.analytics.model.ChunkObservation;
import com.playpulse.analytics.model.SensorReading;
import com.playpulse.analytics.quality.FusionJobConfig;
import com.playpulse.analytics.timeline.ChunkStitcher;
import com.playpulse.analytics.timeline.DiscreteTimeline;
import com.playpulse.analytics.verdict.Verdict;
import com.playpulse.analytics.verdict.VerdictEngine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs stitching, fusion, scoring and session aggregation for one session, strictly in sequence.
 *
 * <p>Pure with respect to its inputs: the same {@link SessionInputs} always yield the same
 * finalization. Flink state handling lives in {@link SessionFinalizeFunction}.</p>
 */
public class SessionFinalizer implements Serializable {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SessionFinalizer.class);

    public static final String REASON_NO_DATA = "no_fused_rows";

    private final FusionEngine fusionEngine;
    private final VerdictEngine verdictEngine;

    public SessionFinalizer(FusionEngine fusionEngine, VerdictEngine verdictEngine) {
        this.fusionEngine = fusionEngine;
        this.verdictEngine = verdictEngine;
    }

    public static SessionFinalizer fromConfig(FusionJobConfig config) {
        return forDimensions(config.affectDimensions, config.physioDimensions, config.baselineDimensions);
    }

    /**
     * Baseline dimensions never dominate a row; baseline and physiological dimensions never dominate a segment.
     */
    public static SessionFinalizer forDimensions(
            Set<String> affectDimensions, Set<String> physioDimensions, Set<String> baselineDimensions) {
        Set<String> excludedFromDominance = new LinkedHashSet<>(baselineDimensions);
        excludedFromDominance.addAll(physioDimensions);
        return new SessionFinalizer(
                new FusionEngine(affectDimensions, physioDimensions, baselineDimensions),
                new VerdictEngine(excludedFromDominance));
    }

    public SessionFinalization finalizeSession(SessionInputs inputs) {
        SessionFinalization result = new SessionFinalization();
        result.sessionId = inputs.sessionId;
        result.projectId = inputs.projectId;
        result.finalizationVersion = inputs.finalizationVersion;
        result.finalizedAtMs = inputs.finalizedAtMs;
        result.specs = inputs.specs == null ? new ArrayList<>() : new ArrayList<>(inputs.specs);

        Integer requested = inputs.request == null ? null : inputs.request.durationSec;
        int durationSec = deriveDurationSec(requested, inputs.chunks, inputs.affect, inputs.physio);
        result.durationSec = durationSec;

        if (durationSec == 0) {
            result.status = FinalizationStatus.INSUFFICIENT_DATA;
            result.reason = REASON_NO_DATA;
            result.timeline = new DiscreteTimeline(0, new ArrayList<>(), new ArrayList<>());
            result.score = emptyScore(inputs);
            LOG.info("Session has no data to finalize (session={}, version={})",
                    inputs.sessionId, inputs.finalizationVersion);
            return result;
        }

        DiscreteTimeline timeline = ChunkStitcher.stitch(inputs.chunks, durationSec);
        List<FusedRow> rows = fusionEngine.fuse(timeline, inputs.affect, inputs.physio, durationSec);
        FusionEngine.applyIntentDeltas(rows, result.specs);
        List<Verdict> verdicts = verdictEngine.score(rows, result.specs);
        SessionScore score = SessionScorer.score(inputs.sessionId, verdicts);
        score.finalizedAtMs = inputs.finalizedAtMs;

        result.status = FinalizationStatus.COMPLETED;
        result.timeline = timeline;
        result.fusedRows = rows;
        result.verdicts = verdicts;
        result.score = score;
        result.unscoredOccurrences = VerdictEngine.occurrences(rows).size() - verdicts.size();
        for (FusedRow row : rows) {
            switch (row.dataQuality) {
                case FULL:
                    result.fullRows++;
                    break;
                case PARTIAL:
                    result.partialRows++;
                    break;
                default:
                    result.missingRows++;
            }
        }
        LOG.info("Session finalized (session={}, version={}, durationSec={}, verdicts={}, score={}, missingRows={})",
                inputs.sessionId, inputs.finalizationVersion, durationSec, verdicts.size(), score.score, result.missingRows);
        return result;
    }

    /**
     * Requested duration when positive, otherwise the extent implied by the retained data.
     */
    public static int deriveDurationSec(
            Integer requestedSec,
            List<ChunkObservation> chunks,
            List<SensorReading> affect,
            List<SensorReading> physio) {
        if (requestedSec != null && requestedSec > 0) {
            return requestedSec;
        }
        int duration = chunks == null ? 0 : ChunkStitcher.impliedDurationSec(chunks);
        duration = Math.max(duration, readingExtent(affect));
        duration = Math.max(duration, readingExtent(physio));
        return duration;
    }

    private static int readingExtent(List<SensorReading> readings) {
        int extent = 0;
        if (readings == null) {
            return extent;
        }
        for (SensorReading reading : readings) {
            extent = Math.max(extent, reading.second() + 1);
        }
        return extent;
    }

    private static SessionScore emptyScore(SessionInputs inputs) {
        SessionScore score = SessionScorer.score(inputs.sessionId, List.of());
        score.finalizedAtMs = inputs.finalizedAtMs;
        return score;
    }
}
