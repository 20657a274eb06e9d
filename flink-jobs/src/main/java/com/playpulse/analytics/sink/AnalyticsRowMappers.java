package com.playpulse.analytics.sink;

import com.playpulse.analytics.aggregate.SegmentRollup;
import com.playpulse.analytics.fusion.FusedRow;
import com.playpulse.analytics.model.ChunkObservation;
import com.playpulse.analytics.model.ParsedTelemetry;
import com.playpulse.analytics.model.RejectedEventEnvelope;
import com.playpulse.analytics.model.SensorReading;
import com.playpulse.analytics.session.SessionFinalization;
import com.playpulse.analytics.session.SessionScoped;
import com.playpulse.analytics.timeline.PointEvent;
import com.playpulse.analytics.util.JsonSupport;
import com.playpulse.analytics.util.SessionKey;
import com.playpulse.analytics.verdict.Verdict;

/**
 * Maps derived records into JSON rows for the outbound topics.
 *
 * <p>Session-derived rows carry {@code finalization_version}; consumers keep the highest version
 * per {@code row_key} so a recompute replaces earlier rows.</p>
 */
public final class AnalyticsRowMappers {
    private AnalyticsRowMappers() {}

    public static String fusedRow(SessionScoped<FusedRow> scoped) {
        FusedRow r = scoped.payload;
        return JsonRow.create()
                .addString("row_key", SessionKey.second(scoped.sessionId, r.t))
                .addString("session_id", scoped.sessionId)
                .addNullableString("project_id", scoped.projectId)
                .addInt("t", r.t)
                .addString("segment_name", r.segmentName)
                .addInt("time_in_segment_sec", r.timeInSegmentSec)
                .addString("data_quality", r.dataQuality == null ? null : r.dataQuality.wireName())
                .addString("dominant_dimension", r.dominantDimension)
                .addDouble("intent_delta", r.intentDelta)
                .addDoubleMap("values", r.values)
                .addLong("finalization_version", scoped.finalizationVersion)
                .addTimestampMillis("finalized_at", scoped.finalizedAtMs)
                .build();
    }

    public static String verdictRow(SessionScoped<Verdict> scoped) {
        Verdict v = scoped.payload;
        return JsonRow.create()
                .addString("row_key", SessionKey.occurrence(scoped.sessionId, v.segmentName, v.occurrenceIndex))
                .addString("session_id", scoped.sessionId)
                .addNullableString("project_id", scoped.projectId)
                .addString("segment_name", v.segmentName)
                .addInt("occurrence_index", v.occurrenceIndex)
                .addInt("start_sec", v.startSec)
                .addInt("end_sec", v.endSec)
                .addString("target_dimension", v.targetDimension)
                .addDouble("target_observed", v.targetObserved)
                .addString("dominant_dimension", v.dominantDimension)
                .addDouble("deviation_score", v.deviationScore)
                .addInt("actual_duration_sec", v.actualDurationSec)
                .addDouble("expected_duration_sec", v.expectedDurationSec)
                .addDouble("time_delta_sec", v.timeDeltaSec)
                .addString("outcome", v.outcome == null ? null : v.outcome.name())
                .addDoubleMap("observed_avg", v.observedAvg)
                .addLong("finalization_version", scoped.finalizationVersion)
                .addTimestampMillis("finalized_at", scoped.finalizedAtMs)
                .build();
    }

    public static String sessionScoreRow(SessionFinalization f) {
        return JsonRow.create()
                .addString("session_id", f.sessionId)
                .addNullableString("project_id", f.projectId)
                .addString("status", f.status == null ? null : f.status.wireName())
                .addNullableString("reason", f.reason)
                .addInt("duration_sec", f.durationSec)
                .addDouble("score", f.score == null ? 0.0 : f.score.score)
                .addInt("pass_count", f.score == null ? 0 : f.score.passCount)
                .addInt("warn_count", f.score == null ? 0 : f.score.warnCount)
                .addInt("fail_count", f.score == null ? 0 : f.score.failCount)
                .addInt("unscored_occurrences", f.unscoredOccurrences)
                .addInt("full_rows", f.fullRows)
                .addInt("partial_rows", f.partialRows)
                .addInt("missing_rows", f.missingRows)
                .addInt("segment_spec_count", f.specs == null ? 0 : f.specs.size())
                .addString("segment_specs_json", JsonSupport.toJson(f.specs))
                .addLong("finalization_version", f.finalizationVersion)
                .addTimestampMillis("finalized_at", f.finalizedAtMs)
                .build();
    }

    public static String sessionEventRow(SessionScoped<PointEvent> scoped) {
        PointEvent e = scoped.payload;
        return JsonRow.create()
                .addString("session_id", scoped.sessionId)
                .addNullableString("project_id", scoped.projectId)
                .addString("label", e.label)
                .addString("severity", e.severity == null ? null : e.severity.wireName())
                .addDouble("timestamp_sec", e.timestampSec)
                .addLong("finalization_version", scoped.finalizationVersion)
                .addTimestampMillis("finalized_at", scoped.finalizedAtMs)
                .build();
    }

    public static String rawReadingRow(ParsedTelemetry<SensorReading> parsed) {
        SensorReading r = parsed.payload;
        return JsonRow.create()
                .addString("event_id", parsed.event == null ? null : parsed.event.eventId)
                .addString("session_id", r.sessionId)
                .addNullableString("project_id", parsed.event == null ? null : parsed.event.projectId)
                .addString("stream", r.stream == null ? null : r.stream.wireName())
                .addDouble("timestamp_sec", r.timestampSec)
                .addDoubleMap("values", r.values)
                .addTimestampMillis("event_timestamp", parsed.event == null ? 0L : parsed.event.timestamp)
                .build();
    }

    public static String chunkAuditRow(ParsedTelemetry<ChunkObservation> parsed) {
        ChunkObservation c = parsed.payload;
        return JsonRow.create()
                .addString("row_key", SessionKey.window(c.sessionId, c.windowIndex))
                .addString("event_id", parsed.event == null ? null : parsed.event.eventId)
                .addString("session_id", c.sessionId)
                .addNullableString("project_id", parsed.event == null ? null : parsed.event.projectId)
                .addInt("window_index", c.windowIndex)
                .addDouble("window_start_sec", c.windowStartSec)
                .addDouble("window_end_sec", c.windowEndSec)
                .addInt("state_count", c.statesObserved == null ? 0 : c.statesObserved.size())
                .addInt("point_event_count", c.pointEvents == null ? 0 : c.pointEvents.size())
                .addNullableString("end_segment", c.endSegment)
                .addNullableString("end_status", c.endStatus)
                .addBoolean("degraded", c.degraded)
                .addString("states_json", JsonSupport.toJson(c.statesObserved))
                .addTimestampMillis("event_timestamp", parsed.event == null ? 0L : parsed.event.timestamp)
                .build();
    }

    public static String segmentRollupRow(SegmentRollup r) {
        return JsonRow.create()
                .addString("project_id", r.projectId)
                .addString("segment_name", r.segmentName)
                .addInt("pain_point_rank", r.rank)
                .addString("target_dimension", r.targetDimension)
                .addInt("pass_count", r.passCount)
                .addInt("warn_count", r.warnCount)
                .addInt("fail_count", r.failCount)
                .addInt("occurrence_count", r.occurrenceCount)
                .addInt("session_count", r.sessionCount)
                .addDouble("mean_target_observed", r.meanTargetObserved)
                .addDouble("mean_deviation", r.meanDeviation)
                .addDouble("mean_time_delta_sec", r.meanTimeDeltaSec)
                .addNullableString("most_frequent_dominant", r.mostFrequentDominant)
                .addLong("version", r.computedAtMs)
                .addTimestampMillis("computed_at", r.computedAtMs)
                .build();
    }

    public static String dlqRow(RejectedEventEnvelope envelope) {
        long sourceRecordTimestamp = envelope.source == null
                ? envelope.ingestionTimestamp
                : envelope.source.recordTimestamp;
        return JsonRow.create()
                .addString("schema_version", envelope.schemaVersion)
                .addString("source_topic", envelope.source == null ? null : envelope.source.topic)
                .addInt("source_partition", envelope.source == null ? 0 : envelope.source.partition)
                .addLong("source_offset", envelope.source == null ? 0L : envelope.source.offset)
                .addTimestampMillis("source_record_timestamp", sourceRecordTimestamp)
                .addString("event_id", envelope.identity == null ? null : envelope.identity.eventId)
                .addString("event_type", envelope.identity == null ? null : envelope.identity.eventType)
                .addNullableString("event_version", envelope.identity == null ? null : envelope.identity.eventVersion)
                .addNullableString("session_id", envelope.identity == null ? null : envelope.identity.sessionId)
                .addNullableString("project_id", envelope.identity == null ? null : envelope.identity.projectId)
                .addNullableTimestampMillis("event_timestamp", envelope.eventTimestamp)
                .addNullableString("dedup_key", envelope.dedupKey)
                .addNullableString("dedup_strategy", envelope.dedupStrategy)
                .addBoolean("replay", envelope.replay)
                .addString("failure_stage", envelope.failure == null ? null : envelope.failure.stage)
                .addString("failure_class", envelope.failure == null ? null : envelope.failure.failureClass)
                .addString("failure_reason", envelope.failure == null ? null : envelope.failure.reason)
                .addNullableString("failure_field", envelope.failure == null ? null : envelope.failure.field)
                .addString("failure_details", envelope.failure == null ? null : envelope.failure.details)
                .addString("payload_encoding", envelope.payload == null ? null : envelope.payload.encoding)
                .addString("payload_body", envelope.payload == null ? null : envelope.payload.body)
                .addNullableString("payload_canonical_json", envelope.payload == null ? null : envelope.payload.canonicalJson)
                .addTimestampMillis("ingestion_timestamp", envelope.ingestionTimestamp)
                .build();
    }
}
