package com.playpulse.analytics.pipeline;

import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.typeinfo.TypeHint;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.datastream.AsyncDataStream;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.streaming.api.functions.ProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;

import com.playpulse.analytics.aggregate.ProjectAggregate;
import com.playpulse.analytics.aggregate.SegmentRollup;
import com.playpulse.analytics.catalog.SegmentSpecCatalog;
import com.playpulse.analytics.catalog.SegmentSpecCatalogLoader;
import com.playpulse.analytics.fusion.FusedRow;
import com.playpulse.analytics.model.ChunkAnalysisRequest;
import com.playpulse.analytics.model.ChunkObservation;
import com.playpulse.analytics.model.FinalizeRequest;
import com.playpulse.analytics.model.InboundRecord;
import com.playpulse.analytics.model.ParsedTelemetry;
import com.playpulse.analytics.model.RejectedEventEnvelope;
import com.playpulse.analytics.model.SensorReading;
import com.playpulse.analytics.parse.TelemetryParsers;
import com.playpulse.analytics.quality.DeduplicationProcessFunction;
import com.playpulse.analytics.quality.FusionJobConfig;
import com.playpulse.analytics.quality.QualityGateProcessFunction;
import com.playpulse.analytics.quality.RejectedEventEnvelopeFactory;
import com.playpulse.analytics.quality.ValidatedEvent;
import com.playpulse.analytics.session.ProjectRollupFunction;
import com.playpulse.analytics.session.SessionFinalization;
import com.playpulse.analytics.session.SessionFinalizeFunction;
import com.playpulse.analytics.session.SessionScoped;
import com.playpulse.analytics.session.SessionSignal;
import com.playpulse.analytics.sink.AnalyticsRowMappers;
import com.playpulse.analytics.sink.KafkaSinkFactory;
import com.playpulse.analytics.sink.RowGuardProcessFunction;
import com.playpulse.analytics.timeline.PointEvent;
import com.playpulse.analytics.upstream.ChunkAnalysisAsyncFunction;
import com.playpulse.analytics.util.BuildMetadata;
import com.playpulse.analytics.util.SessionKey;
import com.playpulse.analytics.verdict.Verdict;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Main Flink pipeline:
 * - Ingest Kafka records
 * - Validate schema + build dedup key
 * - Deduplicate with state TTL (chunks once per session window)
 * - Parse typed events, resolve chunk analysis requests against the analysis service
 * - Accumulate per session; finalize into fused rows, verdicts and a session score
 * - Re-derive project segment rollups after every finalization
 * - Guard oversized rows, sink to Kafka topics and DLQ/quarantine
 */
public class PlaytestTelemetryJob {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(PlaytestTelemetryJob.class);

    static final String UNASSIGNED_PROJECT = "_unassigned";

    private static final OutputTag<RejectedEventEnvelope> DLQ_TAG = new OutputTag<RejectedEventEnvelope>("dlq"){};
    private static final OutputTag<RejectedEventEnvelope> QUARANTINE_TAG = new OutputTag<RejectedEventEnvelope>("quarantine"){};

    // ============================================
    // MAIN JOB
    // ============================================

    public static void main(String[] args) throws Exception {
        final StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();

        FusionJobConfig config = FusionJobConfig.fromEnv();
        env.enableCheckpointing(config.checkpointIntervalMs);
        SegmentSpecCatalog catalog = SegmentSpecCatalogLoader.loadDefault();
        LOG.info("Starting playtest telemetry job (inputTopic={}, dlqTopic={}, quarantineTopic={}, catalogVersion={}, build={})",
                config.inputTopic, config.dlqTopic, config.quarantineTopic, catalog.version(),
                BuildMetadata.current().identity());

        KafkaSource<InboundRecord> kafkaSource = KafkaSource.<InboundRecord>builder()
                .setBootstrapServers(config.kafkaBootstrap)
                .setTopics(config.inputTopic)
                .setGroupId(config.kafkaGroupId)
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setDeserializer(new InboundRecordDeserializationSchema())
                .build();

        // Quality gate: deserialize → validate → build dedup key, then forward or emit DLQ.
        SingleOutputStreamOperator<ValidatedEvent> validatedStream = env
                .fromSource(kafkaSource, WatermarkStrategy.noWatermarks(), "Kafka Source")
                .process(new QualityGateProcessFunction(config, DLQ_TAG))
                .returns(ValidatedEvent.class)
                .name("Quality Gate");

        SingleOutputStreamOperator<ValidatedEvent> dedupedStream = validatedStream
                .keyBy(event -> event.event.dedupKey)
                .process(new DeduplicationProcessFunction(config, QUARANTINE_TAG))
                .returns(ValidatedEvent.class)
                .name("Dedup");

        DataStream<RejectedEventEnvelope> qualityDlqStream = validatedStream.getSideOutput(DLQ_TAG);
        DataStream<RejectedEventEnvelope> quarantineStream = dedupedStream.getSideOutput(QUARANTINE_TAG);

        // ============================================
        // PARSE
        // ============================================

        int maxSessionDurationSec = config.maxSessionDurationSec;
        SingleOutputStreamOperator<ParsedTelemetry<SensorReading>> readingStream = parseEvents(
                dedupedStream,
                TelemetryParsers.SENSOR_READINGS,
                event -> TelemetryParsers.parseSensorReadings(event, maxSessionDurationSec),
                DLQ_TAG,
                new TypeHint<ParsedTelemetry<SensorReading>>() {},
                "Parse: Sensor Readings");

        SingleOutputStreamOperator<ParsedTelemetry<ChunkObservation>> observedChunkStream = parseEvents(
                dedupedStream,
                TelemetryParsers.CHUNK_OBSERVATION,
                event -> TelemetryParsers.parseChunkObservation(event, maxSessionDurationSec),
                DLQ_TAG,
                new TypeHint<ParsedTelemetry<ChunkObservation>>() {},
                "Parse: Chunk Observations");

        SingleOutputStreamOperator<ParsedTelemetry<ChunkAnalysisRequest>> analysisRequestStream = parseEvents(
                dedupedStream,
                TelemetryParsers.CHUNK_ANALYSIS_REQUEST,
                event -> TelemetryParsers.parseChunkAnalysisRequest(event, maxSessionDurationSec),
                DLQ_TAG,
                new TypeHint<ParsedTelemetry<ChunkAnalysisRequest>>() {},
                "Parse: Chunk Analysis Requests");

        SingleOutputStreamOperator<ParsedTelemetry<FinalizeRequest>> finalizeStream = parseEvents(
                dedupedStream,
                TelemetryParsers.SESSION_FINALIZE,
                event -> TelemetryParsers.parseFinalizeRequest(event, maxSessionDurationSec),
                DLQ_TAG,
                new TypeHint<ParsedTelemetry<FinalizeRequest>>() {},
                "Parse: Session Finalize");

        // Upstream analysis never fails the record: exhausted retries and timeouts yield a degraded chunk.
        SingleOutputStreamOperator<ParsedTelemetry<ChunkObservation>> analyzedChunkStream = AsyncDataStream
                .unorderedWaitWithRetry(
                        analysisRequestStream,
                        new ChunkAnalysisAsyncFunction(config),
                        asyncTimeoutMs(config),
                        TimeUnit.MILLISECONDS,
                        config.chunkAnalysisCapacity,
                        ChunkAnalysisAsyncFunction.retryStrategy(config))
                .returns(new TypeHint<ParsedTelemetry<ChunkObservation>>() {})
                .name("Upstream: Chunk Analysis");

        DataStream<ParsedTelemetry<ChunkObservation>> chunkStream = observedChunkStream.union(analyzedChunkStream);

        DataStream<RejectedEventEnvelope> parseDlqStream = readingStream.getSideOutput(DLQ_TAG)
                .union(observedChunkStream.getSideOutput(DLQ_TAG))
                .union(analysisRequestStream.getSideOutput(DLQ_TAG))
                .union(finalizeStream.getSideOutput(DLQ_TAG));

        // ============================================
        // SESSIONIZE
        // ============================================

        DataStream<SessionSignal> readingSignals = readingStream
                .map(PlaytestTelemetryJob::toReadingSignal)
                .returns(SessionSignal.class)
                .name("Session Signal: Readings");

        DataStream<SessionSignal> chunkSignals = chunkStream
                .map(PlaytestTelemetryJob::toChunkSignal)
                .returns(SessionSignal.class)
                .name("Session Signal: Chunks");

        DataStream<SessionSignal> finalizeSignals = finalizeStream
                .map(PlaytestTelemetryJob::toFinalizeSignal)
                .returns(SessionSignal.class)
                .name("Session Signal: Finalize");

        SingleOutputStreamOperator<SessionFinalization> finalizations = readingSignals
                .union(chunkSignals)
                .union(finalizeSignals)
                .keyBy(signal -> signal.sessionId)
                .process(new SessionFinalizeFunction(config, catalog))
                .returns(SessionFinalization.class)
                .name("Sessionize: Finalize");

        SingleOutputStreamOperator<ProjectAggregate> projectAggregates = finalizations
                .keyBy(PlaytestTelemetryJob::projectKey)
                .process(new ProjectRollupFunction(config))
                .returns(ProjectAggregate.class)
                .name("Aggregate: Project Rollups");

        SingleOutputStreamOperator<SessionScoped<FusedRow>> fusedRowStream = finalizations
                .flatMap((SessionFinalization f, Collector<SessionScoped<FusedRow>> out) -> fusedRows(f).forEach(out::collect))
                .returns(new TypeHint<SessionScoped<FusedRow>>() {})
                .name("Derive: Fused Rows");

        SingleOutputStreamOperator<SessionScoped<Verdict>> verdictStream = finalizations
                .flatMap((SessionFinalization f, Collector<SessionScoped<Verdict>> out) -> verdicts(f).forEach(out::collect))
                .returns(new TypeHint<SessionScoped<Verdict>>() {})
                .name("Derive: Segment Verdicts");

        SingleOutputStreamOperator<SessionScoped<PointEvent>> sessionEventStream = finalizations
                .flatMap((SessionFinalization f, Collector<SessionScoped<PointEvent>> out) -> sessionEvents(f).forEach(out::collect))
                .returns(new TypeHint<SessionScoped<PointEvent>>() {})
                .name("Derive: Session Events");

        SingleOutputStreamOperator<SegmentRollup> rollupStream = projectAggregates
                .flatMap((ProjectAggregate aggregate, Collector<SegmentRollup> out) -> aggregate.segments.forEach(out::collect))
                .returns(SegmentRollup.class)
                .name("Derive: Segment Rollups");

        // ============================================
        // ROWS + SINKS
        // ============================================

        int limit = config.maxRecordSizeBytes;
        SingleOutputStreamOperator<String> fusedRows = guardRows(fusedRowStream,
                new RowGuardProcessFunction<>("fused_row", AnalyticsRowMappers::fusedRow, DLQ_TAG, limit,
                        (scoped, reason, details) -> derivedGuardFailure(scoped, "fused_row", reason, details)),
                "Rows: Fused");
        SingleOutputStreamOperator<String> verdictRows = guardRows(verdictStream,
                new RowGuardProcessFunction<>("segment_verdict", AnalyticsRowMappers::verdictRow, DLQ_TAG, limit,
                        (scoped, reason, details) -> derivedGuardFailure(scoped, "segment_verdict", reason, details)),
                "Rows: Segment Verdicts");
        SingleOutputStreamOperator<String> sessionEventRows = guardRows(sessionEventStream,
                new RowGuardProcessFunction<>("session_event", AnalyticsRowMappers::sessionEventRow, DLQ_TAG, limit,
                        (scoped, reason, details) -> derivedGuardFailure(scoped, "session_event", reason, details)),
                "Rows: Session Events");
        SingleOutputStreamOperator<String> sessionScoreRows = guardRows(finalizations,
                new RowGuardProcessFunction<>("session_score", AnalyticsRowMappers::sessionScoreRow, DLQ_TAG, limit,
                        (f, reason, details) -> RejectedEventEnvelopeFactory.forDerivedRowGuardFailure(
                                f.sessionId, f.projectId, "session_score", reason, details)),
                "Rows: Session Scores");
        SingleOutputStreamOperator<String> readingAuditRows = guardRows(readingStream,
                new RowGuardProcessFunction<>("raw_reading", AnalyticsRowMappers::rawReadingRow, DLQ_TAG, limit,
                        (parsed, reason, details) -> RejectedEventEnvelopeFactory.forSinkGuardFailure(parsed.event, reason, details)),
                "Rows: Reading Audit");
        SingleOutputStreamOperator<String> chunkAuditRows = guardRows(chunkStream,
                new RowGuardProcessFunction<>("chunk_audit", AnalyticsRowMappers::chunkAuditRow, DLQ_TAG, limit,
                        (parsed, reason, details) -> RejectedEventEnvelopeFactory.forSinkGuardFailure(parsed.event, reason, details)),
                "Rows: Chunk Audit");
        SingleOutputStreamOperator<String> rollupRows = guardRows(rollupStream,
                new RowGuardProcessFunction<>("segment_rollup", AnalyticsRowMappers::segmentRollupRow, DLQ_TAG, limit,
                        (rollup, reason, details) -> RejectedEventEnvelopeFactory.forDerivedRowGuardFailure(
                                null, rollup.projectId, "segment_rollup", reason, details)),
                "Rows: Segment Rollups");

        DataStream<RejectedEventEnvelope> guardDlqStream = fusedRows.getSideOutput(DLQ_TAG)
                .union(verdictRows.getSideOutput(DLQ_TAG))
                .union(sessionEventRows.getSideOutput(DLQ_TAG))
                .union(sessionScoreRows.getSideOutput(DLQ_TAG))
                .union(readingAuditRows.getSideOutput(DLQ_TAG))
                .union(chunkAuditRows.getSideOutput(DLQ_TAG))
                .union(rollupRows.getSideOutput(DLQ_TAG));

        sinkToKafka(fusedRows, config, config.fusedRowsTopic, "Kafka: Fused Rows");
        sinkToKafka(verdictRows, config, config.verdictsTopic, "Kafka: Segment Verdicts");
        sinkToKafka(sessionEventRows, config, config.sessionEventsTopic, "Kafka: Session Events");
        sinkToKafka(sessionScoreRows, config, config.sessionScoresTopic, "Kafka: Session Scores");
        sinkToKafka(readingAuditRows, config, config.readingAuditTopic, "Kafka: Reading Audit");
        sinkToKafka(chunkAuditRows, config, config.chunkAuditTopic, "Kafka: Chunk Audit");
        sinkToKafka(rollupRows, config, config.segmentRollupsTopic, "Kafka: Segment Rollups");

        // Centralized DLQ stream: quality gate, parse and sink guard failures.
        DataStream<RejectedEventEnvelope> dlqStream = qualityDlqStream.union(parseDlqStream).union(guardDlqStream);

        // Envelope guards only drop, so an oversized envelope can never loop back into the DLQ.
        SingleOutputStreamOperator<String> dlqRows = dlqStream
                .process(RowGuardProcessFunction.<RejectedEventEnvelope>dropping("dlq", AnalyticsRowMappers::dlqRow, limit))
                .returns(String.class)
                .name("Rows: DLQ");
        SingleOutputStreamOperator<String> quarantineRows = quarantineStream
                .process(RowGuardProcessFunction.<RejectedEventEnvelope>dropping("quarantine", AnalyticsRowMappers::dlqRow, limit))
                .returns(String.class)
                .name("Rows: Quarantine");

        sinkToKafka(dlqRows, config, config.dlqTopic, "Kafka: DLQ");
        sinkToKafka(quarantineRows, config, config.quarantineTopic, "Kafka: Quarantine");

        env.execute("PlayPulse Playtest Telemetry");
    }

    private static void sinkToKafka(DataStream<String> rows, FusionJobConfig config, String topic, String name) {
        LOG.info("Configuring Kafka sink (topic={}, bootstrap={})", topic, config.kafkaBootstrap);
        rows.sinkTo(KafkaSinkFactory.build(config, topic)).name(name);
    }

    private static <T> SingleOutputStreamOperator<ParsedTelemetry<T>> parseEvents(
            SingleOutputStreamOperator<ValidatedEvent> input,
            String eventType,
            EventParser<T> parser,
            OutputTag<RejectedEventEnvelope> dlqTag,
            TypeHint<ParsedTelemetry<T>> typeHint,
            String name) {
        return input
                .filter(event -> event != null && event.event != null && eventType.equals(event.event.eventType))
                .process(new SafeParser<>(parser, dlqTag))
                .returns(typeHint)
                .name(name);
    }

    @FunctionalInterface
    interface EventParser<T> extends java.io.Serializable {
        List<T> parse(ValidatedEvent event) throws Exception;
    }

    private static <T> SingleOutputStreamOperator<String> guardRows(
            DataStream<T> input,
            RowGuardProcessFunction<T> guard,
            String name) {
        return input.process(guard).returns(String.class).name(name);
    }

    /**
     * Overall async budget: every attempt may hit the request timeout and wait the max backoff.
     */
    static long asyncTimeoutMs(FusionJobConfig config) {
        long perAttempt = config.chunkAnalysisTimeoutMs + config.chunkAnalysisMaxBackoffMs;
        return perAttempt * config.chunkAnalysisMaxAttempts;
    }

    static String projectKey(SessionFinalization finalization) {
        String projectId = SessionKey.idOrNull(finalization.projectId);
        return projectId == null ? UNASSIGNED_PROJECT : projectId;
    }

    static RejectedEventEnvelope derivedGuardFailure(
            SessionScoped<?> scoped, String recordKind, String reason, String details) {
        return RejectedEventEnvelopeFactory.forDerivedRowGuardFailure(
                scoped.sessionId, scoped.projectId, recordKind, reason, details);
    }

    // ============================================
    // SESSION SIGNALS
    // ============================================

    static SessionSignal toReadingSignal(ParsedTelemetry<SensorReading> parsed) {
        SessionSignal signal = baseSignal(SessionSignal.SignalType.READING, parsed);
        signal.sessionId = parsed.payload.sessionId;
        signal.reading = parsed.payload;
        return signal;
    }

    static SessionSignal toChunkSignal(ParsedTelemetry<ChunkObservation> parsed) {
        SessionSignal signal = baseSignal(SessionSignal.SignalType.CHUNK, parsed);
        signal.sessionId = parsed.payload.sessionId;
        signal.chunk = parsed.payload;
        return signal;
    }

    static SessionSignal toFinalizeSignal(ParsedTelemetry<FinalizeRequest> parsed) {
        SessionSignal signal = baseSignal(SessionSignal.SignalType.FINALIZE, parsed);
        signal.sessionId = parsed.payload.sessionId;
        String requestProject = SessionKey.idOrNull(parsed.payload.projectId);
        if (requestProject != null) {
            signal.projectId = requestProject;
        }
        signal.finalizeRequest = parsed.payload;
        return signal;
    }

    private static SessionSignal baseSignal(SessionSignal.SignalType type, ParsedTelemetry<?> parsed) {
        SessionSignal signal = new SessionSignal();
        signal.signalType = type;
        if (parsed != null && parsed.event != null) {
            signal.projectId = parsed.event.projectId;
            signal.signalTimestamp = parsed.event.timestamp;
            signal.sourceEvent = parsed.event;
        }
        return signal;
    }

    // ============================================
    // DERIVED RECORDS
    // ============================================

    static List<SessionScoped<FusedRow>> fusedRows(SessionFinalization finalization) {
        List<SessionScoped<FusedRow>> out = new ArrayList<>();
        for (FusedRow row : finalization.fusedRows) {
            out.add(new SessionScoped<>(finalization, row));
        }
        return out;
    }

    static List<SessionScoped<Verdict>> verdicts(SessionFinalization finalization) {
        List<SessionScoped<Verdict>> out = new ArrayList<>();
        for (Verdict verdict : finalization.verdicts) {
            out.add(new SessionScoped<>(finalization, verdict));
        }
        return out;
    }

    static List<SessionScoped<PointEvent>> sessionEvents(SessionFinalization finalization) {
        List<SessionScoped<PointEvent>> out = new ArrayList<>();
        if (finalization.timeline == null) {
            return out;
        }
        for (PointEvent event : finalization.timeline.events) {
            out.add(new SessionScoped<>(finalization, event));
        }
        return out;
    }

    static class SafeParser<T> extends ProcessFunction<ValidatedEvent, ParsedTelemetry<T>> {
        private static final long serialVersionUID = 1L;
        private final EventParser<T> parser;
        private final OutputTag<RejectedEventEnvelope> dlqTag;

        SafeParser(EventParser<T> parser, OutputTag<RejectedEventEnvelope> dlqTag) {
            this.parser = parser;
            this.dlqTag = dlqTag;
        }

        @Override
        public void processElement(ValidatedEvent event, Context ctx, Collector<ParsedTelemetry<T>> out) {
            if (event == null || event.event == null) {
                return;
            }
            try {
                List<T> results = parser.parse(event);
                if (results != null) {
                    for (T result : results) {
                        out.collect(new ParsedTelemetry<>(event.event, result));
                    }
                }
            } catch (Exception ex) {
                LOG.debug("Parse failure (type={}, id={}): {}", event.event.eventType, event.event.eventId, ex.getMessage());
                ctx.output(dlqTag, RejectedEventEnvelopeFactory.forParseFailure(event.event, ex));
            }
        }
    }
}
