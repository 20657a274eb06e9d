package com.playpulse.analytics.quality;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Meter;
import org.apache.flink.metrics.MeterView;
import org.apache.flink.streaming.api.functions.ProcessFunction;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.playpulse.analytics.model.InboundRecord;
import com.playpulse.analytics.model.RejectedEventEnvelope;
import com.playpulse.analytics.model.TelemetryEvent;
import com.playpulse.analytics.parse.JsonNodeUtils;
import com.playpulse.analytics.parse.TelemetryParsers;
import com.playpulse.analytics.util.Hashing;
import com.playpulse.analytics.util.JsonSupport;
import com.playpulse.analytics.util.SessionKey;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Quality gate: deserializes raw Kafka records, validates the envelope, and emits either a
 * {@link ValidatedEvent} carrying its dedup key or a DLQ envelope describing the failure.
 */
public class QualityGateProcessFunction extends ProcessFunction<InboundRecord, ValidatedEvent> {
    public static final String STRATEGY_SESSION_WINDOW = "session_window";
    public static final String STRATEGY_EVENT_ID = "event_id";
    public static final String STRATEGY_PAYLOAD_HASH = "payload_hash";

    private static final Logger LOG = LoggerFactory.getLogger(QualityGateProcessFunction.class);
    private static final long DLQ_LOG_INTERVAL_MS = 60_000L;

    private final FusionJobConfig config;
    private final OutputTag<RejectedEventEnvelope> dlqTag;
    private transient SchemaValidator validator;
    private transient Counter inputCounter;
    private transient Counter acceptedCounter;
    private transient Counter dlqCounter;
    private transient Meter inputRate;
    private transient Meter dlqRate;
    private transient long lastDlqLogMs;
    private transient long dlqSinceLastLog;

    public QualityGateProcessFunction(FusionJobConfig config, OutputTag<RejectedEventEnvelope> dlqTag) {
        this.config = config;
        this.dlqTag = dlqTag;
    }

    /**
     * Creates the validator and registers the {@code playpulse.quality_gate} counters and meters.
     * Rates are computed by {@link MeterView} over {@code metricsRateWindow}.
     */
    @Override
    public void open(org.apache.flink.configuration.Configuration parameters) {
        this.validator = new SchemaValidator(config.supportedVersions);
        org.apache.flink.metrics.MetricGroup metrics = getRuntimeContext().getMetricGroup()
                .addGroup("playpulse")
                .addGroup("quality_gate");
        int windowSec = (int) config.metricsRateWindow.getSeconds();
        this.inputCounter = metrics.counter("input");
        this.acceptedCounter = metrics.counter("accepted");
        this.dlqCounter = metrics.counter("dlq");
        this.inputRate = metrics.meter("input_rate", new MeterView(inputCounter, windowSec));
        this.dlqRate = metrics.meter("dlq_rate", new MeterView(dlqCounter, windowSec));
        this.lastDlqLogMs = System.currentTimeMillis();
        this.dlqSinceLastLog = 0;
        LOG.info("Quality gate initialized (supportedVersions={}, metricsWindowSec={})",
                config.supportedVersions, windowSec);
    }

    @Override
    public void processElement(InboundRecord record, Context ctx, org.apache.flink.util.Collector<ValidatedEvent> out) {
        inputCounter.inc();

        if (record == null || record.value == null) {
            LOG.debug("Rejecting record with null payload (topic={}, partition={}, offset={})",
                    record == null ? null : record.topic,
                    record == null ? null : record.partition,
                    record == null ? null : record.offset);
            emitDlq(ctx, RejectedEventEnvelopeFactory.forRawRecord(record, "null_payload", "Record value is null", null, null));
            return;
        }

        String rawJson = new String(record.value, StandardCharsets.UTF_8);
        JsonNode root;
        try {
            root = JsonSupport.MAPPER.readTree(rawJson);
        } catch (IOException ex) {
            LOG.warn("JSON parse failed (topic={}, partition={}, offset={}): {}",
                    record.topic, record.partition, record.offset, ex.getMessage());
            emitDlq(ctx, RejectedEventEnvelopeFactory.forRawRecord(record, "json_parse_error", ex.getMessage(), rawJson, record.value));
            return;
        }

        SchemaValidator.ValidationResult validation = validator.validate(root);
        if (!validation.valid) {
            emitDlq(ctx, RejectedEventEnvelopeFactory.forSchemaValidationFailure(record, root, validation, rawJson));
            return;
        }

        TelemetryEvent event = new TelemetryEvent();
        event.eventId = root.path("id").asText("");
        event.eventType = root.path("type").asText("");
        event.eventVersion = validation.eventVersion;
        event.sessionId = root.path("session_id").asText("").trim();
        event.projectId = JsonNodeUtils.asNullableText(root.path("project_id"));
        event.timestamp = JsonNodeUtils.parseTimestampMillisOrDefault(root.path("timestamp"), System.currentTimeMillis());
        event.rawJson = rawJson;
        event.replay = root.path("__replay").asBoolean(false);
        event.source = RejectedEventEnvelopeSupport.buildSourcePointer(record);

        DedupKey dedupKey = DedupKey.build(event, root);
        event.dedupKey = dedupKey.key;
        event.dedupStrategy = dedupKey.strategy;

        LOG.trace("Accepted event (id={}, type={}, session={}, dedupKey={})",
                event.eventId, event.eventType, event.sessionId, event.dedupKey);
        acceptedCounter.inc();
        out.collect(new ValidatedEvent(event, root));
    }

    private void emitDlq(Context ctx, RejectedEventEnvelope envelope) {
        dlqCounter.inc();
        dlqSinceLastLog++;
        long now = System.currentTimeMillis();
        if (now - lastDlqLogMs >= DLQ_LOG_INTERVAL_MS) {
            LOG.warn("DLQ rate summary: {} rejects in last 60s", dlqSinceLastLog);
            lastDlqLogMs = now;
            dlqSinceLastLog = 0;
        }
        ctx.output(dlqTag, envelope);
    }

    /**
     * Dedup key of an accepted event.
     *
     * <p>Chunk observations and analysis requests are keyed by (session, window index) so only the
     * first result per window is kept. Other events use their id, else a canonical payload hash.</p>
     */
    public static class DedupKey {
        public final String key;
        public final String strategy;

        private DedupKey(String key, String strategy) {
            this.key = key;
            this.strategy = strategy;
        }

        public static DedupKey build(TelemetryEvent event, JsonNode root) {
            if (TelemetryParsers.CHUNK_OBSERVATION.equals(event.eventType)
                    || TelemetryParsers.CHUNK_ANALYSIS_REQUEST.equals(event.eventType)) {
                JsonNode windowIndex = root.path("data").path("window_index");
                if (windowIndex.isIntegralNumber()) {
                    return new DedupKey(event.eventType + "|" + SessionKey.window(event.sessionId, windowIndex.asInt()),
                            STRATEGY_SESSION_WINDOW);
                }
            }
            if (event.eventId != null && !event.eventId.isEmpty()) {
                return new DedupKey(event.eventId, STRATEGY_EVENT_ID);
            }
            // Replay metadata is stripped so a replayed event hashes like the original.
            ObjectNode copy = ((ObjectNode) root).deepCopy();
            copy.remove("__replay");
            copy.remove("__replay_ts");
            copy.remove("__replay_source");
            String canonical = JsonSupport.toCanonicalJsonOrNull(copy);
            String hash = Hashing.sha256Hex(event.eventType + "|" + event.sessionId + "|"
                    + (canonical == null ? event.rawJson : canonical));
            return new DedupKey(hash, STRATEGY_PAYLOAD_HASH);
        }
    }
}
